package io.flowdetect.circuit;

/**
 * Element of the moment-by-moment view of a circuit: either a straight-line
 * {@link Moment} or a whole {@link RepeatBlock}, which always counts as one slice.
 */
public sealed interface TimeSlice permits Moment, RepeatBlock {
}
