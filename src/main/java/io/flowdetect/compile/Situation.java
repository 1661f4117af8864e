package io.flowdetect.compile;

import io.flowdetect.plaquette.Plaquettes;
import io.flowdetect.template.SubTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * A local neighbourhood over one or two consecutive QEC rounds. Detectors are computed at
 * the end of its last round.
 */
public sealed interface Situation permits Situation.One, Situation.Two {

    List<TimestepLayout> timesteps();

    TimestepLayout last();

    default int radius() {
        return last().radius();
    }

    /**
     * @throws IllegalArgumentException if the layer and plaquette counts differ or are not 1 or 2
     */
    static Situation of(SubTemplate subtemplate, List<Plaquettes> plaquettesByTimestep) {
        if (subtemplate.timesteps() != plaquettesByTimestep.size()) {
            throw new IllegalArgumentException("Unsupported input: you should provide as many subtemplates as "
                    + "there are plaquettes.");
        }
        List<TimestepLayout> layouts = new ArrayList<>(plaquettesByTimestep.size());
        for (int t = 0; t < plaquettesByTimestep.size(); t++) {
            layouts.add(new TimestepLayout(subtemplate.layer(t), plaquettesByTimestep.get(t)));
        }
        return of(layouts);
    }

    static Situation of(List<TimestepLayout> layouts) {
        return switch (layouts.size()) {
            case 1 -> new One(layouts.get(0));
            case 2 -> new Two(layouts.get(0), layouts.get(1));
            default -> throw new IllegalArgumentException("A situation spans 1 or 2 time steps, got " + layouts.size());
        };
    }

    /**
     * The same situation without a leading round that has no plaquette at all.
     */
    default Situation withoutLeadingEmptyTimestep() {
        if (this instanceof Two two && two.previous().isEmpty()) {
            return new One(two.last());
        }
        return this;
    }

    record One(TimestepLayout last) implements Situation {
        @Override
        public List<TimestepLayout> timesteps() {
            return List.of(last);
        }
    }

    record Two(TimestepLayout previous, TimestepLayout last) implements Situation {
        public Two {
            if (previous.radius() != last.radius()) {
                throw new IllegalArgumentException("Both time steps of a situation must have the same radius");
            }
        }

        @Override
        public List<TimestepLayout> timesteps() {
            return List.of(previous, last);
        }
    }
}
