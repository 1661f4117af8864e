package io.flowdetect.fragment;

/**
 * Node of the tree produced by {@link FragmentSplitter}: either a straight-line
 * {@link Fragment} or a repeated {@link FragmentLoop}.
 */
public sealed interface FragmentNode permits Fragment, FragmentLoop {

    /**
     * Number of measurements performed by one execution of the node, loop repetitions included.
     */
    int numMeasurements();
}
