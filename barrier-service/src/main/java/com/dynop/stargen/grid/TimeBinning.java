package com.dynop.stargen.grid;

import java.util.Collections;
import java.util.List;

/**
 * Result of {@link TimeBinner}: the ordered bins and the bin of every sample.
 */
public final class TimeBinning {

    private final List<TimeBin> bins;
    private final int[] binOfSample;

    TimeBinning(List<TimeBin> bins, int[] binOfSample) {
        this.bins = Collections.unmodifiableList(bins);
        this.binOfSample = binOfSample;
    }

    public List<TimeBin> getBins() {
        return bins;
    }

    public TimeBin getBin(int index) {
        return bins.get(index);
    }

    public int binCount() {
        return bins.size();
    }

    /**
     * @return Index of the bin holding the sample at the given row
     */
    public int binOf(int sampleIndex) {
        return binOfSample[sampleIndex];
    }
}
