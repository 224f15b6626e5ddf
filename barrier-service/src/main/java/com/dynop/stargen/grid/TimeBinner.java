package com.dynop.stargen.grid;

import com.dynop.stargen.sample.SampleStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Partitions samples into ordered age bins.
 * 
 * <p>Every sample ends up in exactly one bin. Bins may be empty; downstream stages treat an empty
 * bin as "no edges, no fit".
 */
public final class TimeBinner {

    private static final Logger LOGGER = Logger.getLogger(TimeBinner.class.getName());

    /**
     * @param store    Samples to bin
     * @param binCount Number of bins, at least 1
     * @param mode     Binning strategy
     * @return Bins ordered from youngest to oldest
     * @throws IllegalArgumentException if {@code binCount < 1}
     */
    public TimeBinning bin(SampleStore store, int binCount, BinningMode mode) {
        if (binCount < 1) {
            throw new IllegalArgumentException("binCount must be at least 1 but was " + binCount);
        }
        long[] ages = new long[store.size()];
        for (int i = 0; i < ages.length; i++) {
            ages[i] = store.getSample(i).getAge();
        }
        TimeBinning binning = switch (mode) {
            case EQUAL_WIDTH -> equalWidth(ages, binCount);
            case EQUAL_COUNT -> equalCount(ages, binCount);
        };
        LOGGER.fine(() -> String.format("Binned %d samples into %d %s bins (%d empty)",
                ages.length, binCount, mode,
                binning.getBins().stream().filter(TimeBin::isEmpty).count()));
        return binning;
    }

    /**
     * Equal-width intervals over {@code [min, max]}. The bin index is computed in integer arithmetic
     * so a sample sitting exactly on an interior boundary always goes to the upper bin.
     */
    static TimeBinning equalWidth(long[] ages, int binCount) {
        int[] binOfSample = new int[ages.length];
        List<List<Integer>> members = emptyMembers(binCount);
        if (ages.length == 0) {
            List<TimeBin> bins = new ArrayList<>(binCount);
            for (int k = 0; k < binCount; k++) {
                bins.add(new TimeBin(k, 0, 0, members.get(k)));
            }
            return new TimeBinning(bins, binOfSample);
        }

        long min = ages[0];
        long max = ages[0];
        for (long age : ages) {
            min = Math.min(min, age);
            max = Math.max(max, age);
        }
        long range = max - min;

        for (int i = 0; i < ages.length; i++) {
            int bin = 0;
            if (range > 0) {
                bin = (int) Math.min(binCount - 1, ((ages[i] - min) * binCount) / range);
            }
            binOfSample[i] = bin;
            members.get(bin).add(i);
        }

        List<TimeBin> bins = new ArrayList<>(binCount);
        double width = (double) range / binCount;
        for (int k = 0; k < binCount; k++) {
            double lower = min + k * width;
            double upper = k == binCount - 1 ? max : min + (k + 1) * width;
            bins.add(new TimeBin(k, lower, upper, members.get(k)));
        }
        return new TimeBinning(bins, binOfSample);
    }

    /**
     * Consecutive groups of the age-sorted samples, sizes differing by at most one. The first
     * {@code n mod k} bins take the extra sample.
     */
    static TimeBinning equalCount(long[] ages, int binCount) {
        int[] binOfSample = new int[ages.length];
        List<List<Integer>> members = emptyMembers(binCount);

        List<Integer> order = IntStream.range(0, ages.length).boxed()
                .sorted(Comparator.<Integer>comparingLong(i -> ages[i]).thenComparingInt(i -> i))
                .collect(Collectors.toList());

        int perBin = ages.length / binCount;
        int remainder = ages.length % binCount;
        int start = 0;
        List<TimeBin> bins = new ArrayList<>(binCount);
        double previousUpper = ages.length == 0 ? 0 : ages[order.get(0)];
        for (int k = 0; k < binCount; k++) {
            int end = start + perBin + (k < remainder ? 1 : 0);
            List<Integer> bucket = members.get(k);
            for (int pos = start; pos < end; pos++) {
                int sampleIndex = order.get(pos);
                binOfSample[sampleIndex] = k;
                bucket.add(sampleIndex);
            }
            double lower = bucket.isEmpty() ? previousUpper : ages[order.get(start)];
            double upper = bucket.isEmpty() ? previousUpper : ages[order.get(end - 1)];
            bucket.sort(Integer::compare);
            bins.add(new TimeBin(k, lower, upper, bucket));
            previousUpper = upper;
            start = end;
        }
        return new TimeBinning(bins, binOfSample);
    }

    private static List<List<Integer>> emptyMembers(int binCount) {
        List<List<Integer>> members = new ArrayList<>(binCount);
        for (int k = 0; k < binCount; k++) {
            members.add(new ArrayList<>());
        }
        return members;
    }
}
