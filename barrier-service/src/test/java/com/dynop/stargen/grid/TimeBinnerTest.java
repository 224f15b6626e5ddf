package com.dynop.stargen.grid;

import com.dynop.stargen.sample.SampleFixtures;
import com.dynop.stargen.sample.SampleStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TimeBinnerTest {

    private final TimeBinner binner = new TimeBinner();

    @Test
    void equalWidthSplitsTheAgeRange() {
        TimeBinning binning = TimeBinner.equalWidth(new long[]{0, 10, 20, 30, 40, 50, 60, 70, 80, 90, 100}, 5);

        assertEquals(5, binning.binCount());
        assertEquals(List.of(0, 1), binning.getBin(0).getMemberIndices());
        assertEquals(List.of(8, 9, 10), binning.getBin(4).getMemberIndices());
        assertEquals(20.0, binning.getBin(1).getAgeMin());
        assertEquals(40.0, binning.getBin(1).getAgeMax());
        assertEquals(100.0, binning.getBin(4).getAgeMax());
    }

    @Test
    void interiorBoundaryBelongsToUpperBinAndMaximumToLastBin() {
        TimeBinning binning = TimeBinner.equalWidth(new long[]{0, 50, 100}, 2);

        assertEquals(0, binning.binOf(0));
        assertEquals(1, binning.binOf(1));
        assertEquals(1, binning.binOf(2));
    }

    @Test
    void identicalAgesLandInFirstBin() {
        TimeBinning binning = TimeBinner.equalWidth(new long[]{300, 300, 300}, 3);

        assertEquals(List.of(0, 1, 2), binning.getBin(0).getMemberIndices());
        assertTrue(binning.getBin(1).isEmpty());
        assertTrue(binning.getBin(2).isEmpty());
    }

    @Test
    void moreBinsThanDistinctAgesLeavesEmptyBins() {
        TimeBinning binning = TimeBinner.equalWidth(new long[]{100, 200, 200}, 4);

        assertEquals(4, binning.binCount());
        assertEquals(1, binning.getBin(0).getMemberIndices().size());
        assertTrue(binning.getBin(1).isEmpty());
        assertTrue(binning.getBin(2).isEmpty());
        assertEquals(2, binning.getBin(3).getMemberIndices().size());
    }

    @Test
    void noSamplesGivesEmptyBins() {
        TimeBinning binning = TimeBinner.equalWidth(new long[0], 2);

        assertEquals(2, binning.binCount());
        assertTrue(binning.getBins().stream().allMatch(TimeBin::isEmpty));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 7, 14, 40})
    void everySampleIsInExactlyOneBin(int binCount) {
        Random random = new Random(42);
        long[] ages = new long[60];
        for (int i = 0; i < ages.length; i++) {
            ages[i] = random.nextInt(12_000);
        }

        for (TimeBinning binning : List.of(TimeBinner.equalWidth(ages, binCount), TimeBinner.equalCount(ages, binCount))) {
            List<Integer> seen = new ArrayList<>();
            for (TimeBin bin : binning.getBins()) {
                for (int index : bin.getMemberIndices()) {
                    assertEquals(bin.getIndex(), binning.binOf(index));
                    seen.add(index);
                }
            }
            assertEquals(ages.length, seen.size());
            assertEquals(ages.length, seen.stream().distinct().count());
        }
    }

    @Test
    void equalCountSplitsSortedAgesIntoBalancedGroups() {
        TimeBinning binning = TimeBinner.equalCount(new long[]{50, 10, 40, 20, 30}, 2);

        assertEquals(List.of(1, 3, 4), binning.getBin(0).getMemberIndices());
        assertEquals(List.of(0, 2), binning.getBin(1).getMemberIndices());
        assertEquals(10.0, binning.getBin(0).getAgeMin());
        assertEquals(30.0, binning.getBin(0).getAgeMax());
        assertEquals(40.0, binning.getBin(1).getAgeMin());
        assertEquals(50.0, binning.getBin(1).getAgeMax());
    }

    @Test
    void equalCountWithMoreBinsThanSamplesRepeatsLastBound() {
        TimeBinning binning = TimeBinner.equalCount(new long[]{10, 20}, 3);

        assertEquals(List.of(0), binning.getBin(0).getMemberIndices());
        assertEquals(List.of(1), binning.getBin(1).getMemberIndices());
        assertTrue(binning.getBin(2).isEmpty());
        assertEquals(20.0, binning.getBin(2).getAgeMin());
        assertEquals(20.0, binning.getBin(2).getAgeMax());
    }

    @Test
    void binsStoreSamplesByMode() {
        SampleStore store = SampleFixtures.uniformStore(1.0,
                new double[]{0, 0, 1000}, new double[]{0, 1, 1100}, new double[]{0, 2, 1200}, new double[]{0, 3, 5000});

        assertEquals(3, binner.bin(store, 2, BinningMode.EQUAL_WIDTH).getBin(0).getMemberIndices().size());
        assertEquals(2, binner.bin(store, 2, BinningMode.EQUAL_COUNT).getBin(0).getMemberIndices().size());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -3})
    void rejectsNonPositiveBinCount(int binCount) {
        SampleStore store = SampleFixtures.uniformStore(1.0, new double[]{0, 0, 1000});

        assertThrows(IllegalArgumentException.class, () -> binner.bin(store, binCount, BinningMode.EQUAL_WIDTH));
    }

    @ParameterizedTest
    @CsvSource({
            "5000, 3000, 3050 BC - 1050 BC",
            "2000, 1000, 50 BC - 950 AD",
            "1949.6, 0, 0 BC - 1950 AD",
            "1949.4, 1949, 1 AD - 1 AD"
    })
    void labelsRenderCalendarYears(double ageMin, double ageMax, String expected) {
        assertEquals(expected, new TimeBin(0, ageMin, ageMax, List.of()).getLabel());
    }

    @ParameterizedTest
    @CsvSource({
            "EQUAL_WIDTH, equal_width",
            "EQUAL_COUNT, Equal_Count",
            "EQUAL_WIDTH, ''"
    })
    void parsesBinningModes(BinningMode expected, String raw) {
        assertEquals(expected, BinningMode.parse(raw));
    }

    @Test
    void rejectsUnknownBinningMode() {
        assertThrows(IllegalArgumentException.class, () -> BinningMode.parse("quantile"));
    }
}
