package com.dynop.stargen.grid;

import java.util.Collections;
import java.util.List;

/**
 * One age interval and the samples that fall into it.
 * 
 * <p>Equal-width bins are left-inclusive and right-exclusive, except the last bin which is closed
 * on both ends.
 */
public final class TimeBin {

    /** Reference year of the BP time scale. */
    static final long PRESENT_YEAR = 1950;

    private final int index;
    private final double ageMin;
    private final double ageMax;
    private final List<Integer> memberIndices;

    public TimeBin(int index, double ageMin, double ageMax, List<Integer> memberIndices) {
        this.index = index;
        this.ageMin = ageMin;
        this.ageMax = ageMax;
        this.memberIndices = Collections.unmodifiableList(memberIndices);
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return Lower age bound in years BP
     */
    public double getAgeMin() {
        return ageMin;
    }

    /**
     * @return Upper age bound in years BP
     */
    public double getAgeMax() {
        return ageMax;
    }

    /**
     * @return Sample row indices in ascending order
     */
    public List<Integer> getMemberIndices() {
        return memberIndices;
    }

    public boolean isEmpty() {
        return memberIndices.isEmpty();
    }

    /**
     * Render the bounds as calendar years, e.g. {@code "5050 BC - 3050 BC"} or {@code "1050 BC - 450 AD"}.
     */
    public String getLabel() {
        return calendarYear(Math.round(ageMin)) + " - " + calendarYear(Math.round(ageMax));
    }

    static String calendarYear(long ageBp) {
        if (ageBp < PRESENT_YEAR) {
            return (PRESENT_YEAR - ageBp) + " AD";
        }
        return (ageBp - PRESENT_YEAR) + " BC";
    }

    @Override
    public String toString() {
        return String.format("TimeBin{index=%d, ages=[%.1f, %.1f], samples=%d}",
                index, ageMin, ageMax, memberIndices.size());
    }
}
