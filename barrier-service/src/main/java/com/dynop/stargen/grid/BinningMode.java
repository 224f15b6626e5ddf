package com.dynop.stargen.grid;

/**
 * Strategy used to split the observed age range into time bins.
 * 
 * <ul>
 *   <li>{@link #EQUAL_WIDTH} - Every bin spans the same number of years (default)</li>
 *   <li>{@link #EQUAL_COUNT} - Every bin holds the same number of samples (±1)</li>
 * </ul>
 */
public enum BinningMode {
    /**
     * Equal-width age intervals. Sparse and empty bins are kept as they are.
     */
    EQUAL_WIDTH,

    /**
     * Equal-size groups of samples ordered by age.
     */
    EQUAL_COUNT;

    /**
     * Parse the wire form ({@code equal_width} / {@code equal_count}), case-insensitive.
     * 
     * @throws IllegalArgumentException for any other value
     */
    public static BinningMode parse(String value) {
        if (value == null || value.isBlank()) {
            return EQUAL_WIDTH;
        }
        for (BinningMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid binning mode: " + value + ". Valid values: equal_width, equal_count");
    }
}
