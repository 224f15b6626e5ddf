package com.dynop.stargen.sample;

import java.util.List;

/**
 * Exception thrown when the loaded inputs contradict each other.
 * 
 * <p>Aborts the current computation; no partial results are returned. Possible error codes:
 * <ul>
 *   <li>{@code MATRIX_DIMENSION_MISMATCH} - Distance matrix size differs from the sample count</li>
 *   <li>{@code MISSING_MATRIX_ROW} - A sample id has no row in the persisted matrix</li>
 *   <li>{@code ASYMMETRIC_MATRIX} - {@code d(i,j) != d(j,i)}</li>
 *   <li>{@code NEGATIVE_DISTANCE} - A distance is negative or not finite</li>
 *   <li>{@code NONZERO_DIAGONAL} - {@code d(i,i) != 0}</li>
 *   <li>{@code DUPLICATE_SAMPLE_ID} - Two rows share the same sample id</li>
 *   <li>{@code INVALID_SAMPLE} - Coordinates or age outside their domain</li>
 *   <li>{@code UNKNOWN_SAMPLE_INDEX} - A cell references a sample that does not exist</li>
 *   <li>{@code EMPTY_CELL} - A cell reached aggregation without members</li>
 * </ul>
 */
public class InputInconsistencyException extends RuntimeException {

    private final String errorCode;
    private final List<Integer> indices;

    /**
     * @param errorCode Error code
     * @param message   Human readable description
     * @param indices   Offending sample indices, may be empty
     */
    public InputInconsistencyException(String errorCode, String message, List<Integer> indices) {
        super(errorCode + ": " + message + (indices.isEmpty() ? "" : " " + indices));
        this.errorCode = errorCode;
        this.indices = List.copyOf(indices);
    }

    public InputInconsistencyException(String errorCode, String message) {
        this(errorCode, message, List.of());
    }

    /**
     * @return Error code (e.g., "MATRIX_DIMENSION_MISMATCH")
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return Offending sample indices (row order of the sample table)
     */
    public List<Integer> getIndices() {
        return indices;
    }
}
