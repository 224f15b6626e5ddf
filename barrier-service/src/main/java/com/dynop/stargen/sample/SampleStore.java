package com.dynop.stargen.sample;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Immutable in-memory table of samples together with their pairwise genetic distance matrix.
 * 
 * <p>Loaded once at startup and shared read-only by every computation. Row {@code i} of the matrix
 * belongs to {@code getSample(i)}.
 */
public final class SampleStore {

    private static final Logger LOGGER = Logger.getLogger(SampleStore.class.getName());

    private final List<Sample> samples;
    private final DistanceMatrix matrix;

    /**
     * @param samples Samples in matrix row order
     * @param matrix  Distance matrix with one row per sample
     * @throws InputInconsistencyException if the sizes differ, ids repeat or a sample is not
     *                                     geolocatable
     */
    public SampleStore(List<Sample> samples, DistanceMatrix matrix) {
        Objects.requireNonNull(samples, "samples");
        this.matrix = Objects.requireNonNull(matrix, "matrix");

        if (samples.size() != matrix.size()) {
            throw new InputInconsistencyException("MATRIX_DIMENSION_MISMATCH",
                    String.format("%d samples but distance matrix is %dx%d",
                            samples.size(), matrix.size(), matrix.size()));
        }

        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < samples.size(); i++) {
            Sample sample = samples.get(i);
            Integer previous = seen.putIfAbsent(sample.getId(), i);
            if (previous != null) {
                throw new InputInconsistencyException("DUPLICATE_SAMPLE_ID",
                        "sample id " + sample.getId() + " appears twice", List.of(previous, i));
            }
            if (!sample.isValid()) {
                throw new InputInconsistencyException("INVALID_SAMPLE",
                        "sample is not geolocatable or has a negative age: " + sample, List.of(i));
            }
        }
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
    }

    /**
     * Load the persisted sample list and distance matrix produced by the ingestion step.
     * 
     * @param samplesFile        Tab-separated sample table
     * @param distanceMatrixFile Tab-separated distance matrix keyed by sample id
     * @return the populated store
     * @throws IOException if reading either file fails
     */
    public static SampleStore load(Path samplesFile, Path distanceMatrixFile) throws IOException {
        List<Sample> samples = new SampleTableLoader().load(samplesFile);
        List<String> ids = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            ids.add(sample.getId());
        }
        DistanceMatrix matrix = new DistanceMatrixLoader().load(distanceMatrixFile, ids);
        SampleStore store = new SampleStore(samples, matrix);
        LOGGER.info(() -> String.format("Sample store ready: %d samples, ages %d-%d BP",
                store.size(), store.minAge(), store.maxAge()));
        return store;
    }

    public int size() {
        return samples.size();
    }

    public Sample getSample(int index) {
        return samples.get(index);
    }

    public List<Sample> getSamples() {
        return samples;
    }

    public DistanceMatrix getMatrix() {
        return matrix;
    }

    /**
     * @throws InputInconsistencyException if either index does not reference a sample
     */
    public double distance(int i, int j) {
        if (i < 0 || i >= samples.size() || j < 0 || j >= samples.size()) {
            throw new InputInconsistencyException("UNKNOWN_SAMPLE_INDEX",
                    "no sample for index", List.of(i, j));
        }
        return matrix.distance(i, j);
    }

    /**
     * @return Smallest age in the table, 0 if the table is empty
     */
    public long minAge() {
        return samples.stream().mapToLong(Sample::getAge).min().orElse(0);
    }

    /**
     * @return Largest age in the table, 0 if the table is empty
     */
    public long maxAge() {
        return samples.stream().mapToLong(Sample::getAge).max().orElse(0);
    }
}
