package com.dynop.stargen.sample;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loader for the persisted pairwise genetic distance matrix.
 * 
 * <p>Tab-separated layout: the header row lists sample ids (its first cell is ignored), each
 * following row starts with a sample id followed by one distance per header column. The matrix may
 * hold more ids than the sample table; it is re-ordered to the requested id order on load.
 */
public final class DistanceMatrixLoader {

    private static final Logger LOGGER = Logger.getLogger(DistanceMatrixLoader.class.getName());

    /**
     * Load the matrix restricted to and ordered by the given sample ids.
     * 
     * @param file      Matrix file
     * @param sampleIds Sample ids in sample-table row order
     * @return Matrix whose row {@code i} belongs to {@code sampleIds.get(i)}
     * @throws IOException                 if the file cannot be read or is malformed
     * @throws InputInconsistencyException if a sample id has no row or column in the file, or more than one
     */
    public DistanceMatrix load(Path file, List<String> sampleIds) throws IOException {
        Map<String, Integer> wanted = new HashMap<>();
        for (int i = 0; i < sampleIds.size(); i++) {
            wanted.put(sampleIds.get(i), i);
        }

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new IOException("Distance matrix file is empty: " + file);
            }
            String[] header = headerLine.split("\t", -1);

            // file column -> sample row, -1 for ids not in the sample table
            int[] columnTarget = new int[header.length];
            int[] columnsFound = new int[sampleIds.size()];
            Arrays.fill(columnTarget, -1);
            Arrays.fill(columnsFound, -1);
            for (int c = 1; c < header.length; c++) {
                Integer target = wanted.get(header[c].trim());
                if (target != null) {
                    if (columnsFound[target] >= 0) {
                        throw new InputInconsistencyException("DUPLICATE_MATRIX_ID",
                                "sample id " + header[c].trim() + " heads more than one distance matrix column",
                                List.of(target));
                    }
                    columnTarget[c] = target;
                    columnsFound[target] = c;
                }
            }
            requireAll(columnsFound, sampleIds, "column");

            double[][] rows = new double[sampleIds.size()][];
            String line;
            int lineNumber = 1;
            int ignoredRows = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] cols = line.split("\t", -1);
                Integer target = wanted.get(cols[0].trim());
                if (target == null) {
                    ignoredRows++;
                    continue;
                }
                if (cols.length != header.length) {
                    throw new IOException(String.format("Line %d of %s has %d fields, header has %d",
                            lineNumber, file.getFileName(), cols.length, header.length));
                }
                if (rows[target] != null) {
                    throw new InputInconsistencyException("DUPLICATE_MATRIX_ID",
                            "sample id " + cols[0].trim() + " has more than one distance matrix row (line " + lineNumber + ")",
                            List.of(target));
                }
                double[] row = new double[sampleIds.size()];
                for (int c = 1; c < cols.length; c++) {
                    if (columnTarget[c] >= 0) {
                        row[columnTarget[c]] = parseDistance(cols[c], lineNumber, file);
                    }
                }
                rows[target] = row;
            }

            int[] rowsFound = new int[sampleIds.size()];
            for (int i = 0; i < rows.length; i++) {
                rowsFound[i] = rows[i] == null ? -1 : i;
            }
            requireAll(rowsFound, sampleIds, "row");

            int finalIgnored = ignoredRows;
            LOGGER.info(() -> String.format("Loaded %dx%d distance matrix from %s (%d unused rows)",
                    sampleIds.size(), sampleIds.size(), file.getFileName(), finalIgnored));
            return DistanceMatrix.of(rows);
        }
    }

    private static void requireAll(int[] found, List<String> sampleIds, String what) {
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < found.length; i++) {
            if (found[i] < 0) {
                missing.add(i);
            }
        }
        if (!missing.isEmpty()) {
            throw new InputInconsistencyException("MISSING_MATRIX_ROW",
                    String.format("%d samples have no distance matrix %s, first is %s",
                            missing.size(), what, sampleIds.get(missing.get(0))),
                    missing);
        }
    }

    private static double parseDistance(String raw, int lineNumber, Path file) throws IOException {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IOException(String.format("Invalid distance '%s' on line %d of %s",
                    raw, lineNumber, file.getFileName()), e);
        }
    }
}
