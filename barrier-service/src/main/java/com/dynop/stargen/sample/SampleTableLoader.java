package com.dynop.stargen.sample;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loader for the filtered ancient sample list written by the ingestion step.
 * 
 * <p>The file is tab separated with a header row. Columns are located by name (case-insensitive):
 * <table>
 *   <tr><th>Name</th><th>Required</th><th>Description</th></tr>
 *   <tr><td>ID</td><td>yes</td><td>Genetic id, also the key of the distance matrix</td></tr>
 *   <tr><td>Latitude</td><td>yes</td><td>Decimal degrees</td></tr>
 *   <tr><td>Longitude</td><td>yes</td><td>Decimal degrees</td></tr>
 *   <tr><td>Age</td><td>yes</td><td>Mean date in years before 1950 CE</td></tr>
 *   <tr><td>Country</td><td>no</td><td>Political entity</td></tr>
 * </table>
 * 
 * <p>Rows that are not geolocatable ({@code ..} placeholders, blanks, out of range values) or that
 * have no numeric age are skipped.
 */
public final class SampleTableLoader {

    private static final Logger LOGGER = Logger.getLogger(SampleTableLoader.class.getName());

    private static final String COL_ID = "id";
    private static final String COL_LATITUDE = "latitude";
    private static final String COL_LONGITUDE = "longitude";
    private static final String COL_AGE = "age";
    private static final String COL_COUNTRY = "country";

    private static final String MISSING_VALUE = "..";

    /**
     * Load all usable samples from a tab-separated file.
     * 
     * @param file Path to the sample list
     * @return Samples in file order
     * @throws IOException if the file cannot be read or lacks a required column
     */
    public List<Sample> load(Path file) throws IOException {
        List<Sample> samples = new ArrayList<>();
        int skipped = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new IOException("Sample file is empty: " + file);
            }
            Header header = Header.parse(headerLine, file);

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Sample sample = parseSample(line.split("\t", -1), header);
                if (sample == null) {
                    skipped++;
                    final int currentLine = lineNumber;
                    LOGGER.log(Level.FINE, () -> String.format("Skipping unusable sample row %d in %s",
                            currentLine, file.getFileName()));
                } else {
                    samples.add(sample);
                }
            }
        }

        int finalSkipped = skipped;
        LOGGER.info(() -> String.format("Loaded %d samples from %s (%d rows skipped)",
                samples.size(), file.getFileName(), finalSkipped));
        return samples;
    }

    /**
     * @return the sample, or null if the row is missing a usable coordinate or age
     */
    private Sample parseSample(String[] cols, Header header) {
        if (cols.length <= header.maxRequiredIndex()) {
            return null;
        }
        String id = cols[header.id].trim();
        if (id.isEmpty()) {
            return null;
        }

        Double lat = parseNumber(cols[header.latitude]);
        Double lon = parseNumber(cols[header.longitude]);
        Double age = parseNumber(cols[header.age]);
        if (lat == null || lon == null || age == null) {
            return null;
        }

        String country = header.country >= 0 && header.country < cols.length ? cols[header.country].trim() : null;
        Sample sample = new Sample(id, lat, lon, Math.round(age), country == null || country.isEmpty() ? null : country);
        return sample.isValid() ? sample : null;
    }

    private static Double parseNumber(String raw) {
        String value = raw.trim();
        if (value.isEmpty() || MISSING_VALUE.equals(value)) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static final class Header {
        final int id;
        final int latitude;
        final int longitude;
        final int age;
        final int country;

        private Header(int id, int latitude, int longitude, int age, int country) {
            this.id = id;
            this.latitude = latitude;
            this.longitude = longitude;
            this.age = age;
            this.country = country;
        }

        static Header parse(String line, Path file) throws IOException {
            String[] names = line.split("\t", -1);
            return new Header(
                    require(names, COL_ID, file),
                    require(names, COL_LATITUDE, file),
                    require(names, COL_LONGITUDE, file),
                    require(names, COL_AGE, file),
                    indexOf(names, COL_COUNTRY));
        }

        int maxRequiredIndex() {
            return Math.max(Math.max(id, latitude), Math.max(longitude, age));
        }

        private static int require(String[] names, String column, Path file) throws IOException {
            int index = indexOf(names, column);
            if (index < 0) {
                throw new IOException("Sample file " + file + " has no '" + column + "' column");
            }
            return index;
        }

        private static int indexOf(String[] names, String column) {
            for (int i = 0; i < names.length; i++) {
                if (names[i].trim().toLowerCase(Locale.ROOT).equals(column)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
