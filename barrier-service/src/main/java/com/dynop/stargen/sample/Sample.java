package com.dynop.stargen.sample;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Domain object representing one dated and geolocated ancient-DNA sample.
 * 
 * <p>Ages are measured in years before 1950 CE (BP), as in the source annotation file.
 */
public final class Sample {

    private final String id;
    private final double lat;
    private final double lon;
    private final long age;
    @Nullable
    private final String country;

    /**
     * @param id      Genetic id, unique within a sample table
     * @param lat     Latitude in decimal degrees
     * @param lon     Longitude in decimal degrees
     * @param age     Age in years before 1950 CE
     * @param country Political entity of the find site, may be null
     */
    public Sample(String id, double lat, double lon, long age, @Nullable String country) {
        this.id = Objects.requireNonNull(id, "id");
        this.lat = lat;
        this.lon = lon;
        this.age = age;
        this.country = country;
    }

    public Sample(String id, double lat, double lon, long age) {
        this(id, lat, lon, age, null);
    }

    public String getId() {
        return id;
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }

    public long getAge() {
        return age;
    }

    @Nullable
    public String getCountry() {
        return country;
    }

    /**
     * @return true if latitude, longitude and age are inside their documented domains
     */
    public boolean isValid() {
        return Double.isFinite(lat) && Double.isFinite(lon)
                && lat >= -90 && lat <= 90
                && lon >= -180 && lon <= 180
                && age >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sample sample = (Sample) o;
        return id.equals(sample.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("Sample{id='%s', lat=%.4f, lon=%.4f, age=%d}", id, lat, lon, age);
    }
}
