package com.dynop.stargen.graph;

import com.graphhopper.util.shapes.GHPoint;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Azimuthal equidistant projection centered on the mean direction of a point set.
 * 
 * <p>Output coordinates are planar kilometres. Distances from the center are preserved exactly and
 * the antimeridian has no special meaning, which keeps triangulations of points around the
 * dateline or a pole well formed.
 */
final class LocalProjection {

    static final double EARTH_RADIUS_KM = 6371.0;

    private final double centerLon;
    private final double sinCenterLat;
    private final double cosCenterLat;

    private LocalProjection(double centerLat, double centerLon) {
        this.centerLon = centerLon;
        this.sinCenterLat = Math.sin(centerLat);
        this.cosCenterLat = Math.cos(centerLat);
    }

    /**
     * Center on the normalized sum of the points' unit vectors, or on the first point when the sum
     * vanishes.
     */
    static LocalProjection centeredOn(List<GHPoint> points) {
        if (points.isEmpty()) {
            return new LocalProjection(0, 0);
        }
        double x = 0;
        double y = 0;
        double z = 0;
        for (GHPoint p : points) {
            double lat = Math.toRadians(p.getLat());
            double lon = Math.toRadians(p.getLon());
            x += Math.cos(lat) * Math.cos(lon);
            y += Math.cos(lat) * Math.sin(lon);
            z += Math.sin(lat);
        }
        if (Math.sqrt(x * x + y * y + z * z) < 1e-9) {
            GHPoint first = points.get(0);
            return new LocalProjection(Math.toRadians(first.getLat()), Math.toRadians(first.getLon()));
        }
        return new LocalProjection(Math.atan2(z, Math.hypot(x, y)), Math.atan2(y, x));
    }

    Coordinate project(GHPoint point) {
        double lat = Math.toRadians(point.getLat());
        double dLon = Math.toRadians(point.getLon()) - centerLon;
        double sinLat = Math.sin(lat);
        double cosLat = Math.cos(lat);
        double cosDLon = Math.cos(dLon);

        double cosC = sinCenterLat * sinLat + cosCenterLat * cosLat * cosDLon;
        double c = Math.acos(Math.max(-1.0, Math.min(1.0, cosC)));
        double sinC = Math.sin(c);
        if (sinC < 1e-12) {
            // center itself, or its antipode which has no defined direction
            return new Coordinate(c < 1 ? 0 : EARTH_RADIUS_KM * c, 0);
        }
        double k = c / sinC;
        double px = EARTH_RADIUS_KM * k * cosLat * Math.sin(dLon);
        double py = EARTH_RADIUS_KM * k * (cosCenterLat * sinLat - sinCenterLat * cosLat * cosDLon);
        return new Coordinate(px, py);
    }
}
