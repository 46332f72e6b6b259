package com.safeher.sosdispatch.util;

/**
 * Utility class for geographic calculations.
 *
 * All distances are great-circle distances on a spherical Earth (Haversine).
 */
public class GeoUtil {

    // Earth's radius in meters
    public static final double EARTH_RADIUS_METERS = 6371000;

    private static final double METERS_PER_DEGREE_LAT = Math.PI * EARTH_RADIUS_METERS / 180.0;

    private GeoUtil() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @param lat1 Latitude of first point
     * @param lon1 Longitude of first point
     * @param lat2 Latitude of second point
     * @param lon2 Longitude of second point
     * @return Distance in meters
     */
    public static double calculateDistance(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);

        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Distance rounded to whole meters, the unit stored on alerts and notifications.
     */
    public static long calculateDistanceMeters(double lat1, double lon1, double lat2, double lon2) {
        return Math.round(calculateDistance(lat1, lon1, lat2, lon2));
    }

    /**
     * Check if a point is within a radius of a center point
     */
    public static boolean isWithinRadius(double lat1, double lon1, double lat2, double lon2, double radiusMeters) {
        return calculateDistance(lat1, lon1, lat2, lon2) <= radiusMeters;
    }

    /**
     * Latitude in [-90, 90], longitude in [-180, 180]. Nulls and NaN are invalid.
     */
    public static boolean isValidCoordinate(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) return false;
        if (latitude.isNaN() || longitude.isNaN()) return false;
        return latitude >= -90 && latitude <= 90 && longitude >= -180 && longitude <= 180;
    }

    /**
     * Axis-aligned box that fully contains the circle of {@code radiusMeters} around the point.
     * Used as a cheap index pre-filter; callers must still apply the exact distance check.
     *
     * @return {minLat, maxLat, minLon, maxLon}
     */
    public static double[] boundingBox(double latitude, double longitude, double radiusMeters) {
        double latDelta = radiusMeters / METERS_PER_DEGREE_LAT;
        double minLat = Math.max(-90, latitude - latDelta);
        double maxLat = Math.min(90, latitude + latDelta);

        double cosLat = Math.cos(Math.toRadians(Math.max(Math.abs(minLat), Math.abs(maxLat))));
        if (cosLat < 1e-6) {
            // Near a pole every longitude is within reach
            return new double[]{minLat, maxLat, -180, 180};
        }
        double lonDelta = radiusMeters / (METERS_PER_DEGREE_LAT * cosLat);
        if (lonDelta >= 180) {
            return new double[]{minLat, maxLat, -180, 180};
        }
        double minLon = longitude - lonDelta;
        double maxLon = longitude + lonDelta;
        if (minLon < -180 || maxLon > 180) {
            // Crosses the antimeridian; fall back to the full longitude band
            return new double[]{minLat, maxLat, -180, 180};
        }
        return new double[]{minLat, maxLat, minLon, maxLon};
    }
}
