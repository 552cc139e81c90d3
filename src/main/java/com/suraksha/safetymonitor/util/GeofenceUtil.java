package com.suraksha.safetymonitor.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Geofence math shared by safe zones and risk areas.
 *
 * Supports two shapes:
 *  - Circular : Haversine distance against a center + radius, boundary inclusive
 *  - Polygon  : Ray-casting against an arbitrary [lat, lon] ring
 */
public final class GeofenceUtil {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    // Earth's radius in meters
    private static final double EARTH_RADIUS_METERS = 6371000;

    private GeofenceUtil() {
    }

    /**
     * Great-circle distance between two GPS coordinates (Haversine).
     *
     * @return distance in meters
     */
    public static double calculateDistance(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(lon2) - Math.toRadians(lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * A point exactly on the circle (distance == radius) counts as inside.
     *
     * @param lat1         latitude of point to check
     * @param lon1         longitude of point to check
     * @param lat2         latitude of geofence center
     * @param lon2         longitude of geofence center
     * @param radiusMeters radius of geofence in meters
     */
    public static boolean isWithinRadius(double lat1, double lon1, double lat2, double lon2, double radiusMeters) {
        return calculateDistance(lat1, lon1, lat2, lon2) <= radiusMeters;
    }

    /**
     * Parses a polygon given as a JSON array of [lat, lon] pairs:
     *   e.g. [[28.640,77.205],[28.645,77.205],[28.645,77.215],[28.640,77.215]]
     *
     * @throws IllegalArgumentException if the JSON is malformed or has fewer than 3 vertices
     */
    public static double[][] parsePolygon(String polygonCoordinatesJson) {
        if (polygonCoordinatesJson == null || polygonCoordinatesJson.isBlank()) {
            throw new IllegalArgumentException("polygon coordinates are empty");
        }
        double[][] polygon;
        try {
            polygon = OBJECT_MAPPER.readValue(polygonCoordinatesJson, double[][].class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("polygon coordinates are not a JSON array of [lat,lon] pairs", e);
        }
        if (polygon.length < 3) {
            throw new IllegalArgumentException("polygon needs at least 3 vertices, got " + polygon.length);
        }
        for (double[] vertex : polygon) {
            if (vertex == null || vertex.length != 2) {
                throw new IllegalArgumentException("polygon vertex must be a [lat,lon] pair");
            }
        }
        return polygon;
    }

    /**
     * Ray-casting inside test: cast a horizontal ray from the test point and
     * count edge crossings. An odd count means the point is inside.
     *
     * @param lat     latitude of the test point
     * @param lon     longitude of the test point
     * @param polygon array of [lat, lon] pairs
     */
    public static boolean isWithinPolygon(double lat, double lon, double[][] polygon) {
        int n = polygon.length;
        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double latI = polygon[i][0], lonI = polygon[i][1];
            double latJ = polygon[j][0], lonJ = polygon[j][1];
            if (((lonI > lon) != (lonJ > lon)) &&
                    (lat < (latJ - latI) * (lon - lonI) / (lonJ - lonI) + latI)) {
                inside = !inside;
            }
        }
        return inside;
    }

    public static boolean isValidLatitude(double latitude) {
        return latitude >= -90.0 && latitude <= 90.0;
    }

    public static boolean isValidLongitude(double longitude) {
        return longitude >= -180.0 && longitude <= 180.0;
    }
}
