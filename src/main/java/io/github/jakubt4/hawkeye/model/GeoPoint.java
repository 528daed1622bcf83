package io.github.jakubt4.hawkeye.model;

/**
 * Geodetic position.
 *
 * @param lat latitude in degrees
 * @param lng longitude in degrees
 * @param alt altitude in meters
 */
public record GeoPoint(double lat, double lng, double alt) {

    public GeoPoint withAlt(final double newAlt) {
        return new GeoPoint(lat, lng, newAlt);
    }
}
