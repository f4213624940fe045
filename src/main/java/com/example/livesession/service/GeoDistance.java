package com.example.livesession.service;

import com.example.livesession.model.GeoPoint;

/** Great-circle distance on a spherical Earth. */
public final class GeoDistance {

    /** Mean Earth radius (IUGG), meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    private GeoDistance() {}

    public static double haversineMeters(GeoPoint a, GeoPoint b) {
        double lat1 = Math.toRadians(a.latitude());
        double lat2 = Math.toRadians(b.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.longitude() - a.longitude());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(Math.max(0d, 1 - h)));
        return EARTH_RADIUS_METERS * c;
    }
}
