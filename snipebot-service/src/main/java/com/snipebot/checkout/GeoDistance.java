package com.snipebot.checkout;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class GeoDistance {

    static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    /**
     * Great-circle distance in kilometres (haversine).
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Closest point to the given coordinates; on a tie the earlier candidate wins.
     */
    public static Optional<PickupPoint> nearest(List<PickupPoint> candidates, double latitude, double longitude) {
        return candidates.stream()
                .min(Comparator.comparingDouble(p -> haversineKm(latitude, longitude, p.latitude(), p.longitude())));
    }
}
