package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.domain.Candidate;

import java.util.Locale;
import java.util.Map;

/** Helpers for reading resolved places and modes out of tool inputs. */
final class PlaceInputs {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private PlaceInputs() {}

    static Candidate place(Map<String, Object> inputs, String key) throws ToolException {
        Object v = inputs.get(key);
        if (v instanceof Candidate c) return c;
        throw new ToolException("Input '" + key + "' is not a resolved place: " + v);
    }

    static double[] coordinates(Candidate place) throws ToolException {
        Double lat = place.numericAttribute("lat");
        Double lon = place.numericAttribute("lon");
        if (lat == null || lon == null) {
            throw new ToolException("No coordinates known for " + place.getId());
        }
        return new double[]{lat, lon};
    }

    static String label(Candidate place) {
        String region = place.attribute("region");
        return region == null || region.isBlank() ? place.getName() : place.getName() + ", " + region;
    }

    static String text(Map<String, Object> inputs, String key, String defaultValue) {
        Object v = inputs.get(key);
        if (v == null) return defaultValue;
        String s = String.valueOf(v).trim().toLowerCase(Locale.ROOT);
        return s.isEmpty() ? defaultValue : s;
    }

    /** Great-circle distance in km. */
    static double haversineKm(double[] a, double[] b) {
        double dLat = Math.toRadians(b[0] - a[0]);
        double dLon = Math.toRadians(b[1] - a[1]);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a[0])) * Math.cos(Math.toRadians(b[0])) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    /** Canonical transport mode for common spellings, or the input itself. */
    static String canonicalMode(String mode) {
        if (mode == null) return null;
        return switch (mode) {
            case "plane", "fly", "flying", "air", "airplane", "flights" -> "flight";
            case "rail", "railway", "trains" -> "train";
            case "drive", "driving", "auto", "cars" -> "car";
            case "coach", "buses" -> "bus";
            case "boat", "ship" -> "ferry";
            case "bicycle", "cycling", "cycle" -> "bike";
            case "walking", "foot", "hike", "hiking" -> "walk";
            default -> mode;
        };
    }
}
