package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.domain.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Carbon footprint estimate for a one-way trip, from local emission factors
 * (kg CO2e per passenger-km) and the great-circle distance between the two places.
 */
@Component
public class EmissionsTool implements ToolHandler {

    private static final Logger log = LoggerFactory.getLogger(EmissionsTool.class);

    public static final String NAME = "emissions";

    static final Map<String, Double> FACTORS = Map.of(
            "flight", 0.255,
            "car", 0.192,
            "ferry", 0.115,
            "train", 0.041,
            "bus", 0.025,
            "bike", 0.0,
            "walk", 0.0
    );

    // upper bounds in kg CO2e, inclusive
    private static final double[] GRADE_LIMITS = {50, 100, 200, 400, 800};
    private static final String[] GRADES = {"A", "B", "C", "D", "E", "F"};
    private static final double OFFSET_PRICE_PER_KG = 0.02;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredInputs() {
        return Set.of("origin", "destination", "transport_mode");
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs) throws ToolException {
        Candidate origin = PlaceInputs.place(inputs, "origin");
        Candidate destination = PlaceInputs.place(inputs, "destination");
        String mode = PlaceInputs.canonicalMode(PlaceInputs.text(inputs, "transport_mode", null));
        Double factor = mode == null ? null : FACTORS.get(mode);
        if (factor == null) {
            throw new ToolException("No emission factor for transport mode '" + mode + "'");
        }
        double distanceKm = PlaceInputs.round1(PlaceInputs.haversineKm(
                PlaceInputs.coordinates(origin), PlaceInputs.coordinates(destination)));
        double emission = PlaceInputs.round1(distanceKm * factor);
        double trainEmission = PlaceInputs.round1(distanceKm * FACTORS.get("train"));
        String grade = grade(emission);
        double offsetPrice = Math.round(emission * OFFSET_PRICE_PER_KG * 100.0) / 100.0;
        log.debug("[EmissionsTool] {} -> {} by {}: {} km, {} kg CO2e ({})", origin.getId(), destination.getId(), mode, distanceKm, emission, grade);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("origin", PlaceInputs.label(origin));
        payload.put("destination", PlaceInputs.label(destination));
        payload.put("mode", mode);
        payload.put("distanceKm", distanceKm);
        payload.put("emissionKg", emission);
        payload.put("sustainabilityGrade", grade);
        payload.put("offsetPrice", offsetPrice);
        payload.put("trainEmissionKg", trainEmission);
        payload.put("recommendations", recommendations(mode, emission, grade, trainEmission));
        payload.put("summary", String.format(Locale.ROOT,
                "Travelling %.1f km from %s to %s by %s emits about %.1f kg CO2e (grade %s).",
                distanceKm, PlaceInputs.label(origin), PlaceInputs.label(destination), mode, emission, grade));
        return payload;
    }

    static String grade(double emissionKg) {
        for (int i = 0; i < GRADE_LIMITS.length; i++) {
            if (emissionKg <= GRADE_LIMITS[i]) return GRADES[i];
        }
        return GRADES[GRADES.length - 1];
    }

    private static List<String> recommendations(String mode, double emission, String grade, double trainEmission) {
        List<String> recs = new ArrayList<>();
        if ("A".equals(grade) || "B".equals(grade)) {
            recs.add("Great job! This trip is highly sustainable.");
        }
        if ("flight".equals(mode)) {
            recs.add("Consider offsetting your flight emissions or taking the train for shorter distances.");
        }
        if (!"train".equals(mode) && trainEmission < emission) {
            recs.add(String.format(Locale.ROOT, "Going by train would emit about %.1f kg CO2e instead.", trainEmission));
        }
        if (emission > 200) {
            recs.add("Try to reduce car usage or choose eco-certified hotels.");
        }
        if ("E".equals(grade) || "F".equals(grade)) {
            recs.add("This trip has a high carbon footprint. Explore more sustainable options.");
        }
        return recs;
    }
}
