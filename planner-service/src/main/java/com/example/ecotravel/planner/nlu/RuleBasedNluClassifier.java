package com.example.ecotravel.planner.nlu;

import com.example.ecotravel.common.nlu.NluCandidate;
import com.example.ecotravel.common.nlu.NluEntity;
import com.example.ecotravel.common.nlu.NluResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and pattern classifier. Works without any model and serves as the fallback of the
 * model-backed classifier.
 */
@Component
public class RuleBasedNluClassifier implements NluClassifier {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedNluClassifier.class);

    private static final Pattern GREETING = Pattern.compile("^(hi|hello|hey|hiya|good (morning|afternoon|evening))\\b.*");
    private static final Pattern ORDINAL_ONLY = Pattern.compile(
            "^(?:the\\s+)?(?:option\\s+|number\\s+|#\\s*)?(?:first|second|third|fourth|fifth|last|\\d+(?:st|nd|rd|th)?)(?:\\s+one)?\\s*[.!]?$");
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern QUESTION = Pattern.compile("^(what|how|why|which|where|when|is|are|can|should|do|does|tell me|any)\\b.*|.*\\?$");

    private static final Map<String, List<String>> INTENT_KEYWORDS = new LinkedHashMap<>();
    static {
        INTENT_KEYWORDS.put("restart", List.of("start over", "restart", "reset", "start again"));
        INTENT_KEYWORDS.put("goodbye", List.of("goodbye", "bye", "see you", "that's all", "thats all"));
        INTENT_KEYWORDS.put("estimate_emissions", List.of("emission", "carbon", "co2", "footprint"));
        INTENT_KEYWORDS.put("get_weather", List.of("weather", "temperature", "forecast", "raining", "sunny"));
        INTENT_KEYWORDS.put("plan_route", List.of("route", "directions", "how do i get", "how to get", "how far",
                "plan a trip", "plan my trip", "plan a route", "journey", "travel from", "trip from", "get from"));
    }

    private static final Map<String, String> TRANSPORT_WORDS = new LinkedHashMap<>();
    static {
        TRANSPORT_WORDS.put("train", "train");
        TRANSPORT_WORDS.put("rail", "train");
        TRANSPORT_WORDS.put("flight", "flight");
        TRANSPORT_WORDS.put("flying", "flight");
        TRANSPORT_WORDS.put("fly", "flight");
        TRANSPORT_WORDS.put("plane", "flight");
        TRANSPORT_WORDS.put("car", "car");
        TRANSPORT_WORDS.put("driving", "car");
        TRANSPORT_WORDS.put("drive", "car");
        TRANSPORT_WORDS.put("bus", "bus");
        TRANSPORT_WORDS.put("coach", "bus");
        TRANSPORT_WORDS.put("ferry", "ferry");
        TRANSPORT_WORDS.put("boat", "ferry");
        TRANSPORT_WORDS.put("bike", "bike");
        TRANSPORT_WORDS.put("bicycle", "bike");
        TRANSPORT_WORDS.put("cycling", "bike");
        TRANSPORT_WORDS.put("walking", "walk");
        TRANSPORT_WORDS.put("walk", "walk");
        TRANSPORT_WORDS.put("on foot", "walk");
    }

    private static final List<String> ORIGIN_MARKERS = List.of("from", "leaving", "departing", "starting in", "starting from");
    private static final List<String> DESTINATION_MARKERS = List.of("to", "in", "at", "for", "visit", "visiting", "into", "towards");

    private final PlaceGazetteer gazetteer;
    private final Clock clock;

    @Autowired
    public RuleBasedNluClassifier(PlaceGazetteer gazetteer) {
        this(gazetteer, Clock.systemDefaultZone());
    }

    RuleBasedNluClassifier(PlaceGazetteer gazetteer, Clock clock) {
        this.gazetteer = gazetteer;
        this.clock = clock;
    }

    @Override
    public NluResult classify(String text) {
        if (text == null || text.isBlank()) return NluResult.fallback();
        String lower = text.toLowerCase(Locale.ROOT).trim();
        List<NluEntity> entities = new ArrayList<>();
        entities.addAll(places(lower));
        entities.addAll(dates(lower));
        entities.addAll(transportModes(lower));
        String intent = intent(lower, entities);
        log.debug("[RuleBasedNluClassifier] '{}' -> {} with {} entities", text, intent, entities.size());
        return new NluResult(intent, entities);
    }

    private String intent(String lower, List<NluEntity> entities) {
        for (Map.Entry<String, List<String>> e : INTENT_KEYWORDS.entrySet()) {
            for (String kw : e.getValue()) {
                if (startsWord(lower, kw)) return e.getKey();
            }
        }
        if (ORDINAL_ONLY.matcher(lower).matches()) return "choose_option";
        boolean hasOrigin = entities.stream().anyMatch(en -> "origin".equals(en.getRole()));
        boolean hasDestination = entities.stream().anyMatch(en -> "destination".equals(en.getRole()) && "place".equals(en.getType()));
        if (hasOrigin && hasDestination) return "plan_route";
        if (QUESTION.matcher(lower).matches()) return "ask_travel_knowledge";
        if (GREETING.matcher(lower).matches()) return "greet";
        if (!entities.isEmpty()) return "inform";
        return NluResult.FALLBACK_INTENT;
    }

    private List<NluEntity> places(String lower) {
        String normalized = PlaceGazetteer.normalize(lower);
        List<NluEntity> out = new ArrayList<>();
        for (PlaceGazetteer.Mention m : gazetteer.findMentions(lower)) {
            String before = normalized.substring(0, m.getStart()).trim();
            out.add(new NluEntity("place", role(before), m.getSurface(), 1.0, m.getCandidates()));
        }
        return out;
    }

    /** Role from the words right before a place mention: "from X" is an origin, "to X" a destination. */
    static String role(String textBefore) {
        for (String marker : ORIGIN_MARKERS) {
            if (textBefore.equals(marker) || textBefore.endsWith(" " + marker)) return "origin";
        }
        for (String marker : DESTINATION_MARKERS) {
            if (textBefore.equals(marker) || textBefore.endsWith(" " + marker)) return "destination";
        }
        return null;
    }

    private List<NluEntity> dates(String lower) {
        List<NluEntity> out = new ArrayList<>();
        Matcher m = ISO_DATE.matcher(lower);
        while (m.find()) {
            try {
                LocalDate d = LocalDate.parse(m.group(1));
                out.add(date(m.group(1), d));
            } catch (DateTimeParseException e) {
                log.debug("[RuleBasedNluClassifier] Ignoring invalid date {}", m.group(1));
            }
        }
        if (out.isEmpty()) {
            LocalDate today = LocalDate.now(clock);
            if (containsWord(lower, "today")) out.add(date("today", today));
            else if (containsWord(lower, "tomorrow")) out.add(date("tomorrow", today.plusDays(1)));
        }
        return out;
    }

    private static NluEntity date(String surface, LocalDate value) {
        NluCandidate c = new NluCandidate(value.toString(), value.toString(), Map.of(), 1.0);
        return new NluEntity("date", null, surface, 1.0, List.of(c));
    }

    private static List<NluEntity> transportModes(String lower) {
        for (Map.Entry<String, String> e : TRANSPORT_WORDS.entrySet()) {
            if (containsWord(lower, e.getKey())) {
                NluCandidate c = new NluCandidate(e.getValue(), e.getValue(), Map.of(), 1.0);
                return List.of(new NluEntity("transport_mode", null, e.getKey(), 1.0, List.of(c)));
            }
        }
        return List.of();
    }

    // "emission" also matches "emissions"
    private static boolean startsWord(String text, String prefix) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(prefix)).matcher(text).find();
    }

    private static boolean containsWord(String text, String phrase) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}])").matcher(text).find();
    }
}
