package com.example.ecotravel.planner.nlu;

import com.example.ecotravel.common.nlu.NluCandidate;
import com.example.ecotravel.planner.config.PlannerNluProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Known places and the names they go by. Supplies the candidate lists that make
 * "London" ambiguous and "London, Ontario" not.
 */
@Component
public class PlaceGazetteer {

    private static final Logger log = LoggerFactory.getLogger(PlaceGazetteer.class);

    // qualifiers that are also everyday words only count after a comma ("London, ON")
    private static final Set<String> COMMON_WORDS = Set.of("on", "in", "me", "or", "at", "to", "ok", "hi", "oh", "de", "la", "id");

    /** One gazetteer entry as stored in the JSON resource. */
    public static class Place {
        private String id;
        private String name;
        private String region;
        private String country;
        private double lat;
        private double lon;
        private long population;
        private double prior = 1.0;
        private List<String> aliases = new ArrayList<>();
        private List<String> qualifiers = new ArrayList<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
        public String getCountry() { return country; }
        public void setCountry(String country) { this.country = country; }
        public double getLat() { return lat; }
        public void setLat(double lat) { this.lat = lat; }
        public double getLon() { return lon; }
        public void setLon(double lon) { this.lon = lon; }
        public long getPopulation() { return population; }
        public void setPopulation(long population) { this.population = population; }
        public double getPrior() { return prior; }
        public void setPrior(double prior) { this.prior = prior; }
        public List<String> getAliases() { return aliases; }
        public void setAliases(List<String> aliases) { this.aliases = aliases; }
        public List<String> getQualifiers() { return qualifiers; }
        public void setQualifiers(List<String> qualifiers) { this.qualifiers = qualifiers; }
    }

    /** A place name found in a message, with the candidates it may refer to. */
    public static final class Mention {
        private final int start;
        private final String surface;
        private final List<NluCandidate> candidates;

        Mention(int start, String surface, List<NluCandidate> candidates) {
            this.start = start;
            this.surface = surface;
            this.candidates = candidates;
        }

        public int getStart() { return start; }
        public String getSurface() { return surface; }
        public List<NluCandidate> getCandidates() { return candidates; }
    }

    // normalized name or alias -> places going by it
    private final Map<String, List<Place>> byName = new LinkedHashMap<>();
    private final List<String> namesLongestFirst;

    @Autowired
    public PlaceGazetteer(PlannerNluProperties props, ObjectMapper mapper) {
        this(load(props.getGazetteerResource(), mapper));
    }

    public PlaceGazetteer(List<Place> places) {
        for (Place p : places) {
            index(normalize(p.getName()), p);
            for (String alias : p.getAliases()) index(normalize(alias), p);
        }
        List<String> names = new ArrayList<>(byName.keySet());
        names.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        this.namesLongestFirst = names;
        log.info("[PlaceGazetteer] Loaded {} places under {} names", places.size(), byName.size());
    }

    /**
     * Candidates for a place name as the user wrote it. A qualifier after the name ("London, Ontario",
     * "Portland Maine") narrows the candidates when it matches.
     */
    public List<NluCandidate> lookup(String surface) {
        String text = normalize(surface);
        if (text.isEmpty()) return List.of();
        List<Place> exact = byName.get(text);
        if (exact != null) return toCandidates(exact);
        for (String name : namesLongestFirst) {
            if (text.startsWith(name + " ") || text.startsWith(name + ",")) {
                List<Place> qualified = qualify(byName.get(name), text.substring(name.length()));
                if (qualified != null) return toCandidates(qualified);
            }
        }
        return List.of();
    }

    /** Place names in {@code text}, longest match first, without overlaps, in order of appearance. */
    public List<Mention> findMentions(String text) {
        String lower = normalize(text);
        List<Mention> found = new ArrayList<>();
        boolean[] taken = new boolean[lower.length()];
        for (String name : namesLongestFirst) {
            Matcher m = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(name) + "(?![\\p{L}\\p{N}])").matcher(lower);
            while (m.find()) {
                if (overlaps(taken, m.start(), m.end())) continue;
                List<Place> places = byName.get(name);
                int end = m.end();
                List<Place> chosen = places;
                String surface = places.get(0).getName();
                String rest = lower.substring(end);
                List<Place> narrowed = qualify(places, rest);
                if (narrowed != null && narrowed.size() == 1) {
                    String q = matchedQualifier(narrowed.get(0), rest);
                    end = end + rest.indexOf(q) + q.length();
                    chosen = narrowed;
                    surface = display(narrowed.get(0));
                }
                if (overlaps(taken, m.start(), end)) continue;
                for (int i = m.start(); i < end; i++) taken[i] = true;
                found.add(new Mention(m.start(), surface, toCandidates(chosen)));
            }
        }
        found.sort(Comparator.comparingInt(Mention::getStart));
        return found;
    }

    private static boolean overlaps(boolean[] taken, int start, int end) {
        for (int i = start; i < end && i < taken.length; i++) {
            if (taken[i]) return true;
        }
        return false;
    }

    /** Places among {@code sameName} whose qualifier starts {@code rest}, or {@code null} if none does. */
    private static List<Place> qualify(List<Place> sameName, String rest) {
        List<Place> out = new ArrayList<>();
        for (Place p : sameName) {
            if (matchedQualifier(p, rest) != null) out.add(p);
        }
        return out.isEmpty() ? null : out;
    }

    private static String matchedQualifier(Place p, String rest) {
        boolean afterComma = rest.matches("^\\s*,.*");
        String r = rest.replaceFirst("^\\s*,?\\s*", "");
        List<String> qualifiers = new ArrayList<>(p.getQualifiers());
        if (p.getRegion() != null) qualifiers.add(p.getRegion());
        if (p.getCountry() != null) qualifiers.add(p.getCountry());
        String best = null;
        for (String q : qualifiers) {
            String nq = normalize(q);
            if (nq.isEmpty() || (!afterComma && COMMON_WORDS.contains(nq))) continue;
            if ((r.equals(nq) || r.startsWith(nq + " ") || r.startsWith(nq + ",")) && (best == null || nq.length() > best.length())) {
                best = nq;
            }
        }
        return best;
    }

    private static String display(Place p) {
        String q = p.getRegion() != null && !p.getRegion().equalsIgnoreCase(p.getName()) ? p.getRegion() : p.getCountry();
        return q == null ? p.getName() : p.getName() + ", " + q;
    }

    private static List<NluCandidate> toCandidates(List<Place> places) {
        double total = 0;
        for (Place p : places) total += Math.max(p.getPrior(), 0.0);
        List<NluCandidate> out = new ArrayList<>(places.size());
        for (Place p : places) {
            double confidence = places.size() == 1 ? 1.0
                    : total > 0 ? Math.max(p.getPrior(), 0.0) / total : 1.0 / places.size();
            Map<String, Object> attrs = new LinkedHashMap<>();
            if (p.getRegion() != null) attrs.put("region", p.getRegion());
            if (p.getCountry() != null) attrs.put("country", p.getCountry());
            attrs.put("lat", p.getLat());
            attrs.put("lon", p.getLon());
            attrs.put("population", p.getPopulation());
            out.add(new NluCandidate(p.getId(), p.getName(), attrs, confidence));
        }
        return out;
    }

    private void index(String name, Place p) {
        if (name.isEmpty()) return;
        List<Place> list = byName.computeIfAbsent(name, k -> new ArrayList<>());
        if (!list.contains(p)) list.add(p);
    }

    static String normalize(String s) {
        if (s == null) return "";
        return s.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N},]+", " ").replaceAll("\\s*,\\s*", ", ").trim();
    }

    private static List<Place> load(String resource, ObjectMapper mapper) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            return mapper.readValue(in, new TypeReference<List<Place>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load gazetteer " + resource, e);
        }
    }
}
