package com.example.ecotravel.planner.dialogue;

import com.example.ecotravel.planner.domain.Candidate;
import com.example.ecotravel.planner.domain.Entity;
import com.example.ecotravel.planner.domain.Turn;
import com.example.ecotravel.planner.resolve.ClarificationOption;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a reply against the options of a pending clarification question, trying in order:
 * candidate id, ordinal ("2", "second", "2nd", "last"), then distinguishing text
 * ("the one in Ontario"). Only a unique match counts.
 */
@Component
public class ClarificationMatcher {

    private static final Pattern NUMBER = Pattern.compile("(?:^|\\s)(?:option|number|#)?\\s*(\\d+)(?:st|nd|rd|th)?\\b");
    private static final String[] ORDINAL_WORDS = {"first", "second", "third", "fourth", "fifth"};

    public Optional<ClarificationOption> match(Turn turn, List<ClarificationOption> options) {
        if (options == null || options.isEmpty()) return Optional.empty();

        Optional<ClarificationOption> byId = matchById(turn, options);
        if (byId.isPresent()) return byId;

        String text = normalize(turn.getRawText());
        Integer ordinal = parseOrdinal(text, options.size());
        if (ordinal != null && ordinal >= 1 && ordinal <= options.size()) {
            return Optional.of(options.get(ordinal - 1));
        }
        return matchByText(text, options);
    }

    /**
     * Stricter match for a turn that carries an intent of its own: only an option id among the
     * entities' candidates, or an entity whose text names an option's label or qualifier, counts.
     */
    public Optional<ClarificationOption> matchMentioned(Turn turn, List<ClarificationOption> options) {
        if (options == null || options.isEmpty()) return Optional.empty();
        Set<String> mentioned = new LinkedHashSet<>();
        for (Entity e : turn.getEntities()) {
            for (Candidate c : e.getCandidates()) mentioned.add(c.getId());
        }
        List<ClarificationOption> hits = new ArrayList<>();
        for (ClarificationOption o : options) {
            if (mentioned.contains(o.getCandidate().getId())) hits.add(o);
        }
        if (hits.size() == 1) return Optional.of(hits.get(0));
        if (!hits.isEmpty()) return Optional.empty();
        for (Entity e : turn.getEntities()) {
            Optional<ClarificationOption> byText = matchByText(normalize(e.getSurfaceText()), options);
            if (byText.isPresent()) return byText;
        }
        return Optional.empty();
    }

    private static Optional<ClarificationOption> matchById(Turn turn, List<ClarificationOption> options) {
        Set<String> mentioned = new LinkedHashSet<>();
        for (Entity e : turn.getEntities()) {
            for (Candidate c : e.getCandidates()) mentioned.add(c.getId());
        }
        String raw = turn.getRawText().trim();
        List<ClarificationOption> hits = new ArrayList<>();
        for (ClarificationOption o : options) {
            String id = o.getCandidate().getId();
            if (mentioned.contains(id) || raw.equalsIgnoreCase(id)) hits.add(o);
        }
        return hits.size() == 1 ? Optional.of(hits.get(0)) : Optional.empty();
    }

    /** 1-based ordinal in the reply, {@code size} for "last", or {@code null}. */
    static Integer parseOrdinal(String textLower, int size) {
        if (textLower == null || textLower.isBlank()) return null;
        if (containsWord(textLower, "last")) return size;
        for (int i = 0; i < ORDINAL_WORDS.length; i++) {
            if (containsWord(textLower, ORDINAL_WORDS[i])) return i + 1;
        }
        Matcher m = NUMBER.matcher(textLower);
        if (m.find()) {
            try {
                return Integer.parseInt(m.group(1));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Optional<ClarificationOption> matchByText(String text, List<ClarificationOption> options) {
        if (text.isEmpty()) return Optional.empty();
        List<ClarificationOption> hits = new ArrayList<>();
        for (ClarificationOption o : options) {
            if (text.equals(normalize(o.getLabel())) || mentionsQualifier(text, o)) hits.add(o);
        }
        return hits.size() == 1 ? Optional.of(hits.get(0)) : Optional.empty();
    }

    private static boolean mentionsQualifier(String text, ClarificationOption option) {
        Candidate c = option.getCandidate();
        // a qualifier equal to the place name ("Washington, Washington") says nothing
        String name = normalize(c.getName());
        for (String key : new String[]{"region", "country"}) {
            String v = normalize(c.attribute(key));
            if (!v.isEmpty() && !v.equals(name) && containsWord(text, v)) return true;
        }
        String label = option.getLabel();
        int comma = label.indexOf(',');
        if (comma > 0) {
            String qualifier = normalize(label.substring(comma + 1));
            return !qualifier.isEmpty() && !qualifier.equals(name) && containsWord(text, qualifier);
        }
        return false;
    }

    private static boolean containsWord(String text, String phrase) {
        return Pattern.compile("(?:^|\\W)" + Pattern.quote(phrase) + "(?:$|\\W)").matcher(text).find();
    }

    private static String normalize(String s) {
        if (s == null) return "";
        return s.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}#,\\s]", " ").replaceAll("\\s+", " ").trim();
    }
}
