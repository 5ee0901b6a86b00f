package com.example.ecotravel.planner.resolve;

import com.example.ecotravel.planner.config.PlannerDialogueProperties;
import com.example.ecotravel.planner.domain.Candidate;
import com.example.ecotravel.planner.domain.Entity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves an extracted entity against its candidate list.
 *
 * Candidates are ranked by confidence (desc), then population (desc, missing counts as 0),
 * then id (lexical asc), so the outcome is a pure function of the entity and the configured
 * margin / option count. The top candidate wins outright only when it leads the runner-up by
 * at least the margin; otherwise the top options are returned for clarification.
 */
@Component
public class EntityResolver {

    static final List<String> DISTINGUISHING_ATTRIBUTES = List.of("region", "country");

    static final Comparator<Candidate> RANKING = Comparator
            .comparingDouble(Candidate::getConfidence).reversed()
            .thenComparing(EntityResolver::population, Comparator.reverseOrder())
            .thenComparing(Candidate::getId);

    private final double margin;
    private final int maxOptions;

    @Autowired
    public EntityResolver(PlannerDialogueProperties props) {
        this(props.getConfidenceMargin(), props.getClarificationCandidates());
    }

    public EntityResolver(double margin, int maxOptions) {
        if (margin < 0 || margin > 1) throw new IllegalArgumentException("margin must be within [0,1]: " + margin);
        if (maxOptions < 2) throw new IllegalArgumentException("maxOptions must be >= 2: " + maxOptions);
        this.margin = margin;
        this.maxOptions = maxOptions;
    }

    public Resolution resolve(Entity entity) {
        List<Candidate> candidates = entity.getCandidates();
        if (candidates.isEmpty()) return Resolution.unresolved();
        if (candidates.size() == 1) return Resolution.resolved(candidates.get(0));

        List<Candidate> ranked = new ArrayList<>(candidates);
        ranked.sort(RANKING);
        Candidate top = ranked.get(0);
        Candidate runnerUp = ranked.get(1);
        // small epsilon so that 0.8 - 0.6 counts as a 0.2 lead
        if (top.getConfidence() - runnerUp.getConfidence() >= margin - 1e-9) {
            return Resolution.resolved(top);
        }
        List<Candidate> offered = ranked.subList(0, Math.min(maxOptions, ranked.size()));
        return Resolution.ambiguous(label(offered));
    }

    static List<ClarificationOption> label(List<Candidate> offered) {
        String key = distinguishingAttribute(offered);
        List<ClarificationOption> out = new ArrayList<>(offered.size());
        for (Candidate c : offered) {
            String qualifier = key != null ? c.attribute(key) : null;
            if (qualifier == null || qualifier.isBlank()) qualifier = c.getId();
            out.add(new ClarificationOption(c, c.getName() + ", " + qualifier));
        }
        return out;
    }

    /**
     * First attribute whose values tell every offered candidate apart; failing that, the first
     * one that at least varies; {@code null} when none varies.
     */
    private static String distinguishingAttribute(List<Candidate> offered) {
        String partial = null;
        for (String key : DISTINGUISHING_ATTRIBUTES) {
            Set<String> values = new HashSet<>();
            for (Candidate c : offered) {
                String v = c.attribute(key);
                values.add(v == null ? "" : v.trim().toLowerCase());
            }
            if (values.size() == offered.size() && !values.contains("")) return key;
            if (partial == null && values.size() > 1) partial = key;
        }
        return partial;
    }

    private static Double population(Candidate c) {
        Double p = c.numericAttribute("population");
        return p == null ? Double.valueOf(0.0) : p;
    }
}
