package com.contact.resolution.similarity;

import com.contact.resolution.core.model.IdentityTuple;
import com.contact.resolution.core.model.MatchReason;
import com.contact.resolution.rules.DefaultNormalizationRules;
import com.contact.resolution.rules.IdentityField;
import com.contact.resolution.rules.NormalizationEngine;
import com.contact.resolution.rules.PhoneNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores how likely two identity tuples describe the same person.
 *
 * <p>Each signal adds its weight once: exact email, exact phone (E.164), a full-name
 * ratio strictly above the name threshold, and an exact company. The score is the
 * capped sum. A pair is a duplicate when the score reaches the duplicate threshold
 * or when email or phone matched exactly.</p>
 *
 * <p>Stateless apart from its configuration; safe for concurrent use and never throws
 * for any combination of present or missing fields.</p>
 */
public class ContactSimilarityScorer {

    private final NormalizationEngine normalizationEngine;
    private final SimilarityAlgorithm nameSimilarity;
    private final ScoringWeights weights;

    public ContactSimilarityScorer() {
        this(DefaultNormalizationRules.createDefaultEngine(), new LevenshteinSimilarity(), ScoringWeights.defaults());
    }

    public ContactSimilarityScorer(ScoringWeights weights) {
        this(DefaultNormalizationRules.createDefaultEngine(), new LevenshteinSimilarity(), weights);
    }

    public ContactSimilarityScorer(NormalizationEngine normalizationEngine,
                                   SimilarityAlgorithm nameSimilarity,
                                   ScoringWeights weights) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        this.nameSimilarity = Objects.requireNonNull(nameSimilarity, "nameSimilarity is required");
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    public SimilarityScore score(IdentityTuple a, IdentityTuple b) {
        if (a == null || b == null) {
            return SimilarityScore.none();
        }

        double total = 0.0;
        List<MatchReason> reasons = new ArrayList<>(4);

        String emailA = normalizationEngine.normalize(a.email(), IdentityField.EMAIL);
        if (!emailA.isEmpty() && emailA.equals(normalizationEngine.normalize(b.email(), IdentityField.EMAIL))) {
            total += weights.emailWeight();
            reasons.add(MatchReason.EXACT_EMAIL);
        }

        if (PhoneNormalizer.sameNumber(a.phone(), b.phone())) {
            total += weights.phoneWeight();
            reasons.add(MatchReason.EXACT_PHONE);
        }

        String nameA = normalizationEngine.normalizeFullName(a.firstName(), a.lastName());
        String nameB = normalizationEngine.normalizeFullName(b.firstName(), b.lastName());
        if (!nameA.isEmpty() && !nameB.isEmpty()
                && nameSimilarity.compute(nameA, nameB) > weights.nameSimilarityThreshold()) {
            total += weights.fuzzyNameWeight();
            reasons.add(MatchReason.FUZZY_NAME);
        }

        String companyA = normalizationEngine.normalize(a.company(), IdentityField.COMPANY);
        if (!companyA.isEmpty() && companyA.equals(normalizationEngine.normalize(b.company(), IdentityField.COMPANY))) {
            total += weights.companyWeight();
            reasons.add(MatchReason.COMPANY_MATCH);
        }

        if (reasons.isEmpty()) {
            return SimilarityScore.none();
        }
        return new SimilarityScore(Math.min(1.0, total), reasons);
    }

    public boolean isDuplicate(SimilarityScore score) {
        return score.hasExactMatch() || score.score() >= weights.duplicateThreshold();
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public NormalizationEngine getNormalizationEngine() {
        return normalizationEngine;
    }
}
