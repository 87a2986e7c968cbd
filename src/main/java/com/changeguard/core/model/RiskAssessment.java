package com.changeguard.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Scored, categorized safety evaluation of a {@link ChangeRecord}.
 * <p>
 * Scores follow a single convention throughout: 0 is the safest possible change and
 * 10 the most dangerous.
 *
 * @param score          danger score in [0,10]
 * @param category       band the score falls into
 * @param recommendation action derived from the category
 * @param factors        contributing factors in evaluation order
 */
public record RiskAssessment(
    int score,
    RiskCategory category,
    Recommendation recommendation,
    List<RiskFactor> factors
) implements Serializable {

    public RiskAssessment {
        if (score < 0 || score > 10) {
            throw new IllegalArgumentException("Risk score out of range [0,10]: " + score);
        }
        factors = factors == null ? List.of() : List.copyOf(factors);
    }
}
