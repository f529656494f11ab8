package com.planmarshall.core.model;

import java.util.List;

/**
 * Outcome of analysing a request during 2-refine.
 *
 * @param confidence confidence of understanding, 0 to 100
 * @param questions  clarifying questions to ask when confidence is too low
 * @param domains    domains the request touches
 * @param changeType detected change type, may be {@code null}
 */
public record ClarityAssessment(int confidence, List<String> questions, List<String> domains, ChangeType changeType) {

    public ClarityAssessment {
        questions = questions == null ? List.of() : List.copyOf(questions);
        domains = domains == null ? List.of() : List.copyOf(domains);
    }
}
