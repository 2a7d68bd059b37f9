package com.entity.reconciliation.quality;

import java.util.List;

/**
 * Score and ordered issue tags produced for one merged record.
 */
public record QualityResult(int score, List<String> issues) {

    public QualityResult {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100");
        }
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean isClean() {
        return issues.isEmpty();
    }
}
