package com.aijudge.debate;

import com.aijudge.model.Verdict;
import com.aijudge.model.VerdictSource;

import java.util.List;
import java.util.Objects;

/**
 * Result of reading a judge response.
 *
 * @param scoresParsed true only when both scores were present as integer JSON numbers
 * @param qualityIssues problems found in an otherwise usable verdict, such as short reasoning
 */
public record VerdictExtraction(
        Verdict verdict,
        VerdictSource source,
        boolean scoresParsed,
        List<String> qualityIssues
) {
    public VerdictExtraction {
        Objects.requireNonNull(verdict, "verdict is required");
        Objects.requireNonNull(source, "source is required");
        qualityIssues = qualityIssues == null ? List.of() : List.copyOf(qualityIssues);
    }

    public boolean isHeuristic() {
        return source == VerdictSource.HEURISTIC;
    }
}
