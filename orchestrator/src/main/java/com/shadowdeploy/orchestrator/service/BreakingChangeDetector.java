package com.shadowdeploy.orchestrator.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pattern heuristics over engine diff output.
 *
 * Breaking changes block a deployment; data-loss hits are only reported.
 */
@Component
public class BreakingChangeDetector {

    private static final List<Pattern> BREAKING = List.of(
            Pattern.compile("DROP\\s+TABLE", Pattern.CASE_INSENSITIVE),
            Pattern.compile("DROP\\s+COLUMN", Pattern.CASE_INSENSITIVE),
            Pattern.compile("ALTER\\b.*\\bSET\\s+NOT\\s+NULL", Pattern.CASE_INSENSITIVE | Pattern.DOTALL)
    );

    private static final List<Pattern> DATA_LOSS = List.of(
            Pattern.compile("DROP\\s+TABLE", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bTRUNCATE\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bDELETE\\b", Pattern.CASE_INSENSITIVE)
    );

    public boolean hasBreakingChanges(String diffOutput) {
        return matchesAny(BREAKING, diffOutput);
    }

    public boolean detectDataLoss(String diffOutput) {
        return matchesAny(DATA_LOSS, diffOutput);
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }
}
