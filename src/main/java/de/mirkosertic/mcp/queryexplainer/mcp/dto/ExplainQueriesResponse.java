package de.mirkosertic.mcp.queryexplainer.mcp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for the explainQueries tool.
 */
public record ExplainQueriesResponse(
        boolean success,
        List<Entry> results,
        Summary summary,
        String error
) {
    /**
     * Outcome for a single query of the batch. Text fields are null for invalid queries.
     */
    public record Entry(
            String query,
            boolean valid,
            @JsonProperty("narrative_text") String narrativeText,
            @JsonProperty("deterministic_text") String deterministicText,
            @JsonProperty("ast_depth") Integer astDepth,
            String error
    ) {
        public static Entry valid(final String query, final String narrativeText,
                                  final String deterministicText, final int astDepth) {
            return new Entry(query, true, narrativeText, deterministicText, astDepth, null);
        }

        public static Entry invalid(final String query, final String error) {
            return new Entry(query, false, null, null, null, error);
        }
    }

    /**
     * Averages are computed over the valid entries only, 0 if there are none.
     */
    public record Summary(
            int totalQueries,
            int validQueries,
            int invalidQueries,
            double averageNarrativeLength,
            double averageDeterministicLength,
            double averageAstDepth
    ) {
        public static Summary of(final List<Entry> entries) {
            int valid = 0;
            long narrativeLength = 0;
            long deterministicLength = 0;
            long depth = 0;
            for (final Entry entry : entries) {
                if (entry.valid()) {
                    valid++;
                    narrativeLength += entry.narrativeText().length();
                    deterministicLength += entry.deterministicText().length();
                    depth += entry.astDepth();
                }
            }
            if (valid == 0) {
                return new Summary(entries.size(), 0, entries.size(), 0.0, 0.0, 0.0);
            }
            return new Summary(entries.size(), valid, entries.size() - valid,
                    (double) narrativeLength / valid,
                    (double) deterministicLength / valid,
                    (double) depth / valid);
        }
    }

    public static ExplainQueriesResponse success(final List<Entry> results) {
        return new ExplainQueriesResponse(true, results, Summary.of(results), null);
    }

    public static ExplainQueriesResponse error(final String errorMessage) {
        return new ExplainQueriesResponse(false, null, null, errorMessage);
    }
}
