package com.sahd.search.service.grouping;

import java.util.List;
import java.util.Map;

public record ConversationGrouping(List<SegmentGroup> groups, Map<String, Double> matchedScores) {
    public static ConversationGrouping empty() {
        return new ConversationGrouping(List.of(), Map.of());
    }

    public boolean isMatch(String docId) {
        return docId != null && matchedScores.containsKey(docId);
    }

    public double scoreOf(String docId) {
        Double score = docId == null ? null : matchedScores.get(docId);
        return score == null ? 0.0 : score;
    }
}
