package com.sahd.search.ingest;

import java.util.ArrayList;
import java.util.List;

public final class SegmentMerger {
    public static final double DEFAULT_MIN_DURATION = 15.0;
    public static final double DEFAULT_MAX_DURATION = 120.0;

    private SegmentMerger() {
    }

    public static List<TranscriptSpan> merge(List<TranscriptSpan> spans) {
        return merge(spans, DEFAULT_MIN_DURATION, DEFAULT_MAX_DURATION);
    }

    /**
     * The current span absorbs the next one while it is shorter than {@code minDuration} and the
     * combined span would not exceed {@code maxDuration}. Input order is preserved.
     */
    public static List<TranscriptSpan> merge(List<TranscriptSpan> spans, double minDuration, double maxDuration) {
        if (spans == null || spans.isEmpty()) {
            return List.of();
        }
        List<TranscriptSpan> merged = new ArrayList<>();
        TranscriptSpan current = spans.get(0);
        for (int i = 1; i < spans.size(); i++) {
            TranscriptSpan next = spans.get(i);
            double combined = next.end() - current.start();
            if (current.duration() < minDuration && combined <= maxDuration) {
                current = new TranscriptSpan(current.start(), next.end(), join(current.text(), next.text()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    private static String join(String left, String right) {
        String head = left == null ? "" : left;
        String tail = right == null ? "" : right.strip();
        return head + " " + tail;
    }
}
