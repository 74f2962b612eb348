package com.sahd.search.common;

public final class PlaybackTime {
    private PlaybackTime() {
    }

    public static long seconds(Object value) {
        double raw;
        if (value instanceof Number number) {
            raw = number.doubleValue();
        } else if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                return 0L;
            }
            try {
                raw = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return 0L;
            }
        } else {
            return 0L;
        }
        if (Double.isNaN(raw) || Double.isInfinite(raw) || raw <= 0) {
            return 0L;
        }
        return (long) Math.floor(raw);
    }

    public static String format(Object value) {
        long total = seconds(value);
        return String.format("%02d:%02d", total / 60, total % 60);
    }
}
