package com.sahd.search.common;

public final class VideoLinks {
    private static final String WATCH_BASE = "https://www.youtube.com/watch?v=";

    private VideoLinks() {
    }

    public static String videoId(String link) {
        if (link == null) {
            return "";
        }
        String value = link.trim();
        if (value.isEmpty()) {
            return "";
        }
        int marker = value.indexOf("youtu.be/");
        if (marker >= 0) {
            return cut(value.substring(marker + "youtu.be/".length()));
        }
        if (value.contains("youtube.com") || value.contains("youtube-nocookie.com")) {
            String id = queryParam(value, "v");
            if (id != null) {
                return id;
            }
            for (String prefix : new String[] {"/shorts/", "/embed/", "/live/", "/v/"}) {
                marker = value.indexOf(prefix);
                if (marker >= 0) {
                    return cut(value.substring(marker + prefix.length()));
                }
            }
        }
        return value;
    }

    public static String deepLink(String link, Object startSeconds) {
        String id = videoId(link);
        if (id.isEmpty()) {
            return null;
        }
        return WATCH_BASE + id + "&t=" + PlaybackTime.seconds(startSeconds) + "s";
    }

    private static String queryParam(String url, String name) {
        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return null;
        }
        String query = url.substring(queryStart + 1);
        int fragment = query.indexOf('#');
        if (fragment >= 0) {
            query = query.substring(0, fragment);
        }
        for (String pair : query.split("&")) {
            if (pair.startsWith(name + "=")) {
                String value = pair.substring(name.length() + 1);
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private static String cut(String tail) {
        int end = tail.length();
        for (char stop : new char[] {'?', '&', '#', '/'}) {
            int idx = tail.indexOf(stop);
            if (idx >= 0 && idx < end) {
                end = idx;
            }
        }
        return tail.substring(0, end);
    }
}
