package com.sahd.search.opensearch;

public final class SegmentFields {
    public static final String DOC_ID = "doc_id";
    public static final String TEXT = "text";
    public static final String PROCESSED_TEXT = "processed_text";
    public static final String START = "start";
    public static final String END = "end";
    public static final String VIDEO_LINK = "video_link";
    public static final String VIDEO_REFERENCE = "video_reference";
    public static final String VECTOR = "vector";
    public static final String GROUP_ID = "group_id";
    public static final String SEQUENCE = "sequence";
    public static final String IS_FOLLOW_UP = "is_follow_up";
    public static final String QUESTION = "question";
    public static final String ANSWER = "answer";

    private SegmentFields() {
    }
}
