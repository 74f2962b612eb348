package com.sahd.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public class GroupItem {
    @JsonProperty("doc_id")
    private String docId;

    private String text;
    private String start;
    private String end;

    @JsonProperty("start_seconds")
    private long startSeconds;

    @JsonProperty("end_seconds")
    private long endSeconds;

    @JsonProperty("video_link")
    private String videoLink;

    @JsonProperty("video_id")
    private String videoId;

    @JsonProperty("deep_link")
    private String deepLink;

    private long sequence;

    @JsonProperty("is_follow_up")
    private boolean followUp;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String question;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String answer;

    @JsonProperty("is_match")
    private boolean match;

    private double score;

    public String getDocId() {
        return docId;
    }

    public void setDocId(String docId) {
        this.docId = docId;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    public long getStartSeconds() {
        return startSeconds;
    }

    public void setStartSeconds(long startSeconds) {
        this.startSeconds = startSeconds;
    }

    public long getEndSeconds() {
        return endSeconds;
    }

    public void setEndSeconds(long endSeconds) {
        this.endSeconds = endSeconds;
    }

    public String getVideoLink() {
        return videoLink;
    }

    public void setVideoLink(String videoLink) {
        this.videoLink = videoLink;
    }

    public String getVideoId() {
        return videoId;
    }

    public void setVideoId(String videoId) {
        this.videoId = videoId;
    }

    public String getDeepLink() {
        return deepLink;
    }

    public void setDeepLink(String deepLink) {
        this.deepLink = deepLink;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public boolean isFollowUp() {
        return followUp;
    }

    public void setFollowUp(boolean followUp) {
        this.followUp = followUp;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public String getAnswer() {
        return answer;
    }

    public void setAnswer(String answer) {
        this.answer = answer;
    }

    public boolean isMatch() {
        return match;
    }

    public void setMatch(boolean match) {
        this.match = match;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }
}
