package com.sahd.search.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sahd.search.api.dto.ConversationGroup;
import com.sahd.search.api.dto.GroupItem;
import com.sahd.search.api.dto.SegmentHit;
import com.sahd.search.common.PlaybackTime;
import com.sahd.search.common.VideoLinks;
import com.sahd.search.opensearch.OpenSearchHit;
import com.sahd.search.opensearch.SegmentFields;
import com.sahd.search.service.grouping.ConversationGrouping;
import com.sahd.search.service.grouping.ConversationGroupingService;
import com.sahd.search.service.grouping.SegmentGroup;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ResultAggregator {
    private final ConversationGroupingService groupingService;

    public ResultAggregator(ConversationGroupingService groupingService) {
        this.groupingService = groupingService;
    }

    public List<SegmentHit> flat(List<OpenSearchHit> hits) {
        List<SegmentHit> results = new ArrayList<>(hits.size());
        int rank = 1;
        for (OpenSearchHit hit : hits) {
            JsonNode source = hit.getSource();
            SegmentHit item = new SegmentHit();
            item.setDocId(hit.getDocId());
            item.setText(textOf(source, SegmentFields.TEXT));
            Object start = numberOf(source, SegmentFields.START);
            Object end = numberOf(source, SegmentFields.END);
            item.setStart(PlaybackTime.format(start));
            item.setEnd(PlaybackTime.format(end));
            item.setStartSeconds(PlaybackTime.seconds(start));
            item.setEndSeconds(PlaybackTime.seconds(end));
            String link = linkOf(source);
            item.setVideoLink(link);
            item.setVideoId(link == null ? null : VideoLinks.videoId(link));
            item.setDeepLink(VideoLinks.deepLink(link, start));
            item.setGroupId(textOf(source, SegmentFields.GROUP_ID));
            item.setScore(hit.getScore());
            item.setRank(rank++);
            results.add(item);
        }
        return results;
    }

    public List<ConversationGroup> grouped(List<OpenSearchHit> hits, Integer timeBudgetMs) {
        ConversationGrouping grouping = groupingService.group(hits, timeBudgetMs);
        List<ConversationGroup> groups = new ArrayList<>(grouping.groups().size());
        for (SegmentGroup segmentGroup : grouping.groups()) {
            List<GroupItem> items = new ArrayList<>(segmentGroup.segments().size());
            for (OpenSearchHit segment : segmentGroup.segments()) {
                items.add(toGroupItem(segment, grouping));
            }
            ConversationGroup group = new ConversationGroup();
            group.setGroupId(segmentGroup.groupId());
            group.setItems(items);
            groups.add(group);
        }
        return groups;
    }

    private GroupItem toGroupItem(OpenSearchHit segment, ConversationGrouping grouping) {
        JsonNode source = segment.getSource();
        GroupItem item = new GroupItem();
        item.setDocId(segment.getDocId());
        item.setText(textOf(source, SegmentFields.TEXT));
        Object start = numberOf(source, SegmentFields.START);
        Object end = numberOf(source, SegmentFields.END);
        item.setStart(PlaybackTime.format(start));
        item.setEnd(PlaybackTime.format(end));
        item.setStartSeconds(PlaybackTime.seconds(start));
        item.setEndSeconds(PlaybackTime.seconds(end));
        String link = linkOf(source);
        item.setVideoLink(link);
        item.setVideoId(link == null ? null : VideoLinks.videoId(link));
        item.setDeepLink(VideoLinks.deepLink(link, start));
        item.setSequence(Math.max(0L, (long) ConversationGroupingService.sequenceOf(source)));
        item.setFollowUp(source.path(SegmentFields.IS_FOLLOW_UP).asBoolean(false));
        item.setQuestion(textOf(source, SegmentFields.QUESTION));
        item.setAnswer(textOf(source, SegmentFields.ANSWER));
        item.setMatch(grouping.isMatch(segment.getDocId()));
        item.setScore(grouping.scoreOf(segment.getDocId()));
        return item;
    }

    private static String linkOf(JsonNode source) {
        String link = textOf(source, SegmentFields.VIDEO_LINK);
        return link != null ? link : textOf(source, SegmentFields.VIDEO_REFERENCE);
    }

    private static String textOf(JsonNode source, String field) {
        JsonNode value = source.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText("");
        return text.isEmpty() ? null : text;
    }

    private static Object numberOf(JsonNode source, String field) {
        JsonNode value = source.path(field);
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isTextual()) {
            return value.asText();
        }
        return null;
    }
}
