package com.sahd.search.service.grouping;

import com.fasterxml.jackson.databind.JsonNode;
import com.sahd.search.opensearch.OpenSearchGateway;
import com.sahd.search.opensearch.OpenSearchHit;
import com.sahd.search.opensearch.OpenSearchQueryResult;
import com.sahd.search.opensearch.SegmentFields;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Expands matched segments into their full conversations. Group ids are compared exactly, so
 * ids differing only in case are separate conversations.
 */
@Service
public class ConversationGroupingService {
    private static final Logger log = LoggerFactory.getLogger(ConversationGroupingService.class);
    private static final Comparator<OpenSearchHit> BY_SEQUENCE =
        Comparator.comparingDouble(hit -> sequenceOf(hit.getSource()));

    private final OpenSearchGateway openSearchGateway;
    private final GroupingProperties properties;

    public ConversationGroupingService(OpenSearchGateway openSearchGateway, GroupingProperties properties) {
        this.openSearchGateway = openSearchGateway;
        this.properties = properties;
    }

    public ConversationGrouping group(List<OpenSearchHit> matched, Integer timeBudgetMs) {
        if (matched == null || matched.isEmpty()) {
            return ConversationGrouping.empty();
        }
        Set<String> groupIds = new LinkedHashSet<>();
        Map<String, Double> matchedScores = new LinkedHashMap<>();
        Map<String, List<OpenSearchHit>> matchedByGroup = new LinkedHashMap<>();
        for (OpenSearchHit hit : matched) {
            matchedScores.putIfAbsent(hit.getDocId(), hit.getScore());
            String groupId = groupIdOf(hit.getSource());
            if (groupId == null) {
                continue;
            }
            groupIds.add(groupId);
            matchedByGroup.computeIfAbsent(groupId, k -> new ArrayList<>()).add(hit);
        }
        if (groupIds.isEmpty()) {
            return ConversationGrouping.empty();
        }

        Map<String, List<OpenSearchHit>> fetched = fetchMembers(groupIds, timeBudgetMs);

        List<SegmentGroup> groups = new ArrayList<>(groupIds.size());
        for (String groupId : groupIds) {
            List<OpenSearchHit> members = fetched.get(groupId);
            if (members == null || members.isEmpty()) {
                log.debug("group {} missing from member fetch; using matched segments", groupId);
                members = new ArrayList<>(matchedByGroup.get(groupId));
            }
            members.sort(BY_SEQUENCE);
            groups.add(new SegmentGroup(groupId, List.copyOf(members)));
        }
        return new ConversationGrouping(groups, matchedScores);
    }

    int fetchSize(int groupCount) {
        long wanted = Math.max((long) properties.getMinFetchSize(), (long) properties.getPerGroupFetch() * groupCount);
        return (int) Math.min(properties.getMaxFetchSize(), wanted);
    }

    private Map<String, List<OpenSearchHit>> fetchMembers(Set<String> groupIds, Integer timeBudgetMs) {
        Map<String, Object> query = Map.of("terms", Map.of(SegmentFields.GROUP_ID, new ArrayList<>(groupIds)));
        List<Map<String, Object>> sort = List.of(
            Map.of(SegmentFields.GROUP_ID, "asc"),
            Map.of(SegmentFields.SEQUENCE, "asc")
        );
        OpenSearchQueryResult result = openSearchGateway.search(query, fetchSize(groupIds.size()), sort, timeBudgetMs);

        Map<String, List<OpenSearchHit>> byGroup = new LinkedHashMap<>();
        for (OpenSearchHit hit : result.getHits()) {
            String groupId = groupIdOf(hit.getSource());
            if (groupId == null || !groupIds.contains(groupId)) {
                continue;
            }
            byGroup.computeIfAbsent(groupId, k -> new ArrayList<>()).add(hit);
        }
        return byGroup;
    }

    private static String groupIdOf(JsonNode source) {
        JsonNode value = source.path(SegmentFields.GROUP_ID);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String groupId = value.asText("");
        return groupId.isEmpty() ? null : groupId;
    }

    public static double sequenceOf(JsonNode source) {
        JsonNode value = source.path(SegmentFields.SEQUENCE);
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }
}
