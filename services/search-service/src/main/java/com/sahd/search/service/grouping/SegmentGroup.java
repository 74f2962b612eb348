package com.sahd.search.service.grouping;

import com.sahd.search.opensearch.OpenSearchHit;
import java.util.List;

public record SegmentGroup(String groupId, List<OpenSearchHit> segments) {
}
