package com.sahd.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ConversationGroup implements SearchResultItem {
    @JsonProperty("group_id")
    private String groupId;

    private List<GroupItem> items;

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public List<GroupItem> getItems() {
        return items;
    }

    public void setItems(List<GroupItem> items) {
        this.items = items;
    }
}
