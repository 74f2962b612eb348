package com.sahd.search.service.grouping;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.grouping")
public class GroupingProperties {
    private int minFetchSize = 100;
    private int perGroupFetch = 10;
    private int maxFetchSize = 10000;

    public int getMinFetchSize() {
        return minFetchSize;
    }

    public void setMinFetchSize(int minFetchSize) {
        this.minFetchSize = minFetchSize;
    }

    public int getPerGroupFetch() {
        return perGroupFetch;
    }

    public void setPerGroupFetch(int perGroupFetch) {
        this.perGroupFetch = perGroupFetch;
    }

    public int getMaxFetchSize() {
        return maxFetchSize;
    }

    public void setMaxFetchSize(int maxFetchSize) {
        this.maxFetchSize = maxFetchSize;
    }
}
