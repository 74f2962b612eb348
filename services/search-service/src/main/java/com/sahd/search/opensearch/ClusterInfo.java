package com.sahd.search.opensearch;

public record ClusterInfo(String clusterName, String version, String distribution) {
}
