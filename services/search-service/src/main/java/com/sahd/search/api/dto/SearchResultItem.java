package com.sahd.search.api.dto;

public interface SearchResultItem {
}
