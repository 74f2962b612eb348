package com.sahd.search.service;

public record SearchCommand(String query, Object size, String mode, boolean group, Integer timeoutMs) {
}
