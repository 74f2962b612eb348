package com.sahd.search.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SearchSizePolicyTest {

    private final SearchSizePolicy policy = new SearchSizePolicy(new SearchProperties());

    @Test
    void invalidSizesFallBackToDefault() {
        assertThat(policy.resolve(null)).isEqualTo(50);
        assertThat(policy.resolve(0)).isEqualTo(50);
        assertThat(policy.resolve(-5)).isEqualTo(50);
        assertThat(policy.resolve("abc")).isEqualTo(50);
        assertThat(policy.resolve(2.5)).isEqualTo(50);
        assertThat(policy.resolve(true)).isEqualTo(50);
    }

    @Test
    void validSizesAreClampedToMaximum() {
        assertThat(policy.resolve(10)).isEqualTo(10);
        assertThat(policy.resolve("25")).isEqualTo(25);
        assertThat(policy.resolve(7.0)).isEqualTo(7);
        assertThat(policy.resolve(5000)).isEqualTo(1000);
        assertThat(policy.resolve(Long.MAX_VALUE)).isEqualTo(1000);
    }
}
