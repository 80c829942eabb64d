package com.waqiti.auditpipeline.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IpAddressHasher")
class IpAddressHasherTest {

    private final IpAddressHasher hasher = new IpAddressHasher();

    @Test
    @DisplayName("Should produce the truncated SHA-256 hex digest")
    void shouldProduceTruncatedDigest() {
        assertThat(hasher.hash("127.0.0.1")).isEqualTo("12ca17b49af22894");
        assertThat(hasher.hash("203.0.113.7")).isEqualTo("fec52565aa0cf18f");
    }

    @Test
    @DisplayName("Should be deterministic and fixed length")
    void shouldBeDeterministic() {
        String first = hasher.hash("2001:db8::1");

        assertThat(first).hasSize(IpAddressHasher.HASH_LENGTH).isEqualTo(hasher.hash("2001:db8::1"));
        assertThat(first).isNotEqualTo(hasher.hash("2001:db8::2"));
    }

    @Test
    @DisplayName("Should return null for absent address")
    void shouldReturnNullForAbsent() {
        assertThat(hasher.hash(null)).isNull();
        assertThat(hasher.hash("  ")).isNull();
    }
}
