package com.pgcluster.ha.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NetworkUtils")
class NetworkUtilsTest {

    @Test
    @DisplayName("should accept bare IPs and hostnames")
    void shouldAcceptBareHosts() {
        assertThat(NetworkUtils.isSafeHost("192.0.2.1")).isTrue();
        assertThat(NetworkUtils.isSafeHost("db-1.internal")).isTrue();
        assertThat(NetworkUtils.isSafeHost("fd00::1")).isTrue();
    }

    @Test
    @DisplayName("should reject paths, spaces and empty input")
    void shouldRejectUnsafeHosts() {
        assertThat(NetworkUtils.isSafeHost("10.0.0.1/admin?x=1")).isFalse();
        assertThat(NetworkUtils.isSafeHost("10.0.0.1; rm -rf /")).isFalse();
        assertThat(NetworkUtils.isSafeHost("")).isFalse();
        assertThat(NetworkUtils.isSafeHost(null)).isFalse();
    }

    @Test
    @DisplayName("should bracket IPv6 literals for URLs")
    void shouldBracketIpv6() {
        assertThat(NetworkUtils.urlHost("fd00::1")).isEqualTo("[fd00::1]");
        assertThat(NetworkUtils.urlHost("[fd00::1]")).isEqualTo("[fd00::1]");
        assertThat(NetworkUtils.urlHost("10.0.0.1")).isEqualTo("10.0.0.1");
    }

    @Test
    @DisplayName("should derive the Patroni member name from the address")
    void shouldDeriveMemberNames() {
        assertThat(NetworkUtils.patroniMemberName("192.0.2.1")).isEqualTo("pg192_0_2_1");
        assertThat(NetworkUtils.patroniMemberName("fd00::1")).isEqualTo("pgfd00__1");
    }
}
