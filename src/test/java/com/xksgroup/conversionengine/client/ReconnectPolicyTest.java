package com.xksgroup.conversionengine.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectPolicyTest {

    @Test
    void defaultsDoubleFromOneSecondUpToThirty() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofSeconds(16));
        assertThat(policy.delayFor(6)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayFor(40)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void attemptsAreCapped() {
        ReconnectPolicy policy = ReconnectPolicy.builder().maxAttempts(2).build();

        assertThat(policy.allowsAttempt(1)).isTrue();
        assertThat(policy.allowsAttempt(2)).isTrue();
        assertThat(policy.allowsAttempt(3)).isFalse();
    }

    @Test
    void attemptsCountFromOne() {
        assertThatThrownBy(() -> ReconnectPolicy.defaults().delayFor(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
