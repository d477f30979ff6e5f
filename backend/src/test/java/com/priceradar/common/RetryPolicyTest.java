package com.priceradar.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_growsLinearlyWithAttempt() {
        RetryPolicy policy = new RetryPolicy(500L, 0, 2);
        assertThat(policy.delayMs(0)).isEqualTo(500L);
        assertThat(policy.delayMs(1)).isEqualTo(1000L);
        assertThat(policy.delayMs(2)).isEqualTo(1500L);
    }

    @Test
    void delayMs_withJitter_staysWithinBounds() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 2);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }

    @Test
    void delayMs_withLargestAllowedJitter_neverDecreases() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.33, 4);
        for (int i = 0; i < 200; i++) {
            long previous = policy.delayMs(0);
            for (int attempt = 1; attempt < 4; attempt++) {
                long next = policy.delayMs(attempt);
                assertThat(next).isGreaterThan(previous);
                previous = next;
            }
        }
    }

    @Test
    void jitterFactorOutsideRange_isRejected() {
        assertThatThrownBy(() -> new RetryPolicy(500, 0.34, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(500, 0.5, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(500, -0.1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void totalAttempts_isRetriesPlusOne() {
        assertThat(RetryPolicy.defaultPolicy().getMaxRetries()).isEqualTo(2);
        assertThat(RetryPolicy.defaultPolicy().getTotalAttempts()).isEqualTo(3);
        assertThat(new RetryPolicy(0, 0, 0).getTotalAttempts()).isEqualTo(1);
    }

    @Test
    void negativeSettingsAreRejected() {
        assertThatThrownBy(() -> new RetryPolicy(-1, 0, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(100, 0, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
