package com.ryuqq.decider.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryConfig 유닛 테스트.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class RetryConfigTest {

    @Test
    void 기본값_확인() {
        RetryConfig config = new RetryConfig();

        assertThat(config.maxAttempts()).isEqualTo(3);
        assertThat(config.baseDelayMs()).isEqualTo(50);
        assertThat(config.maxDelayMs()).isEqualTo(1000);
        assertThat(config.jitterFactor()).isEqualTo(0.1);
    }

    @Test
    void with_메서드는_해당_값만_바꾼_새_설정을_반환() {
        // given
        RetryConfig config = new RetryConfig();

        // when
        RetryConfig changed = config
            .withMaxAttempts(5)
            .withBaseDelayMs(10)
            .withMaxDelayMs(200)
            .withJitterFactor(0.0);

        // then
        assertThat(changed).isEqualTo(new RetryConfig(5, 10, 200, 0.0));
        assertThat(config).isEqualTo(new RetryConfig());
    }

    @Test
    void maxAttempts가_0이면_예외() {
        assertThatThrownBy(() -> new RetryConfig().withMaxAttempts(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts must be positive");
    }

    @Test
    void baseDelayMs가_음수면_예외() {
        assertThatThrownBy(() -> new RetryConfig(3, -1, 1000, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs must be positive");
    }

    @Test
    void maxDelayMs가_baseDelayMs보다_작으면_예외() {
        assertThatThrownBy(() -> new RetryConfig().withMaxDelayMs(10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs must be >= baseDelayMs");
    }

    @Test
    void jitterFactor가_범위를_벗어나면_예외() {
        assertThatThrownBy(() -> new RetryConfig().withJitterFactor(1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor must be between 0.0 and 1.0");
    }
}
