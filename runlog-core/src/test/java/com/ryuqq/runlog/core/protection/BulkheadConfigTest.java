package com.ryuqq.runlog.core.protection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BulkheadConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BulkheadConfigTest {

    @Test
    void 생성자_양수_허용() {
        assertThat(new BulkheadConfig(3).maxConcurrentCalls()).isEqualTo(3);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void 생성자_양수_아님_예외(int maxConcurrentCalls) {
        assertThatThrownBy(() -> new BulkheadConfig(maxConcurrentCalls))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxConcurrentCalls must be positive");
    }

    @Test
    void unlimited_최대값() {
        assertThat(BulkheadConfig.unlimited().maxConcurrentCalls()).isEqualTo(Integer.MAX_VALUE);
    }
}
