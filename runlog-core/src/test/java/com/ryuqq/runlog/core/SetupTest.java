package com.ryuqq.runlog.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 프로젝트 세팅 검증 테스트
 */
class SetupTest {

    @Test
    void javaVersionShouldBeAtLeast17() {
        // Given
        int feature = Runtime.version().feature();

        // Then
        assertThat(feature).isGreaterThanOrEqualTo(17);
    }
}
