package com.ryuqq.runlog.application.translator;

/**
 * 이벤트 번역기 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultRunType: run에 type 태그가 없을 때 사용할 카테고리 (기본 "chain")</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param defaultRunType 기본 run 타입 (null 또는 빈 문자열 불가)
 */
public record TranslatorConfig(String defaultRunType) {

    /**
     * 기본 run 타입.
     */
    public static final String DEFAULT_RUN_TYPE = "chain";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultRunType="chain"</p>
     */
    public TranslatorConfig() {
        this(DEFAULT_RUN_TYPE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException defaultRunType이 null이거나 빈 문자열인 경우
     */
    public TranslatorConfig {
        if (defaultRunType == null || defaultRunType.isBlank()) {
            throw new IllegalArgumentException("defaultRunType cannot be null or blank");
        }
    }

    /**
     * defaultRunType만 변경한 새 인스턴스 생성.
     */
    public TranslatorConfig withDefaultRunType(String defaultRunType) {
        return new TranslatorConfig(defaultRunType);
    }
}
