package com.ryuqq.ramify.engine.notification;

/**
 * 알림 전달 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>mode: 전달 정책 (기본 IMMEDIATE)</li>
 *   <li>debounceMillis: DEBOUNCED 모드의 대기 시간 (기본 70ms, IMMEDIATE에서는 무시)</li>
 * </ul>
 *
 * @author Ramify Team
 * @since 1.0.0
 * @param mode 전달 정책 (null이 아니어야 함)
 * @param debounceMillis debounce 대기 시간 (밀리초, 양수여야 함)
 */
public record NotificationConfig(
    NotificationMode mode,
    long debounceMillis
) {

    /**
     * Default debounce window.
     */
    public static final long DEFAULT_DEBOUNCE_MILLIS = 70L;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: mode=IMMEDIATE, debounceMillis=70ms</p>
     */
    public NotificationConfig() {
        this(NotificationMode.IMMEDIATE, DEFAULT_DEBOUNCE_MILLIS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public NotificationConfig {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (debounceMillis <= 0) {
            throw new IllegalArgumentException(
                "debounceMillis must be positive (current: " + debounceMillis + ")"
            );
        }
    }

    /**
     * DEBOUNCED 설정 생성.
     *
     * @param debounceMillis debounce 대기 시간
     * @return NotificationConfig 인스턴스
     */
    public static NotificationConfig debounced(long debounceMillis) {
        return new NotificationConfig(NotificationMode.DEBOUNCED, debounceMillis);
    }

    /**
     * mode만 변경한 새 인스턴스 생성.
     */
    public NotificationConfig withMode(NotificationMode mode) {
        return new NotificationConfig(mode, debounceMillis);
    }

    /**
     * debounceMillis만 변경한 새 인스턴스 생성.
     */
    public NotificationConfig withDebounceMillis(long debounceMillis) {
        return new NotificationConfig(mode, debounceMillis);
    }
}
