package com.ryuqq.ramify.engine;

import com.ryuqq.ramify.engine.notification.NotificationConfig;

/**
 * 컬렉션 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>notification: 변경 알림 전달 정책 (기본 IMMEDIATE)</li>
 * </ul>
 *
 * @author Ramify Team
 * @since 1.0.0
 * @param notification 알림 설정 (null이 아니어야 함)
 */
public record CollectionConfig(
    NotificationConfig notification
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: notification=IMMEDIATE</p>
     */
    public CollectionConfig() {
        this(new NotificationConfig());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException notification이 null인 경우
     */
    public CollectionConfig {
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
    }

    /**
     * notification만 변경한 새 인스턴스 생성.
     */
    public CollectionConfig withNotification(NotificationConfig notification) {
        return new CollectionConfig(notification);
    }
}
