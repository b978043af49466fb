package io.github.riemr.production.domain.model;

/**
 * 受注ステータス。PENDING → SCHEDULED → IN_PROGRESS → COMPLETED の順にのみ遷移する。
 */
public enum OrderStatus {
    PENDING,
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED;

    public boolean isOpen() {
        return this != COMPLETED;
    }
}
