package io.github.riemr.production.domain.model;

import java.time.LocalTime;

public enum EntryStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED;

    /** 実績の記録状況からステータスを導出する。 */
    public static EntryStatus derive(LocalTime actualStartTime, LocalTime actualEndTime, Integer actualOutput) {
        if (actualEndTime != null && actualOutput != null) {
            return COMPLETED;
        }
        if (actualStartTime != null) {
            return IN_PROGRESS;
        }
        return NOT_STARTED;
    }
}
