package io.github.riemr.production.application.dto;

import lombok.Data;

import java.time.LocalTime;

@Data
public class RecordStartRequest {
    private LocalTime actualStartTime;   // null なら現在時刻
}
