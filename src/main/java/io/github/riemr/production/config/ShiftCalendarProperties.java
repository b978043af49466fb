package io.github.riemr.production.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;

/**
 * 勤務カレンダー設定。接頭辞は production.calendar。
 * 時刻は HH:mm、休日は yyyy-MM-dd の文字列で指定する。
 */
@Data
@ConfigurationProperties(prefix = "production.calendar")
public class ShiftCalendarProperties {

    /** 始業時刻 */
    private String dayStart = "07:00";

    /** 終業時刻 */
    private String dayEnd = "15:30";

    /** 勤務時間内の休憩（昼休み等） */
    private List<TimeWindow> breaks = new ArrayList<>(List.of(new TimeWindow("11:00", "11:30")));

    /** 稼働曜日 */
    private List<DayOfWeek> workingDays = new ArrayList<>(List.of(
            DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY));

    /** 稼働曜日でも休みとする日 */
    private List<String> holidays = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimeWindow {
        private String start;
        private String end;
    }
}
