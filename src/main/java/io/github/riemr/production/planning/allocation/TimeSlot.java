package io.github.riemr.production.planning.allocation;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/** 1 日内の作業枠と、その枠で完了する出来高。 */
@Value
public class TimeSlot {
    LocalDate date;
    LocalTime start;
    LocalTime end;
    int output;
}
