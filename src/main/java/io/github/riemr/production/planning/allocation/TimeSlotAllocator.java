package io.github.riemr.production.planning.allocation;

import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.planning.calendar.ShiftCalendar;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * 1 工程の作業量を勤務カレンダー上の日ごとの枠に分割する。
 * 枠は日をまたがない。休憩はまたいでよい（所要時間には含めない）。
 * 終業までに 1 個も仕上がらない途中からの枠は作らず、翌稼働日の始業から始める。
 * 1 個が 1 シフトを超える工程だけは、出来高 0 の終日枠が仕掛かりとして残る。
 */
public class TimeSlotAllocator {

    private static final double EPS = 1e-6;

    private final ShiftCalendar calendar;

    public TimeSlotAllocator(ShiftCalendar calendar) {
        this.calendar = calendar;
    }

    /**
     * @param ratePerSecond 日付ごとのクルー処理能力（個/秒）
     * @return 枠の出来高の合計は quantity に一致する
     */
    public List<TimeSlot> allocate(ProductStep step, int quantity, LocalDateTime earliestStart,
                                   ToDoubleFunction<LocalDate> ratePerSecond, GenerationDeadline deadline) {
        if (quantity <= 0) {
            throw new ValidationException(ErrorCode.INVALID_QUANTITY,
                    "Quantity must be positive for step " + step.getId() + ": " + quantity);
        }
        LocalDateTime slot = calendar.nextOpenSlot(earliestStart);
        if (step.timePerPiece() == 0) {
            return List.of(new TimeSlot(slot.toLocalDate(), slot.toLocalTime(), slot.toLocalTime(), quantity));
        }

        List<TimeSlot> slots = new ArrayList<>();
        double produced = 0;
        int emitted = 0;
        while (true) {
            deadline.check();
            LocalDate date = slot.toLocalDate();
            double rate = ratePerSecond.applyAsDouble(date);
            long available = calendar.workSecondsUntilShiftEnd(slot);
            double capacity = available * rate;
            double remaining = quantity - produced;

            if (capacity + EPS >= remaining) {
                long used = Math.min(available, Math.max(1L, (long) Math.ceil(remaining / rate - EPS)));
                LocalDateTime end = calendar.advance(slot, used);
                slots.add(new TimeSlot(date, slot.toLocalTime(), end.toLocalTime(), quantity - emitted));
                return slots;
            }

            int output = (int) Math.floor(produced + capacity + EPS) - emitted;
            if (output > 0 || slot.equals(calendar.nextOpenSlot(date.atStartOfDay()))) {
                produced += capacity;
                LocalDateTime end = calendar.advance(slot, available);
                slots.add(new TimeSlot(date, slot.toLocalTime(), end.toLocalTime(), output));
                emitted += output;
            }
            slot = calendar.nextOpenSlot(date.plusDays(1).atStartOfDay());
        }
    }
}
