package io.github.riemr.production;

import io.github.riemr.production.config.ShiftCalendarProperties;
import io.github.riemr.production.domain.model.Certification;
import io.github.riemr.production.domain.model.Equipment;
import io.github.riemr.production.domain.model.EquipmentStatus;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.domain.model.SkillCategory;
import io.github.riemr.production.domain.model.StepCategory;
import io.github.riemr.production.domain.model.Worker;
import io.github.riemr.production.domain.model.WorkerStatus;
import io.github.riemr.production.planning.calendar.ConfiguredShiftCalendar;
import io.github.riemr.production.planning.catalog.ResourceSnapshot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/** テスト用の工程・作業者・カレンダー生成ヘルパ。 */
public final class Fixtures {

    /** 2026-10-19 は月曜日 */
    public static final LocalDate MONDAY = LocalDate.of(2026, 10, 19);

    private Fixtures() {}

    public static ConfiguredShiftCalendar calendar() {
        return new ConfiguredShiftCalendar(new ShiftCalendarProperties());
    }

    public static ProductStep step(long id, int sequence, StepCategory category, int timePerPiece, Long... deps) {
        SkillCategory skill = category == StepCategory.SEWING ? SkillCategory.SEWING : SkillCategory.OTHER;
        return ProductStep.builder()
                .id(id)
                .productId(1L)
                .name("step-" + id)
                .sequence(sequence)
                .category(category)
                .timePerPieceSeconds(timePerPiece)
                .requiredSkillCategory(skill)
                .dependencies(new LinkedHashSet<>(Arrays.asList(deps)))
                .build();
    }

    public static Worker worker(long id, SkillCategory skill) {
        return Worker.builder().id(id).name("worker-" + id).status(WorkerStatus.ACTIVE).skillCategory(skill).build();
    }

    public static Equipment equipment(long id, EquipmentStatus status) {
        return Equipment.builder().id(id).name("equipment-" + id).status(status).build();
    }

    public static Certification cert(long workerId, long equipmentId, LocalDate expiresAt) {
        return Certification.builder().workerId(workerId).equipmentId(equipmentId).expiresAt(expiresAt).build();
    }

    public static Proficiency proficiency(long workerId, long stepId, int level) {
        return Proficiency.builder().workerId(workerId).stepId(stepId).level(level).version(0L).build();
    }

    public static ResourceSnapshot snapshot(List<Worker> workers) {
        return snapshot(workers, List.of(), List.of(), List.of());
    }

    public static ResourceSnapshot snapshot(List<Worker> workers, List<Equipment> equipment,
                                            List<Certification> certs, List<Proficiency> proficiencies) {
        return new ResourceSnapshot(MONDAY.atStartOfDay(), workers, equipment, certs, proficiencies);
    }

    public static LocalDateTime at(LocalDate date, int hour, int minute) {
        return date.atTime(hour, minute);
    }
}
