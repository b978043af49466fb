package io.github.riemr.production.application.service;

import io.github.riemr.production.application.util.KeyedLocks;
import io.github.riemr.production.planning.catalog.ProficiencyKey;
import org.springframework.stereotype.Component;

/**
 * 受注単位（生成・再計画・実績記録）と作業者 × 工程単位（習熟度更新）のロック。
 */
@Component
public class SchedulingLocks {
    private final KeyedLocks<Long> orders = new KeyedLocks<>("Order");
    private final KeyedLocks<ProficiencyKey> proficiencies = new KeyedLocks<>("Proficiency");

    public KeyedLocks<Long> orders() { return orders; }

    public KeyedLocks<ProficiencyKey> proficiencies() { return proficiencies; }
}
