package io.github.riemr.production.application.dto;

import io.github.riemr.production.planning.analysis.CapacityAnalysis;
import io.github.riemr.production.planning.analysis.DeadlineRisk;
import io.github.riemr.production.planning.analysis.OvertimeProjection;

import java.util.List;

/**
 * 作業者構成を仮に変えたときの納期リスクと稼働率。何も保存しない。
 *
 * @param availableWorkers 上書き適用後に稼働する作業者数
 */
public record ScenarioAnalysis(
    String name,
    String description,
    int availableWorkers,
    List<DeadlineRisk> deadlineRisks,
    List<OvertimeProjection> overtime,
    CapacityAnalysis capacity
) {}
