package io.github.riemr.production.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 製品の製造工程 1 件。dependencies は同一製品内の先行工程 ID。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductStep {
    private Long id;
    private Long productId;
    private String name;
    private Integer sequence;
    private StepCategory category;
    private Integer timePerPieceSeconds;
    private SkillCategory requiredSkillCategory;
    /** 設備を使う工程のみ設定。作業者にはこの設備の有効な認定が必要。 */
    private Long equipmentId;
    @Builder.Default
    private Set<Long> dependencies = new LinkedHashSet<>();

    public boolean isSewing() {
        return category == StepCategory.SEWING || requiredSkillCategory == SkillCategory.SEWING;
    }

    public int timePerPiece() {
        return timePerPieceSeconds == null ? 0 : timePerPieceSeconds;
    }
}
