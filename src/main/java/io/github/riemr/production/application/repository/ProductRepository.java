package io.github.riemr.production.application.repository;

import io.github.riemr.production.domain.model.ProductStep;

import java.util.List;
import java.util.Optional;

public interface ProductRepository {
    /** 依存関係（dependencies）を埋めた工程一覧。 */
    List<ProductStep> findSteps(Long productId);
    Optional<ProductStep> findStep(Long stepId);
}
