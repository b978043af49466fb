package io.github.riemr.production.infrastructure.repository;

import io.github.riemr.production.application.repository.ProductRepository;
import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.infrastructure.mapper.ProductStepMapper;
import io.github.riemr.production.infrastructure.persistence.entity.StepDependency;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
public class ProductRepositoryImpl implements ProductRepository {
    private final ProductStepMapper mapper;

    public ProductRepositoryImpl(ProductStepMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<ProductStep> findSteps(Long productId) {
        List<ProductStep> steps = mapper.selectByProduct(productId);
        Map<Long, ProductStep> byId = steps.stream().collect(Collectors.toMap(ProductStep::getId, Function.identity()));
        for (ProductStep step : steps) {
            step.setDependencies(new LinkedHashSet<>());
        }
        for (StepDependency dep : mapper.selectDependenciesByProduct(productId)) {
            ProductStep step = byId.get(dep.getStepId());
            if (step != null) step.getDependencies().add(dep.getDependsOnStepId());
        }
        return steps;
    }

    @Override
    public Optional<ProductStep> findStep(Long stepId) {
        ProductStep step = mapper.selectByPrimaryKey(stepId);
        if (step == null) return Optional.empty();
        step.setDependencies(new LinkedHashSet<>(mapper.selectDependencies(stepId)));
        return Optional.of(step);
    }
}
