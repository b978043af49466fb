package io.github.riemr.production.infrastructure.mapper;

import io.github.riemr.production.domain.model.ProductStep;
import io.github.riemr.production.infrastructure.persistence.entity.StepDependency;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface ProductStepMapper {
    @Select("SELECT * FROM product_step WHERE product_id = #{productId} ORDER BY sequence, id")
    List<ProductStep> selectByProduct(Long productId);

    @Select("SELECT * FROM product_step WHERE id = #{id}")
    ProductStep selectByPrimaryKey(Long id);

    @Select("SELECT d.step_id, d.depends_on_step_id FROM step_dependency d " +
            "JOIN product_step s ON s.id = d.step_id WHERE s.product_id = #{productId} " +
            "ORDER BY d.step_id, d.depends_on_step_id")
    List<StepDependency> selectDependenciesByProduct(Long productId);

    @Select("SELECT depends_on_step_id FROM step_dependency WHERE step_id = #{stepId} ORDER BY depends_on_step_id")
    List<Long> selectDependencies(Long stepId);
}
