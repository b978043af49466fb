package io.github.riemr.production.infrastructure.mapper;

import io.github.riemr.production.domain.model.Certification;
import io.github.riemr.production.domain.model.Worker;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface WorkerMapper {
    @Select("SELECT * FROM worker WHERE status = 'ACTIVE' ORDER BY id")
    List<Worker> selectActive();

    @Select("SELECT * FROM worker WHERE id = #{id}")
    Worker selectByPrimaryKey(Long id);

    @Select("SELECT worker_id, equipment_id, certified_at, expires_at FROM equipment_certification " +
            "ORDER BY worker_id, equipment_id")
    List<Certification> selectCertifications();
}
