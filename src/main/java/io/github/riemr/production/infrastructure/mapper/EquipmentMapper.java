package io.github.riemr.production.infrastructure.mapper;

import io.github.riemr.production.domain.model.Equipment;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface EquipmentMapper {
    @Select("SELECT * FROM equipment ORDER BY id")
    List<Equipment> selectAll();
}
