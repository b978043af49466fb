package io.github.riemr.production.infrastructure.mapper;

import io.github.riemr.production.domain.model.Schedule;
import org.apache.ibatis.annotations.*;

@Mapper
public interface ScheduleMapper {
    @Select("SELECT * FROM schedule WHERE id = #{id}")
    Schedule selectByPrimaryKey(Long id);

    @Select("SELECT * FROM schedule WHERE order_id = #{orderId}")
    Schedule selectByOrderId(Long orderId);

    @Insert("INSERT INTO schedule (order_id, start_date, created_at) VALUES (#{orderId}, #{startDate}, #{createdAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(Schedule schedule);

    // エントリと割当は ON DELETE CASCADE で消える
    @Delete("DELETE FROM schedule WHERE order_id = #{orderId}")
    int deleteByOrderId(Long orderId);
}
