package io.github.riemr.production.infrastructure.mapper;

import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProficiencyHistory;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface ProficiencyMapper {
    @Select("SELECT worker_id, product_step_id, level, version, updated_at FROM worker_proficiency")
    @Results(id = "proficiencyMap", value = {
        @Result(property = "workerId", column = "worker_id"),
        @Result(property = "stepId", column = "product_step_id"),
        @Result(property = "level", column = "level"),
        @Result(property = "version", column = "version"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    List<Proficiency> selectAll();

    @Select("SELECT worker_id, product_step_id, level, version, updated_at FROM worker_proficiency " +
            "WHERE worker_id = #{workerId} AND product_step_id = #{stepId}")
    @ResultMap("proficiencyMap")
    Proficiency selectByPrimaryKey(@Param("workerId") Long workerId, @Param("stepId") Long stepId);

    @Insert("INSERT INTO worker_proficiency (worker_id, product_step_id, level, version, updated_at) " +
            "VALUES (#{workerId}, #{stepId}, #{level}, #{version}, #{updatedAt}) " +
            "ON CONFLICT (worker_id, product_step_id) DO NOTHING")
    int insert(Proficiency proficiency);

    @Update("UPDATE worker_proficiency SET level = #{level}, version = version + 1, updated_at = now() " +
            "WHERE worker_id = #{workerId} AND product_step_id = #{stepId} AND version = #{expectedVersion}")
    int updateLevel(@Param("workerId") Long workerId, @Param("stepId") Long stepId,
                    @Param("level") int level, @Param("expectedVersion") long expectedVersion);

    @Insert("INSERT INTO proficiency_history (worker_id, product_step_id, old_level, new_level, reason, " +
            "avg_efficiency, sample_size, created_at) " +
            "VALUES (#{workerId}, #{stepId}, #{oldLevel}, #{newLevel}, #{reason}, #{avgEfficiency}, #{sampleSize}, " +
            "COALESCE(#{createdAt}, now()))")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertHistory(ProficiencyHistory history);

    @Select("SELECT id, worker_id, product_step_id, old_level, new_level, reason, avg_efficiency, sample_size, created_at " +
            "FROM proficiency_history WHERE worker_id = #{workerId} ORDER BY created_at DESC, id DESC LIMIT #{limit}")
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "workerId", column = "worker_id"),
        @Result(property = "stepId", column = "product_step_id"),
        @Result(property = "oldLevel", column = "old_level"),
        @Result(property = "newLevel", column = "new_level"),
        @Result(property = "reason", column = "reason"),
        @Result(property = "avgEfficiency", column = "avg_efficiency"),
        @Result(property = "sampleSize", column = "sample_size"),
        @Result(property = "createdAt", column = "created_at")
    })
    List<ProficiencyHistory> selectHistoryByWorker(@Param("workerId") Long workerId, @Param("limit") int limit);
}
