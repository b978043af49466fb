package io.github.riemr.production.infrastructure.mapper;

import io.github.riemr.production.domain.model.Assignment;
import io.github.riemr.production.domain.model.ScheduleEntry;
import org.apache.ibatis.annotations.*;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Mapper
public interface ScheduleEntryMapper {
    String COLUMNS = "e.id, e.schedule_id, s.order_id, e.product_step_id AS step_id, e.work_date, e.start_time, " +
            "e.end_time, e.planned_output, e.actual_start_time, e.actual_end_time, e.actual_output, e.status, e.notes ";
    String FROM = "FROM schedule_entry e JOIN schedule s ON s.id = e.schedule_id ";

    @Select("SELECT " + COLUMNS + FROM + "WHERE e.schedule_id = #{scheduleId} ORDER BY e.work_date, e.start_time, e.id")
    List<ScheduleEntry> selectBySchedule(Long scheduleId);

    @Select("SELECT " + COLUMNS + FROM + "WHERE e.id = #{id}")
    ScheduleEntry selectByPrimaryKey(Long id);

    @Select("<script>SELECT " + COLUMNS + FROM + "WHERE s.order_id IN " +
            "<foreach collection='orderIds' item='id' open='(' separator=',' close=')'>#{id}</foreach> " +
            "ORDER BY s.order_id, e.work_date, e.start_time, e.id</script>")
    List<ScheduleEntry> selectByOrderIds(@Param("orderIds") Collection<Long> orderIds);

    @Select("SELECT " + COLUMNS + FROM + "WHERE e.status = 'COMPLETED' AND e.work_date >= #{since} " +
            "ORDER BY e.work_date DESC, e.actual_end_time DESC, e.id DESC")
    List<ScheduleEntry> selectCompletedSince(LocalDate since);

    @Select("SELECT " + COLUMNS + FROM + "JOIN schedule_entry_assignment a ON a.entry_id = e.id " +
            "WHERE a.worker_id = #{workerId} AND e.product_step_id = #{stepId} " +
            "AND e.status = 'COMPLETED' AND e.work_date >= #{since} " +
            "ORDER BY e.work_date DESC, e.actual_end_time DESC, e.id DESC")
    List<ScheduleEntry> selectCompletedByWorkerAndStep(@Param("workerId") Long workerId,
                                                       @Param("stepId") Long stepId,
                                                       @Param("since") LocalDate since);

    @Select("SELECT " + COLUMNS + FROM + "JOIN schedule_entry_assignment a ON a.entry_id = e.id " +
            "WHERE a.worker_id = #{workerId} AND e.status = 'COMPLETED' " +
            "AND e.actual_start_time IS NOT NULL AND e.actual_end_time IS NOT NULL " +
            "ORDER BY e.work_date DESC, e.id DESC")
    List<ScheduleEntry> selectCompletedByWorker(Long workerId);

    @Select("SELECT COUNT(*) " + FROM + "WHERE s.order_id = #{orderId} AND e.status <> 'COMPLETED'")
    int countIncomplete(Long orderId);

    @Insert("INSERT INTO schedule_entry (schedule_id, product_step_id, work_date, start_time, end_time, planned_output, " +
            "actual_start_time, actual_end_time, actual_output, status, notes) " +
            "VALUES (#{scheduleId}, #{stepId}, #{workDate}, #{startTime}, #{endTime}, #{plannedOutput}, " +
            "#{actualStartTime}, #{actualEndTime}, #{actualOutput}, #{status}, #{notes})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(ScheduleEntry entry);

    @Update("UPDATE schedule_entry SET actual_start_time = #{actualStartTime}, actual_end_time = #{actualEndTime}, " +
            "actual_output = #{actualOutput}, status = #{status}, notes = #{notes} WHERE id = #{id}")
    int updateActuals(ScheduleEntry entry);

    @Insert("INSERT INTO schedule_entry_assignment (entry_id, worker_id, planned_output) " +
            "VALUES (#{entryId}, #{workerId}, #{plannedOutput})")
    int insertAssignment(Assignment assignment);

    @Select("<script>SELECT entry_id, worker_id, planned_output FROM schedule_entry_assignment WHERE entry_id IN " +
            "<foreach collection='entryIds' item='id' open='(' separator=',' close=')'>#{id}</foreach> " +
            "ORDER BY entry_id, planned_output DESC, worker_id</script>")
    List<Assignment> selectAssignmentsByEntryIds(@Param("entryIds") Collection<Long> entryIds);
}
