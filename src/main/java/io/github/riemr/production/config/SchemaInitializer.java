package io.github.riemr.production.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        try {
            // Master data
            jdbc.execute("CREATE TABLE IF NOT EXISTS product (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "name TEXT NOT NULL, " +
                    "description TEXT" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS equipment (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "name TEXT NOT NULL, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'AVAILABLE' " +
                    "CHECK (status IN ('AVAILABLE','IN_USE','MAINTENANCE','RETIRED'))" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS product_step (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "product_id BIGINT NOT NULL REFERENCES product(id) ON DELETE CASCADE, " +
                    "name TEXT NOT NULL, " +
                    "sequence INTEGER NOT NULL, " +
                    "category VARCHAR(16) NOT NULL " +
                    "CHECK (category IN ('CUTTING','SILKSCREEN','PREP','SEWING','INSPECTION')), " +
                    "time_per_piece_seconds INTEGER NOT NULL CHECK (time_per_piece_seconds >= 0), " +
                    "required_skill_category VARCHAR(16) NOT NULL CHECK (required_skill_category IN ('SEWING','OTHER')), " +
                    "equipment_id BIGINT REFERENCES equipment(id)" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS step_dependency (" +
                    "step_id BIGINT NOT NULL REFERENCES product_step(id) ON DELETE CASCADE, " +
                    "depends_on_step_id BIGINT NOT NULL REFERENCES product_step(id) ON DELETE CASCADE, " +
                    "PRIMARY KEY (step_id, depends_on_step_id)" +
                    ")");

            // Workforce
            jdbc.execute("CREATE TABLE IF NOT EXISTS worker (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "name TEXT NOT NULL, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'ACTIVE' CHECK (status IN ('ACTIVE','INACTIVE','ON_LEAVE')), " +
                    "skill_category VARCHAR(16) NOT NULL DEFAULT 'OTHER' CHECK (skill_category IN ('SEWING','OTHER'))" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS equipment_certification (" +
                    "worker_id BIGINT NOT NULL REFERENCES worker(id) ON DELETE CASCADE, " +
                    "equipment_id BIGINT NOT NULL REFERENCES equipment(id) ON DELETE CASCADE, " +
                    "certified_at DATE NOT NULL DEFAULT CURRENT_DATE, " +
                    "expires_at DATE, " +
                    "PRIMARY KEY (worker_id, equipment_id)" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS worker_proficiency (" +
                    "worker_id BIGINT NOT NULL REFERENCES worker(id) ON DELETE CASCADE, " +
                    "product_step_id BIGINT NOT NULL REFERENCES product_step(id) ON DELETE CASCADE, " +
                    "level SMALLINT NOT NULL CHECK (level BETWEEN 1 AND 5), " +
                    "version BIGINT NOT NULL DEFAULT 0, " +
                    "updated_at TIMESTAMP NOT NULL DEFAULT now(), " +
                    "PRIMARY KEY (worker_id, product_step_id)" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS proficiency_history (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "worker_id BIGINT NOT NULL REFERENCES worker(id) ON DELETE CASCADE, " +
                    "product_step_id BIGINT NOT NULL REFERENCES product_step(id) ON DELETE CASCADE, " +
                    "old_level SMALLINT NOT NULL, " +
                    "new_level SMALLINT NOT NULL, " +
                    "reason VARCHAR(16) NOT NULL CHECK (reason IN ('MANUAL','AUTO_INCREASE','AUTO_DECREASE')), " +
                    "avg_efficiency DOUBLE PRECISION, " +
                    "sample_size INTEGER, " +
                    "created_at TIMESTAMP NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_proficiency_history_worker ON proficiency_history (worker_id, created_at DESC)");

            // Orders and schedules
            jdbc.execute("CREATE TABLE IF NOT EXISTS production_order (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "product_id BIGINT NOT NULL REFERENCES product(id), " +
                    "quantity INTEGER NOT NULL CHECK (quantity > 0), " +
                    "due_date DATE NOT NULL, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'PENDING' " +
                    "CHECK (status IN ('PENDING','SCHEDULED','IN_PROGRESS','COMPLETED')), " +
                    "created_at TIMESTAMP NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS schedule (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "order_id BIGINT NOT NULL UNIQUE REFERENCES production_order(id) ON DELETE CASCADE, " +
                    "start_date DATE NOT NULL, " +
                    "created_at TIMESTAMP NOT NULL DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE TABLE IF NOT EXISTS schedule_entry (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "schedule_id BIGINT NOT NULL REFERENCES schedule(id) ON DELETE CASCADE, " +
                    "product_step_id BIGINT NOT NULL REFERENCES product_step(id), " +
                    "work_date DATE NOT NULL, " +
                    "start_time TIME NOT NULL, " +
                    "end_time TIME NOT NULL, " +
                    "planned_output INTEGER NOT NULL, " +
                    "actual_start_time TIME, " +
                    "actual_end_time TIME, " +
                    "actual_output INTEGER, " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'NOT_STARTED' " +
                    "CHECK (status IN ('NOT_STARTED','IN_PROGRESS','COMPLETED')), " +
                    "notes TEXT, " +
                    "CONSTRAINT chk_schedule_entry_window CHECK (end_time >= start_time)" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_schedule_entry_schedule ON schedule_entry (schedule_id, work_date, start_time)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_schedule_entry_completed ON schedule_entry (status, work_date)");
            jdbc.execute("CREATE TABLE IF NOT EXISTS schedule_entry_assignment (" +
                    "entry_id BIGINT NOT NULL REFERENCES schedule_entry(id) ON DELETE CASCADE, " +
                    "worker_id BIGINT NOT NULL REFERENCES worker(id), " +
                    "planned_output INTEGER NOT NULL, " +
                    "PRIMARY KEY (entry_id, worker_id)" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_entry_assignment_worker ON schedule_entry_assignment (worker_id)");
            log.info("Schema ensured");
        } catch (Exception e) {
            log.warn("Schema initialization skipped due to error: {}", e.getMessage());
        }
    }
}
