package io.github.riemr.production.config;

import io.github.riemr.production.planning.allocation.ScheduleGenerator;
import io.github.riemr.production.planning.allocation.TimeSlotAllocator;
import io.github.riemr.production.planning.analysis.CapacityRiskAnalyzer;
import io.github.riemr.production.planning.assignment.WorkerAssignmentResolver;
import io.github.riemr.production.planning.calendar.ConfiguredShiftCalendar;
import io.github.riemr.production.planning.calendar.ShiftCalendar;
import io.github.riemr.production.planning.feedback.EfficiencyEvaluator;
import io.github.riemr.production.planning.graph.StepGraphBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 計画エンジン（Spring 非依存のクラス群）の組み立て。
 */
@Configuration
public class PlanningConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ShiftCalendar shiftCalendar(ShiftCalendarProperties props) {
        return new ConfiguredShiftCalendar(props);
    }

    @Bean
    public StepGraphBuilder stepGraphBuilder() {
        return new StepGraphBuilder();
    }

    @Bean
    public WorkerAssignmentResolver workerAssignmentResolver(SchedulingProperties props) {
        return new WorkerAssignmentResolver(props.getMaxWorkersPerEntry(), props.isSewingWorkersAssistOtherSteps());
    }

    @Bean
    public TimeSlotAllocator timeSlotAllocator(ShiftCalendar calendar) {
        return new TimeSlotAllocator(calendar);
    }

    @Bean
    public ScheduleGenerator scheduleGenerator(ShiftCalendar calendar, TimeSlotAllocator allocator,
                                               WorkerAssignmentResolver resolver) {
        return new ScheduleGenerator(calendar, allocator, resolver);
    }

    @Bean
    public CapacityRiskAnalyzer capacityRiskAnalyzer(ShiftCalendar calendar, WorkerAssignmentResolver resolver) {
        return new CapacityRiskAnalyzer(calendar, resolver);
    }

    @Bean
    public EfficiencyEvaluator efficiencyEvaluator(SchedulingProperties props) {
        SchedulingProperties.Efficiency e = props.getEfficiency();
        return new EfficiencyEvaluator(e.getHighThreshold(), e.getLowThreshold(),
                e.getWindowSize(), e.getMinSamples(), e.getLookbackDays());
    }
}
