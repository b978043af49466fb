package io.github.riemr.production.application.service;

import io.github.riemr.production.application.repository.ProductRepository;
import io.github.riemr.production.application.repository.ProficiencyRepository;
import io.github.riemr.production.application.repository.ResourceCatalogRepository;
import io.github.riemr.production.domain.exception.ErrorCode;
import io.github.riemr.production.domain.exception.NotFoundException;
import io.github.riemr.production.domain.exception.ValidationException;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.ProficiencyChangeReason;
import io.github.riemr.production.domain.model.ProficiencyHistory;
import io.github.riemr.production.domain.model.SkillCategory;
import io.github.riemr.production.domain.model.StepCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;

import static io.github.riemr.production.Fixtures.MONDAY;
import static io.github.riemr.production.Fixtures.step;
import static io.github.riemr.production.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class ProficiencyServiceTest {

    private ProficiencyRepository proficiencyRepository;
    private ResourceCatalogRepository catalogRepository;
    private ProductRepository productRepository;
    private ProficiencyService service;

    @BeforeEach
    void setup() {
        proficiencyRepository = mock(ProficiencyRepository.class);
        catalogRepository = mock(ResourceCatalogRepository.class);
        productRepository = mock(ProductRepository.class);
        Clock clock = Clock.fixed(MONDAY.atTime(12, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new ProficiencyService(proficiencyRepository, catalogRepository, productRepository,
                new SchedulingLocks(), new TransactionTemplate(mock(PlatformTransactionManager.class)), clock);

        when(catalogRepository.findWorker(7L)).thenReturn(Optional.of(worker(7, SkillCategory.SEWING)));
        when(productRepository.findStep(20L)).thenReturn(Optional.of(step(20, 1, StepCategory.SEWING, 60)));
    }

    @Test
    void setProficiency_updatesExistingAndRecordsManualHistory() {
        when(proficiencyRepository.find(7L, 20L)).thenReturn(Optional.of(
                Proficiency.builder().workerId(7L).stepId(20L).level(3).version(4L).build()));
        when(proficiencyRepository.updateProficiency(7L, 20L, 5, 4L)).thenReturn(true);

        Proficiency result = service.setProficiency(7L, 20L, 5);

        assertThat(result.getLevel()).isEqualTo(5);
        assertThat(result.getVersion()).isEqualTo(5L);
        ArgumentCaptor<ProficiencyHistory> history = ArgumentCaptor.forClass(ProficiencyHistory.class);
        verify(proficiencyRepository).appendHistory(history.capture());
        assertThat(history.getValue().getOldLevel()).isEqualTo(3);
        assertThat(history.getValue().getNewLevel()).isEqualTo(5);
        assertThat(history.getValue().getReason()).isEqualTo(ProficiencyChangeReason.MANUAL);
    }

    @Test
    void setProficiency_createsRecordWhenMissing() {
        when(proficiencyRepository.find(7L, 20L)).thenReturn(Optional.empty());
        when(proficiencyRepository.insert(any(Proficiency.class))).thenReturn(true);

        Proficiency result = service.setProficiency(7L, 20L, 2);

        assertThat(result.getVersion()).isZero();
        verify(proficiencyRepository).appendHistory(any(ProficiencyHistory.class));
    }

    @Test
    void setProficiency_sameLevelWritesNothing() {
        when(proficiencyRepository.find(7L, 20L)).thenReturn(Optional.of(
                Proficiency.builder().workerId(7L).stepId(20L).level(4).version(1L).build()));

        assertThat(service.setProficiency(7L, 20L, 4).getLevel()).isEqualTo(4);
        verify(proficiencyRepository, never()).updateProficiency(anyLong(), anyLong(), anyInt(), anyLong());
        verify(proficiencyRepository, never()).appendHistory(any());
    }

    @Test
    void setProficiency_rejectsOutOfRangeLevel() {
        assertThatThrownBy(() -> service.setProficiency(7L, 20L, 6))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_LEVEL));
        verifyNoInteractions(proficiencyRepository);
    }

    @Test
    void setProficiency_unknownWorkerIsNotFound() {
        assertThatThrownBy(() -> service.setProficiency(99L, 20L, 3)).isInstanceOf(NotFoundException.class);
    }
}
