package io.github.riemr.production.application.service;

import io.github.riemr.production.application.repository.ResourceCatalogRepository;
import io.github.riemr.production.planning.catalog.ResourceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 作業者・設備・認定・習熟度を 1 回の処理用スナップショットとして読み込む。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResourceCatalogService {

    private final ResourceCatalogRepository repository;
    private final Clock clock;

    public ResourceSnapshot snapshot() {
        ResourceSnapshot snapshot = new ResourceSnapshot(
                LocalDateTime.now(clock),
                repository.listActiveWorkers(),
                repository.listEquipment(),
                repository.getCertifications(),
                repository.listProficiencies());
        log.debug("Resource snapshot taken at {}: {} active workers",
                snapshot.getTakenAt(), snapshot.getActiveWorkers().size());
        return snapshot;
    }
}
