package io.github.riemr.production.infrastructure.repository;

import io.github.riemr.production.application.repository.ResourceCatalogRepository;
import io.github.riemr.production.domain.model.Certification;
import io.github.riemr.production.domain.model.Equipment;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.Worker;
import io.github.riemr.production.infrastructure.mapper.EquipmentMapper;
import io.github.riemr.production.infrastructure.mapper.ProficiencyMapper;
import io.github.riemr.production.infrastructure.mapper.WorkerMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ResourceCatalogRepositoryImpl implements ResourceCatalogRepository {
    private final WorkerMapper workerMapper;
    private final EquipmentMapper equipmentMapper;
    private final ProficiencyMapper proficiencyMapper;

    public ResourceCatalogRepositoryImpl(WorkerMapper workerMapper,
                                         EquipmentMapper equipmentMapper,
                                         ProficiencyMapper proficiencyMapper) {
        this.workerMapper = workerMapper;
        this.equipmentMapper = equipmentMapper;
        this.proficiencyMapper = proficiencyMapper;
    }

    @Override
    public List<Worker> listActiveWorkers() {
        return workerMapper.selectActive();
    }

    @Override
    public Optional<Worker> findWorker(Long workerId) {
        return Optional.ofNullable(workerMapper.selectByPrimaryKey(workerId));
    }

    @Override
    public List<Equipment> listEquipment() {
        return equipmentMapper.selectAll();
    }

    @Override
    public List<Certification> getCertifications() {
        return workerMapper.selectCertifications();
    }

    @Override
    public List<Proficiency> listProficiencies() {
        return proficiencyMapper.selectAll();
    }

    @Override
    public int getProficiency(Long workerId, Long stepId) {
        Proficiency p = proficiencyMapper.selectByPrimaryKey(workerId, stepId);
        return p == null ? Proficiency.DEFAULT_LEVEL : p.getLevel();
    }
}
