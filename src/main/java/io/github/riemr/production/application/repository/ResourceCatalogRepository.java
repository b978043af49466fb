package io.github.riemr.production.application.repository;

import io.github.riemr.production.domain.model.Certification;
import io.github.riemr.production.domain.model.Equipment;
import io.github.riemr.production.domain.model.Proficiency;
import io.github.riemr.production.domain.model.Worker;

import java.util.List;
import java.util.Optional;

public interface ResourceCatalogRepository {
    List<Worker> listActiveWorkers();
    Optional<Worker> findWorker(Long workerId);
    List<Equipment> listEquipment();
    List<Certification> getCertifications();
    List<Proficiency> listProficiencies();
    /** 登録がなければ既定値 3。 */
    int getProficiency(Long workerId, Long stepId);
}
