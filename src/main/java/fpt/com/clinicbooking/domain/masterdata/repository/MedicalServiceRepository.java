package fpt.com.clinicbooking.domain.masterdata.repository;

import fpt.com.clinicbooking.domain.masterdata.entity.MedicalService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MedicalServiceRepository extends JpaRepository<MedicalService, Integer> {

    Optional<MedicalService> findByCodeIgnoreCase(String code);

    boolean existsByCodeIgnoreCase(String code);
    boolean existsByCodeIgnoreCaseAndIdNot(String code, Integer id);

    List<MedicalService> findByNameContainingIgnoreCaseOrderByNameAsc(String name);
}
