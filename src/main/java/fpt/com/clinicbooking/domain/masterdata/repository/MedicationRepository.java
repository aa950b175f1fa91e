package fpt.com.clinicbooking.domain.masterdata.repository;

import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MedicationRepository extends JpaRepository<Medication, Integer> {

    List<Medication> findByNameIgnoreCase(String name);

    List<Medication> findByNameContainingIgnoreCaseOrderByNameAsc(String name);
}
