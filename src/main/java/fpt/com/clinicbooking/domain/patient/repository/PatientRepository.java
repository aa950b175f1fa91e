package fpt.com.clinicbooking.domain.patient.repository;

import fpt.com.clinicbooking.domain.patient.entity.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PatientRepository extends JpaRepository<Patient, Integer>, JpaSpecificationExecutor<Patient> {

    boolean existsByNationalId(String nationalId);
    boolean existsByNationalIdAndIdNot(String nationalId, Integer id);

    @Query("SELECT p FROM Patient p WHERE " +
            "LOWER(p.firstName) LIKE LOWER(CONCAT('%', :name, '%')) OR " +
            "LOWER(p.lastName) LIKE LOWER(CONCAT('%', :name, '%')) " +
            "ORDER BY p.lastName, p.firstName")
    List<Patient> searchByName(@Param("name") String name);
}
