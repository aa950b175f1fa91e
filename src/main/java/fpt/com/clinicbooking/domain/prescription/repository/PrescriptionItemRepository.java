package fpt.com.clinicbooking.domain.prescription.repository;

import fpt.com.clinicbooking.domain.prescription.entity.PrescriptionItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PrescriptionItemRepository extends JpaRepository<PrescriptionItem, Integer> {

    boolean existsByMedication_Id(Integer medicationId);
}
