package fpt.com.clinicbooking.domain.prescription.repository;

import fpt.com.clinicbooking.domain.prescription.entity.Prescription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PrescriptionRepository extends JpaRepository<Prescription, Integer> {

    Optional<Prescription> findByAppointment_Id(Integer appointmentId);

    boolean existsByAppointment_Id(Integer appointmentId);

    boolean existsByPrescribedBy_Id(Integer doctorId);
}
