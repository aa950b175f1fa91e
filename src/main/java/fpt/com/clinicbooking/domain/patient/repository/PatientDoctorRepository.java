package fpt.com.clinicbooking.domain.patient.repository;

import fpt.com.clinicbooking.domain.patient.entity.PatientDoctor;
import fpt.com.clinicbooking.domain.patient.entity.PatientDoctorId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PatientDoctorRepository extends JpaRepository<PatientDoctor, PatientDoctorId> {

    List<PatientDoctor> findByPatient_IdOrderByPrimaryDescAssignedDateAsc(Integer patientId);
}
