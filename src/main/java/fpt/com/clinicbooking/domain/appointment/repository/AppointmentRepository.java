package fpt.com.clinicbooking.domain.appointment.repository;

import fpt.com.clinicbooking.domain.appointment.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Integer>, JpaSpecificationExecutor<Appointment> {

    boolean existsByPatient_Id(Integer patientId);

    boolean existsByDoctor_Id(Integer doctorId);
}
