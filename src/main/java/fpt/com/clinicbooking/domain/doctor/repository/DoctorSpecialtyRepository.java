package fpt.com.clinicbooking.domain.doctor.repository;

import fpt.com.clinicbooking.domain.doctor.entity.DoctorSpecialty;
import fpt.com.clinicbooking.domain.doctor.entity.DoctorSpecialtyId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DoctorSpecialtyRepository extends JpaRepository<DoctorSpecialty, DoctorSpecialtyId> {

    List<DoctorSpecialty> findByDoctor_Id(Integer doctorId);
}
