package fpt.com.clinicbooking.domain.doctor.repository;

import fpt.com.clinicbooking.domain.doctor.entity.Doctor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface DoctorRepository extends JpaRepository<Doctor, Integer> {

    boolean existsByLicenseNumberIgnoreCase(String licenseNumber);
    boolean existsByLicenseNumberIgnoreCaseAndIdNot(String licenseNumber, Integer id);

    boolean existsByUser_Id(Integer userId);
    boolean existsByUser_IdAndIdNot(Integer userId, Integer id);

    @Query("SELECT d FROM Doctor d WHERE " +
            "(:specialtyId IS NULL OR EXISTS (SELECT 1 FROM DoctorSpecialty ds " +
            "   WHERE ds.doctor = d AND ds.specialty.id = :specialtyId)) AND " +
            "(:name IS NULL OR :name = '' OR " +
            "LOWER(d.firstName) LIKE LOWER(CONCAT('%', :name, '%')) OR " +
            "LOWER(d.lastName) LIKE LOWER(CONCAT('%', :name, '%')))")
    Page<Doctor> search(@Param("specialtyId") Integer specialtyId,
                        @Param("name") String name,
                        Pageable pageable);
}
