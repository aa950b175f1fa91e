package fpt.com.clinicbooking.domain.invoice.repository;

import fpt.com.clinicbooking.domain.invoice.entity.Invoice;
import fpt.com.clinicbooking.domain.invoice.entity.InvoiceStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Integer> {

    boolean existsByPatient_Id(Integer patientId);

    @Query("SELECT i FROM Invoice i WHERE " +
            "(:patientId IS NULL OR i.patient.id = :patientId) AND " +
            "(:status IS NULL OR i.status = :status)")
    Page<Invoice> search(@Param("patientId") Integer patientId,
                         @Param("status") InvoiceStatus status,
                         Pageable pageable);
}
