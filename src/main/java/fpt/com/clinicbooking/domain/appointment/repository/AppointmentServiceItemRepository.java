package fpt.com.clinicbooking.domain.appointment.repository;

import fpt.com.clinicbooking.domain.appointment.entity.AppointmentServiceItem;
import fpt.com.clinicbooking.domain.appointment.entity.AppointmentServiceItemId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AppointmentServiceItemRepository extends JpaRepository<AppointmentServiceItem, AppointmentServiceItemId> {

    boolean existsByService_Id(Integer serviceId);
}
