package fpt.com.clinicbooking.domain.inventory.repository;

import fpt.com.clinicbooking.domain.inventory.entity.Inventory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface InventoryRepository extends JpaRepository<Inventory, Integer> {

    Optional<Inventory> findByMedication_Id(Integer medicationId);

    boolean existsByMedication_Id(Integer medicationId);

    @Query("SELECT i FROM Inventory i JOIN FETCH i.medication m " +
            "WHERE i.quantityOnHand <= i.reorderLevel ORDER BY m.name")
    List<Inventory> findLowStock();
}
