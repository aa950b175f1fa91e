package fpt.com.clinicbooking.domain.inventory.service;

import fpt.com.clinicbooking.common.exception.BusinessException;
import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.domain.inventory.dto.InventoryCreateDto;
import fpt.com.clinicbooking.domain.inventory.dto.InventoryDto;
import fpt.com.clinicbooking.domain.inventory.entity.Inventory;
import fpt.com.clinicbooking.domain.inventory.repository.InventoryRepository;
import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InventoryServiceTest {

    private InventoryRepository inventoryRepository;
    private MedicationRepository medicationRepository;
    private InventoryService service;
    private Medication paracetamol;

    @BeforeEach
    void setUp() {
        inventoryRepository = mock(InventoryRepository.class);
        medicationRepository = mock(MedicationRepository.class);
        service = new InventoryService(inventoryRepository, medicationRepository);
        paracetamol = Medication.builder().id(9).name("Paracetamol").strength("500 mg").build();
        when(medicationRepository.findById(9)).thenReturn(Optional.of(paracetamol));
        when(inventoryRepository.save(any(Inventory.class))).thenAnswer(inv -> {
            Inventory i = inv.getArgument(0);
            if (i.getId() == null) i.setId(11);
            return i;
        });
    }

    private Inventory stock(int onHand, int reorderLevel) {
        Inventory i = Inventory.builder().id(11).medication(paracetamol)
                .quantityOnHand(onHand).reorderLevel(reorderLevel).build();
        when(inventoryRepository.findById(11)).thenReturn(Optional.of(i));
        return i;
    }

    @Test
    void create_defaultsQuantitiesToZero() {
        InventoryDto dto = service.create(InventoryCreateDto.builder().medicationId(9).build());

        assertEquals(0, dto.getQuantityOnHand());
        assertEquals(0, dto.getReorderLevel());
        assertTrue(dto.isLowStock());
    }

    @Test
    void create_conflicts_whenMedicationAlreadyStocked() {
        when(inventoryRepository.existsByMedication_Id(9)).thenReturn(true);

        ConflictException ex = assertThrows(ConflictException.class,
                () -> service.create(InventoryCreateDto.builder().medicationId(9).build()));

        assertEquals("INVENTORY_EXISTS", ex.getCode());
    }

    @Test
    void restock_addsQuantity_andStampsToday_whenNoDateGiven() {
        stock(5, 10);

        InventoryDto dto = service.restock(11, 20, null);

        assertEquals(25, dto.getQuantityOnHand());
        assertEquals(LocalDate.now(), dto.getLastRestock());
        assertFalse(dto.isLowStock());
    }

    @Test
    void restock_refusesQuantityThatWouldOverflow() {
        Inventory i = stock(5, 10);

        BusinessException ex = assertThrows(BusinessException.class,
                () -> service.restock(11, Integer.MAX_VALUE, null));

        assertEquals("STOCK_OVERFLOW", ex.getCode());
        assertEquals(5, i.getQuantityOnHand());
        assertNull(i.getLastRestock());
        verify(inventoryRepository, never()).save(any());
    }

    @Test
    void deduct_refusesToGoBelowZero() {
        Inventory i = stock(3, 0);

        BusinessException ex = assertThrows(BusinessException.class, () -> service.deduct(11, 4));

        assertEquals("INSUFFICIENT_STOCK", ex.getCode());
        assertEquals(3, i.getQuantityOnHand());
    }

    @Test
    void deduct_allowsEmptyingStock() {
        stock(3, 1);

        InventoryDto dto = service.deduct(11, 3);

        assertEquals(0, dto.getQuantityOnHand());
        assertTrue(dto.isLowStock());
    }
}
