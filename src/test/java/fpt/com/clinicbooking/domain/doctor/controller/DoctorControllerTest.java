package fpt.com.clinicbooking.domain.doctor.controller;

import fpt.com.clinicbooking.common.config.ClinicProperties;
import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.GlobalExceptionHandler;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.common.util.PageRequestFactory;
import fpt.com.clinicbooking.domain.doctor.service.DoctorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DoctorControllerTest {

    private DoctorService doctorService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        doctorService = mock(DoctorService.class);
        DoctorController controller =
                new DoctorController(doctorService, new PageRequestFactory(new ClinicProperties()));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void create_returns400_whenLicenseNumberMissing() throws Exception {
        mockMvc.perform(post("/api/v1/doctors")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"firstName\":\"Lan\",\"lastName\":\"Tran\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.data.licenseNumber").value("LICENSE_NUMBER_REQUIRED"));

        verify(doctorService, never()).create(any());
    }

    @Test
    void delete_returns409_whenDoctorHasAppointments() throws Exception {
        doThrow(new ConflictException("DOCTOR_IN_USE", Map.of("id", 3))).when(doctorService).delete(3);

        mockMvc.perform(delete("/api/v1/doctors/3"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DOCTOR_IN_USE"));
    }

    @Test
    void addSpecialty_returns404_forUnknownSpecialty() throws Exception {
        when(doctorService.addSpecialty(3, 99))
                .thenThrow(new NotFoundException("SPECIALTY_NOT_FOUND", Map.of("id", 99)));

        mockMvc.perform(post("/api/v1/doctors/3/specialties/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SPECIALTY_NOT_FOUND"));
    }
}
