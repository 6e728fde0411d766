package com.ridematch.dispatch.controller;

import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.service.DispatchOrchestrator;
import com.ridematch.shared.enums.DriverStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DriverController.class)
class DriverControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DispatchOrchestrator orchestrator;

    @Test
    @DisplayName("Going available with a location → 200 AVAILABLE")
    void goAvailable() throws Exception {
        given(orchestrator.setDriverAvailable("d1", 22.72, 75.86)).willReturn(DriverAvailability.builder()
                .driverId("d1").status(DriverStatus.AVAILABLE).lat(22.72).lng(75.86)
                .updatedAt(Instant.parse("2024-03-01T08:00:00Z")).build());

        mockMvc.perform(post("/api/v1/drivers/{driverId}/available", "d1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lat\": 22.72, \"lng\": 75.86}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("AVAILABLE"))
                .andExpect(jsonPath("$.data.updatedAt").value("2024-03-01T08:00:00Z"));
    }

    @Test
    @DisplayName("A suspended driver cannot go available → 409 DRIVER_SUSPENDED")
    void goAvailable_suspended() throws Exception {
        given(orchestrator.setDriverAvailable("d1", 22.72, 75.86))
                .willThrow(new DispatchException("DRIVER_SUSPENDED", "Driver d1 is suspended"));

        mockMvc.perform(post("/api/v1/drivers/{driverId}/available", "d1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lat\": 22.72, \"lng\": 75.86}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("DRIVER_SUSPENDED"));
    }

    @Test
    @DisplayName("Location update without a longitude → 400")
    void updateLocation_missingLng() throws Exception {
        mockMvc.perform(put("/api/v1/drivers/{driverId}/location", "d1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lat\": 22.72}"))
                .andExpect(status().isBadRequest());

        then(orchestrator).should(never()).updateDriverLocation(anyString(), anyDouble(), anyDouble());
    }

    @Test
    @DisplayName("Status of a driver with no registry entry → 404")
    void status_unknownDriver() throws Exception {
        given(orchestrator.getDriverStatus("ghost")).willReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/drivers/{driverId}/status", "ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("DRIVER_NOT_FOUND"));
    }
}
