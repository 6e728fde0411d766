package com.ridematch.dispatch.controller;

import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.dispatch.model.DriverAvailability;
import com.ridematch.dispatch.model.LocationUpdateRequest;
import com.ridematch.dispatch.model.RideNotification;
import com.ridematch.dispatch.service.DispatchOrchestrator;
import com.ridematch.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/drivers")
@RequiredArgsConstructor
public class DriverController {

    private final DispatchOrchestrator orchestrator;

    @PostMapping("/{driverId}/available")
    public ResponseEntity<ApiResponse<DriverAvailability>> goAvailable(
            @PathVariable("driverId") String driverId,
            @Valid @RequestBody LocationUpdateRequest location) {

        return ResponseEntity.ok(ApiResponse.ok(
                orchestrator.setDriverAvailable(driverId, location.getLat(), location.getLng())));
    }

    @PostMapping("/{driverId}/unavailable")
    public ResponseEntity<ApiResponse<DriverAvailability>> goUnavailable(@PathVariable("driverId") String driverId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.setDriverUnavailable(driverId)));
    }

    @PutMapping("/{driverId}/location")
    public ResponseEntity<ApiResponse<DriverAvailability>> updateLocation(
            @PathVariable("driverId") String driverId,
            @Valid @RequestBody LocationUpdateRequest location) {

        return ResponseEntity.ok(ApiResponse.ok(
                orchestrator.updateDriverLocation(driverId, location.getLat(), location.getLng())));
    }

    @GetMapping("/{driverId}/status")
    public ResponseEntity<ApiResponse<DriverAvailability>> getStatus(@PathVariable("driverId") String driverId) {
        return orchestrator.getDriverStatus(driverId)
                .map(s -> ResponseEntity.ok(ApiResponse.ok(s)))
                .orElseThrow(() -> new DispatchException("DRIVER_NOT_FOUND", "No availability record for driver " + driverId));
    }

    @GetMapping("/{driverId}/notifications")
    public ResponseEntity<ApiResponse<List<RideNotification>>> notifications(@PathVariable("driverId") String driverId) {
        return ResponseEntity.ok(ApiResponse.ok(orchestrator.pendingNotifications(driverId)));
    }
}
