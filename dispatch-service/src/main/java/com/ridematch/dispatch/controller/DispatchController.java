package com.ridematch.dispatch.controller;

import com.ridematch.dispatch.exception.DispatchException;
import com.ridematch.dispatch.model.BroadcastRecord;
import com.ridematch.dispatch.model.BroadcastResult;
import com.ridematch.dispatch.model.RideRequest;
import com.ridematch.dispatch.model.RideResponse;
import com.ridematch.dispatch.result.AcceptOutcome;
import com.ridematch.dispatch.result.DriverCancelOutcome;
import com.ridematch.dispatch.result.ExpandOutcome;
import com.ridematch.dispatch.result.RejectOutcome;
import com.ridematch.dispatch.service.DispatchOrchestrator;
import com.ridematch.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/rides")
@RequiredArgsConstructor
public class DispatchController {

    private final DispatchOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<ApiResponse<RideResponse>> requestRide(@Valid @RequestBody RideRequest request) {
        RideResponse response = RideResponse.from(orchestrator.requestRide(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @GetMapping("/{rideId}")
    public ResponseEntity<ApiResponse<RideResponse>> getRide(@PathVariable("rideId") UUID rideId) {
        return orchestrator.getRide(rideId)
                .map(r -> ResponseEntity.ok(ApiResponse.ok(RideResponse.from(r))))
                .orElseThrow(() -> new DispatchException("RIDE_NOT_FOUND", "Ride " + rideId + " not found"));
    }

    @PostMapping("/{rideId}/broadcast")
    public ResponseEntity<ApiResponse<BroadcastResult>> broadcast(
            @PathVariable("rideId") UUID rideId,
            @RequestParam(value = "radiusKm", required = false) Double radiusKm) {

        return ResponseEntity.ok(ApiResponse.ok(orchestrator.broadcastRide(rideId, radiusKm)));
    }

    @GetMapping("/{rideId}/broadcast")
    public ResponseEntity<ApiResponse<BroadcastRecord>> getBroadcast(@PathVariable("rideId") UUID rideId) {
        return orchestrator.getBroadcast(rideId)
                .map(b -> ResponseEntity.ok(ApiResponse.ok(b)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error("NOT_FOUND", "No broadcast for ride " + rideId)));
    }

    @PostMapping("/{rideId}/accept")
    public ResponseEntity<ApiResponse<AcceptOutcome>> accept(
            @PathVariable("rideId") UUID rideId,
            @RequestParam("driverId") String driverId,
            @RequestParam("riderId") String riderId) {

        return OutcomeResponses.of(orchestrator.accept(rideId, driverId, riderId));
    }

    @PostMapping("/{rideId}/reject")
    public ResponseEntity<ApiResponse<RejectOutcome>> reject(
            @PathVariable("rideId") UUID rideId,
            @RequestParam("driverId") String driverId) {

        return OutcomeResponses.of(orchestrator.reject(rideId, driverId));
    }

    @PostMapping("/{rideId}/expand")
    public ResponseEntity<ApiResponse<ExpandOutcome>> expand(
            @PathVariable("rideId") UUID rideId,
            @RequestParam(value = "currentRadiusKm", required = false) Double currentRadiusKm,
            @RequestParam(value = "incrementKm", required = false) Double incrementKm) {

        return OutcomeResponses.of(orchestrator.expand(rideId, currentRadiusKm, incrementKm));
    }

    @PostMapping("/{rideId}/arriving")
    public ResponseEntity<ApiResponse<RideResponse>> arriving(
            @PathVariable("rideId") UUID rideId,
            @RequestParam("driverId") String driverId) {

        return OutcomeResponses.ofLifecycle(orchestrator.arrive(rideId, driverId));
    }

    @PostMapping("/{rideId}/start")
    public ResponseEntity<ApiResponse<RideResponse>> start(
            @PathVariable("rideId") UUID rideId,
            @RequestParam("driverId") String driverId) {

        return OutcomeResponses.ofLifecycle(orchestrator.start(rideId, driverId));
    }

    @PostMapping("/{rideId}/complete")
    public ResponseEntity<ApiResponse<RideResponse>> complete(
            @PathVariable("rideId") UUID rideId,
            @RequestParam("driverId") String driverId,
            @RequestParam("actualDistanceKm") double actualDistanceKm) {

        return OutcomeResponses.ofLifecycle(orchestrator.complete(rideId, driverId, actualDistanceKm));
    }

    @PostMapping("/{rideId}/cancel")
    public ResponseEntity<ApiResponse<RideResponse>> cancel(
            @PathVariable("rideId") UUID rideId,
            @RequestParam("userId") String userId,
            @RequestParam(value = "reason", required = false) String reason) {

        return OutcomeResponses.ofLifecycle(orchestrator.cancel(rideId, userId, reason));
    }

    @PostMapping("/{rideId}/driver-cancel")
    public ResponseEntity<ApiResponse<DriverCancelOutcome>> driverCancel(
            @PathVariable("rideId") UUID rideId,
            @RequestParam("driverId") String driverId,
            @RequestParam(value = "reason", required = false) String reason) {

        return OutcomeResponses.of(orchestrator.driverCancel(rideId, driverId, reason));
    }
}
