package com.ridematch.dispatch.controller;

import com.ridematch.dispatch.model.RideResponse;
import com.ridematch.dispatch.result.DispatchOutcome;
import com.ridematch.dispatch.result.ErrorKind;
import com.ridematch.dispatch.result.LifecycleResult;
import com.ridematch.shared.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps engine outcomes onto HTTP. Failures keep the outcome as the response
 * data so clients can read its fields (e.g. the remaining drivers).
 */
final class OutcomeResponses {

    private OutcomeResponses() {
    }

    static <T extends DispatchOutcome> ResponseEntity<ApiResponse<T>> of(T outcome) {
        if (outcome.succeeded()) {
            return ResponseEntity.ok(ApiResponse.ok(outcome));
        }
        return ResponseEntity.status(statusOf(outcome.errorKind()))
                .body(ApiResponse.error(outcome.code(), outcome.message(), outcome));
    }

    static ResponseEntity<ApiResponse<RideResponse>> ofLifecycle(LifecycleResult result) {
        if (result instanceof LifecycleResult.Applied applied) {
            return ResponseEntity.ok(ApiResponse.ok(RideResponse.from(applied.ride())));
        }
        return ResponseEntity.status(statusOf(result.errorKind()))
                .body(ApiResponse.error(result.code(), result.message()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND           -> HttpStatus.NOT_FOUND;
            case CONFLICT            -> HttpStatus.CONFLICT;
            case PRECONDITION_FAILED -> HttpStatus.PRECONDITION_FAILED;
            case VALIDATION          -> HttpStatus.BAD_REQUEST;
            case TRANSIENT           -> HttpStatus.SERVICE_UNAVAILABLE;
            case FORBIDDEN           -> HttpStatus.FORBIDDEN;
        };
    }
}
