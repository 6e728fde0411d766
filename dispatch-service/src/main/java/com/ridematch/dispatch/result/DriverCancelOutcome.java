package com.ridematch.dispatch.result;

import com.ridematch.dispatch.model.BroadcastResult;
import com.ridematch.shared.enums.RideStatus;

import java.time.Instant;
import java.util.UUID;

public sealed interface DriverCancelOutcome extends DispatchOutcome {

    /**
     * @param suspensionExpiresAt null unless this cancellation suspended the driver
     */
    record Processed(UUID rideId,
                     String driverId,
                     int newCancellationCount,
                     boolean suspended,
                     Instant suspensionExpiresAt,
                     BroadcastResult rebroadcast) implements DriverCancelOutcome {
        public String code()          { return "PROCESSED"; }
        public ErrorKind errorKind()  { return null; }
        public String message()       { return suspended ? "Cancelled, driver suspended" : "Cancelled"; }
    }

    record NotFound(String message) implements DriverCancelOutcome {
        public String code()          { return "NOT_FOUND"; }
        public ErrorKind errorKind()  { return ErrorKind.NOT_FOUND; }
    }

    record NotAssigned(UUID rideId, String driverId) implements DriverCancelOutcome {
        public String code()          { return "NOT_ASSIGNED"; }
        public ErrorKind errorKind()  { return ErrorKind.FORBIDDEN; }
        public String message()       { return "Driver " + driverId + " is not assigned to ride " + rideId; }
    }

    record NotCancellable(UUID rideId, RideStatus status) implements DriverCancelOutcome {
        public String code()          { return "NOT_CANCELLABLE"; }
        public ErrorKind errorKind()  { return ErrorKind.PRECONDITION_FAILED; }
        public String message()       { return "Ride " + rideId + " cannot be cancelled by the driver in status " + status; }
    }

    record Conflict(UUID rideId) implements DriverCancelOutcome {
        public String code()          { return "CONFLICT"; }
        public ErrorKind errorKind()  { return ErrorKind.CONFLICT; }
        public String message()       { return "Ride " + rideId + " was modified concurrently, retry"; }
    }
}
