package com.ridematch.dispatch.result;

import com.ridematch.shared.enums.RideStatus;

import java.util.List;
import java.util.UUID;

public sealed interface RejectOutcome extends DispatchOutcome {

    /**
     * @param remainingDrivers notified drivers that have not declined yet
     */
    record Recorded(UUID rideId, String driverId, int rejectionCount,
                    List<String> remainingDrivers) implements RejectOutcome {
        public String code()          { return "RECORDED"; }
        public ErrorKind errorKind()  { return null; }
        public String message()       { return "Rejection recorded"; }
    }

    record NotFound(UUID rideId, String message) implements RejectOutcome {
        public String code()          { return "NOT_FOUND"; }
        public ErrorKind errorKind()  { return ErrorKind.NOT_FOUND; }
    }

    record NotNotified(UUID rideId, String driverId) implements RejectOutcome {
        public String code()          { return "NOT_NOTIFIED"; }
        public ErrorKind errorKind()  { return ErrorKind.CONFLICT; }
        public String message()       { return "Driver " + driverId + " was not notified about ride " + rideId; }
    }

    record AlreadyResolved(UUID rideId, RideStatus status) implements RejectOutcome {
        public String code()          { return "ALREADY_RESOLVED"; }
        public ErrorKind errorKind()  { return ErrorKind.PRECONDITION_FAILED; }
        public String message()       { return "Ride " + rideId + " is " + status + ", no longer open"; }
    }
}
