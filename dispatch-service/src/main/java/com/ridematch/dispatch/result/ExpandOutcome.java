package com.ridematch.dispatch.result;

import com.ridematch.dispatch.model.NotifiedDriver;
import com.ridematch.shared.enums.RideStatus;

import java.util.List;
import java.util.UUID;

public sealed interface ExpandOutcome extends DispatchOutcome {

    record Expanded(UUID rideId,
                    double previousRadiusKm,
                    double newRadiusKm,
                    int broadcastCount,
                    List<NotifiedDriver> newlyNotified,
                    int totalNotified) implements ExpandOutcome {
        public String code()          { return "EXPANDED"; }
        public ErrorKind errorKind()  { return null; }
        public String message()       { return "Radius expanded to " + newRadiusKm + " km"; }
    }

    record NotFound(UUID rideId, String message) implements ExpandOutcome {
        public String code()          { return "NOT_FOUND"; }
        public ErrorKind errorKind()  { return ErrorKind.NOT_FOUND; }
    }

    record AlreadyResolved(UUID rideId, RideStatus status) implements ExpandOutcome {
        public String code()          { return "ALREADY_RESOLVED"; }
        public ErrorKind errorKind()  { return ErrorKind.PRECONDITION_FAILED; }
        public String message()       { return "Ride " + rideId + " is " + status + ", no longer open"; }
    }

    record Invalid(String message) implements ExpandOutcome {
        public String code()          { return "INVALID"; }
        public ErrorKind errorKind()  { return ErrorKind.VALIDATION; }
    }
}
