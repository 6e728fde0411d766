package com.ridematch.dispatch.result;

import java.time.Instant;
import java.util.UUID;

public sealed interface AcceptOutcome extends DispatchOutcome {

    record Vehicle(String registration, String make, String model, String color) {
    }

    record Won(UUID rideId,
               String driverId,
               String driverName,
               String driverPhone,
               double driverRating,
               Vehicle vehicle,
               double distanceToPickupKm,
               int etaMinutes,
               Instant matchedAt) implements AcceptOutcome {
        public String code()          { return "WON"; }
        public ErrorKind errorKind()  { return null; }
        public String message()       { return "Ride matched"; }
    }

    record AlreadyMatched(UUID rideId) implements AcceptOutcome {
        public String code()          { return "ALREADY_MATCHED"; }
        public ErrorKind errorKind()  { return ErrorKind.CONFLICT; }
        public String message()       { return "Ride " + rideId + " has already been matched"; }
    }

    record Busy(UUID rideId) implements AcceptOutcome {
        public String code()          { return "BUSY"; }
        public ErrorKind errorKind()  { return ErrorKind.TRANSIENT; }
        public String message()       { return "Ride " + rideId + " is being matched, retry shortly"; }
    }

    record NotFound(UUID rideId) implements AcceptOutcome {
        public String code()          { return "NOT_FOUND"; }
        public ErrorKind errorKind()  { return ErrorKind.NOT_FOUND; }
        public String message()       { return "Ride " + rideId + " not found"; }
    }

    record DriverUnavailable(String driverId) implements AcceptOutcome {
        public String code()          { return "DRIVER_UNAVAILABLE"; }
        public ErrorKind errorKind()  { return ErrorKind.CONFLICT; }
        public String message()       { return "Driver " + driverId + " is not available"; }
    }

    record DriverExcluded(UUID rideId, String driverId) implements AcceptOutcome {
        public String code()          { return "DRIVER_EXCLUDED"; }
        public ErrorKind errorKind()  { return ErrorKind.CONFLICT; }
        public String message()       { return "Driver " + driverId + " cancelled ride " + rideId + " and cannot accept it again"; }
    }

    record PreconditionFailed(UUID rideId, String message) implements AcceptOutcome {
        public String code()          { return "PRECONDITION_FAILED"; }
        public ErrorKind errorKind()  { return ErrorKind.PRECONDITION_FAILED; }
    }
}
