package com.ridematch.dispatch.result;

import com.ridematch.dispatch.entity.Ride;

public sealed interface LifecycleResult extends DispatchOutcome {

    record Applied(Ride ride) implements LifecycleResult {
        public String code()          { return "APPLIED"; }
        public ErrorKind errorKind()  { return null; }
        public String message()       { return "Ride is " + ride.getStatus(); }
    }

    record Refused(ErrorKind errorKind, String message) implements LifecycleResult {
        public String code()          { return errorKind.name(); }
    }

    static LifecycleResult refused(ErrorKind kind, String message) {
        return new Refused(kind, message);
    }
}
