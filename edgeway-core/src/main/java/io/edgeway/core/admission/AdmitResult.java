package io.edgeway.core.admission;

public record AdmitResult(boolean accepted, RejectReason reason) {

    private static final AdmitResult ACCEPTED = new AdmitResult(true, null);

    public static AdmitResult admitted() {
        return ACCEPTED;
    }

    public static AdmitResult rejected(RejectReason reason) {
        return new AdmitResult(false, reason);
    }

    public enum RejectReason {
        PER_SESSION_LIMIT,
        GLOBAL_LIMIT
    }
}
