package io.edgeway.core.ws;

public final class CloseCodes {
    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int ORIGIN_REJECTED = 4003;
    public static final int PER_SESSION_LIMIT = 4004;
    public static final int SERVER_AT_CAPACITY = 4005;
    public static final int INTERNAL_ERROR = 4006;
    public static final int RATE_LIMITED = 4029;

    private CloseCodes() {
    }
}
