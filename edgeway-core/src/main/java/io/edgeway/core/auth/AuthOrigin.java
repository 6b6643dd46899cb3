package io.edgeway.core.auth;

public enum AuthOrigin {
    FORWARD_AUTH,
    LOCAL_VALIDATION
}
