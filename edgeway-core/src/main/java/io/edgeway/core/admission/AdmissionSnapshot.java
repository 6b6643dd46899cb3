package io.edgeway.core.admission;

import java.util.Map;

public record AdmissionSnapshot(int globalCount, Map<String, Integer> perSessionCount) {
    public AdmissionSnapshot {
        perSessionCount = perSessionCount == null ? Map.of() : Map.copyOf(perSessionCount);
    }

    public int sessionCount(String sessionKey) {
        return perSessionCount.getOrDefault(sessionKey, 0);
    }
}
