package io.edgeway.core.admission;

import io.edgeway.core.config.model.AdmissionConfig;
import io.edgeway.core.security.SessionKeys;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AdmissionController {
    private static final Logger LOG = LoggerFactory.getLogger(AdmissionController.class);

    private final int maxPerSession;
    private final int maxGlobal;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Integer> perSessionCount = new HashMap<>();
    private int globalCount;

    public AdmissionController(int maxPerSession, int maxGlobal) {
        if (maxPerSession <= 0) {
            throw new IllegalArgumentException("maxPerSession must be > 0");
        }
        if (maxGlobal <= 0) {
            throw new IllegalArgumentException("maxGlobal must be > 0");
        }
        this.maxPerSession = maxPerSession;
        this.maxGlobal = maxGlobal;
    }

    public static AdmissionController fromConfig(AdmissionConfig config) {
        return new AdmissionController(config.maxPerUser(), config.maxGlobal());
    }

    public AdmitResult tryAdmit(String sessionKey) {
        String key = normalize(sessionKey);
        lock.lock();
        try {
            int current = perSessionCount.getOrDefault(key, 0);
            if (current >= maxPerSession) {
                LOG.warn("Admission rejected for session {}: per-session limit {} reached", SessionKeys.mask(key), maxPerSession);
                return AdmitResult.rejected(AdmitResult.RejectReason.PER_SESSION_LIMIT);
            }
            if (globalCount >= maxGlobal) {
                LOG.warn("Admission rejected for session {}: global limit {} reached", SessionKeys.mask(key), maxGlobal);
                return AdmitResult.rejected(AdmitResult.RejectReason.GLOBAL_LIMIT);
            }
            perSessionCount.put(key, current + 1);
            globalCount++;
            return AdmitResult.admitted();
        } finally {
            lock.unlock();
        }
    }

    public boolean release(String sessionKey) {
        String key = normalize(sessionKey);
        lock.lock();
        try {
            int current = perSessionCount.getOrDefault(key, 0);
            if (current <= 0) {
                return false;
            }
            if (current == 1) {
                perSessionCount.remove(key);
            } else {
                perSessionCount.put(key, current - 1);
            }
            globalCount = Math.max(0, globalCount - 1);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int globalCount() {
        lock.lock();
        try {
            return globalCount;
        } finally {
            lock.unlock();
        }
    }

    public int sessionCount(String sessionKey) {
        lock.lock();
        try {
            return perSessionCount.getOrDefault(normalize(sessionKey), 0);
        } finally {
            lock.unlock();
        }
    }

    public AdmissionSnapshot snapshot() {
        lock.lock();
        try {
            return new AdmissionSnapshot(globalCount, perSessionCount);
        } finally {
            lock.unlock();
        }
    }

    public int maxPerSession() {
        return maxPerSession;
    }

    public int maxGlobal() {
        return maxGlobal;
    }

    private static String normalize(String sessionKey) {
        return SessionKeys.normalize(sessionKey);
    }
}
