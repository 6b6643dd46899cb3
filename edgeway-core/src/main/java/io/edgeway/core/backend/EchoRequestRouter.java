package io.edgeway.core.backend;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.http.FileBlob;
import io.edgeway.core.http.RequestEnvelope;
import io.edgeway.core.security.SessionKeys;
import io.edgeway.core.spi.RequestRouter;
import java.util.LinkedHashMap;
import java.util.Map;

public final class EchoRequestRouter implements RequestRouter {

    @Override
    public Map<String, Object> route(RequestEnvelope envelope, AuthContext authContext) {
        Map<String, Object> files = new LinkedHashMap<>();
        for (Map.Entry<String, FileBlob> file : envelope.files().entrySet()) {
            files.put(file.getKey(), Map.of("filename", file.getValue().filename(), "size", file.getValue().size()));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("endpoint", envelope.endpoint());
        response.put("method", envelope.method());
        response.put("pillar", envelope.pillar());
        response.put("path", envelope.subPath());
        response.put("user_id", authContext == null ? SessionKeys.ANONYMOUS : authContext.userId());
        response.put("params", envelope.body());
        response.put("files", files);
        return response;
    }
}
