package io.edgeway.core.http;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record GatewayResponse(int status, Map<String, Object> body) {

    public GatewayResponse {
        body = body == null ? Map.of() : body;
    }

    public static GatewayResponse ok(Map<String, Object> body) {
        return new GatewayResponse(200, body);
    }

    public static GatewayResponse error(int status, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        return new GatewayResponse(status, body);
    }

    public static GatewayResponse error(int status, String error, String detail) {
        GatewayResponse response = error(status, error);
        response.body().put("detail", detail);
        return response;
    }

    public static GatewayResponse missingMainFile(List<String> availableFiles) {
        GatewayResponse response = error(400, "Main file ('file') is required but not found in upload");
        response.body().put("missing_field", RequestEnvelope.MAIN_FILE_FIELD);
        response.body().put("available_files", List.copyOf(availableFiles));
        return response;
    }
}
