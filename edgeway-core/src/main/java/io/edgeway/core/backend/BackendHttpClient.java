package io.edgeway.core.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public final class BackendHttpClient {
    public static final String HTTP_STATUS = "http_status";
    public static final String OK = "ok";
    private static final MediaType JSON = MediaType.get("application/json");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public BackendHttpClient(OkHttpClient client, ObjectMapper mapper, String baseUrl) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        String base = Objects.requireNonNull(baseUrl, "baseUrl must not be null").trim();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Map<String, Object> send(String method, String path, Map<String, String> headers, Object body)
        throws IOException {
        HttpUrl url = HttpUrl.parse(path == null ? baseUrl : baseUrl + path);
        if (url == null) {
            throw new IOException("Invalid backend URL: " + baseUrl + path);
        }

        Request.Builder call = new Request.Builder().url(url);
        if (headers != null) {
            headers.forEach(call::addHeader);
        }
        call.method(method, carriesBody(method)
            ? RequestBody.create(mapper.writeValueAsBytes(body == null ? Map.of() : body), JSON)
            : null);

        try (Response response = client.newCall(call.build()).execute()) {
            ResponseBody responseBody = response.body();
            Map<String, Object> result = decode(responseBody == null ? "" : responseBody.string());
            result.put(HTTP_STATUS, response.code());
            result.put(OK, response.isSuccessful());
            return result;
        }
    }

    public Map<String, Object> post(String path, Map<String, String> headers, Object body) throws IOException {
        return send("POST", path, headers, body);
    }

    public Map<String, Object> delete(String path) throws IOException {
        return send("DELETE", path, Map.of(), null);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public static int status(Map<String, Object> payload) {
        Object value = payload.get(HTTP_STATUS);
        return value instanceof Number number ? number.intValue() : 0;
    }

    public static boolean ok(Map<String, Object> payload) {
        return Boolean.TRUE.equals(payload.get(OK));
    }

    public static Map<String, Object> body(Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>(payload);
        body.remove(HTTP_STATUS);
        body.remove(OK);
        return body;
    }

    private static boolean carriesBody(String method) {
        return switch (method.toUpperCase(Locale.ROOT)) {
            case "POST", "PUT", "PATCH" -> true;
            default -> false;
        };
    }

    private Map<String, Object> decode(String text) {
        if (text.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> decoded = mapper.readValue(text, MAP_TYPE);
            return decoded == null ? new LinkedHashMap<>() : decoded;
        } catch (JsonProcessingException e) {
            Map<String, Object> unparsed = new LinkedHashMap<>();
            unparsed.put("raw", text);
            return unparsed;
        }
    }
}
