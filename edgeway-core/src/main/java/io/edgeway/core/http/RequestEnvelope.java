package io.edgeway.core.http;

import io.edgeway.core.auth.AuthContext;
import io.edgeway.core.security.SessionKeys;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record RequestEnvelope(
    String method,
    String endpoint,
    String pillar,
    String subPath,
    Map<String, String> headers,
    Map<String, String> queryParams,
    Map<String, Object> body,
    Map<String, FileBlob> files,
    List<String> submittedFileFields,
    AuthContext authContext
) {
    public static final String MAIN_FILE_FIELD = "file";
    public static final String COPYBOOK_FIELD = "copybook";
    public static final String SESSION_TOKEN_HEADER = "X-Session-Token";

    public RequestEnvelope {
        method = method == null ? "GET" : method;
        endpoint = endpoint == null ? "" : endpoint;
        pillar = pillar == null ? "" : pillar;
        subPath = subPath == null ? "" : subPath;
        Map<String, String> headerCopy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headerCopy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(headerCopy);
        queryParams = queryParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        submittedFileFields = submittedFileFields == null ? List.of() : List.copyOf(submittedFileFields);
    }

    public RequestEnvelope withAuthContext(AuthContext context) {
        return new RequestEnvelope(
            method,
            endpoint,
            pillar,
            subPath,
            headers,
            queryParams,
            body,
            files,
            submittedFileFields,
            context
        );
    }

    public String route() {
        return subPath.isEmpty() ? pillar : pillar + "/" + subPath;
    }

    public String sessionToken() {
        String token = headers.get(SESSION_TOKEN_HEADER);
        return token == null || token.isBlank() ? null : token.trim();
    }

    public boolean hasFileUpload() {
        return !submittedFileFields.isEmpty();
    }

    public boolean missingMainFile() {
        return hasFileUpload() && !files.containsKey(MAIN_FILE_FIELD);
    }

    public List<String> availableFiles() {
        return new ArrayList<>(files.keySet());
    }

    public Map<String, Object> toRouterPayload() {
        Map<String, Object> params = new LinkedHashMap<>(body);
        FileBlob main = files.get(MAIN_FILE_FIELD);
        if (main != null) {
            params.put("file_data", main.bytes());
            params.put("filename", main.filename());
            params.put("content_type", main.contentType());
        }
        FileBlob copybook = files.get(COPYBOOK_FIELD);
        if (copybook != null) {
            params.put("copybook_data", copybook.bytes());
            params.put("copybook_filename", copybook.filename());
        }

        String sessionToken = sessionToken();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("endpoint", endpoint);
        payload.put("method", method);
        payload.put("params", params);
        payload.put("headers", headers);
        payload.put("user_id", authContext == null ? SessionKeys.ANONYMOUS : authContext.userId());
        payload.put("session_token", sessionToken);
        payload.put("query_params", queryParams);
        payload.put("user_context", authContext == null ? null : authContext.toUserContext(sessionToken));
        if (!files.isEmpty()) {
            Map<String, Object> fileInfo = new LinkedHashMap<>();
            files.forEach((name, blob) -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("filename", blob.filename());
                entry.put("content", blob.bytes());
                entry.put("content_type", blob.contentType());
                fileInfo.put(name, entry);
            });
            payload.put("files", fileInfo);
        }
        return payload;
    }
}
