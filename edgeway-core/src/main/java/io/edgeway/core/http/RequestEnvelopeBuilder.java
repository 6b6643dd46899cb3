package io.edgeway.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RequestEnvelopeBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(RequestEnvelopeBuilder.class);
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Duration jsonTimeout;
    private final ExecutorService executor;

    public RequestEnvelopeBuilder(ObjectMapper mapper, Duration jsonTimeout, ExecutorService executor) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.jsonTimeout = Objects.requireNonNull(jsonTimeout, "jsonTimeout must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public RequestEnvelope build(RawRequest request, String endpoint, String pillar, String subPath)
        throws MalformedRequestException {
        String method = request.method().toUpperCase(Locale.ROOT);
        Map<String, Object> body = new LinkedHashMap<>();
        Map<String, FileBlob> files = new LinkedHashMap<>();
        List<String> submittedFileFields = new ArrayList<>();

        if (BODY_METHODS.contains(method)) {
            if (isForm(request.contentType())) {
                readForm(request, body, files, submittedFileFields);
            } else {
                body.putAll(readJson(request, method + " " + endpoint));
            }
        }

        return new RequestEnvelope(
            method,
            endpoint,
            pillar,
            subPath,
            request.headers(),
            request.queryParams(),
            body,
            files,
            submittedFileFields,
            null
        );
    }

    private void readForm(
        RawRequest request,
        Map<String, Object> body,
        Map<String, FileBlob> files,
        List<String> submittedFileFields
    ) throws MalformedRequestException {
        List<FormPart> parts;
        try {
            parts = request.formParts();
        } catch (IOException e) {
            throw new MalformedRequestException("Failed to parse form data: " + e.getMessage(), e);
        }
        for (FormPart part : parts) {
            if (!part.isFile()) {
                body.put(part.name(), part.value());
                continue;
            }
            submittedFileFields.add(part.name());
            FileBlob blob = part.file();
            if (blob.isEmpty()) {
                LOG.warn("File field '{}' has empty content (0 bytes), filename '{}'; dropping it", part.name(), blob.filename());
                continue;
            }
            if (!RequestEnvelope.MAIN_FILE_FIELD.equals(part.name()) && !RequestEnvelope.COPYBOOK_FIELD.equals(part.name())) {
                LOG.debug("File field '{}' is forwarded in files only", part.name());
            }
            files.put(part.name(), blob);
        }
    }

    private Map<String, Object> readJson(RawRequest request, String label) throws MalformedRequestException {
        InputStream source;
        try {
            source = request.body();
        } catch (IOException e) {
            throw new MalformedRequestException("Failed to read request body: " + e.getMessage(), e);
        }
        if (source == null) {
            return Map.of();
        }
        Future<JsonNode> pending = executor.submit(() -> {
            try (InputStream in = source) {
                byte[] bytes = in.readAllBytes();
                return bytes.length == 0 ? null : mapper.readTree(bytes);
            }
        });
        JsonNode node;
        try {
            node = pending.get(jsonTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            // interrupting does not unblock a socket read; closing the stream does
            closeBody(source, label);
            LOG.error("JSON body read timed out after {} ms for {}", jsonTimeout.toMillis(), label);
            throw new MalformedRequestException("Request body was not received within " + jsonTimeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new MalformedRequestException("Interrupted while reading request body", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof JsonProcessingException) {
                LOG.warn("Failed to parse JSON body for {}: {}", label, cause.getMessage());
                throw new MalformedRequestException("Request body is not valid JSON", cause);
            }
            throw new MalformedRequestException("Failed to read request body: " + cause.getMessage(), cause);
        }

        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new MalformedRequestException("Request body must be a JSON object");
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private static void closeBody(InputStream source, String label) {
        try {
            source.close();
        } catch (IOException e) {
            LOG.debug("Closing stalled body for {} failed: {}", label, e.getMessage());
        }
    }

    private static boolean isForm(String contentType) {
        String lower = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        return lower.startsWith("multipart/form-data") || lower.startsWith("application/x-www-form-urlencoded");
    }
}
