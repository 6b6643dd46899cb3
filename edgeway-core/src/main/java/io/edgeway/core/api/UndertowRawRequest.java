package io.edgeway.core.api;

import io.edgeway.core.http.FileBlob;
import io.edgeway.core.http.FormPart;
import io.edgeway.core.http.RawRequest;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.form.FormData;
import io.undertow.server.handlers.form.FormDataParser;
import io.undertow.server.handlers.form.FormEncodedDataDefinition;
import io.undertow.server.handlers.form.FormParserFactory;
import io.undertow.server.handlers.form.MultiPartParserDefinition;
import io.undertow.util.HeaderValues;
import io.undertow.util.Headers;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

final class UndertowRawRequest implements RawRequest {
    private final HttpServerExchange exchange;
    private final Path uploadTempDir;
    private final Map<String, String> headers;
    private final Map<String, String> queryParams;

    UndertowRawRequest(HttpServerExchange exchange, Path uploadTempDir) {
        this.exchange = exchange;
        this.uploadTempDir = uploadTempDir;
        this.headers = readHeaders(exchange);
        this.queryParams = readQueryParams(exchange);
    }

    @Override
    public String method() {
        return exchange.getRequestMethod().toString();
    }

    @Override
    public String path() {
        return exchange.getRequestPath();
    }

    @Override
    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public Map<String, String> queryParams() {
        return queryParams;
    }

    @Override
    public InputStream body() {
        return exchange.getInputStream();
    }

    @Override
    public List<FormPart> formParts() throws IOException {
        Files.createDirectories(uploadTempDir);
        MultiPartParserDefinition multiPart = new MultiPartParserDefinition();
        multiPart.setTempFileLocation(uploadTempDir);
        FormDataParser parser = FormParserFactory.builder()
            .addParser(multiPart)
            .addParser(new FormEncodedDataDefinition())
            .build()
            .createParser(exchange);
        if (parser == null) {
            return List.of();
        }
        try {
            FormData form = parser.parseBlocking();
            List<FormPart> parts = new ArrayList<>();
            for (String name : form) {
                Deque<FormData.FormValue> values = form.get(name);
                if (values == null) {
                    continue;
                }
                for (FormData.FormValue value : values) {
                    parts.add(toPart(name, value));
                }
            }
            return parts;
        } finally {
            parser.close();
        }
    }

    private static FormPart toPart(String name, FormData.FormValue value) throws IOException {
        if (!value.isFileItem()) {
            return FormPart.field(name, value.getValue());
        }
        FormData.FileItem item = value.getFileItem();
        byte[] bytes;
        if (item.isInMemory()) {
            try (InputStream in = item.getInputStream()) {
                bytes = in.readAllBytes();
            }
        } else {
            bytes = Files.readAllBytes(item.getFile());
        }
        String contentType = value.getHeaders() == null ? null : value.getHeaders().getFirst(Headers.CONTENT_TYPE);
        String filename = value.getFileName() == null || value.getFileName().isBlank() ? "unknown_" + name : value.getFileName();
        return FormPart.file(name, new FileBlob(filename, bytes, contentType));
    }

    private static Map<String, String> readHeaders(HttpServerExchange exchange) {
        Map<String, String> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (HeaderValues header : exchange.getRequestHeaders()) {
            values.put(header.getHeaderName().toString(), header.getFirst());
        }
        return values;
    }

    private static Map<String, String> readQueryParams(HttpServerExchange exchange) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<String>> entry : exchange.getQueryParameters().entrySet()) {
            String first = entry.getValue() == null ? null : entry.getValue().peekFirst();
            values.put(entry.getKey(), first == null ? "" : first);
        }
        return values;
    }
}
