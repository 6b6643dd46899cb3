package io.edgeway.core.http;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

public interface RawRequest {

    String method();

    String path();

    Map<String, String> headers();

    Map<String, String> queryParams();

    InputStream body() throws IOException;

    List<FormPart> formParts() throws IOException;

    default String header(String name) {
        String value = headers().get(name);
        return value == null ? "" : value;
    }

    default String contentType() {
        return header("Content-Type");
    }
}
