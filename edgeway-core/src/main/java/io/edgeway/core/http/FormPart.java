package io.edgeway.core.http;

import java.util.Objects;

public record FormPart(String name, String value, FileBlob file) {

    public FormPart {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static FormPart field(String name, String value) {
        return new FormPart(name, value == null ? "" : value, null);
    }

    public static FormPart file(String name, FileBlob file) {
        return new FormPart(name, null, Objects.requireNonNull(file, "file must not be null"));
    }

    public boolean isFile() {
        return file != null;
    }
}
