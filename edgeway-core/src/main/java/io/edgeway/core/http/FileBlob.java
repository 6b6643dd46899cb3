package io.edgeway.core.http;

import java.net.URLConnection;

public record FileBlob(String filename, byte[] bytes, String contentType) {
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    public FileBlob {
        bytes = bytes == null ? new byte[0] : bytes;
        filename = filename == null ? "" : filename;
        if (contentType == null || contentType.isBlank()) {
            contentType = guessContentType(filename);
        }
    }

    public int size() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    private static String guessContentType(String filename) {
        String guessed = filename.isBlank() ? null : URLConnection.guessContentTypeFromName(filename);
        return guessed == null || guessed.isBlank() ? DEFAULT_CONTENT_TYPE : guessed;
    }
}
