package io.edgeway.core.security;

import io.edgeway.core.config.model.OriginConfig;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class OriginValidator {
    private final List<AllowedOrigin> allowed;
    private final boolean requireOrigin;
    private final boolean allowAll;

    public OriginValidator(List<String> allowedOrigins, boolean requireOrigin) {
        List<AllowedOrigin> parsed = new ArrayList<>();
        boolean wildcard = false;
        if (allowedOrigins != null) {
            for (String raw : allowedOrigins) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                String entry = raw.trim().toLowerCase(Locale.ROOT);
                if ("*".equals(entry)) {
                    wildcard = true;
                    continue;
                }
                parsed.add(AllowedOrigin.parse(entry));
            }
        }
        this.allowed = List.copyOf(parsed);
        this.requireOrigin = requireOrigin;
        this.allowAll = wildcard;
    }

    public static OriginValidator fromConfig(OriginConfig config) {
        return new OriginValidator(config.allowed(), config.requireOrigin());
    }

    public boolean validate(String originHeader) {
        if (originHeader == null || originHeader.isBlank() || "null".equalsIgnoreCase(originHeader.trim())) {
            return !requireOrigin;
        }
        if (allowAll) {
            return true;
        }
        String scheme;
        String host;
        int port;
        try {
            URI uri = URI.create(originHeader.trim());
            scheme = uri.getScheme();
            host = uri.getHost();
            port = uri.getPort();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (scheme == null || host == null) {
            return false;
        }
        String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
        String normalizedHost = host.toLowerCase(Locale.ROOT);
        for (AllowedOrigin candidate : allowed) {
            if (candidate.matches(normalizedScheme, normalizedHost, port)) {
                return true;
            }
        }
        return false;
    }

    private record AllowedOrigin(String scheme, String host, int port, boolean wildcardSubdomain) {

        static AllowedOrigin parse(String entry) {
            String scheme = null;
            String rest = entry;
            int schemeEnd = entry.indexOf("://");
            if (schemeEnd > 0) {
                scheme = entry.substring(0, schemeEnd);
                rest = entry.substring(schemeEnd + 3);
            }
            while (rest.endsWith("/")) {
                rest = rest.substring(0, rest.length() - 1);
            }
            int port = -1;
            int colon = rest.lastIndexOf(':');
            if (colon > 0) {
                try {
                    port = Integer.parseInt(rest.substring(colon + 1));
                    rest = rest.substring(0, colon);
                } catch (NumberFormatException ignored) {
                    port = -1;
                }
            }
            boolean wildcard = rest.startsWith("*.");
            String host = wildcard ? rest.substring(1) : rest;
            return new AllowedOrigin(scheme, host, port, wildcard);
        }

        boolean matches(String originScheme, String originHost, int originPort) {
            if (scheme != null && !scheme.equals(originScheme)) {
                return false;
            }
            if (port != -1 && effectivePort(scheme == null ? originScheme : scheme, port)
                != effectivePort(originScheme, originPort)) {
                return false;
            }
            if (wildcardSubdomain) {
                // host holds ".example.com"; the bare apex is not a subdomain
                return originHost.endsWith(host) && originHost.length() > host.length();
            }
            return host.equals(originHost);
        }

        private static int effectivePort(String scheme, int port) {
            if (port != -1) {
                return port;
            }
            return switch (scheme) {
                case "http", "ws" -> 80;
                case "https", "wss" -> 443;
                default -> -1;
            };
        }
    }
}
