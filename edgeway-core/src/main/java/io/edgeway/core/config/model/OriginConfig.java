package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OriginConfig(
    List<String> allowed,
    @JsonAlias({"require_origin"}) boolean requireOrigin
) {

    public static OriginConfig defaults() {
        return new OriginConfig(
            List.of(
                "http://localhost:3000",
                "http://127.0.0.1:3000",
                "http://localhost:8787",
                "http://127.0.0.1:8787"
            ),
            false
        );
    }
}
