package io.edgeway.core.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class OriginValidatorTest {

    @Test
    void shouldMatchExactOrigins() {
        OriginValidator validator = new OriginValidator(List.of("https://app.example.com"), true);

        assertThat(validator.validate("https://app.example.com")).isTrue();
        assertThat(validator.validate("HTTPS://APP.EXAMPLE.COM")).isTrue();
        assertThat(validator.validate("http://app.example.com")).isFalse();
        assertThat(validator.validate("https://evil.example.com")).isFalse();
    }

    @Test
    void shouldMatchWildcardSubdomainsButNotApex() {
        OriginValidator validator = new OriginValidator(List.of("https://*.example.com"), true);

        assertThat(validator.validate("https://a.example.com")).isTrue();
        assertThat(validator.validate("https://deep.a.example.com")).isTrue();
        assertThat(validator.validate("https://example.com")).isFalse();
        assertThat(validator.validate("https://notexample.com")).isFalse();
    }

    @Test
    void shouldHonourPortsWhenListed() {
        OriginValidator validator = new OriginValidator(List.of("http://localhost:3000"), true);

        assertThat(validator.validate("http://localhost:3000")).isTrue();
        assertThat(validator.validate("http://localhost:4000")).isFalse();
    }

    @Test
    void explicitDefaultPortMatchesOriginWithoutPort() {
        OriginValidator validator = new OriginValidator(
            List.of("https://app.example.com:443", "http://intranet.local:80"),
            true
        );

        assertThat(validator.validate("https://app.example.com")).isTrue();
        assertThat(validator.validate("https://app.example.com:443")).isTrue();
        assertThat(validator.validate("http://intranet.local")).isTrue();
        assertThat(validator.validate("https://app.example.com:8443")).isFalse();
        assertThat(validator.validate("http://app.example.com")).isFalse();
    }

    @Test
    void missingOriginDependsOnRequireFlag() {
        assertThat(new OriginValidator(List.of("https://a.com"), true).validate(null)).isFalse();
        assertThat(new OriginValidator(List.of("https://a.com"), true).validate("null")).isFalse();
        assertThat(new OriginValidator(List.of("https://a.com"), false).validate("")).isTrue();
    }

    @Test
    void starAllowsAnyOriginAndGarbageIsRejected() {
        assertThat(new OriginValidator(List.of("*"), true).validate("https://anything.io")).isTrue();
        assertThat(new OriginValidator(List.of("https://a.com"), true).validate("not a uri")).isFalse();
    }
}
