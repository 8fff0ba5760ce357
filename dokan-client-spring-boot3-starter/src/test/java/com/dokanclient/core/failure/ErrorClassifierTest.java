package com.dokanclient.core.failure;

import com.dokanclient.core.serializer.JacksonPayloadSerializer;
import com.dokanclient.exception.ApiException;
import com.dokanclient.exception.AuthenticationException;
import com.dokanclient.exception.DokanException;
import com.dokanclient.exception.NotFoundException;
import com.dokanclient.exception.RateLimitedException;
import com.dokanclient.model.ResponseEnvelope;
import com.dokanclient.model.enums.ErrorKind;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier(JacksonPayloadSerializer.createDefaultMapper());

    private DokanException classify(int status, String body) {
        return classifier.classify(ResponseEnvelope.of(status, Map.of(), body)).orElseThrow();
    }

    @Test
    void successIsNotAnError() {
        assertThat(classifier.classify(ResponseEnvelope.of(200, Map.of(), "{}"))).isEmpty();
        assertThat(classifier.classify(ResponseEnvelope.of(302, Map.of(), ""))).isEmpty();
    }

    @Test
    void unauthorized() {
        DokanException e = classify(401, "");
        assertThat(e).isInstanceOf(AuthenticationException.class).hasMessageContaining("unauthorized access");
        assertThat(e.getKind()).isEqualTo(ErrorKind.UNAUTHORIZED);
        assertThat(e.getStatusCode()).isEqualTo(401);
    }

    @Test
    void forbiddenMapsToUnauthorizedByDefault() {
        DokanException e = classify(403, "");
        assertThat(e).hasMessageContaining("forbidden access");
        assertThat(e.getKind()).isEqualTo(ErrorKind.UNAUTHORIZED);
    }

    @Test
    void forbiddenCanBeDistinguished() {
        ErrorClassifier strict = new ErrorClassifier(JacksonPayloadSerializer.createDefaultMapper(), 60, true);
        DokanException e = strict.classify(ResponseEnvelope.of(403, Map.of(), "")).orElseThrow();
        assertThat(e.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
    }

    @Test
    void notFoundWithEmptyObjectBody() {
        DokanException e = classify(404, "{}");
        assertThat(e).isInstanceOf(NotFoundException.class);
        NotFoundException nf = (NotFoundException) e;
        assertThat(nf.getResource()).isEqualTo("resource");
        assertThat(nf.getId()).isEqualTo("unknown");
        assertThat(nf.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void rateLimitedDefaultsToSixtySeconds() {
        RateLimitedException e = (RateLimitedException) classify(429, "");
        assertThat(e.getRetryAfterSeconds()).isEqualTo(60);
        assertThat(e.getStatusCode()).isEqualTo(429);
    }

    @Test
    void rateLimitedHonorsNumericRetryAfter() {
        ResponseEnvelope r = ResponseEnvelope.of(429, Map.of("Retry-After", List.of("7")), "");
        RateLimitedException e = (RateLimitedException) classifier.classify(r).orElseThrow();
        assertThat(e.getRetryAfterSeconds()).isEqualTo(7);

        ResponseEnvelope date = ResponseEnvelope.of(429,
                Map.of("Retry-After", List.of("Wed, 21 Oct 2015 07:28:00 GMT")), "");
        assertThat(((RateLimitedException) classifier.classify(date).orElseThrow()).getRetryAfterSeconds())
                .isEqualTo(60);
    }

    @ParameterizedTest
    @CsvSource({
            "400, bad_request, bad request",
            "500, internal_error, internal server error",
            "502, http_error, HTTP 502 error",
            "418, http_error, HTTP 418 error"
    })
    void fallbackApiErrors(int status, String code, String message) {
        ApiException e = (ApiException) classify(status, "not json");
        assertThat(e.getCode()).isEqualTo(code);
        assertThat(e.getErrorMessage()).isEqualTo(message);
        assertThat(e.getStatusCode()).isEqualTo(status);
        assertThat(e.getKind()).isEqualTo(ErrorKind.API_ERROR);
    }

    @Test
    void structuredPayloadWinsOverStatusTable() {
        DokanException e = classify(404,
                "{\"code\":\"dokan_rest_invalid_product\",\"message\":\"Invalid product\",\"data\":{\"status\":404}}");
        assertThat(e).isInstanceOf(ApiException.class);
        ApiException api = (ApiException) e;
        assertThat(api.getCode()).isEqualTo("dokan_rest_invalid_product");
        assertThat(api.getErrorMessage()).isEqualTo("Invalid product");
        assertThat(api.getStatusCode()).isEqualTo(404);
        assertThat(api.getData().get("status").asInt()).isEqualTo(404);
    }

    @Test
    void payloadWithEmptyCodeFallsBack() {
        assertThat(classify(401, "{\"code\":\"\",\"message\":\"x\"}")).isInstanceOf(AuthenticationException.class);
        assertThat(classify(404, "[]")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void structuredPayloadWinsWithStrictMapper() {
        ObjectMapper strict = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        ErrorClassifier c = new ErrorClassifier(strict);

        DokanException e = c.classify(ResponseEnvelope.of(400, Map.of(),
                "{\"code\":\"dokan_rest_invalid\",\"message\":\"bad sku\",\"trace_id\":\"abc\"}")).orElseThrow();

        assertThat(e).isInstanceOf(ApiException.class);
        assertThat(((ApiException) e).getCode()).isEqualTo("dokan_rest_invalid");
    }
}
