package com.graplsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A decoded response together with the raw body it came from. The raw body is kept so that
 * validation errors can show the user exactly what the server sent.
 *
 * @param response Decoded envelope
 * @param rawBody  Body text as received
 */
public record SubsonicResult(SubsonicResponse response, String rawBody) {

    /**
     * Outer JSON wrapper: every body is {@code {"subsonic-response": {...}}}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Wrapper(@JsonProperty("subsonic-response") SubsonicResponse subsonicResponse) {}
}
