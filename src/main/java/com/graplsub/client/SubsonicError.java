package com.graplsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error detail the server attaches to a {@code "failed"} response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubsonicError(Integer code, String message) {}
