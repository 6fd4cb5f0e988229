package com.graplsub.client;

/**
 * Checks a decoded envelope against the contract of the call that produced it.
 * <p>
 * Two steps are applied:
 * <ul>
 *   <li>The status must be exactly {@code "ok"}. Nothing else in the envelope is looked at otherwise.</li>
 *   <li>Unless the expected kind is {@link PayloadKind#NONE}, the named payload wrapper must be
 *       present. An empty list inside a present wrapper is valid; the contents are left to the caller.</li>
 * </ul>
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public final class ResponseValidator {
    private ResponseValidator() {}

    /**
     * Validates a transported result.
     * @param result Envelope and raw body from the transport
     * @param expected Payload the call must return
     * @throws ResponseValidationException if the status is not ok or the payload is missing
     */
    public static void validate(SubsonicResult result, PayloadKind expected) throws ResponseValidationException {
        validate(result.response(), result.rawBody(), expected);
    }

    /**
     * Validates an envelope.
     * @param response Decoded envelope
     * @param rawBody Body text, quoted in error messages
     * @param expected Payload the call must return
     * @throws ResponseValidationException if the status is not ok or the payload is missing
     */
    public static void validate(SubsonicResponse response, String rawBody, PayloadKind expected) throws ResponseValidationException {
        if (!response.isOk()) {
            throw ResponseValidationException.notOk(response.error(), rawBody);
        }
        if (!expected.isPresentIn(response)) {
            throw ResponseValidationException.missingPayload(expected, rawBody);
        }
    }
}
