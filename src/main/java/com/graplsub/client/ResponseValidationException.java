package com.graplsub.client;

/**
 * Raised when a decoded envelope breaks the contract of the call that produced it.
 */
public class ResponseValidationException extends SubsonicException {

    public enum Kind {
        /** Status was anything other than the literal "ok". */
        NOT_OK,
        /** Status was "ok" but the expected payload was absent. */
        MISSING_PAYLOAD
    }

    private final Kind kind;
    private final PayloadKind payloadKind;
    private final String rawBody;

    private ResponseValidationException(Kind kind, PayloadKind payloadKind, String message, String rawBody) {
        super(message);
        this.kind = kind;
        this.payloadKind = payloadKind;
        this.rawBody = rawBody;
    }

    public static ResponseValidationException notOk(SubsonicError error, String rawBody) {
        String message = "Subsonic response did not have 'ok' status: " + rawBody;
        if (error != null && error.message() != null) {
            message = "Subsonic error " + error.code() + " (" + error.message() + "). " + message;
        }
        return new ResponseValidationException(Kind.NOT_OK, null, message, rawBody);
    }

    public static ResponseValidationException missingPayload(PayloadKind payloadKind, String rawBody) {
        return new ResponseValidationException(Kind.MISSING_PAYLOAD, payloadKind,
            "Subsonic response was missing " + payloadKind.description() + ": " + rawBody, rawBody);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return payload that was missing, or null for {@link Kind#NOT_OK}
     */
    public PayloadKind getPayloadKind() {
        return payloadKind;
    }

    public String getRawBody() {
        return rawBody;
    }
}
