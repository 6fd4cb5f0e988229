package com.graplsub.client;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Map;

/**
 * Utility class for the small helpers shared by credential derivation and transport.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public final class Utils {
    private Utils() {}

    /**
     * Encodes bytes as lowercase hexadecimal, two characters per byte.
     * @param bytes Input bytes
     * @return Hex string
     */
    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * Computes the MD5 digest of the UTF-8 bytes of a string.
     * @param text Input text
     * @return 32-character lowercase hex digest
     */
    public static String md5Hex(String text) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("MD5");
            return toHex(messageDigest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }

    /**
     * Rejects a missing or blank entity id. Thrown from record constructors, so Jackson reports
     * it as a mapping failure of the whole body.
     * @param id Id as decoded
     * @param entity Entity name for the message
     */
    static void requireId(String id, String entity) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(entity + " entry has no id");
        }
    }

    /**
     * Rejects null entries, e.g. from {@code "song": [null]}. A null list is allowed.
     * @param items Decoded list, may be null
     * @param entity Entity name for the message
     */
    static void requireNoNullElements(List<?> items, String entity) {
        if (items == null) return;
        for (Object item : items) {
            if (item == null) {
                throw new IllegalArgumentException("null " + entity + " entry");
            }
        }
    }

    /**
     * Builds a query string from the given parameters, preserving iteration order.
     * @param params Parameter names and values
     * @return Encoded query string without the leading '?'
     */
    public static String encodeQuery(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (sb.length() > 0) sb.append('&');
            sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * Removes the query string and fragment from a URI. The query carries the user, token
     * and salt, so anything reported to the user goes through here first.
     * @param uri Full request URI
     * @return URI string without query or fragment
     */
    public static String stripQuery(URI uri) {
        if (uri == null) return "";
        String s = uri.toString();
        int cut = s.length();
        int q = s.indexOf('?');
        if (q >= 0) cut = q;
        int f = s.indexOf('#');
        if (f >= 0 && f < cut) cut = f;
        return s.substring(0, cut);
    }
}
