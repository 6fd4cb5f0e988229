package com.graplsub.client;

import java.util.Map;

/**
 * Interface for authenticated GET requests against the Subsonic REST API.
 */
public interface SubsonicTransportInterface {
    /**
     * Issues one GET to {@code {baseUrl}/rest/{endpoint}} with the auth parameters followed by
     * the given call parameters. No retries are attempted.
     * @param endpoint API method name, e.g. "getAlbum"
     * @param params Call-specific parameters, sent in iteration order
     * @return Decoded envelope and raw body of an HTTP 200 response
     * @throws TransportException on network failure, non-200 status or undecodable body
     */
    SubsonicResult get(String endpoint, Map<String, String> params) throws TransportException;
}
