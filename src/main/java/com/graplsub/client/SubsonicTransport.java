package com.graplsub.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Subsonic transport over the JDK {@link HttpClient}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Builds {@code {baseUrl}/rest/{endpoint}?u=..&t=..&s=..&f=json&v=..&c=..} followed by the call parameters.</li>
 *   <li>Sends a single GET bounded by the per-request timeout.</li>
 *   <li>HTTP 200 bodies are decoded with Jackson into a {@link SubsonicResponse}.</li>
 *   <li>HTTP 404 and other statuses are reported with the query string stripped.</li>
 * </ul>
 * <p>
 * The client is created once per process with {@link #createHttpClient()} and shared by every call.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public class SubsonicTransport implements SubsonicTransportInterface {
    private static final Logger logger = LoggerFactory.getLogger(SubsonicTransport.class);

    public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration POOL_IDLE_TIMEOUT = Duration.ofSeconds(90);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final HttpClient client;
    private final String baseUrl;
    private final SessionCredentials credentials;
    private final Duration requestTimeout;

    /**
     * Constructs a transport with the default per-request timeout.
     * @param client Shared HTTP client
     * @param baseUrl Server root without trailing slash
     * @param credentials Per-run credentials
     */
    public SubsonicTransport(HttpClient client, String baseUrl, SessionCredentials credentials) {
        this(client, baseUrl, credentials, REQUEST_TIMEOUT);
    }

    /**
     * Constructs a transport with an explicit per-request timeout.
     * @param client Shared HTTP client
     * @param baseUrl Server root without trailing slash
     * @param credentials Per-run credentials
     * @param requestTimeout Upper bound for each request
     */
    SubsonicTransport(HttpClient client, String baseUrl, SessionCredentials credentials, Duration requestTimeout) {
        this.client = client;
        this.baseUrl = baseUrl;
        this.credentials = credentials;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Creates the process-wide HTTP client. The JDK client has no per-instance idle setting, so the
     * pool idle timeout is applied through the {@code jdk.httpclient.keepalive.timeout} property,
     * unless the user already set it.
     * @return Configured client
     */
    public static HttpClient createHttpClient() {
        if (System.getProperty("jdk.httpclient.keepalive.timeout") == null) {
            System.setProperty("jdk.httpclient.keepalive.timeout", Long.toString(POOL_IDLE_TIMEOUT.getSeconds()));
        }
        return HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(CONNECT_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    /**
     * Builds the full request URI, auth parameters first.
     * @param endpoint API method name
     * @param params Call-specific parameters
     * @return Request URI
     */
    URI buildUri(String endpoint, Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("u", credentials.user());
        query.put("t", credentials.authToken());
        query.put("s", credentials.salt());
        query.put("f", "json");
        query.put("v", GraplsubConfig.API_VERSION);
        query.put("c", GraplsubConfig.CLIENT_ID);
        query.putAll(params);
        return URI.create(baseUrl + "/rest/" + endpoint + "?" + Utils.encodeQuery(query));
    }

    @Override
    public SubsonicResult get(String endpoint, Map<String, String> params) throws TransportException {
        URI uri;
        HttpRequest request;
        try {
            uri = buildUri(endpoint, params);
            request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("User-Agent", GraplsubConfig.USER_AGENT)
                .header("Accept", "application/json")
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw TransportException.invalidUrl(baseUrl + "/rest/" + endpoint, e);
        }
        String reportUrl = Utils.stripQuery(uri);
        logger.debug("GET {}", reportUrl);

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw TransportException.network(reportUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.network(reportUrl, e);
        }

        int status = response.statusCode();
        if (status == 404) {
            throw TransportException.notFound(Utils.stripQuery(response.uri()));
        }
        if (status != 200) {
            throw TransportException.http(status, Utils.stripQuery(response.uri()));
        }
        return decode(reportUrl, response.body());
    }

    /**
     * Decodes a response body into the envelope.
     * @param reportUrl Redacted URL for error messages
     * @param body Raw body
     * @return Decoded result
     * @throws TransportException if the body is not a Subsonic JSON envelope
     */
    static SubsonicResult decode(String reportUrl, String body) throws TransportException {
        SubsonicResult.Wrapper wrapper;
        try {
            wrapper = MAPPER.readValue(body, SubsonicResult.Wrapper.class);
        } catch (JsonProcessingException e) {
            throw TransportException.malformed(reportUrl, body, e);
        }
        if (wrapper == null || wrapper.subsonicResponse() == null) {
            throw TransportException.malformed(reportUrl, body, null);
        }
        return new SubsonicResult(wrapper.subsonicResponse(), body);
    }
}
