package com.graplsub.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Run configuration, read from {@code GRAPLSUB_*} environment variables.
 * <p>
 * Each key can also be given as a JVM system property (e.g. {@code -DGRAPLSUB_USER=alice}),
 * which wins over the environment.
 * <ul>
 *   <li>{@code GRAPLSUB_BASE_URL}: server root, default {@value #DEFAULT_BASE_URL}</li>
 *   <li>{@code GRAPLSUB_USER}, {@code GRAPLSUB_PASS}: required</li>
 *   <li>{@code GRAPLSUB_PLAYLIST_NAME}: playlist to rebuild, default {@value #DEFAULT_PLAYLIST_NAME}</li>
 *   <li>{@code GRAPLSUB_NUM_ALBUMS}: random albums to sample, default {@value #DEFAULT_NUM_ALBUMS},
 *       clamped to {@value #MAX_NUM_ALBUMS}</li>
 * </ul>
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public record GraplsubConfig(String baseUrl, String user, String password, String playlistName, int numAlbums) {
    private static final Logger logger = LoggerFactory.getLogger(GraplsubConfig.class);

    public static final String ENV_BASE_URL = "GRAPLSUB_BASE_URL";
    public static final String ENV_USER = "GRAPLSUB_USER";
    public static final String ENV_PASS = "GRAPLSUB_PASS";
    public static final String ENV_PLAYLIST_NAME = "GRAPLSUB_PLAYLIST_NAME";
    public static final String ENV_NUM_ALBUMS = "GRAPLSUB_NUM_ALBUMS";

    public static final String DEFAULT_BASE_URL = "http://localhost:4533";
    public static final String DEFAULT_PLAYLIST_NAME = "graplsub_random_albums";
    public static final int DEFAULT_NUM_ALBUMS = 100;
    public static final int MAX_NUM_ALBUMS = 500;

    public static final String API_VERSION = "1.14.0";
    public static final String CLIENT_ID = "graplsub";
    public static final String USER_AGENT = "graplsub/0.1.0";

    private static final String USAGE = "Please provide all required env vars, minimum " + ENV_PASS + " and " + ENV_USER
        + ", but see also " + ENV_BASE_URL + ", " + ENV_NUM_ALBUMS + " and " + ENV_PLAYLIST_NAME;

    /**
     * Loads the configuration from the process environment.
     * @return Validated configuration
     * @throws ConfigException if a required key is missing or a value is invalid
     */
    public static GraplsubConfig load() {
        return load(System.getenv());
    }

    /**
     * Loads the configuration from the given environment, with system properties taking precedence.
     * @param env Environment variables
     * @return Validated configuration
     * @throws ConfigException if a required key is missing or a value is invalid
     */
    public static GraplsubConfig load(Map<String, String> env) {
        String baseUrl = lookup(env, ENV_BASE_URL, DEFAULT_BASE_URL);
        String user = lookup(env, ENV_USER, null);
        String password = lookup(env, ENV_PASS, null);
        String playlistName = lookup(env, ENV_PLAYLIST_NAME, DEFAULT_PLAYLIST_NAME);
        String numAlbumsStr = lookup(env, ENV_NUM_ALBUMS, Integer.toString(DEFAULT_NUM_ALBUMS));

        if (user == null || user.isBlank()) {
            throw new ConfigException(ENV_USER + " is not set. " + USAGE);
        }
        if (password == null || password.isEmpty()) {
            throw new ConfigException(ENV_PASS + " is not set. " + USAGE);
        }
        if (baseUrl.isBlank()) {
            throw new ConfigException(ENV_BASE_URL + " is empty. " + USAGE);
        }
        if (playlistName.isBlank()) {
            throw new ConfigException(ENV_PLAYLIST_NAME + " is empty. " + USAGE);
        }

        int numAlbums;
        try {
            numAlbums = Integer.parseInt(numAlbumsStr.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(ENV_NUM_ALBUMS + " is not a number: '" + numAlbumsStr + "'. " + USAGE, e);
        }
        if (numAlbums < 0) {
            throw new ConfigException(ENV_NUM_ALBUMS + " must not be negative: " + numAlbums);
        }
        if (numAlbums > MAX_NUM_ALBUMS) {
            logger.warn("{} too big ({}). Setting to {}.", ENV_NUM_ALBUMS, numAlbums, MAX_NUM_ALBUMS);
            numAlbums = MAX_NUM_ALBUMS;
        }

        // strip trailing slashes so "{baseUrl}/rest/..." stays well-formed
        String trimmedBase = baseUrl.trim();
        while (trimmedBase.endsWith("/")) {
            trimmedBase = trimmedBase.substring(0, trimmedBase.length() - 1);
        }
        return new GraplsubConfig(trimmedBase, user, password, playlistName, numAlbums);
    }

    private static String lookup(Map<String, String> env, String key, String defaultValue) {
        return System.getProperty(key, env.getOrDefault(key, defaultValue));
    }

    @Override
    public String toString() {
        return "GraplsubConfig[baseUrl=" + baseUrl + ", user=" + user + ", password=******, playlistName="
            + playlistName + ", numAlbums=" + numAlbums + "]";
    }
}
