package com.graplsub.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.Map;

/**
 * Main entry point for graplsub.
 * This application rebuilds a Subsonic playlist from a random sample of albums: it deletes any
 * playlist with the configured name, creates a fresh one and adds every song from each sampled album.
 * <p>
 * Exit status is 0 on success and 1 on any error, with the error message logged to stderr.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    /**
     * Runs the whole workflow against the server described by the environment.
     * @param env Environment variables
     * @return Process exit status
     */
    static int run(Map<String, String> env) {
        GraplsubConfig config;
        try {
            config = GraplsubConfig.load(env);
        } catch (ConfigException e) {
            logger.error("{}", e.getMessage());
            return EXIT_FAILURE;
        }
        logger.debug("Loaded {}", config);

        SessionCredentials credentials = SessionCredentials.derive(config.user(), config.password());
        HttpClient client = SubsonicTransport.createHttpClient();
        return run(config, new SubsonicTransport(client, config.baseUrl(), credentials));
    }

    /**
     * Rebuilds and fills the playlist through the given transport.
     * @param config Loaded configuration
     * @param transport Transport to the server
     * @return Process exit status
     */
    static int run(GraplsubConfig config, SubsonicTransportInterface transport) {
        SubsonicApi api = new SubsonicApi(transport);
        try {
            String playlistId = new PlaylistService(api).recreatePlaylist(config.playlistName());
            PopulateSummary summary = new AlbumService(api).populate(playlistId, config.numAlbums());
            logger.info("Added {} songs from {} albums to playlist '{}'",
                summary.songs(), summary.albums(), config.playlistName());
            return EXIT_OK;
        } catch (OrchestrationException e) {
            logger.error("{}", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Main application entry point.
     * @param args Ignored; all configuration comes from the environment
     */
    public static void main(String[] args) {
        System.exit(run(System.getenv()));
    }
}
