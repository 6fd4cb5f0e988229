package com.graplsub.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the target playlist from scratch.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Lists the user's playlists.</li>
 *   <li>Takes the first one whose name equals the configured name, in server order.</li>
 *   <li>Deletes it if found.</li>
 *   <li>Creates a new, empty playlist with the configured name and returns its id.</li>
 * </ul>
 * <p>
 * Every failure aborts the rebuild. Nothing is rolled back: if the delete succeeds and the
 * create fails, the run ends with no playlist of that name.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public class PlaylistService {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistService.class);

    private final SubsonicApi api;

    public PlaylistService(SubsonicApi api) {
        this.api = api;
    }

    /**
     * Deletes any playlist called {@code name} and creates a fresh one.
     * @param name Playlist name to rebuild
     * @return Id of the newly created playlist
     * @throws OrchestrationException on the first failing step
     */
    public String recreatePlaylist(String name) throws OrchestrationException {
        Playlist existing;
        try {
            existing = findByName(api.getPlaylists(), name);
        } catch (TransportException | ResponseValidationException e) {
            throw new OrchestrationException(OrchestrationException.Step.LIST_PLAYLISTS, e);
        }

        if (existing != null) {
            logger.info("Deleting existing playlist '{}' (id {})", name, existing.id());
            try {
                api.deletePlaylist(existing.id());
            } catch (TransportException | ResponseValidationException e) {
                throw new OrchestrationException(OrchestrationException.Step.DELETE_PLAYLIST, existing.id(), e);
            }
        } else {
            logger.info("No playlist named '{}' yet, creating it", name);
        }

        Playlist created;
        try {
            created = api.createPlaylist(name);
        } catch (TransportException | ResponseValidationException e) {
            throw new OrchestrationException(OrchestrationException.Step.CREATE_PLAYLIST, name, e);
        }
        logger.info("Created playlist '{}' with id {}", name, created.id());
        return created.id();
    }

    static Playlist findByName(Iterable<Playlist> playlists, String name) {
        for (Playlist playlist : playlists) {
            if (name.equals(playlist.name())) {
                return playlist;
            }
        }
        return null;
    }
}
