package com.graplsub.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fills a playlist with every song from a random sample of albums.
 * <p>
 * Albums are fetched one at a time and each song is appended with its own
 * {@code updatePlaylist} call, strictly in sequence. The first failure stops the run: later
 * albums are never fetched and later songs never added.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public class AlbumService {
    private static final Logger logger = LoggerFactory.getLogger(AlbumService.class);

    private final SubsonicApi api;

    public AlbumService(SubsonicApi api) {
        this.api = api;
    }

    /**
     * Samples albums and appends all their songs to the playlist.
     * @param playlistId Playlist to append to
     * @param sampleSize Number of random albums to request
     * @return Albums and songs processed
     * @throws OrchestrationException on the first failing call
     */
    public PopulateSummary populate(String playlistId, int sampleSize) throws OrchestrationException {
        List<Album> albums;
        try {
            albums = api.getRandomAlbumList(sampleSize);
        } catch (TransportException | ResponseValidationException e) {
            throw new OrchestrationException(OrchestrationException.Step.RANDOM_ALBUM_LIST, e);
        }
        logger.info("Got {} random albums (requested {})", albums.size(), sampleSize);

        int songCount = 0;
        for (Album listed : albums) {
            Album album;
            try {
                album = api.getAlbum(listed.id());
            } catch (TransportException | ResponseValidationException e) {
                throw new OrchestrationException(OrchestrationException.Step.GET_ALBUM, listed.id(), e);
            }

            for (Song song : album.songsOrEmpty()) {
                logger.debug("Adding song {} from album {}", song.id(), listed.id());
                try {
                    api.addSongToPlaylist(playlistId, song.id());
                } catch (TransportException | ResponseValidationException e) {
                    throw new OrchestrationException(OrchestrationException.Step.UPDATE_PLAYLIST, song.id(), e);
                }
                songCount++;
            }
        }
        return new PopulateSummary(albums.size(), songCount);
    }
}
