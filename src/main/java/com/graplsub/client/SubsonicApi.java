package com.graplsub.client;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed wrappers around the Subsonic endpoints used to rebuild the playlist.
 * <p>
 * Each method sends one request through the transport, validates the envelope for the payload
 * that endpoint must return and hands back that payload:
 * <pre>
 *   getPlaylists      -&gt; playlists
 *   deletePlaylist    id -&gt; (none)
 *   createPlaylist    name -&gt; playlist
 *   getAlbumList      type=random, size -&gt; albumList
 *   getAlbum          id -&gt; album
 *   updatePlaylist    playlistId, songIdToAdd -&gt; (none)
 * </pre>
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public class SubsonicApi {
    private final SubsonicTransportInterface transport;

    public SubsonicApi(SubsonicTransportInterface transport) {
        this.transport = transport;
    }

    public List<Playlist> getPlaylists() throws TransportException, ResponseValidationException {
        SubsonicResult result = call("getPlaylists", Map.of(), PayloadKind.PLAYLISTS);
        return result.response().playlists().playlistsOrEmpty();
    }

    public void deletePlaylist(String id) throws TransportException, ResponseValidationException {
        call("deletePlaylist", Map.of("id", id), PayloadKind.NONE);
    }

    public Playlist createPlaylist(String name) throws TransportException, ResponseValidationException {
        SubsonicResult result = call("createPlaylist", Map.of("name", name), PayloadKind.PLAYLIST);
        return result.response().playlist();
    }

    /**
     * Fetches a random sample of albums. Returned albums carry ids only, no songs.
     * @param size Number of albums to request
     * @return Albums in server order, possibly empty
     */
    public List<Album> getRandomAlbumList(int size) throws TransportException, ResponseValidationException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("type", "random");
        params.put("size", Integer.toString(size));
        SubsonicResult result = call("getAlbumList", params, PayloadKind.ALBUM_LIST);
        return result.response().albumList().albumsOrEmpty();
    }

    public Album getAlbum(String id) throws TransportException, ResponseValidationException {
        SubsonicResult result = call("getAlbum", Map.of("id", id), PayloadKind.ALBUM);
        return result.response().album();
    }

    public void addSongToPlaylist(String playlistId, String songId) throws TransportException, ResponseValidationException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("playlistId", playlistId);
        params.put("songIdToAdd", songId);
        call("updatePlaylist", params, PayloadKind.NONE);
    }

    private SubsonicResult call(String endpoint, Map<String, String> params, PayloadKind expected)
            throws TransportException, ResponseValidationException {
        SubsonicResult result = transport.get(endpoint, params);
        ResponseValidator.validate(result, expected);
        return result;
    }
}
