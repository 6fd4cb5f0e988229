package com.graplsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The envelope every Subsonic API call returns.
 * <p>
 * All payload fields are optional. Which one must be present is decided by the call that was
 * made, not by the envelope, so checking it is left to {@link ResponseValidator}:
 * <ul>
 *   <li>{@code album} after {@code getAlbum}</li>
 *   <li>{@code albumList} after {@code getAlbumList}</li>
 *   <li>{@code playlist} after {@code createPlaylist}</li>
 *   <li>{@code playlists} after {@code getPlaylists}</li>
 * </ul>
 * Payload fields must not be read unless {@code status} is {@code "ok"}.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubsonicResponse(
    @JsonProperty(required = true) String status,
    SubsonicError error,
    Album album,
    AlbumList albumList,
    Playlist playlist,
    Playlists playlists
) {
    public static final String STATUS_OK = "ok";

    /**
     * @return true only when the status is exactly {@code "ok"}
     */
    public boolean isOk() {
        return STATUS_OK.equals(status);
    }
}
