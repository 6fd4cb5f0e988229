package com.graplsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The {@code playlists} wrapper returned by {@code getPlaylists}. The server sends an empty
 * {@code "playlists": {}} when the user has none, so the inner list may be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Playlists(@JsonProperty("playlist") List<Playlist> playlists) {

    public Playlists {
        Utils.requireNoNullElements(playlists, "playlist");
    }

    /**
     * @return the playlists, or an empty list when the wrapper carried none
     */
    public List<Playlist> playlistsOrEmpty() {
        return playlists == null ? List.of() : playlists;
    }
}
