package com.graplsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable record representing a Subsonic playlist.
 * <p>
 * Identity is the {@code id}; the {@code name} is only used to find the configured playlist
 * among those returned by {@code getPlaylists}. Entries are never inspected.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Playlist(
    @JsonProperty(required = true) String id,
    @JsonProperty(required = true) String name
) {
    public Playlist {
        Utils.requireId(id, "playlist");
        if (name == null) {
            throw new IllegalArgumentException("playlist " + id + " has no name");
        }
    }
}
