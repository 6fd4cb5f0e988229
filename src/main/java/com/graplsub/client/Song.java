package com.graplsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable record representing a song on a Subsonic album. Only the id is kept, as that is
 * all {@code updatePlaylist} needs.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Song(@JsonProperty(required = true) String id) {
    public Song {
        Utils.requireId(id, "song");
    }
}
