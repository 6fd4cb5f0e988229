package com.graplsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable record representing a Subsonic album.
 * <p>
 * {@code songs} is only populated when the album was fetched on its own via {@code getAlbum};
 * albums inside an {@code albumList} carry no songs.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Album(@JsonProperty(required = true) String id, @JsonProperty("song") List<Song> songs) {

    public Album {
        Utils.requireId(id, "album");
        Utils.requireNoNullElements(songs, "song");
    }

    /**
     * @return the songs on this album, or an empty list when none were sent
     */
    public List<Song> songsOrEmpty() {
        return songs == null ? List.of() : songs;
    }
}
