package com.graplsub.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The {@code albumList} wrapper returned by {@code getAlbumList}. An empty library yields a
 * present wrapper with no {@code album} entries.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlbumList(@JsonProperty("album") List<Album> albums) {

    public AlbumList {
        Utils.requireNoNullElements(albums, "album");
    }

    public List<Album> albumsOrEmpty() {
        return albums == null ? List.of() : albums;
    }
}
