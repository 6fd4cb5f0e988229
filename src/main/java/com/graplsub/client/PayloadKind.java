package com.graplsub.client;

/**
 * The payload a call expects to find in the {@link SubsonicResponse} envelope.
 * {@link #NONE} is used by calls that only return the generic envelope.
 */
public enum PayloadKind {
    ALBUM("an album"),
    ALBUM_LIST("an albumList"),
    PLAYLIST("a playlist"),
    PLAYLISTS("a playlists"),
    NONE("nothing");

    private final String description;

    PayloadKind(String description) {
        this.description = description;
    }

    /**
     * @return human-readable name used in error messages, e.g. "an albumList"
     */
    public String description() {
        return description;
    }

    /**
     * Checks whether the payload this kind names is present in the envelope.
     * @param response Envelope whose status has already been checked
     * @return true if present, always true for {@link #NONE}
     */
    boolean isPresentIn(SubsonicResponse response) {
        switch (this) {
            case ALBUM:
                return response.album() != null;
            case ALBUM_LIST:
                return response.albumList() != null;
            case PLAYLIST:
                return response.playlist() != null;
            case PLAYLISTS:
                return response.playlists() != null;
            default:
                return true;
        }
    }
}
