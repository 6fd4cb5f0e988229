package com.graplsub.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseValidatorTest {

    private static final Album ALBUM = new Album("a1", List.of(new Song("s1")));
    private static final AlbumList ALBUM_LIST = new AlbumList(List.of(ALBUM));
    private static final Playlist PLAYLIST = new Playlist("42", "graplsub_random_albums");
    private static final Playlists PLAYLISTS = new Playlists(List.of(PLAYLIST));

    private static SubsonicResponse full(String status) {
        return new SubsonicResponse(status, null, ALBUM, ALBUM_LIST, PLAYLIST, PLAYLISTS);
    }

    @ParameterizedTest
    @ValueSource(strings = {"failed", "OK", "Ok", " ok", "ok ", ""})
    void rejectsAnyStatusOtherThanOk(String status) {
        for (PayloadKind kind : PayloadKind.values()) {
            ResponseValidationException e = assertThrows(ResponseValidationException.class,
                () -> ResponseValidator.validate(full(status), "body", kind));
            assertEquals(ResponseValidationException.Kind.NOT_OK, e.getKind());
            assertEquals("body", e.getRawBody());
        }
    }

    @Test
    void rejectsNullStatus() {
        ResponseValidationException e = assertThrows(ResponseValidationException.class,
            () -> ResponseValidator.validate(full(null), "body", PayloadKind.NONE));
        assertEquals(ResponseValidationException.Kind.NOT_OK, e.getKind());
    }

    @Test
    void notOkMessageIncludesServerError() throws TransportException {
        SubsonicResult result = SubsonicTransport.decode("u", RecordingTransport.FAILED);
        ResponseValidationException e = assertThrows(ResponseValidationException.class,
            () -> ResponseValidator.validate(result, PayloadKind.NONE));
        assertTrue(e.getMessage().contains("Not found"), e.getMessage());
        assertTrue(e.getMessage().contains("did not have 'ok' status"), e.getMessage());
    }

    @ParameterizedTest
    @EnumSource(value = PayloadKind.class, names = {"ALBUM", "ALBUM_LIST", "PLAYLIST", "PLAYLISTS"})
    void reportsMissingPayloadForEachKind(PayloadKind kind) {
        SubsonicResponse empty = new SubsonicResponse("ok", null, null, null, null, null);
        ResponseValidationException e = assertThrows(ResponseValidationException.class,
            () -> ResponseValidator.validate(empty, "{}", kind));
        assertEquals(ResponseValidationException.Kind.MISSING_PAYLOAD, e.getKind());
        assertEquals(kind, e.getPayloadKind());
        assertTrue(e.getMessage().startsWith("Subsonic response was missing " + kind.description()));
    }

    @Test
    void missingPayloadIsCheckedOnlyForTheExpectedKind() {
        SubsonicResponse onlyAlbum = new SubsonicResponse("ok", null, ALBUM, null, null, null);
        assertDoesNotThrow(() -> ResponseValidator.validate(onlyAlbum, "{}", PayloadKind.ALBUM));
        assertThrows(ResponseValidationException.class,
            () -> ResponseValidator.validate(onlyAlbum, "{}", PayloadKind.PLAYLIST));
    }

    @Test
    void noneAcceptsBareOkEnvelope() throws TransportException {
        SubsonicResult result = SubsonicTransport.decode("u", RecordingTransport.OK_EMPTY);
        assertDoesNotThrow(() -> ResponseValidator.validate(result, PayloadKind.NONE));
    }

    @Test
    void acceptsPresentWrappersWithEmptyContents() throws TransportException {
        SubsonicResult playlists = SubsonicTransport.decode("u",
            "{\"subsonic-response\":{\"status\":\"ok\",\"playlists\":{}}}");
        assertDoesNotThrow(() -> ResponseValidator.validate(playlists, PayloadKind.PLAYLISTS));
        assertTrue(playlists.response().playlists().playlistsOrEmpty().isEmpty());

        SubsonicResult albums = SubsonicTransport.decode("u",
            "{\"subsonic-response\":{\"status\":\"ok\",\"albumList\":{\"album\":[]}}}");
        assertDoesNotThrow(() -> ResponseValidator.validate(albums, PayloadKind.ALBUM_LIST));
        assertTrue(albums.response().albumList().albumsOrEmpty().isEmpty());
    }
}
