package com.graplsub.client;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AlbumServiceTest {

    @Test
    void addsEverySongOfEveryAlbum() throws OrchestrationException {
        RecordingTransport transport = new RecordingTransport()
            .always("getAlbumList", RecordingTransport.albumList("a1", "a2"))
            .then("getAlbum", RecordingTransport.album("a1", "s1", "s2"))
            .then("getAlbum", RecordingTransport.album("a2"))
            .always("updatePlaylist", RecordingTransport.OK_EMPTY);

        PopulateSummary summary = new AlbumService(new SubsonicApi(transport)).populate("p1", 2);

        assertEquals(new PopulateSummary(2, 2), summary);
        List<RecordingTransport.Call> updates = transport.callsTo("updatePlaylist");
        assertEquals(2, updates.size());
        assertEquals("s1", updates.get(0).params().get("songIdToAdd"));
        assertEquals("s2", updates.get(1).params().get("songIdToAdd"));
        assertEquals("p1", updates.get(0).params().get("playlistId"));
        assertEquals(List.of("getAlbumList", "getAlbum", "updatePlaylist", "updatePlaylist", "getAlbum"),
            transport.endpoints());
    }

    @Test
    void requestsRandomListOfSampleSize() throws OrchestrationException {
        RecordingTransport transport = new RecordingTransport()
            .always("getAlbumList", RecordingTransport.albumList());

        PopulateSummary summary = new AlbumService(new SubsonicApi(transport)).populate("p1", 500);

        assertEquals(new PopulateSummary(0, 0), summary);
        RecordingTransport.Call call = transport.calls().get(0);
        assertEquals("random", call.params().get("type"));
        assertEquals("500", call.params().get("size"));
        assertEquals(1, transport.calls().size());
    }

    @Test
    void missingAlbumListIsFatalRatherThanEmpty() {
        RecordingTransport transport = new RecordingTransport()
            .always("getAlbumList", RecordingTransport.OK_EMPTY);

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> new AlbumService(new SubsonicApi(transport)).populate("p1", 10));

        assertEquals(OrchestrationException.Step.RANDOM_ALBUM_LIST, e.getStep());
        assertTrue(e.getMessage().contains("missing an albumList"), e.getMessage());
    }

    @Test
    void albumFailureAbortsRemainingAlbums() {
        RecordingTransport transport = new RecordingTransport()
            .always("getAlbumList", RecordingTransport.albumList("a1", "a2", "a3"))
            .then("getAlbum", RecordingTransport.album("a1", "s1"))
            .then("getAlbum", TransportException.notFound("http://test/rest/getAlbum"))
            .then("getAlbum", RecordingTransport.album("a3", "s3"))
            .always("updatePlaylist", RecordingTransport.OK_EMPTY);

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> new AlbumService(new SubsonicApi(transport)).populate("p1", 3));

        assertEquals(OrchestrationException.Step.GET_ALBUM, e.getStep());
        assertEquals("a2", e.getSubjectId());
        assertEquals(2, transport.callsTo("getAlbum").size());
        assertEquals(1, transport.callsTo("updatePlaylist").size());
    }

    @Test
    void albumWithoutAlbumPayloadIsFatal() {
        RecordingTransport transport = new RecordingTransport()
            .always("getAlbumList", RecordingTransport.albumList("a1"))
            .always("getAlbum", RecordingTransport.OK_EMPTY);

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> new AlbumService(new SubsonicApi(transport)).populate("p1", 1));

        assertEquals(PayloadKind.ALBUM, ((ResponseValidationException) e.getCause()).getPayloadKind());
    }

    @Test
    void updateFailureAbortsRemainingSongsAndAlbums() throws Exception {
        SubsonicApi api = mock(SubsonicApi.class);
        when(api.getRandomAlbumList(2)).thenReturn(List.of(new Album("a1", null), new Album("a2", null)));
        when(api.getAlbum("a1")).thenReturn(new Album("a1", List.of(new Song("s1"), new Song("s2"), new Song("s3"))));
        doNothing().when(api).addSongToPlaylist("p1", "s1");
        doThrow(ResponseValidationException.notOk(null, "{}")).when(api).addSongToPlaylist("p1", "s2");

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> new AlbumService(api).populate("p1", 2));

        assertEquals(OrchestrationException.Step.UPDATE_PLAYLIST, e.getStep());
        assertEquals("s2", e.getSubjectId());
        InOrder inOrder = inOrder(api);
        inOrder.verify(api).getRandomAlbumList(2);
        inOrder.verify(api).getAlbum("a1");
        inOrder.verify(api).addSongToPlaylist("p1", "s1");
        inOrder.verify(api).addSongToPlaylist("p1", "s2");
        verify(api, never()).addSongToPlaylist("p1", "s3");
        verify(api, never()).getAlbum("a2");
        verify(api, times(2)).addSongToPlaylist(eq("p1"), anyString());
    }

    @Test
    void listedAlbumWithoutIdIsMalformed() {
        RecordingTransport transport = new RecordingTransport()
            .always("getAlbumList", "{\"subsonic-response\":{\"status\":\"ok\",\"albumList\":{\"album\":[{\"title\":\"x\"}]}}}");

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> new AlbumService(new SubsonicApi(transport)).populate("p1", 1));

        assertEquals(OrchestrationException.Step.RANDOM_ALBUM_LIST, e.getStep());
        assertEquals(TransportException.Kind.MALFORMED_RESPONSE, ((TransportException) e.getCause()).getKind());
        assertTrue(transport.callsTo("getAlbum").isEmpty());
    }

    @Test
    void songWithoutIdIsMalformedAndNothingIsAdded() {
        RecordingTransport transport = new RecordingTransport()
            .always("getAlbumList", RecordingTransport.albumList("a1"))
            .always("getAlbum", "{\"subsonic-response\":{\"status\":\"ok\",\"album\":{\"id\":\"a1\","
                + "\"song\":[{\"id\":\"s1\"},{\"title\":\"no id\"}]}}}")
            .always("updatePlaylist", RecordingTransport.OK_EMPTY);

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> new AlbumService(new SubsonicApi(transport)).populate("p1", 1));

        assertEquals(OrchestrationException.Step.GET_ALBUM, e.getStep());
        assertEquals(TransportException.Kind.MALFORMED_RESPONSE, ((TransportException) e.getCause()).getKind());
        assertTrue(transport.callsTo("updatePlaylist").isEmpty());
    }

    @Test
    void nullSongEntryIsMalformed() {
        RecordingTransport transport = new RecordingTransport()
            .always("getAlbumList", RecordingTransport.albumList("a1"))
            .always("getAlbum", "{\"subsonic-response\":{\"status\":\"ok\",\"album\":{\"id\":\"a1\",\"song\":[null]}}}");

        OrchestrationException e = assertThrows(OrchestrationException.class,
            () -> new AlbumService(new SubsonicApi(transport)).populate("p1", 1));

        assertEquals(TransportException.Kind.MALFORMED_RESPONSE, ((TransportException) e.getCause()).getKind());
    }
}
