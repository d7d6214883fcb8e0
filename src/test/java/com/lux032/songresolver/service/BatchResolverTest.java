package com.lux032.songresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.lux032.songresolver.model.AudioFingerprint;
import com.lux032.songresolver.model.BatchReport;
import com.lux032.songresolver.model.FileOutcome;
import com.lux032.songresolver.model.Match;
import com.lux032.songresolver.model.Resolution;
import com.lux032.songresolver.model.ResolutionState;
import com.lux032.songresolver.model.Song;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchResolverTest {

    private static final Song SONG = new Song("Artist", "Song", "Album");
    private static final AudioFingerprint FINGERPRINT = new AudioFingerprint(200, "AQAD");
    private static final JsonNode RESPONSE = JsonNodeFactory.instance.objectNode().put("status", "ok");

    @Mock
    private AudioFingerprintService fingerprintService;
    @Mock
    private AcoustIdClient acoustIdClient;
    @Mock
    private ResolutionWorkflow workflow;
    @Mock
    private FileRelocationService relocationService;
    @Mock
    private TagWriterService tagWriter;

    private BatchResolver resolver(int parallelism) {
        return new BatchResolver(fingerprintService, acoustIdClient, workflow, relocationService, tagWriter, parallelism);
    }

    private static Resolution resolution(Path file, ResolutionState state) {
        return new Resolution(file.getFileName().toString(), Match.sentinel(), false, state, SONG);
    }

    @Test
    @DisplayName("accepted files are relocated and tagged at their destination")
    void acceptedFile() throws Exception {
        Path file = Paths.get("in", "Artist - Song.mp3");
        Path destination = Paths.get("finished", "Artist - Song.mp3");
        Resolution accepted = resolution(file, ResolutionState.AUTO_ACCEPTED);
        when(fingerprintService.generateFingerprint(file)).thenReturn(FINGERPRINT);
        when(acoustIdClient.lookup(FINGERPRINT)).thenReturn(RESPONSE);
        when(workflow.resolve(file, RESPONSE)).thenReturn(accepted);
        when(relocationService.relocateResolved(file, SONG)).thenReturn(destination);

        FileOutcome outcome = resolver(1).resolveFile(file);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getDestination()).isEqualTo(destination);
        assertThat(outcome.getResolution()).isSameAs(accepted);
        verify(tagWriter).writeTags(destination, SONG);
    }

    @Test
    @DisplayName("skipped files are moved aside without tagging")
    void skippedFile() throws Exception {
        Path file = Paths.get("in", "unknown.mp3");
        Path destination = Paths.get("skipped", "unknown.mp3");
        when(fingerprintService.generateFingerprint(file)).thenReturn(FINGERPRINT);
        when(acoustIdClient.lookup(FINGERPRINT)).thenReturn(RESPONSE);
        when(workflow.resolve(file, RESPONSE)).thenReturn(resolution(file, ResolutionState.SKIPPED));
        when(relocationService.moveToSkipped(file)).thenReturn(destination);

        FileOutcome outcome = resolver(1).resolveFile(file);

        assertThat(outcome.getDestination()).isEqualTo(destination);
        verify(relocationService, never()).relocateResolved(any(), any());
        verify(tagWriter, never()).writeTags(any(), any());
    }

    @Test
    @DisplayName("a failed lookup is reported and the batch continues")
    void failureDoesNotStopBatch() throws Exception {
        Path broken = Paths.get("in", "broken.mp3");
        Path good = Paths.get("in", "Artist - Song.mp3");
        Path destination = Paths.get("finished", "Artist - Song.mp3");
        AudioFingerprint brokenFingerprint = new AudioFingerprint(10, "BROKEN");
        when(fingerprintService.generateFingerprint(broken)).thenReturn(brokenFingerprint);
        when(fingerprintService.generateFingerprint(good)).thenReturn(FINGERPRINT);
        when(acoustIdClient.lookup(brokenFingerprint)).thenThrow(new LookupServiceException("AcoustID API 返回状态码 400", false));
        when(acoustIdClient.lookup(FINGERPRINT)).thenReturn(RESPONSE);
        when(workflow.resolve(good, RESPONSE)).thenReturn(resolution(good, ResolutionState.AUTO_ACCEPTED));
        when(relocationService.relocateResolved(good, SONG)).thenReturn(destination);

        BatchReport report = resolver(1).resolveAll(List.of(broken, good));

        assertThat(report.getOutcomes()).extracting(FileOutcome::getSource).containsExactly(broken, good);
        assertThat(report.getOutcomes().get(0).isSuccess()).isFalse();
        assertThat(report.getOutcomes().get(0).getError()).contains("400");
        assertThat(report.countSuccessful()).isEqualTo(1);
        assertThat(report.countInState(ResolutionState.AUTO_ACCEPTED)).isEqualTo(1);
        assertThat(report.allSucceeded()).isFalse();
    }

    @Test
    @DisplayName("parallel batches report outcomes in input order")
    void parallelKeepsOrder() throws Exception {
        List<Path> files = List.of(Paths.get("a.mp3"), Paths.get("b.mp3"), Paths.get("c.mp3"), Paths.get("d.mp3"));
        when(fingerprintService.generateFingerprint(any(Path.class))).thenReturn(FINGERPRINT);
        when(acoustIdClient.lookup(FINGERPRINT)).thenReturn(RESPONSE);
        for (Path file : files) {
            when(workflow.resolve(eq(file), eq(RESPONSE))).thenReturn(resolution(file, ResolutionState.MANUALLY_CORRECTED));
            when(relocationService.relocateResolved(file, SONG)).thenReturn(Paths.get("finished").resolve(file));
        }

        BatchReport report = resolver(3).resolveAll(files);

        assertThat(report.getOutcomes()).extracting(FileOutcome::getSource).containsExactlyElementsOf(files);
        assertThat(report.allSucceeded()).isTrue();
        assertThat(report.countInState(ResolutionState.MANUALLY_CORRECTED)).isEqualTo(4);
    }
}
