package com.phillippitts.voxbank.presentation.controller;

import com.phillippitts.voxbank.domain.CacheKey;
import com.phillippitts.voxbank.domain.ClipMetadata;
import com.phillippitts.voxbank.domain.FailureReason;
import com.phillippitts.voxbank.domain.FilterPreset;
import com.phillippitts.voxbank.domain.FilterSpec;
import com.phillippitts.voxbank.domain.PipelineStage;
import com.phillippitts.voxbank.domain.SkippedWord;
import com.phillippitts.voxbank.domain.SynthesisPreview;
import com.phillippitts.voxbank.domain.SynthesisRequest;
import com.phillippitts.voxbank.domain.SynthesisResult;
import com.phillippitts.voxbank.domain.Token;
import com.phillippitts.voxbank.exception.InvalidRequestException;
import com.phillippitts.voxbank.service.cache.CacheStats;
import com.phillippitts.voxbank.service.cache.ImportReport;
import com.phillippitts.voxbank.service.cache.WordBankArchiver;
import com.phillippitts.voxbank.service.cache.WordBankCache;
import com.phillippitts.voxbank.service.orchestration.VoxOrchestrator;
import com.phillippitts.voxbank.testutil.PcmFixtures;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(VoxController.class)
class VoxControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private VoxOrchestrator orchestrator;

    @MockBean
    private WordBankCache cache;

    @MockBean
    private WordBankArchiver archiver;

    private static SynthesisResult success() {
        byte[] pcm = PcmFixtures.pcm(0.25, (byte) 1);
        return SynthesisResult.success(pcm, List.of("open", "gate"),
                List.of(new SkippedWord("ab#cd", "invalid: contains unsupported characters")), 0.25, 1, 1);
    }

    @Test
    void synthesizeReturnsWavWithCountHeaders() throws Exception {
        when(orchestrator.synthesize(any(SynthesisRequest.class))).thenReturn(success());

        byte[] body = mvc.perform(post("/api/vox/guild1/synthesize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"open ab#cd gate\",\"voiceId\":\"amy\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("audio/wav"))
                .andExpect(header().string("X-Vox-Matched-Words", "2"))
                .andExpect(header().string("X-Vox-Skipped-Words", "1"))
                .andExpect(header().string("X-Vox-Cached-Words", "1"))
                .andExpect(header().string("X-Vox-Generated-Words", "1"))
                .andExpect(header().string("X-Vox-Duration-Seconds", "0.250"))
                .andReturn().getResponse().getContentAsByteArray();

        assertThat(body).hasSize(44 + 48_000);
        assertThat(new String(body, 0, 4)).isEqualTo("RIFF");
    }

    @Test
    void synthesizeCanReturnRawPcm() throws Exception {
        when(orchestrator.synthesize(any(SynthesisRequest.class))).thenReturn(success());

        byte[] body = mvc.perform(post("/api/vox/guild1/synthesize").param("format", "pcm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"open gate\",\"voiceId\":\"amy\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andReturn().getResponse().getContentAsByteArray();

        assertThat(body).hasSize(48_000);
    }

    @Test
    void requestBodyIsMappedToTheDomainRequest() throws Exception {
        when(orchestrator.synthesize(any(SynthesisRequest.class))).thenReturn(success());

        mvc.perform(post("/api/vox/guild1/synthesize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"composition": [{"word": "open"}, {"pause": ".", "pauseMs": 300}, {"word": "gate"}],
                                 "voiceId": "amy", "filter": {"preset": "heavy"}, "wordGapMs": 80}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<SynthesisRequest> captor = ArgumentCaptor.forClass(SynthesisRequest.class);
        verify(orchestrator).synthesize(captor.capture());
        SynthesisRequest request = captor.getValue();
        assertThat(request.scopeId()).isEqualTo("guild1");
        assertThat(request.voiceId()).isEqualTo("amy");
        assertThat(request.composition()).containsExactly(Token.word("open"), Token.pause(".", 300),
                Token.word("gate"));
        assertThat(request.filter()).isEqualTo(FilterSpec.preset(FilterPreset.HEAVY));
        assertThat(request.wordGapMs()).isEqualTo(80);
    }

    @Test
    void failedResultIsReturnedAsJson() throws Exception {
        when(orchestrator.synthesize(any(SynthesisRequest.class))).thenReturn(SynthesisResult.failure(
                PipelineStage.GENERATING, FailureReason.NO_CONTENT, "No content to synthesize", List.of(),
                List.of(new SkippedWord("alpha", "provider rejected word"))));

        mvc.perform(post("/api/vox/guild1/synthesize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"alpha\",\"voiceId\":\"amy\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.failedStage").value("GENERATING"))
                .andExpect(jsonPath("$.failureReason").value("NO_CONTENT"))
                .andExpect(jsonPath("$.skipped[0].word").value("alpha"));
    }

    @Test
    void invalidRequestsReturn400() throws Exception {
        when(orchestrator.synthesize(any(SynthesisRequest.class)))
                .thenThrow(new InvalidRequestException("text", "Message exceeds 500 characters (got 501)"));

        mvc.perform(post("/api/vox/guild1/synthesize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"x\",\"voiceId\":\"amy\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequestException"))
                .andExpect(jsonPath("$.details").value("Message exceeds 500 characters (got 501) (field: text)"));
    }

    @Test
    void missingVoiceFailsBeanValidation() throws Exception {
        mvc.perform(post("/api/vox/guild1/synthesize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"open gate\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value(containsString("voiceId")));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void textAndCompositionAreMutuallyExclusive() throws Exception {
        mvc.perform(post("/api/vox/guild1/synthesize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"open\",\"composition\":[{\"word\":\"open\"}],\"voiceId\":\"amy\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(orchestrator);
    }

    @Test
    void unknownFormatAndMalformedBodyReturn400() throws Exception {
        mvc.perform(post("/api/vox/guild1/synthesize").param("format", "mp3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"open\",\"voiceId\":\"amy\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/vox/guild1/synthesize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Malformed request body"));
    }

    @Test
    void previewReturnsPerTokenView() throws Exception {
        SynthesisPreview preview = new SynthesisPreview(
                List.of(new SynthesisPreview.TokenPreview(Token.word("gate"), true, 0.3)),
                List.of(), 1, 0, 0.3);
        when(orchestrator.preview("guild1", "amy", "gate", null)).thenReturn(preview);

        mvc.perform(post("/api/vox/guild1/preview")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"gate\",\"voiceId\":\"amy\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cachedCount").value(1))
                .andExpect(jsonPath("$.tokens[0].cached").value(true))
                .andExpect(jsonPath("$.estimatedDurationSeconds").value(0.3));
    }

    @Test
    void statsListAndSearch() throws Exception {
        when(cache.stats("guild1")).thenReturn(new CacheStats("guild1", 2, 1_000, List.of("amy")));
        ClipMetadata gate = new ClipMetadata(CacheKey.of("guild1", "gate", "amy"), 500, 0.5, PcmFixtures.CREATED);
        when(cache.list("guild1", "amy")).thenReturn(List.of(gate));
        when(cache.search("guild1", null, "ga", 5)).thenReturn(List.of(gate));

        mvc.perform(get("/api/vox/guild1/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalWords").value(2))
                .andExpect(jsonPath("$.voicesUsed[0]").value("amy"));
        mvc.perform(get("/api/vox/guild1/clips").param("voice", "amy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].key.word").value("gate"));
        mvc.perform(get("/api/vox/guild1/clips").param("q", "ga").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void purgeOneWordNeedsAVoice() throws Exception {
        when(cache.purgeWord(CacheKey.of("guild1", "gate", "amy"))).thenReturn(true);

        mvc.perform(delete("/api/vox/guild1/clips").param("word", "gate"))
                .andExpect(status().isBadRequest());
        mvc.perform(delete("/api/vox/guild1/clips").param("word", "gate").param("voice", "amy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(1));
    }

    @Test
    void purgeScope() throws Exception {
        when(cache.purge("guild1", null)).thenReturn(7);

        mvc.perform(delete("/api/vox/guild1/clips"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(7));
    }

    @Test
    void exportStreamsAZip() throws Exception {
        doAnswer(invocation -> {
            OutputStream out = invocation.getArgument(2);
            out.write(new byte[]{'P', 'K', 3, 4});
            return null;
        }).when(archiver).exportArchive(eq("guild1"), isNull(), any(OutputStream.class));

        mvc.perform(get("/api/vox/guild1/export"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/zip"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"guild1-wordbank.zip\""))
                .andExpect(content().bytes(new byte[]{'P', 'K', 3, 4}));
    }

    @Test
    void importReturnsTheReport() throws Exception {
        when(archiver.importArchive(eq("guild2"), any(InputStream.class)))
                .thenReturn(new ImportReport("guild1", "guild2", List.of("amy/gate"), List.of()));

        mvc.perform(post("/api/vox/guild2/import")
                        .contentType("application/zip")
                        .content(new byte[]{'P', 'K', 3, 4}))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imported[0]").value("amy/gate"))
                .andExpect(jsonPath("$.sourceScope").value("guild1"));
    }

    @Test
    void failureReasonsMapToStatuses() {
        assertThat(VoxController.statusFor(FailureReason.NO_CONTENT)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(VoxController.statusFor(FailureReason.CANCELLED)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(VoxController.statusFor(FailureReason.FILTER)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(VoxController.statusFor(FailureReason.STORAGE)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
