package com.phillippitts.voxbank;

import com.phillippitts.voxbank.domain.SynthesisPreview;
import com.phillippitts.voxbank.domain.SynthesisRequest;
import com.phillippitts.voxbank.domain.SynthesisResult;
import com.phillippitts.voxbank.service.audio.AudioFormat;
import com.phillippitts.voxbank.service.cache.WordBankCache;
import com.phillippitts.voxbank.service.orchestration.VoxOrchestrator;
import com.phillippitts.voxbank.testutil.PcmFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ActiveProfiles("test")
@SpringBootTest(
    properties = {
        "vox.request.skip-missing-words=true", // never reach the provider in tests
        "threadpool.generation.core-pool-size=2"
    }
)
class VoxBankApplicationTests {

    private final String scope = "it-" + UUID.randomUUID().toString().substring(0, 8);

    @Autowired
    private VoxOrchestrator orchestrator;

    @Autowired
    private WordBankCache cache;

    @AfterEach
    void purgeScope() {
        cache.purge(scope, null);
    }

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(cache.stats(scope).totalWords()).isZero();
    }

    @Test
    void cachedWordsPlayWithoutTheProvider() {
        cache.put(PcmFixtures.clip(scope, "open", "amy", 0.25));
        cache.put(PcmFixtures.clip(scope, "gate", "amy", 0.25));

        SynthesisResult result = orchestrator.synthesize(SynthesisRequest.forText(scope, "amy", "Open the gate"));

        assertThat(result.success()).isTrue();
        assertThat(result.matchedWords()).containsExactly("open", "gate");
        assertThat(result.skippedWords()).containsExactly("the");
        assertThat(result.cachedCount()).isEqualTo(2);
        assertThat(result.generatedCount()).isZero();
        // two clips and one default 50 ms gap
        assertThat(result.buffer()).hasSize(48_000 * 2 + AudioFormat.silenceBytes(50));
    }

    @Test
    void previewReportsCachedAndMissingWords() {
        cache.put(PcmFixtures.clip(scope, "gate", "amy", 0.25));

        SynthesisPreview preview = orchestrator.preview(scope, "amy", "open gate", null);

        assertThat(preview.cachedCount()).isEqualTo(1);
        assertThat(preview.missingCount()).isEqualTo(1);
    }
}
