package com.phillippitts.voxbank.service.filter;

import com.phillippitts.voxbank.domain.CustomFilterSettings;
import com.phillippitts.voxbank.domain.FilterPreset;
import com.phillippitts.voxbank.domain.FilterSpec;
import com.phillippitts.voxbank.exception.FilterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FilterEngineTest {

    @Mock
    private AudioEffectsProcessor processor;

    @Test
    void offReturnsTheInputUntouched() {
        FilterEngine engine = new FilterEngine(processor);
        byte[] pcm = new byte[]{1, 2, 3, 4};

        assertThat(engine.apply(pcm, FilterSpec.off())).isSameAs(pcm);
        verifyNoInteractions(processor);
    }

    @Test
    void presetIsResolvedToItsSettings() {
        FilterEngine engine = new FilterEngine(processor);
        byte[] pcm = new byte[8];
        byte[] processed = new byte[]{1, 1, 1, 1, 1, 1, 1, 1};
        CustomFilterSettings light = FilterPreset.LIGHT.settings().orElseThrow();
        when(processor.process(pcm, light)).thenReturn(processed);

        assertThat(engine.apply(pcm, FilterSpec.preset(FilterPreset.LIGHT))).isSameAs(processed);
        verify(processor).process(pcm, light);
    }

    @Test
    void processorFailureFailsTheRequest() {
        FilterEngine engine = new FilterEngine(processor);
        IllegalStateException boom = new IllegalStateException("boom");
        when(processor.process(any(), any())).thenThrow(boom);
        when(processor.name()).thenReturn("test-chain");

        assertThatThrownBy(() -> engine.apply(new byte[4],
                FilterSpec.custom(new CustomFilterSettings(100, 5_000, 2.0, 0.2))))
                .isInstanceOf(FilterException.class)
                .hasMessageContaining("test-chain")
                .hasMessageContaining("custom")
                .hasCause(boom);
    }

    @Test
    void wrongOutputLengthFailsTheRequest() {
        FilterEngine engine = new FilterEngine(processor);
        when(processor.process(any(), any())).thenReturn(new byte[2]);
        when(processor.name()).thenReturn("test-chain");

        assertThatThrownBy(() -> engine.apply(new byte[4], FilterSpec.preset(FilterPreset.HEAVY)))
                .isInstanceOf(FilterException.class)
                .hasMessageContaining("returned 2 bytes for 4 bytes input");
    }
}
