package com.phillippitts.voxbank.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AudioFormatTest {

    @Test
    void derivedConstantsMatchTheFixedFormat() {
        assertThat(AudioFormat.BLOCK_ALIGN).isEqualTo(4);
        assertThat(AudioFormat.BYTE_RATE).isEqualTo(192_000);
        assertThat(AudioFormat.BYTES_PER_MILLISECOND).isEqualTo(192);
    }

    @Test
    void silenceBytesIs192PerMillisecond() {
        assertThat(AudioFormat.silenceBytes(0)).isZero();
        assertThat(AudioFormat.silenceBytes(1)).isEqualTo(192);
        assertThat(AudioFormat.silenceBytes(300)).isEqualTo(57_600);
        assertThat(AudioFormat.isFrameAligned(AudioFormat.silenceBytes(7))).isTrue();
    }

    @Test
    void negativeSilenceIsRejected() {
        assertThatThrownBy(() -> AudioFormat.silenceBytes(-5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void durationFromBytes() {
        assertThat(AudioFormat.durationSeconds(96_000)).isCloseTo(0.5, within(1e-12));
        assertThat(AudioFormat.isFrameAligned(6)).isFalse();
    }
}
