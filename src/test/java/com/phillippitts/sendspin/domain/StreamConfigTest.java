package com.phillippitts.sendspin.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamConfigTest {

    @Test
    void computesFrameSizeAndByteRate() {
        StreamConfig cd = new StreamConfig("pcm", 44_100, 2, 16);
        assertThat(cd.frameSize()).isEqualTo(4);
        assertThat(cd.byteRate()).isEqualTo(176_400);

        StreamConfig hiRes = new StreamConfig("pcm", 48_000, 2, 24);
        assertThat(hiRes.frameSize()).isEqualTo(6);
    }

    @Test
    void rejectsNonPositiveFields() {
        assertThatThrownBy(() -> new StreamConfig("pcm", 0, 2, 16)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StreamConfig("pcm", 48_000, 0, 16)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StreamConfig("pcm", 48_000, 2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StreamConfig(null, 48_000, 2, 16)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void codecHeaderIsDefensivelyCopiedAndComparedByContent() {
        byte[] header = {1, 2, 3};
        StreamConfig a = new StreamConfig("flac", 48_000, 2, 16, header);
        header[0] = 9;

        assertThat(a.codecHeader()).containsExactly(1, 2, 3);
        assertThat(a).isEqualTo(new StreamConfig("flac", 48_000, 2, 16, new byte[]{1, 2, 3}));
        assertThat(a.hashCode()).isEqualTo(new StreamConfig("flac", 48_000, 2, 16, new byte[]{1, 2, 3}).hashCode());
    }
}
