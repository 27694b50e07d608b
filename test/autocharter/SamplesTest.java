package autocharter;

import javax.sound.sampled.AudioFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SamplesTest {

    @Test
    @DisplayName("Should refuse an empty signal")
    void testEmpty() {
        assertThatThrownBy(() -> Samples.of(new float[0], 44100f))
                .isInstanceOf(ChartingException.class)
                .extracting(e -> ((ChartingException) e).getKind())
                .isEqualTo(ChartingException.Kind.EMPTY_SIGNAL);
    }

    @Test
    @DisplayName("Should average interleaved channels")
    void testDownmix() throws Exception {
        Samples samples = Samples.downmix(new float[] {1f, 0f, -0.5f, 0.5f, 0.2f, 0.4f, 0.9f}, 2, 8000f);

        assertThat(samples.length()).isEqualTo(3);
        assertThat(samples.toArray()).containsExactly(new float[] {0.5f, 0f, 0.3f}, within(1e-6f));
    }

    @Test
    @DisplayName("Should decode signed 16-bit little-endian PCM")
    void testSigned16() throws Exception {
        AudioFormat format = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED, 8000f, 16, 1, 2, 8000f, false);
        byte[] bytes = {0x00, (byte) 0x80, 0x00, 0x40, 0x00, 0x00};

        Samples samples = Samples.fromPcm(bytes, format);

        assertThat(samples.toArray()).containsExactly(new float[] {-1f, 0.5f, 0f}, within(1e-6f));
    }

    @Test
    @DisplayName("Should decode unsigned 8-bit PCM around its midpoint")
    void testUnsigned8() throws Exception {
        AudioFormat format = new AudioFormat(AudioFormat.Encoding.PCM_UNSIGNED, 8000f, 8, 1, 1, 8000f, false);
        byte[] bytes = {(byte) 128, 0, (byte) 192};

        Samples samples = Samples.fromPcm(bytes, format);

        assertThat(samples.toArray()).containsExactly(new float[] {0f, -1f, 0.5f}, within(1e-6f));
    }

    @Test
    @DisplayName("Should decode big-endian float PCM and clamp it")
    void testFloat32() throws Exception {
        AudioFormat format = new AudioFormat(AudioFormat.Encoding.PCM_FLOAT, 8000f, 32, 1, 4, 8000f, true);
        byte[] bytes = new byte[8];
        putInt(bytes, 0, Float.floatToIntBits(0.25f));
        putInt(bytes, 4, Float.floatToIntBits(3f));

        Samples samples = Samples.fromPcm(bytes, format);

        assertThat(samples.toArray()).containsExactly(new float[] {0.25f, 1f}, within(1e-6f));
    }

    @Test
    @DisplayName("Should zero-pad ranges running past the end")
    void testCopyRange() throws Exception {
        Samples samples = Samples.of(new float[] {0.1f, 0.2f, 0.3f}, 100f);

        assertThat(samples.copyRange(1, 4)).containsExactly(0.2f, 0.3f, 0f, 0f);
        assertThat(samples.copyRange(5, 2)).containsExactly(0f, 0f);
        assertThat(samples.copyRange(-2, 4)).containsExactly(0f, 0f, 0.1f, 0.2f);
        assertThat(samples.copyRange(-1, 5)).containsExactly(0f, 0.1f, 0.2f, 0.3f, 0f);
    }

    private static void putInt(byte[] bytes, int offset, int value) {
        bytes[offset] = (byte) (value >>> 24);
        bytes[offset + 1] = (byte) (value >>> 16);
        bytes[offset + 2] = (byte) (value >>> 8);
        bytes[offset + 3] = (byte) value;
    }
}
