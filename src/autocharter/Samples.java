package autocharter;

import java.util.Arrays;
import javax.sound.sampled.AudioFormat;

/**
 * Mono sample data normalized to [-1, 1] together with its sample rate.
 * Instances never change after construction, so one load can be read by
 * several difficulty runs at once.
 */
public final class Samples {

    private final float[] data;
    private final float sampleRate;

    private Samples(float[] data, float sampleRate) {
        this.data = data;
        this.sampleRate = sampleRate;
    }

    /**
     * Wrap mono amplitudes. The array is copied.
     * @throws ChartingException EMPTY_SIGNAL when there are no samples
     */
    public static Samples of(float[] mono, float sampleRate) throws ChartingException {
        if (sampleRate <= 0f) {
            throw new ChartingException(ChartingException.Kind.DECODE_ERROR, "Sample rate must be positive: " + sampleRate);
        }
        if (mono == null || mono.length == 0) {
            throw new ChartingException(ChartingException.Kind.EMPTY_SIGNAL, "Signal contains no samples");
        }
        return new Samples(Arrays.copyOf(mono, mono.length), sampleRate);
    }

    /**
     * Average interleaved channels into one.
     * Trailing samples that do not fill a whole frame are dropped.
     */
    public static Samples downmix(float[] interleaved, int channels, float sampleRate) throws ChartingException {
        if (channels <= 0) {
            throw new ChartingException(ChartingException.Kind.DECODE_ERROR, "Channel count must be positive: " + channels);
        }
        int frames = interleaved.length / channels;
        if (channels == 1) {
            return of(Arrays.copyOf(interleaved, frames), sampleRate);
        }
        float[] mono = new float[frames];
        for (int f = 0; f < frames; f++) {
            float sum = 0f;
            int base = f * channels;
            for (int c = 0; c < channels; c++) {
                sum += interleaved[base + c];
            }
            mono[f] = sum / channels;
        }
        return of(mono, sampleRate);
    }

    /**
     * Decode raw PCM bytes in the given format and downmix them.
     * Handles signed/unsigned integer PCM of 8 to 32 bits and 32/64-bit float PCM.
     */
    public static Samples fromPcm(byte[] bytes, AudioFormat format) throws ChartingException {
        int bits = format.getSampleSizeInBits();
        int bytesPerSample = (bits + 7) / 8;
        int channels = format.getChannels();
        if (bytesPerSample <= 0 || channels <= 0) {
            throw new ChartingException(ChartingException.Kind.UNSUPPORTED_FORMAT, "Unsupported PCM layout: " + format);
        }
        AudioFormat.Encoding encoding = format.getEncoding();
        boolean bigEndian = format.isBigEndian();
        int count = bytes.length / bytesPerSample;
        float[] interleaved = new float[count];

        if (AudioFormat.Encoding.PCM_FLOAT.equals(encoding)) {
            if (bits != 32 && bits != 64) {
                throw new ChartingException(ChartingException.Kind.UNSUPPORTED_FORMAT, "Unsupported float sample size: " + bits);
            }
            for (int i = 0; i < count; i++) {
                long raw = readInteger(bytes, i * bytesPerSample, bytesPerSample, bigEndian);
                float value = bits == 32 ? Float.intBitsToFloat((int) raw) : (float) Double.longBitsToDouble(raw);
                interleaved[i] = clamp(value);
            }
        } else if (AudioFormat.Encoding.PCM_SIGNED.equals(encoding) || AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding)) {
            if (bits > 32) {
                throw new ChartingException(ChartingException.Kind.UNSUPPORTED_FORMAT, "Unsupported integer sample size: " + bits);
            }
            boolean signed = AudioFormat.Encoding.PCM_SIGNED.equals(encoding);
            int usedBits = bytesPerSample * 8;
            double fullScale = Math.pow(2, usedBits - 1.0);
            for (int i = 0; i < count; i++) {
                long raw = readInteger(bytes, i * bytesPerSample, bytesPerSample, bigEndian);
                long value;
                if (signed) {
                    // sign-extend from the sample width
                    value = (raw << (64 - usedBits)) >> (64 - usedBits);
                } else {
                    value = raw - (long) fullScale;
                }
                interleaved[i] = clamp((float) (value / fullScale));
            }
        } else {
            throw new ChartingException(ChartingException.Kind.UNSUPPORTED_FORMAT, "Not a PCM encoding: " + encoding);
        }
        return downmix(interleaved, channels, format.getSampleRate());
    }

    private static long readInteger(byte[] bytes, int offset, int width, boolean bigEndian) {
        long raw = 0;
        for (int b = 0; b < width; b++) {
            int index = bigEndian ? offset + b : offset + width - 1 - b;
            raw = (raw << 8) | (bytes[index] & 0xFF);
        }
        return raw;
    }

    private static float clamp(float value) {
        if (Float.isNaN(value)) return 0f;
        return Math.max(-1f, Math.min(1f, value));
    }

    public int length() {
        return data.length;
    }

    public float getSampleRate() {
        return sampleRate;
    }

    public float get(int index) {
        return data[index];
    }

    public float getDurationSeconds() {
        return data.length / sampleRate;
    }

    /**
     * Copy {@code length} samples starting at {@code start}; positions before the start or past
     * the end read as zero.
     */
    public float[] copyRange(int start, int length) {
        float[] out = new float[length];
        int from = Math.max(0, start);
        int to = Math.min(data.length, start + length);
        if (from < to) {
            System.arraycopy(data, from, out, from - start, to - from);
        }
        return out;
    }

    public float[] toArray() {
        return Arrays.copyOf(data, data.length);
    }
}
