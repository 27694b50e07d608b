package autocharter;

import ddf.minim.analysis.FFT;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Restricts a signal to one frequency band: short-time FFT, zero every bin outside
 * the band, inverse FFT and overlap-add. The result is peak-normalized to 1.
 */
public class BandpassFilter {

    private static final Logger logger = Logger.getLogger(BandpassFilter.class.getName());

    private final int fftSize;
    private final int hopSize;

    public BandpassFilter(int fftSize, int hopSize) {
        if (Integer.bitCount(fftSize) != 1) {
            throw new IllegalArgumentException("FFT size must be a power of two: " + fftSize);
        }
        if (hopSize <= 0 || hopSize >= fftSize) {
            throw new IllegalArgumentException("Hop size must be in (0, " + fftSize + "): " + hopSize);
        }
        this.fftSize = fftSize;
        this.hopSize = hopSize;
    }

    public Samples apply(Samples input, FrequencyBand band) throws ChartingException {
        float sampleRate = input.getSampleRate();
        int length = input.length();
        float[] output = new float[length];

        FFT fft = new FFT(fftSize, sampleRate);
        fft.window(FFT.HANN);
        float binWidth = sampleRate / fftSize;
        boolean[] keep = new boolean[fftSize];
        int keptBins = 0;
        for (int k = 0; k < fftSize; k++) {
            // bins above Nyquist mirror the ones below it
            int mirrored = Math.min(k, fftSize - k);
            keep[k] = band.contains(mirrored * binWidth);
            if (keep[k] && k <= fftSize / 2) keptBins++;
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Bandpass %s keeps %d of %d bins", band, keptBins, fftSize / 2 + 1));
        }

        float[] frame = new float[fftSize];
        // start before zero so the first samples see a full set of overlapping windows
        for (int start = hopSize - fftSize; start < length; start += hopSize) {
            fillFrame(input, start, frame);
            fft.forward(frame);
            float[] real = fft.getSpectrumReal().clone();
            float[] imag = fft.getSpectrumImaginary().clone();
            for (int k = 0; k < fftSize; k++) {
                if (!keep[k]) {
                    real[k] = 0f;
                    imag[k] = 0f;
                }
            }
            fft.inverse(real, imag, frame);
            for (int i = 0; i < fftSize; i++) {
                int target = start + i;
                if (target >= 0 && target < length) output[target] += frame[i];
            }
        }

        float max = 0f;
        for (float v : output) max = Math.max(max, Math.abs(v));
        if (max > 0f) {
            for (int i = 0; i < length; i++) output[i] /= max;
        }
        return Samples.of(output, sampleRate);
    }

    private static void fillFrame(Samples input, int start, float[] frame) {
        for (int i = 0; i < frame.length; i++) {
            int source = start + i;
            frame[i] = source >= 0 && source < input.length() ? input.get(source) : 0f;
        }
    }
}
