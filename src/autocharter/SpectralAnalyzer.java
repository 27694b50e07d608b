package autocharter;

import ddf.minim.analysis.FFT;
import gnu.trove.list.array.TFloatArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Windows samples into overlapping Hann frames and measures their spectral energy.
 * Frame {@code f} is centred on sample {@code f * hop} and stamped with that sample's time,
 * so an onset at the very start of the signal lands in the middle of frame 0.
 */
public class SpectralAnalyzer {

    private static final Logger logger = Logger.getLogger(SpectralAnalyzer.class.getName());

    private final int windowSize;
    private final int hopSize;
    private final int smoothingWidth;

    public SpectralAnalyzer(int windowSize, int hopSize, int smoothingWidth) {
        if (Integer.bitCount(windowSize) != 1) {
            throw new IllegalArgumentException("Window size must be a power of two: " + windowSize);
        }
        if (hopSize <= 0 || hopSize >= windowSize) {
            throw new IllegalArgumentException("Hop size must be in (0, " + windowSize + "): " + hopSize);
        }
        this.windowSize = windowSize;
        this.hopSize = hopSize;
        this.smoothingWidth = Math.max(1, smoothingWidth);
    }

    public SpectralAnalyzer(CharterConfig config) {
        this(config.getWindowSize(), config.getHopSize(), config.getSmoothingWidth());
    }

    public int getHopSize() {
        return hopSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /** Number of frames needed so that every sample is some frame's centre or lies between two. */
    public int frameCount(Samples samples) {
        return (samples.length() + hopSize - 1) / hopSize;
    }

    /** Smoothed energy envelope of the whole signal. */
    public EnergyEnvelope envelope(Samples samples) {
        return analyze(samples, Collections.<FrequencyBand>emptyList()).envelope();
    }

    public SpectralAnalysis analyze(Samples samples, Collection<FrequencyBand> bands) {
        float sampleRate = samples.getSampleRate();
        int frames = frameCount(samples);
        float frameDuration = hopSize / sampleRate;

        FFT fft = new FFT(windowSize, sampleRate);
        fft.window(FFT.HANN);
        int specSize = fft.specSize();
        float binWidth = sampleRate / windowSize;

        Map<FrequencyBand, int[]> binRanges = new LinkedHashMap<>();
        Map<FrequencyBand, float[]> bandSeries = new LinkedHashMap<>();
        for (FrequencyBand band : bands) {
            binRanges.put(band, binRange(band, binWidth, specSize));
            bandSeries.put(band, new float[frames]);
        }

        TFloatArrayList times = new TFloatArrayList(frames);
        TFloatArrayList energies = new TFloatArrayList(frames);
        float[] power = new float[specSize];
        for (int f = 0; f < frames; f++) {
            int centre = f * hopSize;
            // zero-padded on both ends
            fft.forward(samples.copyRange(centre - windowSize / 2, windowSize));
            float total = 0f;
            for (int k = 0; k < specSize; k++) {
                float magnitude = fft.getBand(k);
                power[k] = magnitude * magnitude;
                total += power[k];
            }
            times.add(centre / sampleRate);
            energies.add(total);
            for (Map.Entry<FrequencyBand, int[]> entry : binRanges.entrySet()) {
                int[] range = entry.getValue();
                float sum = 0f;
                for (int k = range[0]; k <= range[1]; k++) sum += power[k];
                bandSeries.get(entry.getKey())[f] = sum;
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Analyzed %d frames (window %d, hop %d) and %d bands", frames, windowSize, hopSize, bands.size()));
        }
        EnergyEnvelope raw = new EnergyEnvelope(times.toArray(), energies.toArray(), frameDuration);
        return new SpectralAnalysis(raw, smoothingWidth, bandSeries);
    }

    // inclusive bin range covering the band; a band narrower than one bin gets its nearest bin
    static int[] binRange(FrequencyBand band, float binWidth, int specSize) {
        int low = (int) Math.ceil(band.getLowHz() / binWidth);
        int high = (int) Math.floor(band.getHighHz() / binWidth);
        low = Math.max(0, Math.min(specSize - 1, low));
        high = Math.max(0, Math.min(specSize - 1, high));
        if (low > high) {
            int nearest = Math.round((band.getLowHz() + band.getHighHz()) / 2f / binWidth);
            nearest = Math.max(0, Math.min(specSize - 1, nearest));
            return new int[] {nearest, nearest};
        }
        return new int[] {low, high};
    }
}
