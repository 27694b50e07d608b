package autocharter;

/**
 * Settings for one charting run. Immutable; every stage receives it explicitly.
 */
public final class CharterConfig {

    private final Float bpmOverride;
    private final int gridDivision;
    private final float sustainThreshold;
    private final float minHoldDuration;
    private final LaneStrategy laneStrategy;
    private final long randomSeed;
    private final int windowSize;
    private final int hopSize;
    private final int smoothingWidth;
    private final float defaultBpm;
    private final float minBpm;
    private final float maxBpm;

    private CharterConfig(Builder b) {
        this.bpmOverride = b.bpmOverride;
        this.gridDivision = b.gridDivision;
        this.sustainThreshold = b.sustainThreshold;
        this.minHoldDuration = b.minHoldDuration;
        this.laneStrategy = b.laneStrategy;
        this.randomSeed = b.randomSeed;
        this.windowSize = b.windowSize;
        this.hopSize = b.hopSize;
        this.smoothingWidth = b.smoothingWidth;
        this.defaultBpm = b.defaultBpm;
        this.minBpm = b.minBpm;
        this.maxBpm = b.maxBpm;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CharterConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .bpmOverride(bpmOverride)
                .gridDivision(gridDivision)
                .sustainThreshold(sustainThreshold)
                .minHoldDuration(minHoldDuration)
                .laneStrategy(laneStrategy)
                .randomSeed(randomSeed)
                .windowSize(windowSize)
                .hopSize(hopSize)
                .smoothingWidth(smoothingWidth)
                .defaultBpm(defaultBpm)
                .tempoRange(minBpm, maxBpm);
    }

    /**
     * Reject settings no stage can work with. Called before any audio is touched.
     * @throws ChartingException INVALID_CONFIG
     */
    public void validate() throws ChartingException {
        if (bpmOverride != null && (!(bpmOverride > 0f) || bpmOverride.isInfinite())) {
            throw invalid("BPM override must be positive: " + bpmOverride);
        }
        if (gridDivision <= 0) throw invalid("Grid division must be positive: " + gridDivision);
        if (!(sustainThreshold >= 0f && sustainThreshold <= 1f)) {
            throw invalid("Sustain threshold must be within [0, 1]: " + sustainThreshold);
        }
        if (!(minHoldDuration > 0f)) throw invalid("Minimum hold duration must be positive: " + minHoldDuration);
        if (laneStrategy == null) throw invalid("Lane strategy is required");
        if (windowSize <= 0 || Integer.bitCount(windowSize) != 1) throw invalid("Window size must be a power of two: " + windowSize);
        if (hopSize <= 0 || hopSize >= windowSize) throw invalid("Hop size must be in (0, window size): " + hopSize);
        if (smoothingWidth < 1 || smoothingWidth % 2 == 0) throw invalid("Smoothing width must be a positive odd number: " + smoothingWidth);
        if (!(minBpm > 0f) || maxBpm < 2f * minBpm) throw invalid(String.format("Tempo range %s-%s must span at least an octave", minBpm, maxBpm));
        if (defaultBpm < minBpm || defaultBpm > maxBpm) throw invalid("Default BPM must lie within the tempo range: " + defaultBpm);
    }

    private static ChartingException invalid(String message) {
        return new ChartingException(ChartingException.Kind.INVALID_CONFIG, message);
    }

    /** Tempo forced by the caller, or null to use the estimate. */
    public Float getBpmOverride() { return bpmOverride; }
    public int getGridDivision() { return gridDivision; }
    public float getSustainThreshold() { return sustainThreshold; }
    public float getMinHoldDuration() { return minHoldDuration; }
    public LaneStrategy getLaneStrategy() { return laneStrategy; }
    public long getRandomSeed() { return randomSeed; }
    public int getWindowSize() { return windowSize; }
    public int getHopSize() { return hopSize; }
    public int getSmoothingWidth() { return smoothingWidth; }
    public float getDefaultBpm() { return defaultBpm; }
    public float getMinBpm() { return minBpm; }
    public float getMaxBpm() { return maxBpm; }

    @Override
    public String toString() {
        return String.format("CharterConfig[bpm=%s, grid=%d, sustain=%.2f, minHold=%.2fs, lanes=%s, seed=%d]",
                bpmOverride == null ? "auto" : bpmOverride.toString(), gridDivision, sustainThreshold, minHoldDuration,
                laneStrategy == null ? "none" : laneStrategy.label(), randomSeed);
    }

    public static final class Builder {
        private Float bpmOverride;
        private int gridDivision = 4;
        private float sustainThreshold = 0.5f;
        private float minHoldDuration = 0.25f;
        private LaneStrategy laneStrategy = LaneStrategy.SEQUENTIAL;
        private long randomSeed = 1L;
        private int windowSize = 2048;
        private int hopSize = 512;
        private int smoothingWidth = 3;
        private float defaultBpm = 120f;
        private float minBpm = 60f;
        private float maxBpm = 240f;

        private Builder() {}

        public Builder bpmOverride(Float bpm) { this.bpmOverride = bpm; return this; }
        public Builder gridDivision(int gridDivision) { this.gridDivision = gridDivision; return this; }
        public Builder sustainThreshold(float sustainThreshold) { this.sustainThreshold = sustainThreshold; return this; }
        public Builder minHoldDuration(float minHoldDuration) { this.minHoldDuration = minHoldDuration; return this; }
        public Builder laneStrategy(LaneStrategy laneStrategy) { this.laneStrategy = laneStrategy; return this; }
        public Builder randomSeed(long randomSeed) { this.randomSeed = randomSeed; return this; }
        public Builder windowSize(int windowSize) { this.windowSize = windowSize; return this; }
        public Builder hopSize(int hopSize) { this.hopSize = hopSize; return this; }
        public Builder smoothingWidth(int smoothingWidth) { this.smoothingWidth = smoothingWidth; return this; }
        public Builder defaultBpm(float defaultBpm) { this.defaultBpm = defaultBpm; return this; }

        public Builder tempoRange(float minBpm, float maxBpm) {
            this.minBpm = minBpm;
            this.maxBpm = maxBpm;
            return this;
        }

        public CharterConfig build() {
            return new CharterConfig(this);
        }
    }
}
