package autocharter;

import java.io.File;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the whole pipeline: instrument filter, analysis, then beat detection, quantization,
 * lanes and holds once per difficulty.
 */
public class ChartOrchestrator {

    private static final Logger logger = Logger.getLogger(ChartOrchestrator.class.getName());

    // Expert inserts a note in the middle of gaps longer than this
    static final float FILL_GAP = 0.5f;
    static final float FILL_DEDUP = 0.05f;

    private final CharterConfig config;
    private final Executor executor;
    private final Clock clock;
    private final ChartExporter exporter = new ChartExporter();

    public ChartOrchestrator(CharterConfig config) {
        this(config, Runnable::run);
    }

    /** Difficulty runs are handed to {@code executor}; results keep difficulty order. */
    public ChartOrchestrator(CharterConfig config, Executor executor) {
        this(config, executor, Clock.systemUTC());
    }

    ChartOrchestrator(CharterConfig config, Executor executor, Clock clock) {
        this.config = config;
        this.executor = executor;
        this.clock = clock;
    }

    public CharterConfig getConfig() {
        return config;
    }

    /**
     * Generate the Easy, Normal, Hard and Expert charts for one instrument.
     * @throws ChartingException the first stage failure, in difficulty order
     */
    public List<Chart> generateAll(Samples samples, String songId, Instrument instrument) throws ChartingException {
        config.validate();
        checkSongId(songId);
        InstrumentAnalysis analysis = analyzeInstrument(samples, instrument);
        List<FutureTask<Chart>> tasks = submitDifficulties(analysis, songId);
        List<Chart> charts = new ArrayList<>(tasks.size());
        for (FutureTask<Chart> task : tasks) {
            charts.add(await(task));
        }
        return charts;
    }

    /**
     * Load {@code audio} once and write every (instrument, difficulty) chart into {@code outputDir}.
     * Failures of single units are recorded in the report and do not stop the others.
     *
     * @throws ChartingException INVALID_CONFIG before any audio is read, or the load failure
     */
    public GenerationReport generateAndExport(File audio, String songId, List<Instrument> instruments, Path outputDir, ChartFormat format)
            throws ChartingException {
        config.validate();
        checkSongId(songId);
        if (instruments.isEmpty()) {
            throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "No instrument requested");
        }
        if (logger.isLoggable(Level.INFO)) {
            logger.info(String.format("Generating %s charts for %s (%s)", format.getExtension(), audio.getName(), config));
        }
        Samples samples = AudioSource.load(audio);
        SongMetadata metadata = SongMetadataReader.read(audio);

        GenerationReport report = new GenerationReport();
        Set<Instrument> unique = new LinkedHashSet<>(instruments);
        for (Instrument instrument : unique) {
            InstrumentAnalysis analysis;
            try {
                analysis = analyzeInstrument(samples, instrument);
            } catch (ChartingException e) {
                logger.warning(String.format("Analysis of %s failed: %s", instrument.label(), e));
                for (Difficulty difficulty : Difficulty.values()) report.addFailure(instrument.label(), difficulty, e);
                continue;
            }
            List<FutureTask<Chart>> tasks = submitDifficulties(analysis, songId);
            Difficulty[] difficulties = Difficulty.values();
            for (int i = 0; i < difficulties.length; i++) {
                try {
                    Chart chart = await(tasks.get(i));
                    Path file = exporter.write(chart, metadata, outputDir, format);
                    report.addSuccess(chart, file);
                } catch (ChartingException e) {
                    logger.warning(String.format("%s %s chart failed: %s", instrument.label(), difficulties[i].getDisplayName(), e));
                    report.addFailure(instrument.label(), difficulties[i], e);
                }
            }
        }
        if (logger.isLoggable(Level.INFO)) logger.info(report.toString());
        return report;
    }

    /**
     * Band-limit the signal to the instrument and analyse it once, with the lane bands
     * for both the four- and the five-column layouts.
     */
    InstrumentAnalysis analyzeInstrument(Samples samples, Instrument instrument) throws ChartingException {
        BandpassFilter filter = new BandpassFilter(config.getWindowSize(), config.getHopSize());
        Samples filtered = filter.apply(samples, instrument.getBand());

        Set<FrequencyBand> bands = new LinkedHashSet<>();
        for (Difficulty difficulty : Difficulty.values()) {
            bands.addAll(instrument.getBand().split(difficulty.getColumnCount()));
        }
        SpectralAnalysis analysis = new SpectralAnalyzer(config).analyze(filtered, bands);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("%s: %d frames over %.2fs", instrument.label(), analysis.envelope().size(), samples.getDurationSeconds()));
        }
        return new InstrumentAnalysis(instrument, analysis, samples.getDurationSeconds());
    }

    private List<FutureTask<Chart>> submitDifficulties(final InstrumentAnalysis analysis, final String songId) {
        List<FutureTask<Chart>> tasks = new ArrayList<>();
        for (final Difficulty difficulty : Difficulty.values()) {
            FutureTask<Chart> task = new FutureTask<>(() -> generate(analysis, songId, difficulty));
            tasks.add(task);
            executor.execute(task);
        }
        return tasks;
    }

    private static Chart await(FutureTask<Chart> task) throws ChartingException {
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a chart", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ChartingException) throw (ChartingException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause);
        }
    }

    /** One difficulty of one instrument. */
    Chart generate(InstrumentAnalysis analysis, String songId, Difficulty difficulty) throws ChartingException {
        float duration = analysis.duration;
        BeatDetection beats = new BeatDetector(config).detect(analysis.spectral.envelope(),
                difficulty.getPeakThreshold(), difficulty.getMinPeakInterval(), config.getBpmOverride());

        float[] onsets = beats.peakTimes();
        if (difficulty.isFillGaps()) onsets = fillGaps(onsets);

        Quantizer quantizer = new Quantizer(beats.getBpm(), difficulty.gridDivision(config.getGridDivision()));
        float[] times = quantizer.quantizeAll(onsets, duration);

        int columns = difficulty.getColumnCount();
        BandEnergies laneBands = analysis.spectral.bandEnergies(analysis.instrument.getBand().split(columns));
        List<Note> notes = new LaneAssigner(columns).assign(times, config.getLaneStrategy(), config.getRandomSeed(), laneBands);

        HoldDetector holds = new HoldDetector(config.getSustainThreshold(), config.getMinHoldDuration() * difficulty.getHoldScale());
        notes = holds.detect(notes, laneBands, duration);

        Chart chart = new ChartBuilder()
                .songId(songId)
                .instrument(analysis.instrument.label())
                .difficulty(difficulty)
                .columnCount(columns)
                .bpm(beats.getBpm())
                .fallbackBpmUsed(beats.isFallbackBpmUsed())
                .signalDuration(duration)
                .notes(notes)
                .clock(clock)
                .build();
        if (logger.isLoggable(Level.INFO)) {
            logger.info(String.format("%s %s: %d notes (%d holds) at %.2f BPM%s", analysis.instrument.label(), difficulty.getDisplayName(),
                    chart.getNotes().size(), chart.holdCount(), chart.getBpm(), beats.isFallbackBpmUsed() ? " (fallback tempo)" : ""));
        }
        return chart;
    }

    /**
     * Add the midpoint of every gap longer than {@link #FILL_GAP}, then drop onsets within
     * {@link #FILL_DEDUP} of the previous kept one.
     */
    static float[] fillGaps(float[] onsets) {
        List<Float> filled = new ArrayList<>(onsets.length * 2);
        for (int i = 0; i < onsets.length; i++) {
            filled.add(onsets[i]);
            if (i + 1 < onsets.length && onsets[i + 1] - onsets[i] > FILL_GAP) {
                filled.add((onsets[i] + onsets[i + 1]) / 2f);
            }
        }
        Collections.sort(filled);
        List<Float> kept = new ArrayList<>(filled.size());
        for (Float t : filled) {
            if (kept.isEmpty() || t - kept.get(kept.size() - 1) >= FILL_DEDUP) kept.add(t);
        }
        float[] result = new float[kept.size()];
        for (int i = 0; i < result.length; i++) result[i] = kept.get(i);
        return result;
    }

    private static void checkSongId(String songId) throws ChartingException {
        if (songId == null || songId.trim().isEmpty()) {
            throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "Song id is required");
        }
    }

    /** Filtered analysis of one instrument, shared read-only by its difficulty runs. */
    static final class InstrumentAnalysis {
        final Instrument instrument;
        final SpectralAnalysis spectral;
        final float duration;

        InstrumentAnalysis(Instrument instrument, SpectralAnalysis spectral, float duration) {
            this.instrument = instrument;
            this.spectral = spectral;
            this.duration = duration;
        }
    }
}
