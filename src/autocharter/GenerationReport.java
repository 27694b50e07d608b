package autocharter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a batch run: one entry per (instrument, difficulty) unit that was attempted.
 */
public final class GenerationReport {

    /** A single unit of work and how it ended. */
    public static final class Outcome {
        private final String instrument;
        private final Difficulty difficulty;
        private final Path file;
        private final ChartingException error;
        private final boolean fallbackBpmUsed;

        private Outcome(String instrument, Difficulty difficulty, Path file, ChartingException error, boolean fallbackBpmUsed) {
            this.instrument = instrument;
            this.difficulty = difficulty;
            this.file = file;
            this.error = error;
            this.fallbackBpmUsed = fallbackBpmUsed;
        }

        public String getInstrument() { return instrument; }

        /** May be null when the failure happened before the difficulty runs started. */
        public Difficulty getDifficulty() { return difficulty; }

        /** Written file, null on failure. */
        public Path getFile() { return file; }

        /** Cause of failure, null on success. */
        public ChartingException getError() { return error; }

        public boolean isSuccess() {
            return error == null;
        }

        /** The written chart carries the default tempo instead of an estimate. */
        public boolean isFallbackBpmUsed() {
            return fallbackBpmUsed;
        }

        @Override
        public String toString() {
            String unit = instrument + "/" + (difficulty == null ? "*" : difficulty.getDisplayName());
            if (!isSuccess()) return unit + " failed: " + error;
            return unit + " -> " + file + (fallbackBpmUsed ? " (fallback tempo)" : "");
        }
    }

    private final List<Outcome> outcomes = new ArrayList<>();

    void addSuccess(Chart chart, Path file) {
        outcomes.add(new Outcome(chart.getInstrument(), chart.getDifficulty(), file, null, chart.isFallbackBpmUsed()));
    }

    void addFailure(String instrument, Difficulty difficulty, ChartingException error) {
        outcomes.add(new Outcome(instrument, difficulty, null, error, false));
    }

    public List<Outcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<Outcome> succeeded() {
        List<Outcome> result = new ArrayList<>();
        for (Outcome o : outcomes) {
            if (o.isSuccess()) result.add(o);
        }
        return result;
    }

    public List<Outcome> failed() {
        List<Outcome> result = new ArrayList<>();
        for (Outcome o : outcomes) {
            if (!o.isSuccess()) result.add(o);
        }
        return result;
    }

    /** Written charts whose tempo is the default rather than an estimate. */
    public List<Outcome> fallbackTempo() {
        List<Outcome> result = new ArrayList<>();
        for (Outcome o : outcomes) {
            if (o.isFallbackBpmUsed()) result.add(o);
        }
        return result;
    }

    public List<Path> writtenFiles() {
        List<Path> files = new ArrayList<>();
        for (Outcome o : succeeded()) files.add(o.getFile());
        return files;
    }

    /** True when at least one unit ran and none failed. */
    public boolean isComplete() {
        return !outcomes.isEmpty() && failed().isEmpty();
    }

    @Override
    public String toString() {
        return String.format("GenerationReport[%d written, %d failed, %d on fallback tempo]",
                succeeded().size(), failed().size(), fallbackTempo().size());
    }
}
