package autocharter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serializes charts to JSON or to the sectioned chart-text format, and reads both back.
 */
public class ChartExporter {

    private static final Logger logger = Logger.getLogger(ChartExporter.class.getName());

    private static final String SONG_SECTION = "[SONG]";
    private static final String NOTES_SECTION = "[NOTES]";
    private static final String TAP = "1";
    private static final String HOLD = "2";

    private final ObjectMapper objectMapper;

    public ChartExporter() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * {@code {songId}_{instrument}_{difficulty}.{ext}}; characters other than ASCII letters and
     * digits in the song id become underscores.
     */
    public static String fileName(String songId, String instrument, Difficulty difficulty, ChartFormat format) {
        return String.format("%s_%s_%s.%s", songId.replaceAll("[^A-Za-z0-9]", "_"),
                instrument.toLowerCase(Locale.ROOT), difficulty.label(), format.getExtension());
    }

    public String serialize(Chart chart, SongMetadata metadata, ChartFormat format) throws ChartingException {
        if (format == ChartFormat.JSON) return toJson(chart);
        return toChartText(metadata, Collections.singletonList(chart));
    }

    /**
     * Write one chart into {@code outputDir}, creating the directory if needed.
     * @return the written file
     */
    public Path write(Chart chart, SongMetadata metadata, Path outputDir, ChartFormat format) throws ChartingException {
        String content = serialize(chart, metadata, format);
        Path target = outputDir.resolve(fileName(chart.getSongId(), chart.getInstrument(), chart.getDifficulty(), format));
        try {
            Files.createDirectories(outputDir);
            Files.write(target, content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ChartingException(ChartingException.Kind.IO_ERROR, "Could not write " + target + ": " + e.getMessage(), e);
        }
        if (logger.isLoggable(Level.INFO)) {
            logger.info(String.format("Saved %s chart to: %s", chart.getDifficulty().getDisplayName(), target));
        }
        return target;
    }

    // ---- JSON ----

    public String toJson(Chart chart) throws ChartingException {
        try {
            return objectMapper.writeValueAsString(ChartDocument.from(chart));
        } catch (JsonProcessingException e) {
            throw new ChartingException(ChartingException.Kind.SERIALIZATION_ERROR, "Could not serialize " + chart, e);
        }
    }

    public Chart readJson(String json) throws ChartingException {
        try {
            return objectMapper.readValue(json, ChartDocument.class).toChart();
        } catch (JsonProcessingException | IllegalArgumentException | IllegalStateException e) {
            throw new ChartingException(ChartingException.Kind.SERIALIZATION_ERROR, "Invalid chart JSON: " + e.getMessage(), e);
        }
    }

    @JsonPropertyOrder({"songId", "instrument", "difficulty", "columnCount", "bpm", "generatedAt", "notes"})
    static class ChartDocument {
        public String songId;
        public String instrument;
        public String difficulty;
        public int columnCount;
        public float bpm;
        public long generatedAt;
        public List<NoteEntry> notes = new ArrayList<>();

        static ChartDocument from(Chart chart) {
            ChartDocument doc = new ChartDocument();
            doc.songId = chart.getSongId();
            doc.instrument = chart.getInstrument();
            doc.difficulty = chart.getDifficulty().getDisplayName();
            doc.columnCount = chart.getColumnCount();
            doc.bpm = chart.getBpm();
            doc.generatedAt = chart.getGeneratedAt();
            for (Note note : chart.getNotes()) {
                doc.notes.add(NoteEntry.from(note));
            }
            return doc;
        }

        Chart toChart() {
            if (difficulty == null) throw new IllegalStateException("Missing field: difficulty");
            if (instrument == null) throw new IllegalStateException("Missing field: instrument");
            if (notes == null) throw new IllegalStateException("Missing field: notes");
            List<Note> parsed = new ArrayList<>(notes.size());
            for (NoteEntry entry : notes) {
                if (entry == null) throw new IllegalStateException("Null entry in notes");
                parsed.add(new Note(entry.time, entry.col, entry.duration == null ? 0f : entry.duration));
            }
            return new ChartBuilder()
                    .songId(songId)
                    .instrument(instrument)
                    .difficulty(Difficulty.fromDisplayName(difficulty))
                    .columnCount(columnCount)
                    .bpm(bpm)
                    .notes(parsed)
                    .clock(Clock.fixed(Instant.ofEpochSecond(generatedAt), ZoneOffset.UTC))
                    .build();
        }
    }

    @JsonPropertyOrder({"time", "col", "duration"})
    static class NoteEntry {
        public float time;
        public int col;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public Float duration;

        static NoteEntry from(Note note) {
            NoteEntry entry = new NoteEntry();
            entry.time = note.getTime();
            entry.col = note.getLane();
            entry.duration = note.isHold() ? note.getDuration() : null;
            return entry;
        }
    }

    // ---- chart-text ----

    /**
     * One [SONG] block followed by one [NOTES] block per chart. Each note is a single line,
     * {@code 1|col|time} for taps and {@code 2|col|time|duration} for holds, so the
     * {@code Notes} header always equals the number of note lines.
     */
    public String toChartText(SongMetadata metadata, List<Chart> charts) {
        if (charts.isEmpty()) throw new IllegalArgumentException("At least one chart is required");
        Chart first = charts.get(0);
        StringBuilder out = new StringBuilder();
        out.append(SONG_SECTION).append('\n');
        out.append("  Title = \"").append(metadata.titleOr(first.getSongId())).append("\"\n");
        out.append("  Artist = \"").append(metadata.getArtist()).append("\"\n");
        out.append("  BPM = ").append(first.getBpm()).append('\n');
        out.append("  Gap = 0\n\n");

        for (Chart chart : charts) {
            out.append(NOTES_SECTION).append('\n');
            out.append("  Instrument = ").append(chart.getInstrument()).append('\n');
            out.append("  Difficulty = ").append(chart.getDifficulty().getDisplayName()).append('\n');
            out.append("  Columns = ").append(chart.getColumnCount()).append('\n');
            out.append("  BPM = ").append(chart.getBpm()).append('\n');
            out.append("  Notes = ").append(chart.getNotes().size()).append('\n');
            out.append(":\n");
            for (Note note : chart.getNotes()) {
                if (note.isHold()) {
                    out.append(String.format(Locale.ROOT, "  %s|%d|%.3f|%.3f\n", HOLD, note.getLane(), note.getTime(), note.getDuration()));
                } else {
                    out.append(String.format(Locale.ROOT, "  %s|%d|%.3f\n", TAP, note.getLane(), note.getTime()));
                }
            }
            out.append(";\n\n");
        }
        return out.toString();
    }

    /**
     * Parse chart-text back into charts. Note times carry the millisecond precision of the format.
     * @throws ChartingException SERIALIZATION_ERROR on malformed input or a wrong Notes count
     */
    public List<Chart> readChartText(String songId, String text) throws ChartingException {
        List<Chart> charts = new ArrayList<>();
        float songBpm = 0f;
        ChartBuilder current = null;
        List<Note> notes = null;
        int declaredNotes = -1;
        float blockBpm = 0f;
        boolean inNotes = false;
        String[] lines = text.split("\\r?\\n");
        try {
            for (String raw : lines) {
                String line = raw.trim();
                if (line.isEmpty()) continue;
                if (line.equals(SONG_SECTION)) {
                    continue;
                }
                if (line.equals(NOTES_SECTION)) {
                    current = new ChartBuilder().songId(songId);
                    notes = new ArrayList<>();
                    declaredNotes = -1;
                    blockBpm = songBpm;
                    continue;
                }
                if (line.equals(":")) {
                    if (current == null) throw new IllegalStateException("Note list outside a [NOTES] block");
                    inNotes = true;
                    continue;
                }
                if (line.equals(";")) {
                    if (current == null) throw new IllegalStateException("Note list end outside a [NOTES] block");
                    if (declaredNotes != notes.size()) {
                        throw new IllegalStateException(String.format("Notes header says %d but %d were listed", declaredNotes, notes.size()));
                    }
                    charts.add(current.bpm(blockBpm).notes(notes).build());
                    current = null;
                    inNotes = false;
                    continue;
                }
                if (inNotes) {
                    notes.add(parseNoteLine(line));
                    continue;
                }
                int eq = line.indexOf('=');
                if (eq < 0) throw new IllegalStateException("Unexpected line: " + line);
                String key = line.substring(0, eq).trim();
                String value = line.substring(eq + 1).trim();
                if (current == null) {
                    if (key.equals("BPM")) songBpm = Float.parseFloat(value);
                    continue;
                }
                switch (key) {
                    case "Instrument":
                        current.instrument(value);
                        break;
                    case "Difficulty":
                        current.difficulty(Difficulty.fromDisplayName(value));
                        break;
                    case "Columns":
                        current.columnCount(Integer.parseInt(value));
                        break;
                    case "BPM":
                        blockBpm = Float.parseFloat(value);
                        break;
                    case "Notes":
                        declaredNotes = Integer.parseInt(value);
                        break;
                    default:
                        break;
                }
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ChartingException(ChartingException.Kind.SERIALIZATION_ERROR, "Invalid chart text: " + e.getMessage(), e);
        }
        if (current != null) {
            throw new ChartingException(ChartingException.Kind.SERIALIZATION_ERROR, "Unterminated [NOTES] block");
        }
        return charts;
    }

    private static Note parseNoteLine(String line) {
        String[] parts = line.split("\\|");
        if (parts.length < 3) throw new IllegalArgumentException("Malformed note line: " + line);
        int lane = Integer.parseInt(parts[1].trim());
        float time = Float.parseFloat(parts[2].trim());
        if (HOLD.equals(parts[0].trim())) {
            if (parts.length < 4) throw new IllegalArgumentException("Hold without duration: " + line);
            return new Note(time, lane, Float.parseFloat(parts[3].trim()));
        }
        return new Note(time, lane);
    }
}
