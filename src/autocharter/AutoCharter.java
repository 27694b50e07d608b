package autocharter;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line front end. Arguments are {@code key=value} pairs, e.g.
 * {@code input=song.wav songid=song1 instrument=all format=json}.
 */
public class AutoCharter {

    private static final Logger logger = Logger.getLogger(AutoCharter.class.getName());

    // package logger, held so a debug level set on it is not collected
    private static final Logger PACKAGE_LOGGER = Logger.getLogger("autocharter");

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final String INPUT_ARG = "input";
    private static final String SONG_ID_ARG = "songid";
    private static final String INSTRUMENT_ARG = "instrument";
    private static final String OUTPUT_ARG = "output";
    private static final String BPM_ARG = "bpm";
    private static final String GRID_ARG = "grid";
    private static final String FORMAT_ARG = "format";
    private static final String SUSTAIN_ARG = "sustain";
    private static final String MIN_HOLD_ARG = "minhold";
    private static final String LANES_ARG = "lanes";
    private static final String SEED_ARG = "seed";
    private static final String DEBUG_ARG = "debug";
    private static final String ALL_INSTRUMENTS = "all";

    private static final String USAGE = "Argument usage:\n"
            + "input=<audio file> songid=<song id> instrument=<vocals|bass|drums|lead|all>\n"
            + "optional: output=<dir, default .> bpm=<override> grid=<subdivisions per beat, default 4>"
            + " format=<json|chart, default json> sustain=<0..1, default 0.5> minhold=<seconds, default 0.25>"
            + " lanes=<sequential|frequency|random, default sequential> seed=<random seed, default 1> debug=<true/false>";

    private AutoCharter() {}

    // argument parser
    public static String getArg(String[] args, String argname, String def) {
        String prefix = argname + "=";
        for (String s : args) {
            String arg = s.replace("\"", "").trim();
            if (arg.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                return arg.substring(prefix.length());
            }
        }
        return def;
    }

    // argument parser
    public static boolean hasArg(String[] args, String argname) {
        for (String s : args) {
            if (s.toLowerCase(Locale.ROOT).equals(argname)) return true;
        }
        return false;
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args));
    }

    /**
     * Parse the arguments, generate and write the charts.
     * @return {@link #EXIT_OK} when every requested file was written
     */
    public static int run(String[] args) {
        if (shouldShowHelp(args)) {
            logger.info(USAGE);
            return EXIT_OK;
        }
        if (Boolean.parseBoolean(getArg(args, DEBUG_ARG, "false"))) {
            PACKAGE_LOGGER.setLevel(Level.FINE);
        }

        String input = getArg(args, INPUT_ARG, null);
        String songId = getArg(args, SONG_ID_ARG, null);
        String instrumentArg = getArg(args, INSTRUMENT_ARG, null);
        if (input == null || songId == null || instrumentArg == null) {
            logger.severe("input, songid and instrument are required.\n" + USAGE);
            return EXIT_USAGE;
        }

        CharterConfig config;
        List<Instrument> instruments;
        ChartFormat format;
        try {
            config = parseConfig(args);
            config.validate();
            instruments = parseInstruments(instrumentArg);
            format = ChartFormat.fromLabel(getArg(args, FORMAT_ARG, ChartFormat.JSON.getExtension()));
        } catch (NumberFormatException e) {
            logger.severe("Invalid number: " + e.getMessage() + "\n" + USAGE);
            return EXIT_USAGE;
        } catch (ChartingException e) {
            logger.severe(e.getMessage() + "\n" + USAGE);
            return EXIT_USAGE;
        }

        Path outputDir = Paths.get(getArg(args, OUTPUT_ARG, "."));
        try {
            GenerationReport report = new ChartOrchestrator(config)
                    .generateAndExport(new File(input), songId, instruments, outputDir, format);
            for (GenerationReport.Outcome failure : report.failed()) {
                logger.severe(failure.toString());
            }
            for (GenerationReport.Outcome guessed : report.fallbackTempo()) {
                logger.warning("No tempo could be estimated, default BPM used: " + guessed);
            }
            if (logger.isLoggable(Level.INFO)) {
                logger.info(String.format("Wrote %d chart file(s) to %s", report.succeeded().size(), outputDir.toAbsolutePath()));
            }
            return report.isComplete() ? EXIT_OK : EXIT_FAILURE;
        } catch (ChartingException e) {
            logger.severe("Chart generation failed: " + e);
            return EXIT_FAILURE;
        }
    }

    static CharterConfig parseConfig(String[] args) throws ChartingException {
        CharterConfig.Builder builder = CharterConfig.builder()
                .gridDivision(Integer.parseInt(getArg(args, GRID_ARG, "4")))
                .sustainThreshold(Float.parseFloat(getArg(args, SUSTAIN_ARG, "0.5")))
                .minHoldDuration(Float.parseFloat(getArg(args, MIN_HOLD_ARG, "0.25")))
                .laneStrategy(LaneStrategy.fromLabel(getArg(args, LANES_ARG, LaneStrategy.SEQUENTIAL.label())))
                .randomSeed(Long.parseLong(getArg(args, SEED_ARG, "1")));
        String bpm = getArg(args, BPM_ARG, null);
        if (bpm != null) builder.bpmOverride(Float.parseFloat(bpm));
        return builder.build();
    }

    static List<Instrument> parseInstruments(String value) throws ChartingException {
        if (value.equalsIgnoreCase(ALL_INSTRUMENTS)) return Arrays.asList(Instrument.values());
        List<Instrument> instruments = new ArrayList<>();
        for (String part : value.split(",")) {
            instruments.add(Instrument.fromLabel(part));
        }
        return instruments;
    }

    private static boolean shouldShowHelp(String[] args) {
        return hasArg(args, "help") || hasArg(args, "h") || hasArg(args, "?") || hasArg(args, "-help") || hasArg(args, "-?") || hasArg(args, "-h");
    }

    // bundled logging.properties unless the JVM was pointed at another file
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = AutoCharter.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }
}
