package autocharter;

import java.io.File;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class AutoCharterTest {

    @TempDir
    Path tempDir;

    private File clickTrack() throws Exception {
        File wav = tempDir.resolve("beat.wav").toFile();
        SyntheticSignals.writeWav(wav, SyntheticSignals.RATE, SyntheticSignals.clickTrack(100f, 6f, 0.6f));
        return wav;
    }

    @Test
    @DisplayName("Should write four charts and exit with 0")
    void testRun() throws Exception {
        File wav = clickTrack();
        Path out = tempDir.resolve("out");

        int status = AutoCharter.run(new String[] {
                "input=" + wav.getAbsolutePath(), "songid=Beat Song", "instrument=drums", "output=" + out, "format=chart"});

        assertThat(status).isEqualTo(AutoCharter.EXIT_OK);
        assertThat(out.resolve("Beat_Song_drums_easy.chart")).exists();
        assertThat(out.resolve("Beat_Song_drums_normal.chart")).exists();
        assertThat(out.resolve("Beat_Song_drums_hard.chart")).exists();
        assertThat(out.resolve("Beat_Song_drums_expert.chart")).exists();
    }

    @Test
    @DisplayName("Should exit with 1 when the charts cannot be produced")
    void testFailure() {
        int status = AutoCharter.run(new String[] {
                "input=" + tempDir.resolve("missing.wav"), "songid=x", "instrument=drums", "output=" + tempDir});

        assertThat(status).isEqualTo(AutoCharter.EXIT_FAILURE);
    }

    @Test
    @DisplayName("Should exit with 2 on missing or malformed arguments")
    void testUsage() {
        assertThat(AutoCharter.run(new String[] {"songid=x"})).isEqualTo(AutoCharter.EXIT_USAGE);
        assertThat(AutoCharter.run(new String[] {"input=a.wav", "songid=x", "instrument=kazoo"})).isEqualTo(AutoCharter.EXIT_USAGE);
        assertThat(AutoCharter.run(new String[] {"input=a.wav", "songid=x", "instrument=bass", "grid=four"})).isEqualTo(AutoCharter.EXIT_USAGE);
        assertThat(AutoCharter.run(new String[] {"input=a.wav", "songid=x", "instrument=bass", "sustain=2"})).isEqualTo(AutoCharter.EXIT_USAGE);
    }

    @Test
    @DisplayName("Should print usage for help")
    void testHelp() {
        assertThat(AutoCharter.run(new String[] {"help"})).isEqualTo(AutoCharter.EXIT_OK);
    }

    @Test
    @DisplayName("Should map arguments onto the configuration")
    void testParseConfig() throws Exception {
        CharterConfig config = AutoCharter.parseConfig(new String[] {"bpm=140", "grid=8", "lanes=random", "seed=3", "minhold=0.4"});

        assertThat(config.getBpmOverride()).isEqualTo(140f);
        assertThat(config.getGridDivision()).isEqualTo(8);
        assertThat(config.getLaneStrategy()).isEqualTo(LaneStrategy.RANDOM);
        assertThat(config.getRandomSeed()).isEqualTo(3L);
        assertThat(config.getMinHoldDuration()).isEqualTo(0.4f);
        assertThat(AutoCharter.parseInstruments("all")).containsExactly(Instrument.values());
        assertThat(AutoCharter.parseInstruments("bass,lead")).containsExactly(Instrument.BASS, Instrument.LEAD);
    }
}
