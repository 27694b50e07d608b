package autocharter;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

/**
 * Loads an audio file through Java Sound and turns it into mono {@link Samples}.
 * Compressed input (mp3) is decoded by whichever SPI is on the classpath.
 */
public final class AudioSource {

    private static final Logger logger = Logger.getLogger(AudioSource.class.getName());

    private static final List<String> SUPPORTED_EXTENSIONS = Arrays.asList("wav", "wave", "aif", "aiff", "aifc", "au", "snd", "mp3");

    private AudioSource() {}

    public static boolean isSupportedAudioFile(File f) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(f));
    }

    public static Samples load(File file) throws ChartingException {
        if (!isSupportedAudioFile(file)) {
            throw new ChartingException(ChartingException.Kind.UNSUPPORTED_FORMAT, "Unsupported audio format: " + file.getName());
        }
        if (!Files.isReadable(file.toPath())) {
            throw new ChartingException(ChartingException.Kind.IO_ERROR, "Cannot read audio file: " + file.getAbsolutePath());
        }
        if (logger.isLoggable(Level.FINE)) logger.fine(String.format("Loading %s", file.getAbsolutePath()));

        try (InputStream in = new BufferedInputStream(Files.newInputStream(file.toPath()));
             AudioInputStream stream = AudioSystem.getAudioInputStream(in)) {
            Samples samples = load(stream);
            if (logger.isLoggable(Level.INFO)) {
                logger.info(String.format("Loaded %s: %.2f seconds at %.0f Hz", file.getName(), samples.getDurationSeconds(), samples.getSampleRate()));
            }
            return samples;
        } catch (UnsupportedAudioFileException e) {
            throw new ChartingException(ChartingException.Kind.DECODE_ERROR, "Could not decode " + file.getName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ChartingException(ChartingException.Kind.DECODE_ERROR, "Failed reading " + file.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Read a whole stream into mono samples. Non-PCM streams are converted to 16-bit signed PCM first.
     */
    public static Samples load(AudioInputStream stream) throws ChartingException, IOException {
        AudioInputStream pcm = toPcm(stream);
        AudioFormat format = pcm.getFormat();
        byte[] bytes = pcm.readAllBytes();

        long declaredFrames = pcm.getFrameLength();
        int frameSize = format.getFrameSize();
        if (declaredFrames != AudioSystem.NOT_SPECIFIED && frameSize > 0 && bytes.length < declaredFrames * frameSize) {
            throw new ChartingException(ChartingException.Kind.DECODE_ERROR,
                    String.format("Truncated audio data: expected %d frames, got %d", declaredFrames, bytes.length / frameSize));
        }
        if (bytes.length == 0) {
            throw new ChartingException(ChartingException.Kind.EMPTY_SIGNAL, "Audio stream contains no frames");
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Decoding %d bytes of %s", bytes.length, format));
        }
        return Samples.fromPcm(bytes, format);
    }

    private static AudioInputStream toPcm(AudioInputStream stream) throws ChartingException {
        AudioFormat source = stream.getFormat();
        AudioFormat.Encoding encoding = source.getEncoding();
        if (AudioFormat.Encoding.PCM_SIGNED.equals(encoding)
                || AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding)
                || AudioFormat.Encoding.PCM_FLOAT.equals(encoding)) {
            return stream;
        }
        int channels = source.getChannels() > 0 ? source.getChannels() : 2;
        AudioFormat target = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED,
                source.getSampleRate(), 16, channels, channels * 2, source.getSampleRate(), false);
        if (!AudioSystem.isConversionSupported(target, source)) {
            throw new ChartingException(ChartingException.Kind.UNSUPPORTED_FORMAT, "No decoder available for " + encoding);
        }
        if (logger.isLoggable(Level.FINE)) logger.fine(String.format("Converting %s to %s", source, target));
        return AudioSystem.getAudioInputStream(target, stream);
    }

    private static String extensionOf(File f) {
        String name = f.getName();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
