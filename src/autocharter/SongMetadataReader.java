package autocharter;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagException;

/**
 * Reads song tags (ID3 and friends) for the chart header.
 */
public final class SongMetadataReader {

    private static final Logger logger = Logger.getLogger(SongMetadataReader.class.getName());

    // held here so the level survives; jaudiotagger is chatty at INFO
    private static final Logger TAGGER_LOGGER = Logger.getLogger("org.jaudiotagger");

    static {
        TAGGER_LOGGER.setLevel(Level.WARNING);
    }

    private SongMetadataReader() {}

    /**
     * Tags of {@code audioFile}, or {@link SongMetadata#EMPTY} when the file has none or they cannot be read.
     */
    public static SongMetadata read(File audioFile) {
        try {
            AudioFile f = AudioFileIO.read(audioFile);
            return fromTag(f.getTag());
        } catch (CannotReadException | IOException | TagException | ReadOnlyFileException | InvalidAudioFrameException e) {
            if (logger.isLoggable(Level.FINE)) logger.fine("No readable tags in " + audioFile + ": " + e.getMessage());
            return SongMetadata.EMPTY;
        } catch (Exception e) {
            // tags only decorate the chart header; never let a tagger bug stop charting
            logger.log(Level.WARNING, "Tag reading failed for " + audioFile, e);
            return SongMetadata.EMPTY;
        }
    }

    static SongMetadata fromTag(Tag tag) {
        if (tag == null) {
            logger.fine("No tags found in file");
            return SongMetadata.EMPTY;
        }
        SongMetadata metadata = new SongMetadata(tag.getFirst(FieldKey.TITLE), tag.getFirst(FieldKey.ARTIST), tag.getFirst(FieldKey.GENRE));
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Read tags - Title: '%s', Artist: '%s', Genre: '%s'", metadata.getTitle(), metadata.getArtist(), metadata.getGenre()));
        }
        return metadata;
    }
}
