package autocharter;

/**
 * Title, artist and genre read from an audio file's tags. Missing values are empty strings.
 */
public final class SongMetadata {

    public static final SongMetadata EMPTY = new SongMetadata("", "", "");

    private final String title;
    private final String artist;
    private final String genre;

    public SongMetadata(String title, String artist, String genre) {
        this.title = title == null ? "" : title.trim();
        this.artist = artist == null ? "" : artist.trim();
        this.genre = genre == null ? "" : genre.trim();
    }

    public boolean hasData() {
        return !title.isEmpty() || !artist.isEmpty() || !genre.isEmpty();
    }

    /** Tag title, or {@code fallback} when the file has none. */
    public String titleOr(String fallback) {
        return title.isEmpty() ? fallback : title;
    }

    public String getTitle() { return title; }
    public String getArtist() { return artist; }
    public String getGenre() { return genre; }
}
