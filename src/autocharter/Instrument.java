package autocharter;

import java.util.Locale;

/**
 * The instrument parts a chart can be generated for, each with the frequency
 * range its notes are drawn from.
 */
public enum Instrument {
    VOCALS(200f, 4000f),
    BASS(40f, 250f),
    DRUMS(30f, 5000f),
    LEAD(400f, 8000f);

    private final FrequencyBand band;

    Instrument(float lowHz, float highHz) {
        this.band = new FrequencyBand(lowHz, highHz);
    }

    public FrequencyBand getBand() {
        return band;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Instrument fromLabel(String label) throws ChartingException {
        if (label != null) {
            for (Instrument instrument : values()) {
                if (instrument.label().equalsIgnoreCase(label.trim())) return instrument;
            }
        }
        throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "Unknown instrument: " + label);
    }
}
