package solcore.config;

import java.util.Locale;

/**
 * What a run does: fit parameters per plant, or predict with stored ones.
 */
public enum RunMode {
    TRAIN,
    INFERENCE;

    public static RunMode fromKey(String key) {
        if (key == null) throw new IllegalArgumentException("mode must not be null");
        switch (key.trim().toLowerCase(Locale.ROOT)) {
            case "train":
                return TRAIN;
            case "inference":
                return INFERENCE;
            default:
                throw new IllegalArgumentException("Unknown mode: " + key);
        }
    }
}
