package solcore.model;

/**
 * Irradiance streams produced by the model.
 * {@code *_CS} are the clear-sky counterparts (no cloud transmittance applied).
 */
public enum RadiationType {

    GHI("ghi"),
    DNI("dni"),
    DHI("dhi"),
    GHI_TRACKER("ghi_tracker"),
    GHI_CS("ghi_cs"),
    DNI_CS("dni_cs"),
    DHI_CS("dhi_cs"),
    GHI_TRACKER_CS("ghi_tracker_cs");

    private final String key;

    RadiationType(String key) {
        this.key = key;
    }

    /** Lower-case name used in config files and artifacts. */
    public String key() {
        return key;
    }

    public boolean isClearSky() {
        return switch (this) {
            case GHI, DNI, DHI, GHI_TRACKER -> false;
            case GHI_CS, DNI_CS, DHI_CS, GHI_TRACKER_CS -> true;
        };
    }

    public static RadiationType fromKey(String key) {
        if (key != null) {
            for (RadiationType t : values()) {
                if (t.key.equals(key.trim().toLowerCase())) return t;
            }
        }
        throw new IllegalArgumentException("Unknown radiation type: " + key);
    }
}
