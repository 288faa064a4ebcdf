package solcore.model;

import java.util.Objects;

/**
 * PV plant with a pyranometer; the unit of calibration.
 */
public record Plant(String id, double latitude, double longitude) {

    public Plant {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("plant id must not be blank");
    }
}
