package solcore.engine.solar;

/**
 * Per-timestep sun geometry.
 *
 * @param extraterrestrialW_m2 Isc * dr * cos(z), W/m² (negative at night)
 * @param zenithRad            solar zenith angle, radians, not clamped
 */
public record SolarPosition(double[] extraterrestrialW_m2, double[] zenithRad) {

    public int size() {
        return zenithRad.length;
    }
}
