// File: solcore/config/RadiationConstants.java
package solcore.config;

import java.time.ZoneId;

/**
 * Global model constants.
 * Physical coefficients shared by several engine components live here;
 * per-band empirical tables stay inside the band classes.
 */
public final class RadiationConstants {

    // =========================================================================
    // ===========================    SUN  =====================================
    // =========================================================================

    /** Solar constant, W/m² (Gueymard, 2018). */
    public static final double SOLAR_CONSTANT_W_M2 = 1366.1;

    /** Local standard time reference for apparent solar time. */
    public static final ZoneId REFERENCE_TIMEZONE = ZoneId.of("America/Sao_Paulo");

    /** Zenith angle above which the sun is below the horizon, degrees. */
    public static final double NIGHT_ZENITH_DEG = 90.0;

    // =========================================================================
    // ===========================    ATMOSPHERE  ==============================
    // =========================================================================

    /** Standard sea-level pressure, hPa. */
    public static final double STANDARD_PRESSURE_HPA = 1013.25;

    /** Upper limit of Angstrom turbidity. */
    public static final double MAX_ANGSTROM_TURBIDITY = 1.1;

    /** Reference air mass for diffuse-path gas transmittances. */
    public static final double REFERENCE_AIR_MASS = 1.66;

    // ===== physical bounds of model inputs =====
    public static final Bounds ANGSTROM_EXPONENT_BOUNDS = new Bounds(0.0, 2.5);
    public static final Bounds SURFACE_PRESSURE_BOUNDS = new Bounds(300.0, 1100.0);
    public static final Bounds WATER_VAPOUR_BOUNDS = new Bounds(0.0, 10.0);
    public static final Bounds OZONE_BOUNDS = new Bounds(0.0, 10.0);
    public static final Bounds NITROGEN_DIOXIDE_BOUNDS = new Bounds(0.0, 0.03);
    public static final Bounds SURFACE_ALBEDO_BOUNDS = new Bounds(0.0, 1.0);
    public static final Bounds COD_BOUNDS = new Bounds(0.0, 160.0);

    // =========================================================================
    // ===========================    BANDS  ===================================
    // =========================================================================

    /** Share of extraterrestrial irradiance in band 1 (0.29–0.70 µm). */
    public static final double BAND1_ENERGY_FRACTION = 0.46512;

    /** Share of extraterrestrial irradiance in band 2 (0.70–4.0 µm). */
    public static final double BAND2_ENERGY_FRACTION = 0.51951;

    // =========================================================================
    // ===========================    CALIBRATION  =============================
    // =========================================================================

    /** Initial cloud parameter mu0. */
    public static final double DEFAULT_MU0 = 0.0;

    /**
     * Initial cloud asymmetry parameter g.
     * Liquid water clouds scatter mostly forward with g ≈ 0.85, ice clouds ≈ 0.7.
     */
    public static final double DEFAULT_G = 0.85;

    private RadiationConstants() {}
}
