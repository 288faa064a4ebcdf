package solcore.engine.airmass;

/**
 * Per-timestep optical air masses and Angstrom turbidity.
 */
public final class AirMassSet {

    /** Rayleigh scattering and uniformly mixed gases (amR). */
    public final double[] rayleigh;

    /** Rayleigh air mass scaled by surface pressure (amRe). */
    public final double[] rayleighPressureScaled;

    /** Ozone absorption (amo). */
    public final double[] ozone;

    /** Water vapour absorption (amw); NO2 uses it as well. */
    public final double[] waterVapour;

    /** Aerosol extinction (ama). */
    public final double[] aerosol;

    /** Angstrom turbidity beta, within [0, 1.1] or NaN. */
    public final double[] angstromTurbidity;

    public AirMassSet(double[] rayleigh,
                      double[] rayleighPressureScaled,
                      double[] ozone,
                      double[] waterVapour,
                      double[] aerosol,
                      double[] angstromTurbidity) {
        this.rayleigh = rayleigh;
        this.rayleighPressureScaled = rayleighPressureScaled;
        this.ozone = ozone;
        this.waterVapour = waterVapour;
        this.aerosol = aerosol;
        this.angstromTurbidity = angstromTurbidity;
    }

    public int size() {
        return rayleigh.length;
    }
}
