package solcore.engine.band;

/**
 * Transmittances and scattering terms of one spectral band, per timestep.
 * Band 2 fills ozone and NO2 arrays with 1.
 */
public final class BandTransmittance {

    /** Rayleigh scattering (TR). */
    public final double[] rayleigh;

    /** Uniformly mixed gases absorption (Tg). */
    public final double[] mixedGases;

    /** Ozone absorption (To). */
    public final double[] ozone;

    /** NO2 absorption at the water vapour air mass, capped at 1 (Tn). */
    public final double[] nitrogenDioxide;

    /** NO2 absorption at air mass 1.66, capped at 1 (Tn166). */
    public final double[] nitrogenDioxideRef;

    /** Water vapour absorption (Tw). */
    public final double[] waterVapour;

    /** Water vapour absorption at air mass 1.66 (Tw166). */
    public final double[] waterVapourRef;

    /** Aerosol extinction (TA). */
    public final double[] aerosol;

    /** Aerosol scattering (TAS). */
    public final double[] aerosolScattering;

    /** Forward scattering fraction of Rayleigh extinction (BR). */
    public final double[] rayleighForwardFraction;

    /** Aerosol forward scatterance factor (Ba). */
    public final double[] aerosolForwardFactor;

    /** Aerosol scattering correction factor (F). */
    public final double[] aerosolScatteringCorrection;

    /** Sky albedo (rs). */
    public final double[] skyAlbedo;

    public BandTransmittance(double[] rayleigh,
                             double[] mixedGases,
                             double[] ozone,
                             double[] nitrogenDioxide,
                             double[] nitrogenDioxideRef,
                             double[] waterVapour,
                             double[] waterVapourRef,
                             double[] aerosol,
                             double[] aerosolScattering,
                             double[] rayleighForwardFraction,
                             double[] aerosolForwardFactor,
                             double[] aerosolScatteringCorrection,
                             double[] skyAlbedo) {
        this.rayleigh = rayleigh;
        this.mixedGases = mixedGases;
        this.ozone = ozone;
        this.nitrogenDioxide = nitrogenDioxide;
        this.nitrogenDioxideRef = nitrogenDioxideRef;
        this.waterVapour = waterVapour;
        this.waterVapourRef = waterVapourRef;
        this.aerosol = aerosol;
        this.aerosolScattering = aerosolScattering;
        this.rayleighForwardFraction = rayleighForwardFraction;
        this.aerosolForwardFactor = aerosolForwardFactor;
        this.aerosolScatteringCorrection = aerosolScatteringCorrection;
        this.skyAlbedo = skyAlbedo;
    }

    public int size() {
        return rayleigh.length;
    }
}
