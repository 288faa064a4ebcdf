package solcore.engine.band;

import solcore.engine.airmass.AirMassSet;

/**
 * One spectral band of the two-band model.
 * Implementations differ only in coefficient tables and active absorbers.
 */
public interface SpectralBand {

    /** Share of the extraterrestrial irradiance falling in this band. */
    double energyFraction();

    /**
     * @param ozone            total ozone, atm-cm
     * @param nitrogenDioxide  total NO2, atm-cm
     * @param waterVapour      precipitable water, cm
     * @param angstromExponent Angstrom alpha
     * @param zenithRad        solar zenith angle, radians
     * @param airMasses        air masses of the same timesteps
     */
    BandTransmittance transmittance(double[] ozone,
                                    double[] nitrogenDioxide,
                                    double[] waterVapour,
                                    double[] angstromExponent,
                                    double[] zenithRad,
                                    AirMassSet airMasses);

    /** Aerosol forward scatterance factor, same in both bands. */
    static double aerosolForwardFactor(double zenithRad) {
        return 1.0 - Math.exp(-0.6931 - 1.8326 * Math.cos(zenithRad));
    }
}
