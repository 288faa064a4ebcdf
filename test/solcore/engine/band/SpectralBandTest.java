package solcore.engine.band;

import org.junit.jupiter.api.Test;
import solcore.config.RadiationConstants;
import solcore.engine.airmass.AirMassModel;
import solcore.engine.airmass.AirMassSet;

import static org.junit.jupiter.api.Assertions.*;

class SpectralBandTest {

    private static final double[] ZENITH = {Math.toRadians(10), Math.toRadians(45), Math.toRadians(80)};
    private static final double[] ALPHA = {1.3, 1.3, 1.3};
    private static final double[] OZONE = {0.3, 0.3, 0.3};
    private static final double[] NO2 = {0.001, 0.001, 0.001};
    private static final double[] WATER = {1.0, 1.0, 1.0};

    private static AirMassSet airMasses() {
        return new AirMassModel().evaluate(ZENITH, ALPHA,
                new double[]{1013.25, 1013.25, 1013.25}, new double[]{0.2, 0.2, 0.2});
    }

    @Test
    void nitrogenDioxideTransmittanceIsCappedAtOne() {
        assertEquals(0.7706049093, UvVisibleBand.nitrogenDioxideTransmittance(0.03, 1.66), 1e-9);
        // uncapped value would be about 2.29
        assertEquals(1.0, UvVisibleBand.nitrogenDioxideTransmittance(0.03, 200.0), 0.0);
        assertEquals(1.0, UvVisibleBand.nitrogenDioxideTransmittance(0.0, 3.0), 1e-15);
    }

    @Test
    void nitrogenDioxideCapKeepsNaN() {
        assertTrue(Double.isNaN(UvVisibleBand.nitrogenDioxideTransmittance(Double.NaN, 1.66)));
    }

    @Test
    void bandOneTransmittancesArePhysical() {
        BandTransmittance t = new UvVisibleBand().transmittance(OZONE, NO2, WATER, ALPHA, ZENITH, airMasses());

        assertEquals(3, t.size());
        for (int i = 0; i < t.size(); i++) {
            assertBetween(t.rayleigh[i], 0, 1);
            assertBetween(t.mixedGases[i], 0, 1);
            assertBetween(t.ozone[i], 0, 1);
            assertBetween(t.nitrogenDioxide[i], 0, 1);
            assertBetween(t.nitrogenDioxideRef[i], 0, 1);
            assertBetween(t.waterVapour[i], 0, 1);
            assertBetween(t.aerosol[i], 0, 1);
            assertBetween(t.aerosolScattering[i], t.aerosol[i], 1);
            assertBetween(t.skyAlbedo[i], 0, 1);
            assertBetween(t.aerosolForwardFactor[i], 0, 1);
        }
        // longer path, more extinction
        assertTrue(t.rayleigh[2] < t.rayleigh[0]);
        assertTrue(t.aerosol[2] < t.aerosol[0]);
        // Tn166 and Tw166 do not depend on the sun
        assertEquals(t.nitrogenDioxideRef[0], t.nitrogenDioxideRef[2], 0.0);
        assertEquals(t.waterVapourRef[0], t.waterVapourRef[2], 0.0);
    }

    @Test
    void bandTwoHasNoOzoneOrNitrogenDioxideAbsorption() {
        BandTransmittance t = new NearInfraredBand().transmittance(OZONE, NO2, WATER, ALPHA, ZENITH, airMasses());

        for (int i = 0; i < t.size(); i++) {
            assertEquals(1.0, t.ozone[i], 0.0);
            assertEquals(1.0, t.nitrogenDioxide[i], 0.0);
            assertEquals(1.0, t.nitrogenDioxideRef[i], 0.0);
            assertEquals(0.5, t.rayleighForwardFraction[i], 0.0);
            assertBetween(t.rayleigh[i], 0, 1);
            assertBetween(t.waterVapour[i], 0, 1);
            assertBetween(t.aerosol[i], 0, 1);
        }
    }

    @Test
    void nearInfraredScattersLessThanUvVisible() {
        AirMassSet am = airMasses();
        BandTransmittance b1 = new UvVisibleBand().transmittance(OZONE, NO2, WATER, ALPHA, ZENITH, am);
        BandTransmittance b2 = new NearInfraredBand().transmittance(OZONE, NO2, WATER, ALPHA, ZENITH, am);
        for (int i = 0; i < ZENITH.length; i++) {
            assertTrue(b2.rayleigh[i] > b1.rayleigh[i]);
            assertTrue(b2.aerosol[i] > b1.aerosol[i]);
        }
    }

    @Test
    void energyFractions() {
        assertEquals(RadiationConstants.BAND1_ENERGY_FRACTION, new UvVisibleBand().energyFraction());
        assertEquals(RadiationConstants.BAND2_ENERGY_FRACTION, new NearInfraredBand().energyFraction());
    }

    @Test
    void aerosolForwardFactorAtZenith() {
        assertEquals(1.0 - Math.exp(-0.6931 - 1.8326), SpectralBand.aerosolForwardFactor(0.0), 1e-15);
    }

    private static void assertBetween(double v, double lo, double hi) {
        assertTrue(v >= lo && v <= hi, v + " not in [" + lo + ", " + hi + "]");
    }
}
