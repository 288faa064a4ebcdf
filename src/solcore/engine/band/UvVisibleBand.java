package solcore.engine.band;

import solcore.config.RadiationConstants;
import solcore.engine.ComplexPowers;
import solcore.engine.airmass.AirMassSet;

/**
 * Band 1 of REST2 (0.29–0.70 µm): ozone and NO2 absorb here.
 */
public final class UvVisibleBand implements SpectralBand {

    /** Recommended single-scattering albedo of aerosols. */
    private static final double AEROSOL_SSA = 0.92;

    private static final double AM_REF = RadiationConstants.REFERENCE_AIR_MASS;

    @Override
    public double energyFraction() {
        return RadiationConstants.BAND1_ENERGY_FRACTION;
    }

    @Override
    public BandTransmittance transmittance(double[] ozone,
                                           double[] nitrogenDioxide,
                                           double[] waterVapour,
                                           double[] angstromExponent,
                                           double[] zenithRad,
                                           AirMassSet airMasses) {
        if (angstromExponent == null) {
            throw new IllegalArgumentException("angstrom_exponent must not be null");
        }
        final int n = airMasses.size();

        double[] tr = new double[n];
        double[] tg = new double[n];
        double[] to = new double[n];
        double[] tn = new double[n];
        double[] tn166 = new double[n];
        double[] tw = new double[n];
        double[] tw166 = new double[n];
        double[] ta = new double[n];
        double[] tas = new double[n];
        double[] br = new double[n];
        double[] ba = new double[n];
        double[] f = new double[n];
        double[] rs = new double[n];

        for (int i = 0; i < n; i++) {
            double amR = airMasses.rayleigh[i];
            double amRe = airMasses.rayleighPressureScaled[i];
            double amo = airMasses.ozone[i];
            double amw = airMasses.waterVapour[i];
            double ama = airMasses.aerosol[i];
            double beta = airMasses.angstromTurbidity[i];
            double alpha = angstromExponent[i];

            // Rayleigh scattering
            tr[i] = (1 + 1.8169 * amRe - 0.033454 * amRe * amRe)
                    / (1 + 2.063 * amRe + 0.31978 * amRe * amRe);

            // uniformly mixed gases
            tg[i] = (1 + 0.95885 * amRe + 0.012871 * amRe * amRe)
                    / (1 + 0.96321 * amRe + 0.015455 * amRe * amRe);

            to[i] = ozoneTransmittance(ozone[i], amo);

            tn[i] = nitrogenDioxideTransmittance(nitrogenDioxide[i], amw);
            tn166[i] = nitrogenDioxideTransmittance(nitrogenDioxide[i], AM_REF);

            tw[i] = waterVapourTransmittance(waterVapour[i], amw);
            tw166[i] = waterVapourTransmittance(waterVapour[i], AM_REF);

            // aerosol
            double tauA = aerosolOpticalDepth(alpha, beta, ama);
            ta[i] = Math.exp(-ama * tauA);
            tas[i] = Math.exp(-ama * AEROSOL_SSA * tauA);

            br[i] = 0.5 * (0.89013 - 0.0049558 * amR + 0.000045721 * amR * amR);
            ba[i] = SpectralBand.aerosolForwardFactor(zenithRad[i]);
            f[i] = scatteringCorrection(ama, tauA);
            rs[i] = skyAlbedo(alpha, beta);
        }

        return new BandTransmittance(tr, tg, to, tn, tn166, tw, tw166, ta, tas, br, ba, f, rs);
    }

    static double ozoneTransmittance(double uo, double amo) {
        double f1 = uo * (10.979 - 8.5421 * uo) / (1 + 2.0115 * uo + 40.189 * uo * uo);
        double f2 = uo * (-0.027589 - 0.005138 * uo) / (1 - 2.4857 * uo + 13.942 * uo * uo);
        double f3 = uo * (10.995 - 5.5001 * uo) / (1 + 1.6784 * uo + 42.406 * uo * uo);
        return (1 + f1 * amo + f2 * amo * amo) / (1 + f3 * amo);
    }

    /** Capped at 1. */
    static double nitrogenDioxideTransmittance(double un, double am) {
        double g1 = (0.17499 + 41.654 * un - 2146.4 * un * un) / (1 + 22295.0 * un * un);
        double g2 = un * (-1.2134 + 59.324 * un) / (1 + 8847.8 * un * un);
        double g3 = (0.17499 + 61.658 * un + 9196.4 * un * un) / (1 + 74109.0 * un * un);
        double t = (1 + g1 * am + g2 * am * am) / (1 + g3 * am);
        return t > 1 ? 1.0 : t;
    }

    static double waterVapourTransmittance(double w, double am) {
        double h1 = w * (0.065445 + 0.00029901 * w) / (1 + 1.2728 * w);
        double h2 = w * (0.065687 + 0.0013218 * w) / (1 + 1.2008 * w);
        return (1 + h1 * am) / (1 + h2 * am);
    }

    /** tau_a = |beta * lambda^-alpha|, lambda the effective wavelength in µm. */
    static double aerosolOpticalDepth(double alpha, double beta, double ama) {
        double d0 = 0.57664 - 0.024743 * alpha;
        double d1 = (0.093942 - 0.2269 * alpha + 0.12848 * alpha * alpha) / (1 + 0.6418 * alpha);
        double d2 = (-0.093819 + 0.36668 * alpha - 0.12775 * alpha * alpha) / (1 - 0.11651 * alpha);
        double d3 = alpha * (0.15232 - 0.087214 * alpha + 0.012664 * alpha * alpha)
                / (1 - 0.90454 * alpha + 0.26167 * alpha * alpha);

        double ua = Math.log(1 + ama * beta);
        double lambda = (d0 + d1 * ua + d2 * ua * ua) / (1 + d3 * ua * ua);

        return Math.abs(beta * ComplexPowers.absPow(lambda, -alpha));
    }

    static double scatteringCorrection(double ama, double tauA) {
        double g0 = (3.715 + 0.368 * ama + 0.036294 * ama * ama) / (1 + 0.0009391 * ama * ama);
        double g1 = (-0.164 - 0.72567 * ama + 0.20701 * ama * ama) / (1 + 0.0019012 * ama * ama);
        double g2 = (-0.052288 + 0.31902 * ama + 0.17871 * ama * ama) / (1 + 0.0069592 * ama * ama);
        return (g0 + g1 * tauA) / (1 + g2 * tauA);
    }

    static double skyAlbedo(double alpha, double beta) {
        return (0.13363 + 0.00077358 * alpha + beta * (0.37567 + 0.22946 * alpha) / (1 - 0.10832 * alpha))
                / (1 + beta * (0.84057 + 0.68683 * alpha) / (1 - 0.08158 * alpha));
    }
}
