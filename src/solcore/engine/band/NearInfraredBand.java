package solcore.engine.band;

import java.util.Arrays;

import solcore.config.RadiationConstants;
import solcore.engine.ComplexPowers;
import solcore.engine.airmass.AirMassSet;

/**
 * Band 2 of REST2 (0.70–4.0 µm). Ozone and NO2 are transparent here.
 */
public final class NearInfraredBand implements SpectralBand {

    private static final double AEROSOL_SSA = 0.84;

    private static final double RAYLEIGH_FORWARD_FRACTION = 0.5;

    private static final double AM_REF = RadiationConstants.REFERENCE_AIR_MASS;

    @Override
    public double energyFraction() {
        return RadiationConstants.BAND2_ENERGY_FRACTION;
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
        double[] ones = new double[n];
        Arrays.fill(ones, 1.0);
        double[] tw = new double[n];
        double[] tw166 = new double[n];
        double[] ta = new double[n];
        double[] tas = new double[n];
        double[] br = new double[n];
        Arrays.fill(br, RAYLEIGH_FORWARD_FRACTION);
        double[] ba = new double[n];
        double[] f = new double[n];
        double[] rs = new double[n];

        for (int i = 0; i < n; i++) {
            double amRe = airMasses.rayleighPressureScaled[i];
            double amw = airMasses.waterVapour[i];
            double ama = airMasses.aerosol[i];
            double beta = airMasses.angstromTurbidity[i];
            double alpha = angstromExponent[i];

            tr[i] = (1 - 0.010394 * amRe) / (1 - 0.00011042 * amRe * amRe);
            tg[i] = (1 + 0.27284 * amRe - 0.00063699 * amRe * amRe) / (1 + 0.30306 * amRe);

            tw[i] = waterVapourTransmittance(waterVapour[i], amw);
            tw166[i] = waterVapourTransmittance(waterVapour[i], AM_REF);

            double tauA = aerosolOpticalDepth(alpha, beta, ama);
            ta[i] = Math.exp(-ama * tauA);
            tas[i] = Math.exp(-ama * AEROSOL_SSA * tauA);

            ba[i] = SpectralBand.aerosolForwardFactor(zenithRad[i]);
            f[i] = scatteringCorrection(ama, tauA);
            rs[i] = skyAlbedo(alpha, beta);
        }

        // ozone, NO2 and NO2 at 1.66 share the same all-ones array; nothing writes to it
        return new BandTransmittance(tr, tg, ones, ones, ones, tw, tw166, ta, tas, br, ba, f, rs);
    }

    static double waterVapourTransmittance(double w, double am) {
        double w2 = w * w;
        double c1 = w * (19.566 - 1.6506 * w + 1.0672 * w2) / (1 + 5.4248 * w + 1.6005 * w2);
        double c2 = w * (0.50158 - 0.14732 * w + 0.047584 * w2) / (1 + 1.1811 * w + 1.0699 * w2);
        double c3 = w * (21.286 - 0.39232 * w + 1.2692 * w2) / (1 + 4.8318 * w + 1.412 * w2);
        double c4 = w * (0.70992 - 0.23155 * w + 0.096514 * w2) / (1 + 0.44907 * w + 0.75425 * w2);
        return (1 + c1 * am + c2 * am * am) / (1 + c3 * am + c4 * am * am);
    }

    static double aerosolOpticalDepth(double alpha, double beta, double ama) {
        double a2 = alpha * alpha;
        double e0 = (1.183 - 0.022989 * alpha + 0.020829 * a2) / (1 + 0.11133 * alpha);
        double e1 = (-0.50003 - 0.18329 * alpha + 0.23835 * a2) / (1 + 1.6756 * alpha);
        double e2 = (-0.50001 + 1.1414 * alpha + 0.0083589 * a2) / (1 + 11.168 * alpha);
        double e3 = (-0.70003 - 0.73587 * alpha + 0.51509 * a2) / (1 + 4.7665 * alpha);

        double ua = Math.log(1 + ama * beta);
        double lambda = (e0 + e1 * ua + e2 * ua * ua) / (1 + e3 * ua);

        return Math.abs(beta * ComplexPowers.absPow(lambda, -alpha));
    }

    static double scatteringCorrection(double ama, double tauA) {
        double ama15 = Math.pow(ama, 1.5);
        double h0 = (3.4352 + 0.65267 * ama + 0.00034328 * ama * ama) / (1 + 0.034388 * ama15);
        double h1 = (1.231 - 1.63853 * ama + 0.20667 * ama * ama) / (1 + 0.1451 * ama15);
        double h2 = (0.8889 - 0.55063 * ama + 0.50152 * ama * ama) / (1 + 0.14865 * ama15);
        return (h0 + h1 * tauA) / (1 + h2 * tauA);
    }

    static double skyAlbedo(double alpha, double beta) {
        return (0.010191 + 0.00085547 * alpha + beta * (0.14618 + 0.062758 * alpha) / (1 - 0.19402 * alpha))
                / (1 + beta * (0.58101 + 0.17426 * alpha) / (1 - 0.17586 * alpha));
    }
}
