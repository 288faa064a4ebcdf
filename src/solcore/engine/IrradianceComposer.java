package solcore.engine;

import solcore.config.RadiationConstants;
import solcore.engine.band.BandTransmittance;
import solcore.engine.cloud.CloudTransmittance;
import solcore.engine.solar.SolarPosition;
import solcore.model.IrradianceResult;
import solcore.model.TimeSeries;

import java.time.Instant;

/**
 * Combines band transmittances, cloud transmittance and surface albedo into
 * clear-sky and cloud-sky GHI / DNI / DHI / tracker irradiance.
 * <p>
 * Night rule (zenith above 90°): DNI, horizontal beam and DHI are forced to 0.
 * Quality control afterwards: any negative value becomes NaN.
 */
public final class IrradianceComposer {

    /**
     * Direct beam (Ebn), diffuse on a perfectly absorbing ground (Edp)
     * and ground/atmosphere multiple reflections (Edd) of one band.
     */
    static final class BandIrradiance {
        final double[] directBeam;
        final double[] diffuseOnAbsorbingGround;
        final double[] multipleReflections;

        BandIrradiance(double[] directBeam, double[] diffuseOnAbsorbingGround, double[] multipleReflections) {
            this.directBeam = directBeam;
            this.diffuseOnAbsorbingGround = diffuseOnAbsorbingGround;
            this.multipleReflections = multipleReflections;
        }
    }

    private final double band1Fraction;
    private final double band2Fraction;

    public IrradianceComposer() {
        this(RadiationConstants.BAND1_ENERGY_FRACTION, RadiationConstants.BAND2_ENERGY_FRACTION);
    }

    public IrradianceComposer(double band1Fraction, double band2Fraction) {
        this.band1Fraction = band1Fraction;
        this.band2Fraction = band2Fraction;
    }

    public IrradianceResult compose(Instant[] times,
                                    SolarPosition sun,
                                    double[] surfaceAlbedo,
                                    BandTransmittance band1,
                                    BandTransmittance band2,
                                    CloudTransmittance cloud) {
        final int n = times.length;
        if (sun.size() != n || surfaceAlbedo.length != n || band1.size() != n
                || band2.size() != n || cloud.size() != n) {
            throw new IllegalArgumentException("Shape mismatch: all inputs must have " + n + " timesteps");
        }

        double[] zenith = sun.zenithRad();
        double[] e0 = sun.extraterrestrialW_m2();

        BandIrradiance[] b1 = bandIrradiance(e0, band1Fraction, zenith, surfaceAlbedo, band1, cloud);
        BandIrradiance[] b2 = bandIrradiance(e0, band2Fraction, zenith, surfaceAlbedo, band2, cloud);

        double[][] clear = aggregate(zenith, b1[0], b2[0]);
        double[][] cloudy = aggregate(zenith, b1[1], b2[1]);

        return new IrradianceResult(
                new TimeSeries(times, cloudy[0]),
                new TimeSeries(times, cloudy[1]),
                new TimeSeries(times, cloudy[2]),
                new TimeSeries(times, cloudy[3]),
                new TimeSeries(times, clear[0]),
                new TimeSeries(times, clear[1]),
                new TimeSeries(times, clear[2]),
                new TimeSeries(times, clear[3])
        );
    }

    /**
     * @return {clear-sky, cloud-sky}
     */
    static BandIrradiance[] bandIrradiance(double[] extraterrestrial,
                                           double fraction,
                                           double[] zenith,
                                           double[] rg,
                                           BandTransmittance t,
                                           CloudTransmittance cloud) {
        final int n = zenith.length;
        double[] ebn = new double[n];
        double[] edp = new double[n];
        double[] edd = new double[n];
        double[] ebnC = new double[n];
        double[] edpC = new double[n];
        double[] eddC = new double[n];

        for (int i = 0; i < n; i++) {
            double e0n = extraterrestrial[i] * fraction;
            double cosZ = Math.cos(zenith[i]);

            ebn[i] = e0n * t.rayleigh[i] * t.mixedGases[i] * t.ozone[i]
                    * t.nitrogenDioxide[i] * t.waterVapour[i] * t.aerosol[i];

            edp[i] = e0n * cosZ * t.ozone[i] * t.mixedGases[i]
                    * t.nitrogenDioxideRef[i] * t.waterVapourRef[i]
                    * (t.rayleighForwardFraction[i] * (1 - t.rayleigh[i]) * Math.pow(t.aerosol[i], 0.25)
                    + t.aerosolForwardFactor[i] * t.aerosolScatteringCorrection[i] * t.rayleigh[i]
                    * (1 - Math.pow(t.aerosolScattering[i], 0.25)));

            double rgRs = rg[i] * t.skyAlbedo[i];
            edd[i] = rgRs * (ebn[i] * cosZ + edp[i]) / (1 - rgRs);

            ebnC[i] = ebn[i] * cloud.direct[i];
            edpC[i] = edp[i] * cloud.diffuse[i];
            eddC[i] = rgRs * (ebnC[i] * cosZ + edpC[i]) / (1 - rgRs);
        }

        return new BandIrradiance[]{
                new BandIrradiance(ebn, edp, edd),
                new BandIrradiance(ebnC, edpC, eddC)
        };
    }

    /**
     * @return {ghi, ghiTracker, dni, dhi}
     */
    static double[][] aggregate(double[] zenith, BandIrradiance b1, BandIrradiance b2) {
        final int n = zenith.length;
        double[] ghi = new double[n];
        double[] tracker = new double[n];
        double[] dni = new double[n];
        double[] dhi = new double[n];

        for (int i = 0; i < n; i++) {
            double beamNormal = b1.directBeam[i] + b2.directBeam[i];
            double beamHorizontal = beamNormal * Math.cos(zenith[i]);
            double diffuse = b1.diffuseOnAbsorbingGround[i] + b1.multipleReflections[i]
                    + b2.diffuseOnAbsorbingGround[i] + b2.multipleReflections[i];

            if (Math.toDegrees(zenith[i]) > RadiationConstants.NIGHT_ZENITH_DEG) {
                beamNormal = 0.0;
                beamHorizontal = 0.0;
                diffuse = 0.0;
            }

            dni[i] = qualityControl(beamNormal);
            dhi[i] = qualityControl(diffuse);
            ghi[i] = qualityControl(beamHorizontal + diffuse);
            tracker[i] = qualityControl(beamNormal + diffuse);
        }
        return new double[][]{ghi, tracker, dni, dhi};
    }

    private static double qualityControl(double value) {
        return value < 0 ? Double.NaN : value;
    }
}
