package solcore.engine.solar;

import solcore.config.RadiationConstants;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Extraterrestrial irradiance and solar zenith angle per timestep.
 * Equation numbers refer to Duffie &amp; Beckman, Solar Engineering of Thermal Processes.
 */
public final class SolarGeometry {

    private final double solarConstant;
    private final ZoneId timezone;

    public SolarGeometry() {
        this(RadiationConstants.SOLAR_CONSTANT_W_M2, RadiationConstants.REFERENCE_TIMEZONE);
    }

    public SolarGeometry(double solarConstant, ZoneId timezone) {
        this.solarConstant = solarConstant;
        this.timezone = timezone;
    }

    public SolarPosition compute(Instant[] utcTimes, double latDeg, double lonDeg) {
        final int n = utcTimes.length;

        double[] dayOfYear = new double[n];
        double[] localHour = new double[n];
        double[] localMinute = new double[n];
        for (int i = 0; i < n; i++) {
            ZonedDateTime local = utcTimes[i].truncatedTo(ChronoUnit.MINUTES).atZone(timezone);
            dayOfYear[i] = local.getDayOfYear();
            localHour[i] = local.getHour();
            localMinute[i] = local.getMinute();
        }

        double phi = Math.toRadians(latDeg);

        // longitude in degrees west, 0..360
        double psi = -lonDeg;
        if (lonDeg > 0) {
            psi = 360.0 - lonDeg;
        }
        double psiStd = Math.abs(15.0 * Math.rint(psi / 15.0));

        double[] extraterrestrial = new double[n];
        double[] zenith = new double[n];

        for (int i = 0; i < n; i++) {
            double b = 2.0 * Math.PI * (dayOfYear[i] - 1.0) / 365.0;

            double et = equationOfTimeMinutes(b);
            double dr = earthSunDistanceFactor(b);
            double delta = declination(b);

            // Eq. 1.5.2, minutes
            double correction = 4.0 * (psiStd - psi) + et;
            double minuteAp = localMinute[i] + correction;
            double hourAp = localHour[i] + (localMinute[i] + correction) / 60.0;

            // two ordered passes: hour wrap first, minute borrow second
            if (hourAp < 0) {
                hourAp = 24.0 + (localMinute[i] + correction) / 60.0;
                minuteAp = 60.0 + minuteAp;
            }
            if (hourAp >= 0 && minuteAp < 0) {
                minuteAp = 60.0 + minuteAp;
                hourAp = localHour[i] + (localMinute[i] + correction) / 60.0;
            }

            // 12h == 0 rad
            double omega = Math.toRadians((hourAp - 12.0) * 15.0);

            // Eq. 1.6.5
            double cosZ = Math.cos(phi) * Math.cos(delta) * Math.cos(omega)
                    + Math.sin(phi) * Math.sin(delta);
            zenith[i] = Math.acos(cosZ);

            // Eq. 1.10.2
            extraterrestrial[i] = solarConstant * dr * Math.cos(zenith[i]);
        }

        return new SolarPosition(extraterrestrial, zenith);
    }

    /** Eq. 1.5.3, minutes. */
    static double equationOfTimeMinutes(double b) {
        return 229.18 * (0.000075
                + 0.001868 * Math.cos(b)
                - 0.032077 * Math.sin(b)
                - 0.014615 * Math.cos(2 * b)
                - 0.04089 * Math.sin(2 * b));
    }

    /** Eq. 1.4.1b, (r0/r)². */
    static double earthSunDistanceFactor(double b) {
        return 1.000110
                + 0.034221 * Math.cos(b)
                + 0.001280 * Math.sin(b)
                + 0.000719 * Math.cos(2 * b)
                + 0.000077 * Math.sin(2 * b);
    }

    /** Eq. 1.6.1b, radians. */
    static double declination(double b) {
        return 0.006918
                - 0.399912 * Math.cos(b)
                + 0.070257 * Math.sin(b)
                - 0.006758 * Math.cos(2 * b)
                + 0.000907 * Math.sin(2 * b)
                - 0.002697 * Math.cos(3 * b)
                + 0.00148 * Math.sin(3 * b);
    }
}
