package solcore.engine.solar;

import org.junit.jupiter.api.Test;
import solcore.config.RadiationConstants;
import solcore.model.AtmosphereFixtures;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SolarGeometryTest {

    private final SolarGeometry geometry = new SolarGeometry();

    @Test
    void seriesTermsOnFirstOfJanuary() {
        assertEquals(-2.90416896, SolarGeometry.equationOfTimeMinutes(0.0), 1e-8);
        assertEquals(1.03505, SolarGeometry.earthSunDistanceFactor(0.0), 1e-12);
        assertEquals(-0.402449, SolarGeometry.declination(0.0), 1e-12);
    }

    @Test
    void zenithNearOverheadAtLocalNoonInJanuary() {
        // 15:00Z is 12:00 in Sao Paulo
        SolarPosition p = geometry.compute(
                new Instant[]{Instant.parse("2024-01-15T15:00:00Z")},
                AtmosphereFixtures.LATITUDE, AtmosphereFixtures.LONGITUDE);

        assertEquals(2.755130672, Math.toDegrees(p.zenithRad()[0]), 1e-6);
        assertEquals(1411.351665, p.extraterrestrialW_m2()[0], 1e-4);
    }

    @Test
    void sunIsBelowHorizonAtLocalMidnight() {
        SolarPosition p = geometry.compute(
                new Instant[]{Instant.parse("2024-01-15T03:00:00Z")},
                AtmosphereFixtures.LATITUDE, AtmosphereFixtures.LONGITUDE);

        assertEquals(136.150609, Math.toDegrees(p.zenithRad()[0]), 1e-5);
        assertTrue(p.extraterrestrialW_m2()[0] < 0);
    }

    @Test
    void extraterrestrialFollowsCosineOfZenith() {
        Instant[] times = AtmosphereFixtures.referenceDay();
        SolarPosition p = geometry.compute(times, AtmosphereFixtures.LATITUDE, AtmosphereFixtures.LONGITUDE);

        double b = 2.0 * Math.PI * (15 - 1) / 365.0;
        double dr = SolarGeometry.earthSunDistanceFactor(b);
        for (int i = 3; i < times.length; i++) {
            double expected = RadiationConstants.SOLAR_CONSTANT_W_M2 * dr * Math.cos(p.zenithRad()[i]);
            assertEquals(expected, p.extraterrestrialW_m2()[i], 1e-9);
        }
    }

    @Test
    void secondsAreTruncated() {
        SolarPosition a = geometry.compute(
                new Instant[]{Instant.parse("2024-01-15T15:00:00Z")}, -22.5, -45.5);
        SolarPosition b = geometry.compute(
                new Instant[]{Instant.parse("2024-01-15T15:00:59.900Z")}, -22.5, -45.5);
        assertEquals(a.zenithRad()[0], b.zenithRad()[0], 0.0);
    }
}
