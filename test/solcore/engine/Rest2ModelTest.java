package solcore.engine;

import org.junit.jupiter.api.Test;
import solcore.engine.metrics.MetricsEvaluator;
import solcore.model.AtmosphereFixtures;
import solcore.model.CalibratedParameters;
import solcore.model.IrradianceResult;
import solcore.model.LocationAtmosphericState;
import solcore.model.LocationAtmosphericStateBuilder;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class Rest2ModelTest {

    private static final int[] NIGHT_HOURS = {0, 1, 2, 3, 4, 5, 6, 7, 8, 22, 23};
    private static final int NOON = 15;

    @Test
    void clearReferenceDayProducesOneValuePerInputStep() {
        IrradianceResult r = new Rest2Model(AtmosphereFixtures.clearReferenceDay()).convertRadiation();

        assertEquals(24, r.size());
        for (RadiationType type : RadiationType.values()) {
            assertTrue(r.get(type).sameTimesAs(r.getGhi()), type.key());
        }
    }

    @Test
    void nightStepsAreExactlyZeroInEveryStream() {
        IrradianceResult r = new Rest2Model(AtmosphereFixtures.clearReferenceDay()).convertRadiation();

        for (int h : NIGHT_HOURS) {
            for (RadiationType type : RadiationType.values()) {
                assertEquals(0.0, r.get(type).valueAt(h), 0.0, type.key() + " at hour " + h);
            }
        }
        for (int h = 9; h <= 21; h++) {
            assertTrue(r.getGhiCs().valueAt(h) > 0, "daylight at hour " + h);
        }
    }

    @Test
    void noonValuesOfReferenceAtmosphere() {
        IrradianceResult r = new Rest2Model(AtmosphereFixtures.clearReferenceDay()).convertRadiation();

        assertEquals(1124.455, r.getGhiCs().valueAt(NOON), 0.01);
        assertEquals(941.908, r.getDniCs().valueAt(NOON), 0.01);
        assertEquals(183.637, r.getDhiCs().valueAt(NOON), 0.01);
        assertEquals(1125.544, r.getGhiTrackerCs().valueAt(NOON), 0.01);

        assertEquals(959.778, r.getGhi().valueAt(NOON), 0.01);
        assertEquals(18.959, r.getDhi().valueAt(NOON), 0.01);
    }

    @Test
    void cloudFreeStepKeepsDirectBeamButLosesDiffuse() {
        IrradianceResult r = new Rest2Model(AtmosphereFixtures.clearReferenceDay()).convertRadiation();

        for (int h = 9; h <= 21; h++) {
            assertEquals(r.getDniCs().valueAt(h), r.getDni().valueAt(h), 1e-9);
            assertTrue(r.getDhi().valueAt(h) < r.getDhiCs().valueAt(h));
        }
    }

    @Test
    void globalIsBeamOnHorizontalPlusDiffuse() {
        Rest2Model model = new Rest2Model(AtmosphereFixtures.reference(
                AtmosphereFixtures.referenceDay(), AtmosphereFixtures.cyclingCod(24)));
        IrradianceResult r = model.convertRadiation(new CalibratedParameters(0.2, 0.6));
        double[] zenith = model.getSolarPosition().zenithRad();

        for (int i = 0; i < r.size(); i++) {
            double cosZ = Math.cos(zenith[i]);
            if (zenith[i] > Math.PI / 2) continue;
            assertEquals(r.getDni().valueAt(i) * cosZ + r.getDhi().valueAt(i), r.getGhi().valueAt(i), 1e-6);
            assertEquals(r.getDni().valueAt(i) + r.getDhi().valueAt(i), r.getGhiTracker().valueAt(i), 1e-6);
            assertEquals(r.getDniCs().valueAt(i) * cosZ + r.getDhiCs().valueAt(i), r.getGhiCs().valueAt(i), 1e-6);
        }
    }

    @Test
    void thickerCloudsTransmitLessDirectLight() {
        Instant[] times = AtmosphereFixtures.referenceDay();
        IrradianceResult thin = new Rest2Model(AtmosphereFixtures.reference(times, AtmosphereFixtures.filled(24, 1.0)))
                .convertRadiation();
        IrradianceResult thick = new Rest2Model(AtmosphereFixtures.reference(times, AtmosphereFixtures.filled(24, 10.0)))
                .convertRadiation();

        assertTrue(thick.getDni().valueAt(NOON) < thin.getDni().valueAt(NOON));
        assertTrue(thick.getGhi().valueAt(NOON) < thin.getGhi().valueAt(NOON));
        assertEquals(thin.getGhiCs().valueAt(NOON), thick.getGhiCs().valueAt(NOON), 1e-9);
    }

    @Test
    void missingCloudOpticalDepthIsReadAsCloudFree() {
        Instant[] times = AtmosphereFixtures.referenceDay();
        IrradianceResult clear = new Rest2Model(AtmosphereFixtures.reference(times, new double[24])).convertRadiation();
        IrradianceResult missing = new Rest2Model(AtmosphereFixtures.reference(times, AtmosphereFixtures.filled(24, Double.NaN)))
                .convertRadiation();

        for (int i = 0; i < 24; i++) {
            assertEquals(clear.getGhi().valueAt(i), missing.getGhi().valueAt(i), 0.0);
            assertEquals(clear.getDhi().valueAt(i), missing.getDhi().valueAt(i), 0.0);
        }
    }

    @Test
    void inputsOutsidePhysicalRangeAreClipped() {
        Instant[] times = AtmosphereFixtures.referenceDay();
        IrradianceResult atLimit = new Rest2Model(withNitrogenDioxide(times, 0.03)).convertRadiation();
        IrradianceResult above = new Rest2Model(withNitrogenDioxide(times, 0.5)).convertRadiation();

        for (int i = 0; i < 24; i++) {
            assertEquals(atLimit.getGhiCs().valueAt(i), above.getGhiCs().valueAt(i), 0.0);
        }
    }

    @Test
    void evaluatingAgainstItselfGivesZeroErrors() {
        Rest2Model model = new Rest2Model(AtmosphereFixtures.clearReferenceDay());
        IrradianceResult r = model.convertRadiation();

        Map<String, Double> metrics = model.evaluate(r, r.getGhi(), RadiationType.GHI);

        assertEquals(List.of(MetricsEvaluator.ME, MetricsEvaluator.MAE, MetricsEvaluator.RMSE),
                List.copyOf(metrics.keySet()));
        assertEquals(0.0, metrics.get(MetricsEvaluator.ME), 0.0);
        assertEquals(0.0, metrics.get(MetricsEvaluator.MAE), 0.0);
        assertEquals(0.0, metrics.get(MetricsEvaluator.RMSE), 0.0);
    }

    @Test
    void evaluationOnlyUsesMatchingTimestamps() {
        Rest2Model model = new Rest2Model(AtmosphereFixtures.clearReferenceDay());
        IrradianceResult r = model.convertRadiation();
        TimeSeries noon = r.getGhi().slice(r.getGhi().timeAt(NOON), r.getGhi().timeAt(NOON));
        TimeSeries offset = noon.withValues(new double[]{noon.valueAt(0) - 50.0});

        Map<String, Double> metrics = model.evaluate(r, offset, RadiationType.GHI);

        assertEquals(50.0, metrics.get(MetricsEvaluator.ME), 1e-9);
        assertEquals(50.0, metrics.get(MetricsEvaluator.RMSE), 1e-9);
    }

    private static LocationAtmosphericState withNitrogenDioxide(Instant[] times, double no2) {
        return new LocationAtmosphericStateBuilder()
                .setLocation(AtmosphereFixtures.LATITUDE, AtmosphereFixtures.LONGITUDE)
                .setCod(TimeSeries.constant(times, 0.0))
                .setSurfaceAlbedo(TimeSeries.constant(times, 0.2))
                .setAngstromExponent(TimeSeries.constant(times, 1.3))
                .setPressure(TimeSeries.constant(times, 1013.25))
                .setWaterVapour(TimeSeries.constant(times, 1.0))
                .setOzone(TimeSeries.constant(times, 0.3))
                .setNitrogenDioxide(TimeSeries.constant(times, no2))
                .setOpticalDepth550nm(TimeSeries.constant(times, 0.2))
                .build();
    }
}
