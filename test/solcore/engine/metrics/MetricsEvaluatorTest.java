package solcore.engine.metrics;

import org.junit.jupiter.api.Test;
import solcore.engine.Rest2Model;
import solcore.model.AtmosphereFixtures;
import solcore.model.IrradianceResult;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsEvaluatorTest {

    private final MetricsEvaluator evaluator = new MetricsEvaluator();

    @Test
    void keysComeInFixedOrder() {
        Map<String, Double> m = evaluator.evaluate(new double[]{1.0}, new double[]{2.0});
        assertEquals(List.of("ME", "MAE", "RMSE"), List.copyOf(m.keySet()));
        assertEquals(-1.0, m.get(MetricsEvaluator.ME), 0.0);
        assertEquals(1.0, m.get(MetricsEvaluator.MAE), 0.0);
        assertEquals(1.0, m.get(MetricsEvaluator.RMSE), 0.0);
    }

    @Test
    void measuredSeriesIsJoinedOnTheModelTimeIndex() {
        IrradianceResult r = new Rest2Model(AtmosphereFixtures.clearReferenceDay()).convertRadiation();
        TimeSeries dni = r.getDni();

        // measurements every other hour, 20 W/m2 above the model
        Instant[] everyOther = new Instant[12];
        double[] values = new double[12];
        for (int i = 0; i < 12; i++) {
            everyOther[i] = dni.timeAt(2 * i);
            values[i] = dni.valueAt(2 * i) + 20.0;
        }

        Map<String, Double> m = evaluator.evaluate(r, new TimeSeries(everyOther, values), RadiationType.DNI);

        assertEquals(-20.0, m.get(MetricsEvaluator.ME), 1e-9);
        assertEquals(20.0, m.get(MetricsEvaluator.MAE), 1e-9);
        assertEquals(20.0, m.get(MetricsEvaluator.RMSE), 1e-9);
    }

    @Test
    void disjointTimestampsGiveNaN() {
        IrradianceResult r = new Rest2Model(AtmosphereFixtures.clearReferenceDay()).convertRadiation();
        Instant[] later = AtmosphereFixtures.hourly(Instant.parse("2025-01-01T00:00:00Z"), 3);
        double[] values = new double[3];
        Arrays.fill(values, 500.0);

        Map<String, Double> m = evaluator.evaluate(r, new TimeSeries(later, values), RadiationType.GHI);

        assertTrue(Double.isNaN(m.get(MetricsEvaluator.ME)));
        assertTrue(Double.isNaN(m.get(MetricsEvaluator.RMSE)));
    }
}
