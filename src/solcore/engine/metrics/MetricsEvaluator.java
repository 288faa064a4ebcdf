package solcore.engine.metrics;

import solcore.model.IrradianceResult;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ME / MAE / RMSE of one irradiance stream against a measured series.
 * The measured series is joined onto the result's time index; unmatched timestamps are NaN.
 */
public final class MetricsEvaluator {

    public static final String ME = "ME";
    public static final String MAE = "MAE";
    public static final String RMSE = "RMSE";

    public Map<String, Double> evaluate(IrradianceResult result, TimeSeries measured, RadiationType radiationType) {
        TimeSeries predicted = result.get(radiationType);
        double[] observed = measured.alignTo(predicted.getTimes());
        return evaluate(predicted.getValues(), observed);
    }

    public Map<String, Double> evaluate(double[] predicted, double[] measured) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(ME, ErrorMetrics.me(predicted, measured));
        m.put(MAE, ErrorMetrics.mae(predicted, measured));
        m.put(RMSE, ErrorMetrics.rmse(predicted, measured));
        return m;
    }
}
