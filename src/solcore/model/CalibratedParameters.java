package solcore.model;

import solcore.config.RadiationConstants;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free cloud parameters of the model.
 *
 * @param mu0 shifts the effective cosine in the cloud direct transmittance exp(-COD / (0.5 + mu0))
 * @param g   asymmetry-type factor in the cloud diffuse transmittance 1 / (1 + (1 - g) COD)
 */
public record CalibratedParameters(double mu0, double g) {

    public static final CalibratedParameters DEFAULT =
            new CalibratedParameters(RadiationConstants.DEFAULT_MU0, RadiationConstants.DEFAULT_G);

    public static CalibratedParameters fromVector(double[] x) {
        if (x.length != 2) throw new IllegalArgumentException("expected [mu0, g], got length " + x.length);
        return new CalibratedParameters(x[0], x[1]);
    }

    public double[] toVector() {
        return new double[]{mu0, g};
    }

    public Map<String, Double> asMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("mu0", mu0);
        m.put("g", g);
        return m;
    }

    public static CalibratedParameters fromMap(Map<String, Double> map) {
        Double mu0 = map.get("mu0");
        Double g = map.get("g");
        if (mu0 == null || g == null) {
            throw new IllegalArgumentException("parameters must contain mu0 and g: " + map);
        }
        return new CalibratedParameters(mu0, g);
    }
}
