package solcore.engine.cloud;

/**
 * Direct and diffuse cloud transmittance per timestep, shared by both bands.
 */
public final class CloudTransmittance {

    public final double[] direct;
    public final double[] diffuse;

    public CloudTransmittance(double[] direct, double[] diffuse) {
        if (direct.length != diffuse.length) {
            throw new IllegalArgumentException(
                    "direct/diffuse length mismatch: " + direct.length + " != " + diffuse.length);
        }
        this.direct = direct;
        this.diffuse = diffuse;
    }

    public int size() {
        return direct.length;
    }
}
