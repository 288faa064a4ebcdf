package solcore.engine;

import solcore.config.RadiationConstants;
import solcore.engine.airmass.AirMassModel;
import solcore.engine.airmass.AirMassSet;
import solcore.engine.band.BandTransmittance;
import solcore.engine.band.NearInfraredBand;
import solcore.engine.band.SpectralBand;
import solcore.engine.band.UvVisibleBand;
import solcore.engine.calibration.CalibrationOutcome;
import solcore.engine.calibration.Calibrator;
import solcore.engine.cloud.CloudTransmittance;
import solcore.engine.cloud.CloudTransmittanceModel;
import solcore.engine.metrics.MetricsEvaluator;
import solcore.engine.solar.SolarGeometry;
import solcore.engine.solar.SolarPosition;
import solcore.model.CalibratedParameters;
import solcore.model.IrradianceResult;
import solcore.model.LocationAtmosphericState;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * REST2 two-band model with cloud transmittance for one location.
 * <p>
 * Inputs are clipped to their physical ranges on construction and NaN COD is
 * read as cloud free. Solar position, air masses and band transmittances do not
 * depend on (mu0, g) and are computed once here; each
 * {@link #convertRadiation(CalibratedParameters)} call only redoes the cloud
 * terms and the composition.
 */
public final class Rest2Model {

    private final Instant[] times;
    private final double[] cod;
    private final double[] surfaceAlbedo;

    private final SolarPosition sun;
    private final BandTransmittance band1;
    private final BandTransmittance band2;

    private final CloudTransmittanceModel cloudModel = new CloudTransmittanceModel();
    private final IrradianceComposer composer;
    private final MetricsEvaluator metricsEvaluator = new MetricsEvaluator();

    public Rest2Model(LocationAtmosphericState state) {
        this(state, new SolarGeometry(), new UvVisibleBand(), new NearInfraredBand());
    }

    public Rest2Model(LocationAtmosphericState state,
                      SolarGeometry geometry,
                      SpectralBand uvVisible,
                      SpectralBand nearInfrared) {
        Objects.requireNonNull(state, "state");
        if (state.size() == 0) {
            throw new IllegalArgumentException("atmospheric state is empty");
        }

        this.times = state.getTimes();
        this.cod = codOrClear(RadiationConstants.COD_BOUNDS.clipAll(state.getCod().getValues()));
        this.surfaceAlbedo = RadiationConstants.SURFACE_ALBEDO_BOUNDS.clipAll(state.getSurfaceAlbedo().getValues());

        double[] alpha = RadiationConstants.ANGSTROM_EXPONENT_BOUNDS.clipAll(state.getAngstromExponent().getValues());
        double[] pressure = RadiationConstants.SURFACE_PRESSURE_BOUNDS.clipAll(state.getPressure().getValues());
        double[] water = RadiationConstants.WATER_VAPOUR_BOUNDS.clipAll(state.getWaterVapour().getValues());
        double[] ozone = RadiationConstants.OZONE_BOUNDS.clipAll(state.getOzone().getValues());
        double[] no2 = RadiationConstants.NITROGEN_DIOXIDE_BOUNDS.clipAll(state.getNitrogenDioxide().getValues());
        double[] od550 = state.getOpticalDepth550nm().getValues();

        this.sun = geometry.compute(times, state.getLatitude(), state.getLongitude());
        AirMassSet airMasses = new AirMassModel().evaluate(sun.zenithRad(), alpha, pressure, od550);
        this.band1 = uvVisible.transmittance(ozone, no2, water, alpha, sun.zenithRad(), airMasses);
        this.band2 = nearInfrared.transmittance(ozone, no2, water, alpha, sun.zenithRad(), airMasses);
        this.composer = new IrradianceComposer(uvVisible.energyFraction(), nearInfrared.energyFraction());
    }

    public IrradianceResult convertRadiation() {
        return convertRadiation(CalibratedParameters.DEFAULT);
    }

    public IrradianceResult convertRadiation(CalibratedParameters parameters) {
        CloudTransmittance cloud = cloudModel.evaluate(cod, parameters);
        return composer.compose(times, sun, surfaceAlbedo, band1, band2, cloud);
    }

    /**
     * Fits (mu0, g) against the measured series of the given stream.
     */
    public CalibrationOutcome train(TimeSeries measured, RadiationType radiationType) {
        return new Calibrator(this::convertRadiation, times).train(measured, radiationType);
    }

    /**
     * ME, MAE and RMSE of {@code result} against {@code measured}, keys in that order.
     */
    public Map<String, Double> evaluate(IrradianceResult result, TimeSeries measured, RadiationType radiationType) {
        return metricsEvaluator.evaluate(result, measured, radiationType);
    }

    public Instant[] getTimes() {
        return times.clone();
    }

    public SolarPosition getSolarPosition() {
        return sun;
    }

    public int size() {
        return times.length;
    }

    private static double[] codOrClear(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) values[i] = 0.0;
        }
        return values;
    }
}
