package solcore.model;

import java.time.Instant;

/**
 * Aligned atmospheric inputs for one location.
 * Every series shares one time index; use {@link LocationAtmosphericStateBuilder} to create.
 *
 * Units: pressure hPa; water vapour, ozone, NO2 atm-cm; the rest dimensionless.
 */
public final class LocationAtmosphericState {

    private final double latitude;
    private final double longitude;

    private final TimeSeries cod;
    private final TimeSeries surfaceAlbedo;
    private final TimeSeries angstromExponent;
    private final TimeSeries pressure;
    private final TimeSeries waterVapour;
    private final TimeSeries ozone;
    private final TimeSeries nitrogenDioxide;
    private final TimeSeries opticalDepth550nm;

    LocationAtmosphericState(double latitude,
                             double longitude,
                             TimeSeries cod,
                             TimeSeries surfaceAlbedo,
                             TimeSeries angstromExponent,
                             TimeSeries pressure,
                             TimeSeries waterVapour,
                             TimeSeries ozone,
                             TimeSeries nitrogenDioxide,
                             TimeSeries opticalDepth550nm) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.cod = cod;
        this.surfaceAlbedo = surfaceAlbedo;
        this.angstromExponent = angstromExponent;
        this.pressure = pressure;
        this.waterVapour = waterVapour;
        this.ozone = ozone;
        this.nitrogenDioxide = nitrogenDioxide;
        this.opticalDepth550nm = opticalDepth550nm;
    }

    public double getLatitude()             { return latitude; }
    public double getLongitude()            { return longitude; }
    public TimeSeries getCod()              { return cod; }
    public TimeSeries getSurfaceAlbedo()    { return surfaceAlbedo; }
    public TimeSeries getAngstromExponent() { return angstromExponent; }
    public TimeSeries getPressure()         { return pressure; }
    public TimeSeries getWaterVapour()      { return waterVapour; }
    public TimeSeries getOzone()            { return ozone; }
    public TimeSeries getNitrogenDioxide()  { return nitrogenDioxide; }
    public TimeSeries getOpticalDepth550nm() { return opticalDepth550nm; }

    /** Shared time index (the COD timestamps). */
    public Instant[] getTimes() {
        return cod.getTimes();
    }

    public int size() {
        return cod.size();
    }

    /** Same location restricted to start <= t <= end. */
    public LocationAtmosphericState slice(Instant start, Instant end) {
        return new LocationAtmosphericState(
                latitude,
                longitude,
                cod.slice(start, end),
                surfaceAlbedo.slice(start, end),
                angstromExponent.slice(start, end),
                pressure.slice(start, end),
                waterVapour.slice(start, end),
                ozone.slice(start, end),
                nitrogenDioxide.slice(start, end),
                opticalDepth550nm.slice(start, end)
        );
    }
}
