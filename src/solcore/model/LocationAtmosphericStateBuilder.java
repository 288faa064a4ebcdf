package solcore.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builder for {@link LocationAtmosphericState}.
 * {@link #build()} refuses misaligned or incomplete inputs instead of broadcasting them.
 */
public class LocationAtmosphericStateBuilder {

    private Double latitude;
    private Double longitude;

    private TimeSeries cod;
    private TimeSeries surfaceAlbedo;
    private TimeSeries angstromExponent;
    private TimeSeries pressure;
    private TimeSeries waterVapour;
    private TimeSeries ozone;
    private TimeSeries nitrogenDioxide;
    private TimeSeries opticalDepth550nm;

    public LocationAtmosphericStateBuilder() {
    }

    public static LocationAtmosphericStateBuilder from(LocationAtmosphericState base) {
        LocationAtmosphericStateBuilder b = new LocationAtmosphericStateBuilder();
        b.latitude = base.getLatitude();
        b.longitude = base.getLongitude();
        b.cod = base.getCod();
        b.surfaceAlbedo = base.getSurfaceAlbedo();
        b.angstromExponent = base.getAngstromExponent();
        b.pressure = base.getPressure();
        b.waterVapour = base.getWaterVapour();
        b.ozone = base.getOzone();
        b.nitrogenDioxide = base.getNitrogenDioxide();
        b.opticalDepth550nm = base.getOpticalDepth550nm();
        return b;
    }

    public LocationAtmosphericState build() {
        if (latitude == null || longitude == null) {
            throw new IllegalStateException("latitude/longitude not set");
        }
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalStateException("latitude out of range: " + latitude);
        }
        if (angstromExponent == null) {
            throw new IllegalStateException("angstrom_exponent must not be null");
        }

        Map<String, TimeSeries> all = new LinkedHashMap<>();
        all.put("cod", cod);
        all.put("albedo", surfaceAlbedo);
        all.put("angstrom_exponent", angstromExponent);
        all.put("pressure", pressure);
        all.put("water_vapour", waterVapour);
        all.put("ozone", ozone);
        all.put("nitrogen_dioxide", nitrogenDioxide);
        all.put("od550", opticalDepth550nm);

        for (Map.Entry<String, TimeSeries> e : all.entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalStateException(e.getKey() + " not set");
            }
        }
        if (cod.isEmpty()) {
            throw new IllegalStateException("cod series is empty");
        }
        for (Map.Entry<String, TimeSeries> e : all.entrySet()) {
            TimeSeries s = e.getValue();
            if (s.size() != cod.size()) {
                throw new IllegalStateException(
                        "Shape mismatch: " + e.getKey() + " has " + s.size() + " points, cod has " + cod.size());
            }
            if (!s.sameTimesAs(cod)) {
                throw new IllegalStateException("Time index of " + e.getKey() + " differs from cod");
            }
        }

        return new LocationAtmosphericState(
                latitude,
                longitude,
                cod,
                surfaceAlbedo,
                angstromExponent,
                pressure,
                waterVapour,
                ozone,
                nitrogenDioxide,
                opticalDepth550nm
        );
    }

    // ------------------------------------------------------------------
    // setters

    public LocationAtmosphericStateBuilder setLocation(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
        return this;
    }

    public LocationAtmosphericStateBuilder setCod(TimeSeries cod) {
        this.cod = cod;
        return this;
    }

    public LocationAtmosphericStateBuilder setSurfaceAlbedo(TimeSeries surfaceAlbedo) {
        this.surfaceAlbedo = surfaceAlbedo;
        return this;
    }

    public LocationAtmosphericStateBuilder setAngstromExponent(TimeSeries angstromExponent) {
        this.angstromExponent = angstromExponent;
        return this;
    }

    public LocationAtmosphericStateBuilder setPressure(TimeSeries pressure) {
        this.pressure = pressure;
        return this;
    }

    public LocationAtmosphericStateBuilder setWaterVapour(TimeSeries waterVapour) {
        this.waterVapour = waterVapour;
        return this;
    }

    public LocationAtmosphericStateBuilder setOzone(TimeSeries ozone) {
        this.ozone = ozone;
        return this;
    }

    public LocationAtmosphericStateBuilder setNitrogenDioxide(TimeSeries nitrogenDioxide) {
        this.nitrogenDioxide = nitrogenDioxide;
        return this;
    }

    public LocationAtmosphericStateBuilder setOpticalDepth550nm(TimeSeries opticalDepth550nm) {
        this.opticalDepth550nm = opticalDepth550nm;
        return this;
    }
}
