package solcore.io;

import solcore.model.LocationAtmosphericState;
import solcore.model.Plant;
import solcore.model.TimeSeries;

/**
 * Inputs of one plant: location, atmospheric state and, when available, measured irradiance.
 */
public final class InputData {

    private final Plant plant;
    private final LocationAtmosphericState atmosphere;
    private final TimeSeries measured;

    public InputData(Plant plant, LocationAtmosphericState atmosphere, TimeSeries measured) {
        this.plant = plant;
        this.atmosphere = atmosphere;
        this.measured = measured;
    }

    public Plant getPlant() {
        return plant;
    }

    public LocationAtmosphericState getAtmosphere() {
        return atmosphere;
    }

    /** Null when the plant has no measured.csv. */
    public TimeSeries getMeasured() {
        return measured;
    }

    public boolean hasMeasured() {
        return measured != null;
    }
}
