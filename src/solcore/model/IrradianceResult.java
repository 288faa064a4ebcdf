package solcore.model;

import java.util.Objects;

/**
 * Output of one model run: eight series on the input time index.
 * Values that failed quality control (negative irradiance) are NaN.
 */
public final class IrradianceResult {

    private final TimeSeries ghi;
    private final TimeSeries ghiTracker;
    private final TimeSeries dni;
    private final TimeSeries dhi;
    private final TimeSeries ghiCs;
    private final TimeSeries ghiTrackerCs;
    private final TimeSeries dniCs;
    private final TimeSeries dhiCs;

    public IrradianceResult(TimeSeries ghi,
                            TimeSeries ghiTracker,
                            TimeSeries dni,
                            TimeSeries dhi,
                            TimeSeries ghiCs,
                            TimeSeries ghiTrackerCs,
                            TimeSeries dniCs,
                            TimeSeries dhiCs) {
        this.ghi = Objects.requireNonNull(ghi, "ghi");
        this.ghiTracker = Objects.requireNonNull(ghiTracker, "ghiTracker");
        this.dni = Objects.requireNonNull(dni, "dni");
        this.dhi = Objects.requireNonNull(dhi, "dhi");
        this.ghiCs = Objects.requireNonNull(ghiCs, "ghiCs");
        this.ghiTrackerCs = Objects.requireNonNull(ghiTrackerCs, "ghiTrackerCs");
        this.dniCs = Objects.requireNonNull(dniCs, "dniCs");
        this.dhiCs = Objects.requireNonNull(dhiCs, "dhiCs");
    }

    public TimeSeries get(RadiationType type) {
        return switch (type) {
            case GHI -> ghi;
            case DNI -> dni;
            case DHI -> dhi;
            case GHI_TRACKER -> ghiTracker;
            case GHI_CS -> ghiCs;
            case DNI_CS -> dniCs;
            case DHI_CS -> dhiCs;
            case GHI_TRACKER_CS -> ghiTrackerCs;
        };
    }

    public TimeSeries getGhi()          { return ghi; }
    public TimeSeries getGhiTracker()   { return ghiTracker; }
    public TimeSeries getDni()          { return dni; }
    public TimeSeries getDhi()          { return dhi; }
    public TimeSeries getGhiCs()        { return ghiCs; }
    public TimeSeries getGhiTrackerCs() { return ghiTrackerCs; }
    public TimeSeries getDniCs()        { return dniCs; }
    public TimeSeries getDhiCs()        { return dhiCs; }

    public int size() {
        return ghi.size();
    }
}
