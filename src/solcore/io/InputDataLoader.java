package solcore.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solcore.config.TimeWindow;
import solcore.engine.airmass.AngstromExponent;
import solcore.model.LocationAtmosphericState;
import solcore.model.LocationAtmosphericStateBuilder;
import solcore.model.Plant;
import solcore.model.TimeSeries;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads pre-aligned plant inputs from a directory:
 * <pre>
 * input/plants.csv               id,latitude,longitude
 * input/&lt;plant&gt;/atmosphere.csv   time,cod,albedo,angstrom_exponent,pressure,water_vapour,ozone,nitrogen_dioxide,od550[,od670]
 * input/&lt;plant&gt;/measured.csv     time,value
 * </pre>
 * Blank cells are NaN. Rows with a wrong number of cells are skipped with a warning.
 */
public class InputDataLoader {

    private static final Logger log = LoggerFactory.getLogger(InputDataLoader.class);

    public static final String PLANTS_FILE = "plants.csv";
    public static final String ATMOSPHERE_FILE = "atmosphere.csv";
    public static final String MEASURED_FILE = "measured.csv";

    private final Path inputDir;

    public InputDataLoader(Path inputDir) {
        this.inputDir = inputDir;
    }

    public InputData load(Plant plant) throws IOException {
        LocationAtmosphericState atmosphere = loadAtmosphere(plant);
        Path measuredFile = inputDir.resolve(plant.id()).resolve(MEASURED_FILE);
        TimeSeries measured = Files.exists(measuredFile) ? loadMeasured(plant.id()) : null;
        return new InputData(plant, atmosphere, measured);
    }

    public List<Plant> loadPlants() throws IOException {
        Path file = inputDir.resolve(PLANTS_FILE);
        CsvTable table = readCsv(file);
        int id = table.column("id");
        int lat = table.column("latitude");
        int lon = table.column("longitude");

        List<Plant> plants = new ArrayList<>();
        for (int r = 0; r < table.rows.size(); r++) {
            String[] row = table.rows.get(r);
            plants.add(new Plant(row[id].trim(),
                    parseNumber(row[lat], file, r),
                    parseNumber(row[lon], file, r)));
        }
        return plants;
    }

    public LocationAtmosphericState loadAtmosphere(Plant plant) throws IOException {
        Path file = inputDir.resolve(plant.id()).resolve(ATMOSPHERE_FILE);
        CsvTable table = readCsv(file);
        Instant[] times = parseTimes(table, file);

        double[] alpha;
        if (table.hasColumn("angstrom_exponent")) {
            alpha = numericColumn(table, "angstrom_exponent", file);
        } else if (table.hasColumn("od670")) {
            alpha = AngstromExponent.fromOpticalDepths(
                    numericColumn(table, "od550", file),
                    numericColumn(table, "od670", file));
        } else {
            throw new IOException("Neither angstrom_exponent nor od670 present in " + file);
        }

        try {
            return new LocationAtmosphericStateBuilder()
                    .setLocation(plant.latitude(), plant.longitude())
                    .setCod(new TimeSeries(times, numericColumn(table, "cod", file)))
                    .setSurfaceAlbedo(new TimeSeries(times, numericColumn(table, "albedo", file)))
                    .setAngstromExponent(new TimeSeries(times, alpha))
                    .setPressure(new TimeSeries(times, numericColumn(table, "pressure", file)))
                    .setWaterVapour(new TimeSeries(times, numericColumn(table, "water_vapour", file)))
                    .setOzone(new TimeSeries(times, numericColumn(table, "ozone", file)))
                    .setNitrogenDioxide(new TimeSeries(times, numericColumn(table, "nitrogen_dioxide", file)))
                    .setOpticalDepth550nm(new TimeSeries(times, numericColumn(table, "od550", file)))
                    .build();
        } catch (IllegalStateException e) {
            throw new IOException("Invalid atmosphere data in " + file + ": " + e.getMessage(), e);
        }
    }

    public TimeSeries loadMeasured(String plantId) throws IOException {
        Path file = inputDir.resolve(plantId).resolve(MEASURED_FILE);
        CsvTable table = readCsv(file);
        return new TimeSeries(parseTimes(table, file), numericColumn(table, "value", file));
    }

    // ===== CSV =====

    static final class CsvTable {
        final Map<String, Integer> header;
        final List<String[]> rows;

        CsvTable(Map<String, Integer> header, List<String[]> rows) {
            this.header = header;
            this.rows = rows;
        }

        boolean hasColumn(String name) {
            return header.containsKey(name);
        }

        int column(String name) throws IOException {
            Integer idx = header.get(name);
            if (idx == null) throw new IOException("Missing column '" + name + "'");
            return idx;
        }
    }

    static CsvTable readCsv(Path file) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                throw new IOException("Empty file: " + file);
            }
            String[] names = headerLine.split(",", -1);
            Map<String, Integer> header = new HashMap<>();
            for (int i = 0; i < names.length; i++) {
                header.put(names[i].trim().toLowerCase(Locale.ROOT), i);
            }

            List<String[]> rows = new ArrayList<>();
            String line;
            int lineNo = 1;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.trim().isEmpty()) continue;
                String[] cells = line.split(",", -1);
                if (cells.length != names.length) {
                    log.warn("{}:{} has {} cells, expected {}; row skipped", file, lineNo, cells.length, names.length);
                    continue;
                }
                rows.add(cells);
            }
            return new CsvTable(header, rows);
        }
    }

    private static Instant[] parseTimes(CsvTable table, Path file) throws IOException {
        int col;
        try {
            col = table.column("time");
        } catch (IOException e) {
            throw new IOException(e.getMessage() + " in " + file, e);
        }
        Instant[] times = new Instant[table.rows.size()];
        for (int r = 0; r < times.length; r++) {
            try {
                times[r] = TimeWindow.parseUtc(table.rows.get(r)[col]);
            } catch (IllegalArgumentException e) {
                throw new IOException(file + " row " + (r + 1) + ": " + e.getMessage(), e);
            }
            if (r > 0 && !times[r].isAfter(times[r - 1])) {
                throw new IOException(file + " row " + (r + 1) + ": timestamps out of order ("
                        + times[r - 1] + " -> " + times[r] + ")");
            }
        }
        return times;
    }

    private static double[] numericColumn(CsvTable table, String name, Path file) throws IOException {
        if (!table.hasColumn(name)) throw new IOException("Missing column '" + name + "' in " + file);
        int col = table.header.get(name);
        double[] out = new double[table.rows.size()];
        for (int r = 0; r < out.length; r++) {
            out[r] = parseNumber(table.rows.get(r)[col], file, r);
        }
        return out;
    }

    private static double parseNumber(String cell, Path file, int row) throws IOException {
        String s = cell.trim();
        if (s.isEmpty() || s.equalsIgnoreCase("nan")) return Double.NaN;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new IOException(file + " row " + (row + 1) + ": not a number '" + s + "'", e);
        }
    }
}
