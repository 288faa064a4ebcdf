package solcore.io;

import solcore.model.IrradianceResult;
import solcore.model.RadiationType;
import solcore.model.TimeSeries;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes irradiance results as ';'-separated CSV, one row per timestep. NaN is an empty cell.
 */
public final class ResultsCsvWriter {

    static final RadiationType[] COLUMNS = {
            RadiationType.GHI,
            RadiationType.DNI,
            RadiationType.DHI,
            RadiationType.GHI_TRACKER,
            RadiationType.GHI_CS,
            RadiationType.DNI_CS,
            RadiationType.DHI_CS,
            RadiationType.GHI_TRACKER_CS
    };

    private ResultsCsvWriter() {}

    public static Path writeResults(Path dir, String plantId, IrradianceResult result) throws IOException {
        Files.createDirectories(dir);
        Path path = dir.resolve(plantId + ".csv");

        TimeSeries[] series = new TimeSeries[COLUMNS.length];
        for (int c = 0; c < COLUMNS.length; c++) {
            series[c] = result.get(COLUMNS[c]);
        }

        try (BufferedWriter w = new BufferedWriter(new FileWriter(path.toFile(), StandardCharsets.UTF_8, false))) {
            w.write(buildHeaderLine());
            w.newLine();

            for (int i = 0; i < result.size(); i++) {
                StringBuilder sb = new StringBuilder();
                sb.append(series[0].timeAt(i));
                for (TimeSeries s : series) {
                    sb.append(';').append(fmt3(s.valueAt(i)));
                }
                w.write(sb.toString());
                w.newLine();
            }
        }
        return path;
    }

    static String buildHeaderLine() {
        StringBuilder sb = new StringBuilder("time");
        for (RadiationType t : COLUMNS) {
            sb.append(';').append(t.key());
        }
        return sb.toString();
    }

    private static String fmt3(double v) {
        return Double.isNaN(v) ? "" : String.format(Locale.ROOT, "%.3f", v);
    }
}
