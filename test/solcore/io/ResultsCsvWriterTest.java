package solcore.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import solcore.engine.Rest2Model;
import solcore.model.AtmosphereFixtures;
import solcore.model.IrradianceResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ResultsCsvWriterTest {

    @Test
    void headerListsAllStreams() {
        assertEquals("time;ghi;dni;dhi;ghi_tracker;ghi_cs;dni_cs;dhi_cs;ghi_tracker_cs",
                ResultsCsvWriter.buildHeaderLine());
    }

    @Test
    void writesOneRowPerTimestep(@TempDir Path dir) throws IOException {
        IrradianceResult r = new Rest2Model(AtmosphereFixtures.clearReferenceDay()).convertRadiation();

        Path file = ResultsCsvWriter.writeResults(dir.resolve("out"), "P1", r);

        assertEquals(dir.resolve("out").resolve("P1.csv"), file);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(25, lines.size());
        assertEquals("2024-01-15T00:00:00Z;0.000;0.000;0.000;0.000;0.000;0.000;0.000;0.000", lines.get(1));

        String[] noon = lines.get(16).split(";", -1);
        assertEquals("2024-01-15T15:00:00Z", noon[0]);
        assertEquals(String.format(Locale.ROOT, "%.3f", r.getGhi().valueAt(15)), noon[1]);
        assertEquals(String.format(Locale.ROOT, "%.3f", r.getGhiTrackerCs().valueAt(15)), noon[8]);
    }

    @Test
    void nanIsAnEmptyCell(@TempDir Path dir) throws IOException {
        IrradianceResult r = new Rest2Model(AtmosphereFixtures.clearReferenceDay()).convertRadiation();
        double[] ghi = r.getGhi().getValues();
        ghi[15] = Double.NaN;
        IrradianceResult withGap = new IrradianceResult(r.getGhi().withValues(ghi), r.getGhiTracker(), r.getDni(),
                r.getDhi(), r.getGhiCs(), r.getGhiTrackerCs(), r.getDniCs(), r.getDhiCs());

        Path file = ResultsCsvWriter.writeResults(dir, "P1", withGap);

        String[] noon = Files.readAllLines(file, StandardCharsets.UTF_8).get(16).split(";", -1);
        assertEquals(9, noon.length);
        assertEquals("", noon[1]);
        assertFalse(noon[2].isEmpty());
    }
}
