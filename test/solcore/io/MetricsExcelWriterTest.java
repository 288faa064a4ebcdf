package solcore.io;

import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import solcore.model.CalibratedParameters;
import solcore.model.RadiationType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsExcelWriterTest {

    private static Map<String, Double> metrics(double me, double mae, double rmse) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("ME", me);
        m.put("MAE", mae);
        m.put("RMSE", rmse);
        return m;
    }

    @Test
    void oneRowPerEvaluatedSplit(@TempDir Path dir) throws IOException {
        List<PlantArtifact> artifacts = List.of(
                new PlantArtifact("P1", new CalibratedParameters(0.3, 0.7),
                        metrics(-1.0, 10.0, 15.0), metrics(2.0, 11.0, 16.0), null, RadiationType.GHI),
                new PlantArtifact("P2", CalibratedParameters.DEFAULT,
                        metrics(Double.NaN, 5.0, 6.0), null, null, RadiationType.DNI));

        Path file = MetricsExcelWriter.writeXlsx(dir.resolve("report").resolve("metrics.xlsx"), artifacts);

        try (InputStream in = Files.newInputStream(file); Workbook wb = new XSSFWorkbook(in)) {
            Sheet sheet = wb.getSheet(MetricsExcelWriter.SHEET_NAME);
            assertNotNull(sheet);
            assertEquals(3, sheet.getLastRowNum());

            Row header = sheet.getRow(0);
            for (int c = 0; c < MetricsExcelWriter.HEADERS.length; c++) {
                assertEquals(MetricsExcelWriter.HEADERS[c], header.getCell(c).getStringCellValue());
            }

            Row validation = sheet.getRow(2);
            assertEquals("P1", validation.getCell(0).getStringCellValue());
            assertEquals(PlantArtifact.VALIDATION, validation.getCell(1).getStringCellValue());
            assertEquals("ghi", validation.getCell(2).getStringCellValue());
            assertEquals(16.0, validation.getCell(5).getNumericCellValue(), 0.0);
            assertEquals(0.7, validation.getCell(7).getNumericCellValue(), 0.0);

            Row p2 = sheet.getRow(3);
            assertEquals("P2", p2.getCell(0).getStringCellValue());
            assertEquals("dni", p2.getCell(2).getStringCellValue());
            assertEquals(CellType.BLANK, p2.getCell(3).getCellType());
            assertEquals(6.0, p2.getCell(5).getNumericCellValue(), 0.0);
        }
    }
}
