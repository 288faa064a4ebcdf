package solcore.io;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import solcore.engine.metrics.MetricsEvaluator;
import solcore.model.CalibratedParameters;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Error summary workbook: one row per plant and split (train / validation / testing)
 * with ME, MAE, RMSE and the fitted parameters. Splits that were not evaluated are omitted;
 * NaN metrics are left blank.
 */
public final class MetricsExcelWriter {

    public static final String SHEET_NAME = "METRICS";

    static final String[] HEADERS = {"plant", "split", "radiation_type", "ME", "MAE", "RMSE", "mu0", "g"};

    private static final String[] SPLITS = {PlantArtifact.TRAIN, PlantArtifact.VALIDATION, PlantArtifact.TESTING};

    private MetricsExcelWriter() {}

    public static Path writeXlsx(Path path, List<PlantArtifact> artifacts) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle textStyle = wb.createCellStyle();
            textStyle.setAlignment(HorizontalAlignment.CENTER);
            textStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle metricStyle = wb.createCellStyle();
            metricStyle.setAlignment(HorizontalAlignment.CENTER);
            metricStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            metricStyle.setDataFormat(df.getFormat("0.00"));

            CellStyle parameterStyle = wb.createCellStyle();
            parameterStyle.setAlignment(HorizontalAlignment.CENTER);
            parameterStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            parameterStyle.setDataFormat(df.getFormat("0.0000"));

            Sheet sheet = wb.createSheet(SHEET_NAME);

            int r = 0;
            Row hdr = sheet.createRow(r++);
            int c = 0;
            for (String h : HEADERS) {
                c = writeHeader(hdr, c, h, headerStyle);
            }

            for (PlantArtifact artifact : artifacts) {
                CalibratedParameters p = artifact.getParameters();
                for (String split : SPLITS) {
                    Map<String, Double> m = artifact.getMetrics(split);
                    if (m == null) continue;

                    Row row = sheet.createRow(r++);
                    int cc = 0;
                    writeText(row, cc++, artifact.getPlantId(), textStyle);
                    writeText(row, cc++, split, textStyle);
                    writeText(row, cc++, artifact.getRadiationType().key(), textStyle);
                    writeNumber(row, cc++, m.get(MetricsEvaluator.ME), metricStyle);
                    writeNumber(row, cc++, m.get(MetricsEvaluator.MAE), metricStyle);
                    writeNumber(row, cc++, m.get(MetricsEvaluator.RMSE), metricStyle);
                    writeNumber(row, cc++, p.mu0(), parameterStyle);
                    writeNumber(row, cc++, p.g(), parameterStyle);
                }
            }

            // fixed widths: autoSizeColumn needs AWT fonts
            for (int i = 0; i < HEADERS.length; i++) sheet.setColumnWidth(i, 14 * 256);

            try (FileOutputStream out = new FileOutputStream(path.toFile())) {
                wb.write(out);
            }
        }
        return path;
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeText(Row row, int col, String value, CellStyle style) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    // blank cell for missing or NaN
    private static void writeNumber(Row row, int col, Double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        if (value != null && !value.isNaN()) {
            cell.setCellValue(value);
        }
        cell.setCellStyle(numStyle);
    }
}
