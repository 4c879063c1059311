package com.DentalCare.chart_backend.util;

import com.DentalCare.chart_backend.dto.request.ImportRow;
import com.DentalCare.chart_backend.dto.response.FlatExportTable;
import com.DentalCare.chart_backend.exception.ApiException;
import com.DentalCare.chart_backend.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.http.HttpStatus;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the flat export table as CSV or XLSX and parses CSV back into rows.
 */
@Slf4j
public class FlatExportWriter {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private FlatExportWriter() {
        // Utility class, no instantiation
    }

    public static byte[] toCsv(FlatExportTable table) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(table.getColumns().toArray(new String[0]))
                .build();

        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {

            for (int i = 0; i < table.size(); i++) {
                List<String> cells = new ArrayList<>(table.getColumns().size());
                for (String column : table.getColumns()) {
                    cells.add(table.cell(i, column));
                }
                printer.printRecord(cells);
            }
            printer.flush();
            return out.toByteArray();

        } catch (IOException e) {
            log.error("Failed to write CSV export", e);
            throw new ApiException("Failed to generate export", HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    public static byte[] toXlsx(FlatExportTable table) {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet(Constants.EXPORT_SHEET_NAME);
            CellStyle headerStyle = createHeaderStyle(workbook);

            int rowNum = 0;
            Row headerRow = sheet.createRow(rowNum++);
            for (int col = 0; col < table.getColumns().size(); col++) {
                Cell cell = headerRow.createCell(col);
                cell.setCellValue(table.getColumns().get(col));
                cell.setCellStyle(headerStyle);
            }

            // Every cell is text so the file imports back unchanged
            for (int i = 0; i < table.size(); i++) {
                Row row = sheet.createRow(rowNum++);
                for (int col = 0; col < table.getColumns().size(); col++) {
                    row.createCell(col).setCellValue(table.cell(i, table.getColumns().get(col)));
                }
            }

            sheet.createFreezePane(0, 1);
            for (int col = 0; col < table.getColumns().size(); col++) {
                sheet.autoSizeColumn(col);
            }

            workbook.write(out);
            return out.toByteArray();

        } catch (IOException e) {
            log.error("Failed to write XLSX export", e);
            throw new ApiException("Failed to generate export", HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    /**
     * Reads a CSV with a header row. Row numbers count the header as row 1.
     */
    public static List<ImportRow> parseCsv(InputStream inputStream) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setIgnoreSurroundingSpaces(true)
                .build();

        List<ImportRow> rows = new ArrayList<>();
        try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {

            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw ValidationException.forField("file", "header", "The file has no header row");
            }

            for (CSVRecord csvRecord : parser) {
                Map<String, String> values = new LinkedHashMap<>();
                for (int col = 0; col < headers.size() && col < csvRecord.size(); col++) {
                    values.put(cleanHeader(headers.get(col)), csvRecord.get(col));
                }
                rows.add(new ImportRow((int) csvRecord.getRecordNumber() + 1, values));
            }
            return rows;

        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            log.error("Failed to read CSV import: {}", e.getMessage(), e);
            throw ValidationException.forField("file", "content", "The file is not a readable CSV: " + e.getMessage());
        }
    }

    private static String cleanHeader(String header) {
        String cleaned = header.startsWith(BYTE_ORDER_MARK) ? header.substring(1) : header;
        return cleaned.trim().toLowerCase(Locale.ROOT);
    }

    private static CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        return style;
    }
}
