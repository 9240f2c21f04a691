package com.github.dimitryivaniuta.relay.upload;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.relay.config.RelayProperties;
import com.github.dimitryivaniuta.relay.error.InvalidUploadException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExcelPayloadReaderTest {

    private final RelayProperties props = new RelayProperties();
    private final ExcelPayloadReader reader = new ExcelPayloadReader(props);

    private static void row(Sheet sheet, int index, Object... values) {
        Row row = sheet.createRow(index);
        for (int i = 0; i < values.length; i++) {
            if (values[i] instanceof Number n) {
                row.createCell(i).setCellValue(n.doubleValue());
            } else if (values[i] instanceof Boolean b) {
                row.createCell(i).setCellValue(b);
            } else if (values[i] != null) {
                row.createCell(i).setCellValue(values[i].toString());
            }
        }
    }

    private static byte[] orders(Workbook wb) throws IOException {
        try (wb; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet("orders");
            row(sheet, 0, "id", "amount", "note", "zip");
            row(sheet, 1, 1, 9.99, "rush", "12345");
            // row 2 never created
            row(sheet, 3, "", "NA", null, "N/A");
            row(sheet, 4, 2, "N/A", "  late ", 2345);
            wb.write(out);
            return out.toByteArray();
        }
    }

    @Test
    void xlsxRowsAreReadAsTextWithBlankAndNaRowsDropped() throws IOException {
        List<ObjectNode> rows = reader.read("orders.xlsx", orders(new XSSFWorkbook()));

        assertEquals(2, rows.size());
        ObjectNode first = rows.get(0);
        assertEquals("1", first.get("id").textValue());
        assertEquals("9.99", first.get("amount").textValue());
        assertEquals("rush", first.get("note").textValue());
        assertEquals("12345", first.get("zip").textValue());

        ObjectNode second = rows.get(1);
        assertEquals("2", second.get("id").textValue());
        assertTrue(second.get("amount").isNull());
        assertEquals("late", second.get("note").textValue());
        assertEquals("2345", second.get("zip").textValue());
    }

    @Test
    void legacyXlsIsReadTheSameWay() throws IOException {
        List<ObjectNode> rows = reader.read("orders.xls", orders(new HSSFWorkbook()));

        assertEquals(2, rows.size());
        assertEquals("9.99", rows.get(0).get("amount").textValue());
    }

    @Test
    void missingCellsAndBlankHeadersAreHandled() throws IOException {
        byte[] content;
        try (Workbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet();
            row(sheet, 0, "name", "", "active");
            row(sheet, 1, "Ada", "ignored", true);
            row(sheet, 2, "Bob");
            wb.write(out);
            content = out.toByteArray();
        }

        List<ObjectNode> rows = reader.read("people.xlsx", content);

        assertEquals(2, rows.size());
        assertEquals(2, rows.get(0).size());
        assertEquals("TRUE", rows.get(0).get("active").textValue());
        assertTrue(rows.get(1).get("active").isNull());
    }

    @Test
    void rowLimitIsEnforced() throws IOException {
        props.getUpload().setMaxRows(1);

        byte[] content = orders(new XSSFWorkbook());
        assertThrows(InvalidUploadException.class, () -> reader.read("orders.xlsx", content));
    }

    @Test
    void corruptWorkbookIsRejected() {
        byte[] notExcel = "id,amount\n1,2\n".getBytes(StandardCharsets.UTF_8);

        assertThrows(InvalidUploadException.class, () -> reader.read("orders.xlsx", notExcel));
    }
}
