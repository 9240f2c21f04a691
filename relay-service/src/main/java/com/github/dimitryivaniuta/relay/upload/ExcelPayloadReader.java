package com.github.dimitryivaniuta.relay.upload;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.relay.config.RelayProperties;
import com.github.dimitryivaniuta.relay.error.InvalidUploadException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

/**
 * First sheet of an Excel workbook ({@code .xlsx}, {@code .xlsm}, {@code .xls}); the first
 * row is the header. Every cell is read as its displayed text, formulas evaluated, and then
 * handled like a CSV cell. Columns with a blank header are ignored.
 */
@Component
@RequiredArgsConstructor
public class ExcelPayloadReader implements PayloadFileReader {

    private static final Set<String> EXTENSIONS = Set.of("xlsx", "xlsm", "xls");

    private final RelayProperties props;

    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public List<ObjectNode> read(String filename, byte[] content) {
        int maxRows = props.getUpload().getMaxRows();
        List<ObjectNode> rows = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                return rows;
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            int headerIndex = Math.max(sheet.getFirstRowNum(), 0);
            Row header = sheet.getRow(headerIndex);
            if (header == null) {
                return rows;
            }
            List<String> columns = new ArrayList<>();
            for (int c = 0; c < header.getLastCellNum(); c++) {
                columns.add(text(header.getCell(c), formatter, evaluator).trim());
            }

            for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
                Row source = sheet.getRow(r);
                if (source == null) continue;
                ObjectNode row = CellValues.newRow();
                for (int c = 0; c < columns.size(); c++) {
                    String name = columns.get(c);
                    if (name.isEmpty()) continue;
                    row.set(name, CellValues.cell(text(source.getCell(c), formatter, evaluator)));
                }
                if (CellValues.hasValue(row)) {
                    CellValues.add(rows, row, filename, maxRows);
                }
            }
        } catch (InvalidUploadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new InvalidUploadException("Cannot parse '" + filename + "' as a spreadsheet: " + e.getMessage(), e);
        }
        return rows;
    }

    private static String text(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        return cell == null ? "" : formatter.formatCellValue(cell, evaluator);
    }
}
