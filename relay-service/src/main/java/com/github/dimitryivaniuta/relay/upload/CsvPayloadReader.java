package com.github.dimitryivaniuta.relay.upload;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.github.dimitryivaniuta.relay.config.RelayProperties;
import com.github.dimitryivaniuta.relay.error.InvalidUploadException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * CSV with a header row. Cells are trimmed; empty cells and the {@code NA}-style markers
 * become JSON null, everything else stays a string.
 */
@Component
@RequiredArgsConstructor
public class CsvPayloadReader implements PayloadFileReader {

    private static final Set<String> EXTENSIONS = Set.of("csv", "txt");

    private final CsvMapper csv = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final RelayProperties props;

    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public List<ObjectNode> read(String filename, byte[] content) {
        int maxRows = props.getUpload().getMaxRows();
        List<ObjectNode> rows = new ArrayList<>();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = csv.readerFor(Map.class).with(schema).readValues(content)) {
            while (it.hasNextValue()) {
                ObjectNode row = CellValues.newRow();
                for (Map.Entry<String, String> c : it.nextValue().entrySet()) {
                    row.set(c.getKey().trim(), CellValues.cell(c.getValue()));
                }
                if (CellValues.hasValue(row)) {
                    CellValues.add(rows, row, filename, maxRows);
                }
            }
        } catch (InvalidUploadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new InvalidUploadException("Cannot parse '" + filename + "' as CSV: " + e.getMessage(), e);
        }
        return rows;
    }
}
