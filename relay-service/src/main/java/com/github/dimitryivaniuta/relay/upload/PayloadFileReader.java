package com.github.dimitryivaniuta.relay.upload;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Set;

/**
 * Reads one tabular file format into one JSON object per data row. Cell values are JSON
 * strings or null; typing against the schema happens later in {@link SchemaTypedCells}.
 */
public interface PayloadFileReader {

    /** Lower-case file extensions this reader accepts, without the dot. */
    Set<String> extensions();

    /** Data rows in file order; rows whose cells are all missing are left out. */
    List<ObjectNode> read(String filename, byte[] content);
}
