package com.github.dimitryivaniuta.relay.service;

import com.github.dimitryivaniuta.relay.error.RelayException;
import com.github.dimitryivaniuta.relay.record.RelayRecord;

/** Per-row result of a file upload: either a record or the error that rejected the row. */
public record RowOutcome(int row, RelayRecord record, RelayException error) {

    public static RowOutcome accepted(int row, RelayRecord record) {
        return new RowOutcome(row, record, null);
    }

    public static RowOutcome rejected(int row, RelayException error) {
        return new RowOutcome(row, null, error);
    }
}
