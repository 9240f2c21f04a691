package com.github.dimitryivaniuta.relay.service;

import com.github.dimitryivaniuta.relay.record.RelayRecord;
import java.util.List;

/** One page of the query path; {@code limit} is the effective (clamped) limit. */
public record RecordSlice(String schemaName, int limit, int offset, List<RelayRecord> records) {}
