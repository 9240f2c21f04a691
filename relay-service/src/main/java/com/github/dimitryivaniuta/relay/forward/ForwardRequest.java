package com.github.dimitryivaniuta.relay.forward;

import com.github.dimitryivaniuta.relay.record.RelayRecord;

/** What one forward attempt sends: the transformed payload plus routing metadata. */
public record ForwardRequest(
        long recordId,
        String schemaName,
        int schemaVersion,
        String destinationUrl,
        String payloadJson
) {
    public static ForwardRequest of(RelayRecord r) {
        return new ForwardRequest(r.id(), r.schemaName(), r.schemaVersion(), r.destinationUrl(), r.transformedPayload());
    }
}
