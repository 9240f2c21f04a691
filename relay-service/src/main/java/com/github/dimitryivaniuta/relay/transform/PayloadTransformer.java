package com.github.dimitryivaniuta.relay.transform;

import com.github.dimitryivaniuta.relay.registry.SchemaDescriptor;
import com.github.dimitryivaniuta.relay.validation.ValidatedPayload;

/**
 * Maps a validated payload to the destination shape of its schema.
 *
 * <p>Implementations must be pure: the same input always yields the same output, with no I/O.
 * A payload that cannot be mapped raises {@link com.github.dimitryivaniuta.relay.error.TransformException}.</p>
 */
public interface PayloadTransformer {

    TransformedPayload transform(ValidatedPayload validated, SchemaDescriptor descriptor);
}
