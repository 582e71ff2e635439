package com.eainde.structured.handler;

import com.eainde.structured.instance.Instance;
import com.eainde.structured.schema.SchemaDefinition;

/**
 * Post-extraction behavior attached to a schema, run on request through
 * {@link ExtractionHandlerRegistry}.
 *
 * @param <R> type of the handler's result
 */
@FunctionalInterface
public interface ExtractionHandler<R> {

    R handle(SchemaDefinition schema, Instance instance);
}
