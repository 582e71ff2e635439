package com.eainde.structured.handler;

import com.eainde.structured.instance.Instance;
import com.eainde.structured.parallel.NamedInstance;
import com.eainde.structured.retry.ExtractionResult;
import com.eainde.structured.schema.SchemaDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps schemas to the handlers that act on their extracted instances.
 *
 * <p>
 * Keyed by schema identity ({@link SchemaDefinition#equals}), so two
 * structurally equal definitions share a handler. Handlers only run when one
 * of the {@code dispatch} methods is called.
 */
@Slf4j
public class ExtractionHandlerRegistry {

    private final Map<SchemaDefinition, ExtractionHandler<?>> handlers = new ConcurrentHashMap<>();

    /**
     * Registers {@code handler} for {@code schema}, replacing any previous one.
     */
    public ExtractionHandlerRegistry register(SchemaDefinition schema, ExtractionHandler<?> handler) {
        if (schema == null || handler == null) {
            throw new IllegalArgumentException("schema and handler are required");
        }
        ExtractionHandler<?> previous = handlers.put(schema, handler);
        if (previous != null) {
            log.debug("Replaced handler for schema '{}'", schema.getName());
        }
        return this;
    }

    public boolean hasHandler(SchemaDefinition schema) {
        return handlers.containsKey(schema);
    }

    /**
     * @throws IllegalStateException if no handler is registered for {@code schema}
     */
    public Object dispatch(SchemaDefinition schema, Instance instance) {
        ExtractionHandler<?> handler = handlers.get(schema);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for schema '" + schema.getName() + "'");
        }
        return handler.handle(schema, instance);
    }

    public Object dispatch(NamedInstance named) {
        return dispatch(named.schema(), named.instance());
    }

    /**
     * Dispatches the value of a successful result.
     *
     * @return the handler output, or empty when the result is not a success
     */
    public Optional<Object> dispatch(SchemaDefinition schema, ExtractionResult<Instance> result) {
        if (result instanceof ExtractionResult.Success<Instance> success) {
            return Optional.ofNullable(dispatch(schema, success.value()));
        }
        return Optional.empty();
    }

    /**
     * Dispatches every call of a parallel extraction in order.
     */
    public List<Object> dispatchAll(List<NamedInstance> instances) {
        List<Object> outputs = new ArrayList<>(instances.size());
        for (NamedInstance named : instances) {
            outputs.add(dispatch(named));
        }
        return outputs;
    }
}
