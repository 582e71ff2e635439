package com.eainde.structured.parallel;

import com.eainde.structured.instance.Instance;
import com.eainde.structured.schema.SchemaDefinition;

/**
 * One validated call of a parallel extraction, tagged with the schema it matched.
 */
public record NamedInstance(SchemaDefinition schema, Instance instance) {

    public NamedInstance {
        if (schema == null || instance == null) {
            throw new IllegalArgumentException("schema and instance are required");
        }
    }

    public String schemaName() {
        return schema.getName();
    }
}
