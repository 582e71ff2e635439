package com.eainde.structured.compiler;

import com.eainde.structured.schema.FieldSpec;
import com.eainde.structured.schema.SchemaDefinition;
import com.eainde.structured.schema.TypeTag;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Shared compute-once cache of compiled schemas.
 *
 * <p>
 * Keyed by schema structure plus the documentation text of the schema and of
 * every schema nested in it, since all of those docs can appear in the
 * rendered output while none of them take part in schema equality. Two threads compiling the same schema for the first time
 * may both do the work; the first insert wins and both callers get an equal
 * result. Entries are never replaced.
 */
public class CompilationCache {

    private final SchemaCompiler compiler;
    private final ConcurrentMap<Key, CompiledSchema> entries = new ConcurrentHashMap<>();

    public CompilationCache(SchemaCompiler compiler) {
        this.compiler = compiler;
    }

    public CompiledSchema get(SchemaDefinition schema) {
        Key key = new Key(schema, List.copyOf(docs(schema, new ArrayList<>())));
        CompiledSchema cached = entries.get(key);
        if (cached != null) {
            return cached;
        }
        CompiledSchema compiled = compiler.compile(schema);
        CompiledSchema raced = entries.putIfAbsent(key, compiled);
        return raced != null ? raced : compiled;
    }

    public SchemaCompiler getCompiler() {
        return compiler;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Collects docs depth first in declaration order. Equal schemas have the
     * same shape, so equal lists mean equal docs at every position.
     */
    private static List<String> docs(SchemaDefinition schema, List<String> into) {
        into.add(schema.getDoc());
        for (FieldSpec field : schema.fields()) {
            nestedDocs(field.type(), into);
        }
        return into;
    }

    private static void nestedDocs(TypeTag type, List<String> into) {
        if (type instanceof TypeTag.NestedSchema nested) {
            docs(nested.schema(), into);
        } else if (type instanceof TypeTag.ArrayOf array) {
            nestedDocs(array.items(), into);
        }
    }

    private record Key(SchemaDefinition schema, List<String> docs) {
    }
}
