package com.specgen.schema;

import io.swagger.v3.oas.models.media.Schema;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static table of type names that map straight onto an OpenAPI base type and format.
 * <p>
 * The table holds both the names used in annotation text ({@code integer}, {@code int64}, {@code bool}) and
 * the Java names found in declarations ({@code Integer}, {@code long}, {@code BigDecimal}), plus the
 * well-known date, time and UUID classes.
 */
public final class PrimitiveTypes {

    private record TypeFormat(String type, String format) {
    }

    private static final Map<String, TypeFormat> TABLE = new HashMap<>();

    static {
        register(new TypeFormat("string", null),
                "string", "String", "CharSequence", "char", "Character");
        register(new TypeFormat("integer", "int32"),
                "int", "Integer", "short", "Short", "int8", "int16", "int32", "integer", "uint", "uint8", "uint16", "uint32");
        register(new TypeFormat("integer", "int64"),
                "long", "Long", "int64", "uint64", "BigInteger", "java.math.BigInteger");
        register(new TypeFormat("number", "float"),
                "float", "Float", "float32");
        register(new TypeFormat("number", "double"),
                "double", "Double", "float64", "number", "BigDecimal", "java.math.BigDecimal");
        register(new TypeFormat("boolean", null),
                "boolean", "Boolean", "bool");
        register(new TypeFormat("string", "byte"),
                "byte", "Byte");
        register(new TypeFormat("object", null),
                "Object", "any", "object", "interface{}", "java.lang.Object");
        register(new TypeFormat("array", null),
                "array");
        register(new TypeFormat("string", "date-time"),
                "Instant", "OffsetDateTime", "ZonedDateTime", "LocalDateTime", "Date", "time.Time",
                "java.time.Instant", "java.time.OffsetDateTime", "java.time.ZonedDateTime",
                "java.time.LocalDateTime", "java.util.Date");
        register(new TypeFormat("string", "date"),
                "LocalDate", "java.time.LocalDate");
        register(new TypeFormat("string", "uuid"),
                "UUID", "uuid.UUID", "java.util.UUID");
    }

    /** Sequence-like Java types; their single type argument is the element type. */
    public static final Set<String> COLLECTIONS = Set.of("List", "Set", "Collection", "Iterable", "ArrayList",
            "LinkedList", "HashSet", "LinkedHashSet", "TreeSet", "SortedSet", "Queue", "Deque");

    /** Keyed Java types; their second type argument is the value type. */
    public static final Set<String> MAPS = Set.of("Map", "HashMap", "LinkedHashMap", "TreeMap", "SortedMap",
            "ConcurrentMap", "ConcurrentHashMap");

    private PrimitiveTypes() {
    }

    private static void register(TypeFormat typeFormat, String... names) {
        for (String name : names) {
            TABLE.put(name, typeFormat);
        }
    }

    /**
     * Looks up a name in the table.
     *
     * @param name A simple or qualified type name.
     * @return A fresh schema node carrying the mapped type and format, or empty when the name is not primitive.
     */
    public static Optional<Schema<Object>> lookup(String name) {
        TypeFormat typeFormat = name == null ? null : TABLE.get(name.trim());
        if (typeFormat == null) {
            return Optional.empty();
        }
        Schema<Object> schema = new Schema<>();
        schema.setType(typeFormat.type());
        schema.setFormat(typeFormat.format());
        return Optional.of(schema);
    }
}
