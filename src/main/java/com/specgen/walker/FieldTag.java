package com.specgen.walker;

/**
 * The serialization view of one field.
 *
 * @param name      The serialized property name, or {@link #EXCLUDED}.
 * @param omitEmpty Whether the field is left out of the payload when empty, which makes it optional.
 */
public record FieldTag(String name, boolean omitEmpty) {

    public static final String EXCLUDED = "-";

    public boolean excluded() {
        return EXCLUDED.equals(name);
    }
}
