package com.specgen.walker;

import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;

/**
 * Reads the serialization name and the "omit when empty" marker of a field declaration.
 */
public interface SerializationTagReader {

    /**
     * @param declaration  The field or record component.
     * @param declaredName The name used when no explicit serialization name is present.
     * @return The tag; its name is {@link FieldTag#EXCLUDED} when the field is never serialized.
     */
    FieldTag read(NodeWithAnnotations<?> declaration, String declaredName);
}
