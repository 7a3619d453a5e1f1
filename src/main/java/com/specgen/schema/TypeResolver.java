package com.specgen.schema;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.WildcardType;
import io.swagger.v3.oas.models.media.Schema;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Converts declared types into schema nodes.
 * <p>
 * Two kinds of input are accepted: JavaParser {@link Type}s taken from field and record component
 * declarations, and type expressions written in annotation text ({@code integer}, {@code []string},
 * {@code *int}, {@code map[string]Item}, or any Java type such as {@code List<Item>}).
 * Resolution never fails. Whatever cannot be mapped becomes an empty node, meaning "no constraint".
 */
@Component
public class TypeResolver {

    public static final String SCHEMA_REF_PREFIX = "#/components/schemas/";

    private final JavaParser typeParser =
            new JavaParser(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    /**
     * Resolves a type expression written in annotation text.
     *
     * @param expression The expression, for example {@code integer}, {@code []Item} or {@code Map<String, Item>}.
     * @return The schema node; empty for a blank or unparseable expression.
     */
    public Schema<Object> resolveTypeExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            return emptyNode();
        }
        String expr = expression.trim();
        Optional<Schema<Object>> primitive = PrimitiveTypes.lookup(expr);
        if (primitive.isPresent()) {
            return primitive.get();
        }
        if (expr.startsWith("[]")) {
            return arrayOf(resolveTypeExpression(expr.substring(2)));
        }
        if (expr.startsWith("*")) {
            return nullable(resolveTypeExpression(expr.substring(1)));
        }
        if (expr.startsWith("map[")) {
            int close = expr.indexOf(']');
            if (close < 0) {
                return emptyNode();
            }
            return mapOf(resolveTypeExpression(expr.substring(close + 1)));
        }
        if (expr.endsWith("[]") && !"byte[]".equals(expr)) {
            return arrayOf(resolveTypeExpression(expr.substring(0, expr.length() - 2)));
        }
        ParseResult<Type> parsed = typeParser.parseType(expr);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            return emptyNode();
        }
        return resolve(parsed.getResult().get());
    }

    /**
     * Resolves the schema token of a body or response line. A plain name is always a reference, and
     * {@code []Name} or {@code Name[]} is an array of references, even when the name is a primitive keyword.
     */
    public Schema<Object> resolveReferenceToken(String token) {
        if (token == null || token.isBlank()) {
            return emptyNode();
        }
        String name = token.trim();
        if (name.startsWith("[]")) {
            return arrayOf(refTo(name.substring(2)));
        }
        if (name.endsWith("[]")) {
            return arrayOf(refTo(name.substring(0, name.length() - 2)));
        }
        return refTo(name);
    }

    /**
     * Resolves a declared Java type.
     *
     * @param type The type as parsed by JavaParser.
     * @return The schema node, never {@code null}.
     */
    public Schema<Object> resolve(Type type) {
        if (type == null) {
            return emptyNode();
        }
        if (type.isPrimitiveType()) {
            PrimitiveType primitive = type.asPrimitiveType();
            return PrimitiveTypes.lookup(primitive.asString()).orElseGet(TypeResolver::emptyNode);
        }
        if (type.isArrayType()) {
            ArrayType arrayType = type.asArrayType();
            Type component = arrayType.getComponentType();
            if (component.isPrimitiveType() && component.asPrimitiveType().getType() == PrimitiveType.Primitive.BYTE) {
                return PrimitiveTypes.lookup("byte").orElseGet(TypeResolver::emptyNode);
            }
            return arrayOf(resolve(component));
        }
        if (type.isWildcardType()) {
            WildcardType wildcard = type.asWildcardType();
            return wildcard.getExtendedType().map(this::resolve).orElseGet(TypeResolver::emptyNode);
        }
        if (type.isClassOrInterfaceType()) {
            return resolveClassType(type.asClassOrInterfaceType());
        }
        // var, void, union and intersection types carry no usable constraint
        return emptyNode();
    }

    private Schema<Object> resolveClassType(ClassOrInterfaceType type) {
        String simpleName = type.getNameAsString();
        List<Type> arguments = type.getTypeArguments().map(List::<Type>copyOf).orElse(List.of());

        if (type.getScope().isPresent()) {
            // qualified names map only when they name a well-known type
            return PrimitiveTypes.lookup(type.getNameWithScope()).orElseGet(TypeResolver::emptyNode);
        }
        Optional<Schema<Object>> primitive = PrimitiveTypes.lookup(simpleName);
        if (primitive.isPresent()) {
            return primitive.get();
        }
        switch (simpleName) {
            case "Optional":
                return arguments.isEmpty() ? emptyNode() : nullable(resolve(arguments.get(0)));
            case "OptionalInt":
                return nullable(PrimitiveTypes.lookup("int").orElseGet(TypeResolver::emptyNode));
            case "OptionalLong":
                return nullable(PrimitiveTypes.lookup("long").orElseGet(TypeResolver::emptyNode));
            case "OptionalDouble":
                return nullable(PrimitiveTypes.lookup("double").orElseGet(TypeResolver::emptyNode));
            default:
                break;
        }
        if (PrimitiveTypes.COLLECTIONS.contains(simpleName)) {
            return arrayOf(arguments.isEmpty() ? null : resolve(arguments.get(0)));
        }
        if (PrimitiveTypes.MAPS.contains(simpleName)) {
            return mapOf(arguments.size() < 2 ? null : resolve(arguments.get(1)));
        }
        return refTo(simpleName);
    }

    /**
     * Builds a reference node to a named component schema.
     */
    public static Schema<Object> refTo(String name) {
        Schema<Object> schema = new Schema<>();
        schema.set$ref(name.startsWith("#/") ? name : SCHEMA_REF_PREFIX + name.trim());
        return schema;
    }

    public static Schema<Object> emptyNode() {
        return new Schema<>();
    }

    /**
     * @return {@code true} when the node carries neither a reference nor any type information.
     */
    public static boolean isEmptyNode(Schema<?> schema) {
        return schema == null || (schema.get$ref() == null
                && schema.getType() == null
                && schema.getFormat() == null
                && schema.getItems() == null
                && schema.getProperties() == null
                && schema.getAdditionalProperties() == null);
    }

    private static Schema<Object> arrayOf(Schema<Object> items) {
        Schema<Object> schema = new Schema<>();
        schema.setType("array");
        schema.setItems(isEmptyNode(items) ? null : items);
        return schema;
    }

    private static Schema<Object> mapOf(Schema<Object> values) {
        Schema<Object> schema = new Schema<>();
        schema.setType("object");
        schema.setAdditionalProperties(isEmptyNode(values) ? null : values);
        return schema;
    }

    /**
     * Marks a node nullable. References and empty nodes are returned unchanged: a reference cannot carry
     * siblings, and an empty node has nothing to qualify.
     */
    private static Schema<Object> nullable(Schema<Object> schema) {
        if (schema.get$ref() == null && !isEmptyNode(schema)) {
            schema.setNullable(true);
        }
        return schema;
    }
}
