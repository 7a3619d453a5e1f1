package com.specgen.walker;

import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Reads serialization tags from Jackson annotations.
 * <ul>
 *     <li>{@code @JsonProperty("n")} or {@code @JsonProperty(value = "n")} renames the property.</li>
 *     <li>{@code @JsonIgnore} excludes it, unless written {@code @JsonIgnore(false)}.</li>
 *     <li>{@code @JsonInclude(NON_NULL)} and the other {@code NON_*} inclusions mark it as omitted when empty.</li>
 * </ul>
 * Annotations are matched by simple name, so both imported and fully qualified usages are recognized.
 */
@Component
public class JacksonTagReader implements SerializationTagReader {

    private static final Set<String> OMIT_INCLUSIONS = Set.of("NON_NULL", "NON_EMPTY", "NON_ABSENT", "NON_DEFAULT");

    @Override
    public FieldTag read(NodeWithAnnotations<?> declaration, String declaredName) {
        Optional<AnnotationExpr> ignore = find(declaration, "JsonIgnore");
        if (ignore.isPresent() && value(ignore.get()).map(v -> !"false".equals(v.toString())).orElse(true)) {
            return new FieldTag(FieldTag.EXCLUDED, false);
        }
        String name = find(declaration, "JsonProperty")
                .flatMap(JacksonTagReader::value)
                .filter(Expression::isStringLiteralExpr)
                .map(v -> v.asStringLiteralExpr().asString())
                .filter(v -> !v.isEmpty())
                .orElse(declaredName);
        boolean omitEmpty = find(declaration, "JsonInclude")
                .flatMap(JacksonTagReader::value)
                .map(JacksonTagReader::isOmitInclusion)
                .orElse(false);
        return new FieldTag(name, omitEmpty);
    }

    private static Optional<AnnotationExpr> find(NodeWithAnnotations<?> declaration, String simpleName) {
        for (AnnotationExpr annotation : declaration.getAnnotations()) {
            if (annotation.getName().getIdentifier().equals(simpleName)) {
                return Optional.of(annotation);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The single member value or the {@code value} pair of an annotation.
     */
    private static Optional<Expression> value(AnnotationExpr annotation) {
        if (annotation.isSingleMemberAnnotationExpr()) {
            return Optional.of(annotation.asSingleMemberAnnotationExpr().getMemberValue());
        }
        if (annotation.isNormalAnnotationExpr()) {
            for (MemberValuePair pair : annotation.asNormalAnnotationExpr().getPairs()) {
                if (pair.getNameAsString().equals("value")) {
                    return Optional.of(pair.getValue());
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isOmitInclusion(Expression value) {
        String text = value.isFieldAccessExpr() ? value.asFieldAccessExpr().getNameAsString() : value.toString();
        return OMIT_INCLUSIONS.contains(text);
    }
}
