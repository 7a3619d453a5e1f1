package com.specgen.walker;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.type.Type;
import com.specgen.annotation.Annotation;
import com.specgen.annotation.AnnotationParser;
import com.specgen.model.SchemaRecord;
import com.specgen.schema.TypeResolver;
import io.swagger.v3.oas.models.media.Schema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the object schema of a {@code !model} class or record from its fields.
 */
@Slf4j
class ModelSchemaBuilder {

    /**
     * A field as seen by the schema: its declared name and type, the node that carries its annotations and
     * comments, and its serialization tag.
     */
    private record FieldView(String declaredName, Type type, Node node, FieldTag tag) {
    }

    private final AnnotationParser annotationParser;
    private final TypeResolver typeResolver;
    private final SerializationTagReader tagReader;

    ModelSchemaBuilder(AnnotationParser annotationParser, TypeResolver typeResolver, SerializationTagReader tagReader) {
        this.annotationParser = annotationParser;
        this.typeResolver = typeResolver;
        this.tagReader = tagReader;
    }

    /**
     * @param declaration The type declaration.
     * @param docText     The text of the declaration's doc comment.
     * @param comments    The comment blocks of the declaration's compilation unit.
     * @return The schema record, or empty when the declaration has no {@code !model} line or is not a class
     *         or record.
     */
    Optional<SchemaRecord> build(TypeDeclaration<?> declaration, String docText, CommentBlocks comments) {
        List<Annotation> docAnnotations = annotationParser.parse(docText);
        Optional<Annotation.Model> model = docAnnotations.stream()
                .filter(Annotation.Model.class::isInstance)
                .map(Annotation.Model.class::cast)
                .findFirst();
        if (model.isEmpty()) {
            return Optional.empty();
        }
        List<FieldView> fields = fieldsOf(declaration);
        if (fields == null) {
            log.debug("Skipping !model on '{}': only classes and records describe object schemas.", declaration.getNameAsString());
            return Optional.empty();
        }

        SchemaRecord record = new SchemaRecord();
        record.setName(declaration.getNameAsString());
        record.setDescription(model.get().description());
        Schema<Object> schema = new Schema<>();
        schema.setType("object");
        schema.setDescription(model.get().description());
        Map<String, Schema<Object>> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();

        List<FieldView> included = new ArrayList<>();
        for (FieldView field : fields) {
            if (field.tag().excluded()) {
                continue;
            }
            Schema<Object> property = typeResolver.resolve(field.type());
            String description = describe(field.node(), comments);
            if (description != null && property.getDescription() == null) {
                property.setDescription(description);
            }
            properties.put(field.tag().name(), property);
            if (!field.tag().omitEmpty() && !required.contains(field.tag().name())) {
                required.add(field.tag().name());
            }
            included.add(field);
        }
        schema.setRequired(required);
        record.setSchema(schema);

        for (Annotation annotation : docAnnotations) {
            if (annotation instanceof Annotation.Field field) {
                applyFieldOverride(record, properties, field.name(), field);
            }
        }
        for (FieldView field : included) {
            comments.docFor(field.node()).ifPresent(doc -> {
                for (Annotation annotation : annotationParser.parse(doc.text())) {
                    if (annotation instanceof Annotation.Field override) {
                        applyFieldOverride(record, properties, field.tag().name(), override);
                    }
                }
            });
        }
        schema.setProperties(new LinkedHashMap<>(properties));
        if (required.isEmpty()) {
            schema.setRequired(null);
        }
        return Optional.of(record);
    }

    private List<FieldView> fieldsOf(TypeDeclaration<?> declaration) {
        List<FieldView> fields = new ArrayList<>();
        if (declaration instanceof RecordDeclaration recordDeclaration) {
            for (Parameter component : recordDeclaration.getParameters()) {
                String name = component.getNameAsString();
                fields.add(new FieldView(name, component.getType(), component, tagReader.read(component, name)));
            }
            return fields;
        }
        if (declaration instanceof ClassOrInterfaceDeclaration classDeclaration && !classDeclaration.isInterface()) {
            for (FieldDeclaration fieldDeclaration : classDeclaration.getFields()) {
                if (fieldDeclaration.hasModifier(Modifier.Keyword.STATIC)
                        || fieldDeclaration.hasModifier(Modifier.Keyword.TRANSIENT)) {
                    continue;
                }
                for (VariableDeclarator variable : fieldDeclaration.getVariables()) {
                    String name = variable.getNameAsString();
                    fields.add(new FieldView(name, variable.getType(), fieldDeclaration,
                            tagReader.read(fieldDeclaration, name)));
                }
            }
            return fields;
        }
        return null;
    }

    /**
     * The doc comment prose of a field, or its trailing comment when the doc comment has none.
     */
    private static String describe(Node node, CommentBlocks comments) {
        String doc = comments.docFor(node).map(b -> CommentBlocks.prose(b.text())).orElse(null);
        if (doc != null) {
            return doc;
        }
        return comments.trailingFor(node).map(b -> CommentBlocks.prose(b.text())).orElse(null);
    }

    private void applyFieldOverride(SchemaRecord record, Map<String, Schema<Object>> properties, String propertyName,
                                    Annotation.Field field) {
        Schema<Object> schema = record.getSchema();
        Schema<Object> property = properties.get(propertyName);
        if (property == null) {
            return;
        }
        if (TypeResolver.isEmptyNode(property) && field.type() != null) {
            Schema<Object> typed = typeResolver.resolveTypeExpression(field.type());
            typed.setDescription(property.getDescription());
            properties.put(propertyName, typed);
            property = typed;
        }
        if (field.description() != null && !field.description().isEmpty()) {
            property.setDescription(field.description());
        }
        if (field.example() != null) {
            property.setExample(field.example());
            record.getExamples().put(propertyName, field.example());
        }
        if (property.get$ref() == null) {
            if (!field.enumValues().isEmpty()) {
                property.setEnum(new ArrayList<>(field.enumValues()));
            }
            if (field.format() != null) {
                property.setFormat(field.format());
            }
        }
        if (field.required() && !schema.getRequired().contains(propertyName)) {
            schema.getRequired().add(propertyName);
        }
    }
}
