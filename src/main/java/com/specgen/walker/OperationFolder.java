package com.specgen.walker;

import com.specgen.annotation.Annotation;
import com.specgen.annotation.AnnotationVisitor;
import com.specgen.model.OperationRecord;
import com.specgen.schema.TypeResolver;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.security.SecurityRequirement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Folds the annotations of one method's doc comment into an {@link OperationRecord}.
 */
class OperationFolder implements AnnotationVisitor {

    static final String JSON_MEDIA_TYPE = "application/json";

    /** Schema tokens that mean "this response has no body". */
    static final Set<String> NO_BODY = Set.of("-", "nil", "none", "null", "void");

    private final TypeResolver typeResolver;
    private final OperationRecord operation = new OperationRecord();

    OperationFolder(TypeResolver typeResolver) {
        this.typeResolver = typeResolver;
    }

    OperationRecord fold(List<Annotation> annotations) {
        annotations.forEach(annotation -> annotation.accept(this));
        return operation;
    }

    @Override
    public void visitRoute(Annotation.Route annotation) {
        operation.setMethod(annotation.method());
        operation.setPath(annotation.path());
        operation.setOperationId(annotation.operationId());
        operation.setSummary(annotation.summary());
        operation.getTags().addAll(annotation.tags());
        operation.setDeprecated(operation.isDeprecated() || annotation.deprecated());
    }

    @Override
    public void visitParam(Annotation.Param annotation) {
        Schema<Object> schema = typeResolver.resolveTypeExpression(annotation.type());
        if (schema.get$ref() == null) {
            if (annotation.defaultValue() != null) {
                schema.setDefault(annotation.defaultValue());
            }
            if (!annotation.enumValues().isEmpty()) {
                schema.setEnum(new ArrayList<>(annotation.enumValues()));
            }
            if (annotation.format() != null) {
                schema.setFormat(annotation.format());
            }
        }
        boolean required = "path".equals(annotation.location()) || annotation.required();
        Parameter parameter = new Parameter()
                .name(annotation.name())
                .in(annotation.location())
                .description(annotation.description())
                .required(required ? Boolean.TRUE : null)
                .schema(schema);
        if (annotation.example() != null) {
            parameter.setExample(annotation.example());
        }
        operation.getParameters().add(parameter);
    }

    @Override
    public void visitBody(Annotation.Body annotation) {
        operation.setRequestBody(new RequestBody()
                .description(annotation.description())
                .required(annotation.required() ? Boolean.TRUE : null)
                .content(jsonContent(annotation.schema())));
    }

    @Override
    public void visitResponse(Annotation.Response annotation) {
        ApiResponse response = new ApiResponse()
                .description(annotation.description() == null ? "" : annotation.description());
        String schema = annotation.schema();
        if (schema != null && !NO_BODY.contains(schema.toLowerCase(Locale.ROOT))) {
            response.setContent(jsonContent(schema));
        }
        operation.getResponses().put(annotation.status(), response);
    }

    @Override
    public void visitSecure(Annotation.Secure annotation) {
        for (String name : annotation.names()) {
            operation.getSecurity().add(new SecurityRequirement().addList(name, new ArrayList<>()));
        }
    }

    @Override
    public void visitDescription(Annotation.Description annotation) {
        operation.setDescription(annotation.text());
    }

    @Override
    public void visitDeprecated(Annotation.Deprecated annotation) {
        operation.setDeprecated(true);
    }

    private Content jsonContent(String schemaToken) {
        return new Content().addMediaType(JSON_MEDIA_TYPE, new MediaType().schema(typeResolver.resolveReferenceToken(schemaToken)));
    }
}
