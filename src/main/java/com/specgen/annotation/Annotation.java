package com.specgen.annotation;

import java.util.List;

/**
 * A typed record produced from a single {@code !}-prefixed comment line.
 * <p>
 * Every variant is an immutable record nested in this interface. Consumers dispatch on the variant through
 * {@link #accept(AnnotationVisitor)}; absent optional values are {@code null}, absent lists are empty.
 */
public sealed interface Annotation {

    AnnotationKind kind();

    void accept(AnnotationVisitor visitor);

    /** {@code !api 3.0.3} */
    record ApiVersion(String version) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.API_VERSION; }
        public void accept(AnnotationVisitor visitor) { visitor.visitApiVersion(this); }
    }

    /** {@code !info "Title" v1.0.0 "Description"} */
    record Info(String title, String version, String description) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.INFO; }
        public void accept(AnnotationVisitor visitor) { visitor.visitInfo(this); }
    }

    /** {@code !contact "Name" <email> url} */
    record Contact(String name, String email, String url) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.CONTACT; }
        public void accept(AnnotationVisitor visitor) { visitor.visitContact(this); }
    }

    /** {@code !license MIT url} */
    record License(String name, String url) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.LICENSE; }
        public void accept(AnnotationVisitor visitor) { visitor.visitLicense(this); }
    }

    /** {@code !tos url} */
    record TermsOfService(String url) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.TERMS_OF_SERVICE; }
        public void accept(AnnotationVisitor visitor) { visitor.visitTermsOfService(this); }
    }

    /** {@code !server url "Description"} */
    record Server(String url, String description) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.SERVER; }
        public void accept(AnnotationVisitor visitor) { visitor.visitServer(this); }
    }

    /** {@code !tag name "Description"} */
    record Tag(String name, String description) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.TAG; }
        public void accept(AnnotationVisitor visitor) { visitor.visitTag(this); }
    }

    /** {@code !externalDocs url "Description"} */
    record ExternalDocs(String url, String description) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.EXTERNAL_DOCS; }
        public void accept(AnnotationVisitor visitor) { visitor.visitExternalDocs(this); }
    }

    /** {@code !link "Label" url} */
    record Link(String label, String url) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.LINK; }
        public void accept(AnnotationVisitor visitor) { visitor.visitLink(this); }
    }

    /**
     * {@code !security name:kind location url url2 "Description"}
     *
     * @param schemeType One of {@code apiKey}, {@code http}, {@code oauth2}, {@code openIdConnect}.
     * @param location   The apiKey location, the HTTP auth scheme or the OAuth2 flow name.
     */
    record Security(String name, String schemeType, String location, String url, String secondaryUrl,
                    String description, String bearerFormat) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.SECURITY; }
        public void accept(AnnotationVisitor visitor) { visitor.visitSecurity(this); }
    }

    /** {@code !scope scheme scopeName "Description"} */
    record Scope(String scheme, String name, String description) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.SCOPE; }
        public void accept(AnnotationVisitor visitor) { visitor.visitScope(this); }
    }

    /** {@code !schema Name type "Description" format=f enum=a,b example=v} */
    record Schema(String name, String type, String description, String format, List<Object> enumValues,
                  Object example) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.SCHEMA; }
        public void accept(AnnotationVisitor visitor) { visitor.visitSchema(this); }
    }

    /** {@code !GET /path -> operationId "Summary" #tag deprecated} */
    record Route(String method, String path, String operationId, String summary, List<String> tags,
                 boolean deprecated) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.ROUTE; }
        public void accept(AnnotationVisitor visitor) { visitor.visitRoute(this); }
    }

    /**
     * {@code !query name:type "Description" required default=v example=v enum=a,b format=f}, and the same for
     * {@code !path} and {@code !header}.
     *
     * @param location {@code query}, {@code path} or {@code header}.
     */
    record Param(String location, String name, String type, String description, boolean required,
                 Object defaultValue, Object example, List<Object> enumValues, String format) implements Annotation {
        public AnnotationKind kind() {
            switch (location) {
                case "path":
                    return AnnotationKind.PATH_PARAM;
                case "header":
                    return AnnotationKind.HEADER_PARAM;
                default:
                    return AnnotationKind.QUERY_PARAM;
            }
        }
        public void accept(AnnotationVisitor visitor) { visitor.visitParam(this); }
    }

    /** {@code !body Schema "Description" required} */
    record Body(String schema, String description, boolean required) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.BODY; }
        public void accept(AnnotationVisitor visitor) { visitor.visitBody(this); }
    }

    /**
     * {@code !ok 200 Schema "Description"} or {@code !error 404 Schema "Description"}.
     *
     * @param schema The schema token, or {@code null} when the line names none.
     */
    record Response(boolean error, String status, String schema, String description) implements Annotation {
        public AnnotationKind kind() { return error ? AnnotationKind.ERROR_RESPONSE : AnnotationKind.SUCCESS_RESPONSE; }
        public void accept(AnnotationVisitor visitor) { visitor.visitResponse(this); }
    }

    /** {@code !secure scheme1 scheme2} */
    record Secure(List<String> names) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.SECURE; }
        public void accept(AnnotationVisitor visitor) { visitor.visitSecure(this); }
    }

    /** {@code !model "Description"} */
    record Model(String description) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.MODEL; }
        public void accept(AnnotationVisitor visitor) { visitor.visitModel(this); }
    }

    /** {@code !field name:type "Description" required example=v enum=a,b format=f} */
    record Field(String name, String type, String description, boolean required, Object example,
                 List<Object> enumValues, String format) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.FIELD; }
        public void accept(AnnotationVisitor visitor) { visitor.visitField(this); }
    }

    /** {@code !description "Text"} */
    record Description(String text) implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.DESCRIPTION; }
        public void accept(AnnotationVisitor visitor) { visitor.visitDescription(this); }
    }

    /** {@code !deprecated} */
    record Deprecated() implements Annotation {
        public AnnotationKind kind() { return AnnotationKind.DEPRECATED; }
        public void accept(AnnotationVisitor visitor) { visitor.visitDeprecated(this); }
    }
}
