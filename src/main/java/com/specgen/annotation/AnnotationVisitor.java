package com.specgen.annotation;

/**
 * Dispatch target for {@link Annotation#accept(AnnotationVisitor)}.
 * <p>
 * Every method has an empty default body, so an implementation only overrides the kinds that are meaningful
 * in its context: the API-level handler ignores routes and the operation folder ignores servers.
 */
public interface AnnotationVisitor {

    default void visitApiVersion(Annotation.ApiVersion annotation) {
    }

    default void visitInfo(Annotation.Info annotation) {
    }

    default void visitContact(Annotation.Contact annotation) {
    }

    default void visitLicense(Annotation.License annotation) {
    }

    default void visitTermsOfService(Annotation.TermsOfService annotation) {
    }

    default void visitServer(Annotation.Server annotation) {
    }

    default void visitTag(Annotation.Tag annotation) {
    }

    default void visitExternalDocs(Annotation.ExternalDocs annotation) {
    }

    default void visitLink(Annotation.Link annotation) {
    }

    default void visitSecurity(Annotation.Security annotation) {
    }

    default void visitScope(Annotation.Scope annotation) {
    }

    default void visitSchema(Annotation.Schema annotation) {
    }

    default void visitRoute(Annotation.Route annotation) {
    }

    default void visitParam(Annotation.Param annotation) {
    }

    default void visitBody(Annotation.Body annotation) {
    }

    default void visitResponse(Annotation.Response annotation) {
    }

    default void visitSecure(Annotation.Secure annotation) {
    }

    default void visitModel(Annotation.Model annotation) {
    }

    default void visitField(Annotation.Field annotation) {
    }

    default void visitDescription(Annotation.Description annotation) {
    }

    default void visitDeprecated(Annotation.Deprecated annotation) {
    }
}
