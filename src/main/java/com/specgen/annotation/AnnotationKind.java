package com.specgen.annotation;

/**
 * The closed set of annotation kinds understood by the {@link AnnotationParser}.
 */
public enum AnnotationKind {
    API_VERSION,
    INFO,
    CONTACT,
    LICENSE,
    TERMS_OF_SERVICE,
    SERVER,
    TAG,
    EXTERNAL_DOCS,
    LINK,
    SECURITY,
    SCOPE,
    SCHEMA,
    ROUTE,
    QUERY_PARAM,
    PATH_PARAM,
    HEADER_PARAM,
    BODY,
    SUCCESS_RESPONSE,
    ERROR_RESPONSE,
    SECURE,
    MODEL,
    FIELD,
    DESCRIPTION,
    DEPRECATED
}
