package com.specgen.walker;

import com.specgen.annotation.Annotation;
import com.specgen.annotation.AnnotationVisitor;
import com.specgen.model.LinkRecord;
import com.specgen.model.SchemaRecord;
import com.specgen.model.SpecState;
import com.specgen.schema.TypeResolver;
import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.security.OAuthFlow;
import io.swagger.v3.oas.models.security.OAuthFlows;
import io.swagger.v3.oas.models.security.Scopes;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies API-level annotations (version, info, servers, tags, security, explicit schemas) to a
 * {@link SpecState}. Operation and model annotations are ignored here.
 */
@Slf4j
class SpecStateHandler implements AnnotationVisitor {

    private final SpecState state;
    private final TypeResolver typeResolver;

    SpecStateHandler(SpecState state, TypeResolver typeResolver) {
        this.state = state;
        this.typeResolver = typeResolver;
    }

    @Override
    public void visitApiVersion(Annotation.ApiVersion annotation) {
        state.setOpenApiVersion(annotation.version());
    }

    @Override
    public void visitInfo(Annotation.Info annotation) {
        state.getInfo().setTitle(annotation.title());
        if (annotation.version() != null) {
            state.getInfo().setVersion(annotation.version());
        }
        if (annotation.description() != null) {
            state.getInfo().setDescription(annotation.description());
        }
    }

    @Override
    public void visitContact(Annotation.Contact annotation) {
        state.getInfo().setContact(new Contact()
                .name(annotation.name())
                .email(annotation.email())
                .url(annotation.url()));
    }

    @Override
    public void visitLicense(Annotation.License annotation) {
        state.getInfo().setLicense(new License().name(annotation.name()).url(annotation.url()));
    }

    @Override
    public void visitTermsOfService(Annotation.TermsOfService annotation) {
        state.getInfo().setTermsOfService(annotation.url());
    }

    @Override
    public void visitServer(Annotation.Server annotation) {
        state.getServers().add(new Server().url(annotation.url()).description(annotation.description()));
    }

    @Override
    public void visitTag(Annotation.Tag annotation) {
        state.getTags().add(new Tag().name(annotation.name()).description(annotation.description()));
    }

    @Override
    public void visitExternalDocs(Annotation.ExternalDocs annotation) {
        state.setExternalDocs(new ExternalDocumentation().url(annotation.url()).description(annotation.description()));
    }

    @Override
    public void visitLink(Annotation.Link annotation) {
        state.getLinks().add(new LinkRecord(annotation.label(), annotation.url()));
    }

    @Override
    public void visitSecurity(Annotation.Security annotation) {
        SecurityScheme scheme = new SecurityScheme().description(annotation.description());
        switch (annotation.schemeType()) {
            case "apiKey":
                scheme.type(SecurityScheme.Type.APIKEY)
                        .in(apiKeyLocation(annotation.location()))
                        .name(annotation.url());
                break;
            case "http":
                scheme.type(SecurityScheme.Type.HTTP)
                        .scheme(annotation.location())
                        .bearerFormat(annotation.bearerFormat());
                break;
            case "oauth2":
                scheme.type(SecurityScheme.Type.OAUTH2).flows(oauthFlows(annotation));
                break;
            case "openIdConnect":
                scheme.type(SecurityScheme.Type.OPENIDCONNECT).openIdConnectUrl(annotation.url());
                break;
            default:
                log.debug("Ignoring security scheme '{}' of unsupported kind '{}'.", annotation.name(), annotation.schemeType());
                return;
        }
        state.getSecuritySchemes().put(annotation.name(), scheme);
    }

    /**
     * Adds the scope to every flow of an already declared OAuth2 scheme. Scopes for unknown or non-OAuth2
     * schemes are dropped.
     */
    @Override
    public void visitScope(Annotation.Scope annotation) {
        SecurityScheme scheme = state.getSecuritySchemes().get(annotation.scheme());
        if (scheme == null || scheme.getFlows() == null) {
            log.debug("Dropping scope '{}': no OAuth2 scheme named '{}' is declared yet.", annotation.name(), annotation.scheme());
            return;
        }
        for (OAuthFlow flow : flowsOf(scheme.getFlows())) {
            if (flow.getScopes() == null) {
                flow.setScopes(new Scopes());
            }
            flow.getScopes().addString(annotation.name(), annotation.description() == null ? "" : annotation.description());
        }
    }

    @Override
    public void visitSchema(Annotation.Schema annotation) {
        Schema<Object> schema = typeResolver.resolveTypeExpression(annotation.type() == null ? "object" : annotation.type());
        if (schema.get$ref() == null) {
            schema.setDescription(annotation.description());
            if (annotation.format() != null) {
                schema.setFormat(annotation.format());
            }
            if (!annotation.enumValues().isEmpty()) {
                schema.setEnum(new ArrayList<>(annotation.enumValues()));
            }
            if (annotation.example() != null) {
                schema.setExample(annotation.example());
            }
        }
        SchemaRecord record = new SchemaRecord();
        record.setName(annotation.name());
        record.setDescription(annotation.description());
        record.setSchema(schema);
        if (!state.putExplicitSchema(record)) {
            log.debug("Schema '{}' is already declared, keeping the first declaration.", annotation.name());
        }
    }

    private static OAuthFlows oauthFlows(Annotation.Security annotation) {
        OAuthFlows flows = new OAuthFlows();
        String url = annotation.url();
        switch (annotation.location()) {
            case "password":
                flows.password(new OAuthFlow().tokenUrl(url).scopes(new Scopes()));
                break;
            case "clientCredentials":
                flows.clientCredentials(new OAuthFlow().tokenUrl(url).scopes(new Scopes()));
                break;
            case "authorizationCode":
                flows.authorizationCode(new OAuthFlow()
                        .authorizationUrl(url)
                        .tokenUrl(annotation.secondaryUrl() != null ? annotation.secondaryUrl() : url)
                        .scopes(new Scopes()));
                break;
            default:
                flows.implicit(new OAuthFlow().authorizationUrl(url).scopes(new Scopes()));
                break;
        }
        return flows;
    }

    private static List<OAuthFlow> flowsOf(OAuthFlows flows) {
        List<OAuthFlow> result = new ArrayList<>();
        if (flows.getImplicit() != null) {
            result.add(flows.getImplicit());
        }
        if (flows.getPassword() != null) {
            result.add(flows.getPassword());
        }
        if (flows.getClientCredentials() != null) {
            result.add(flows.getClientCredentials());
        }
        if (flows.getAuthorizationCode() != null) {
            result.add(flows.getAuthorizationCode());
        }
        return result;
    }

    private static SecurityScheme.In apiKeyLocation(String location) {
        if (location == null) {
            return SecurityScheme.In.HEADER;
        }
        switch (location.toLowerCase(Locale.ROOT)) {
            case "query":
                return SecurityScheme.In.QUERY;
            case "cookie":
                return SecurityScheme.In.COOKIE;
            default:
                return SecurityScheme.In.HEADER;
        }
    }
}
