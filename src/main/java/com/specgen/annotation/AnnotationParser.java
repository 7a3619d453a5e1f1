package com.specgen.annotation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns comment text into typed {@link Annotation} records.
 * <p>
 * Parsing is line oriented. A line is an annotation when, after trimming, it starts with {@code !} immediately
 * followed by a verb. Prose lines, unknown verbs and malformed annotation lines produce nothing; none of them
 * raise an exception.
 */
@Component
public class AnnotationParser {

    public static final String MARKER = "!";

    private static final Pattern STATUS = Pattern.compile("\\d{3}|[1-5]XX|default", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERSION_PREFIX = Pattern.compile("v(?=\\d)");
    private static final Set<String> HTTP_METHODS =
            Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS", "HEAD", "TRACE");
    private static final Set<String> OAUTH_FLOWS =
            Set.of("implicit", "password", "clientCredentials", "authorizationCode");
    private static final Map<String, String> SECURITY_KINDS = Map.of(
            "apikey", "apiKey",
            "http", "http",
            "oauth2", "oauth2",
            "openidconnect", "openIdConnect");

    private final Map<String, Function<List<Token>, Optional<Annotation>>> handlers = new LinkedHashMap<>();

    public AnnotationParser() {
        handlers.put("api", this::parseApiVersion);
        handlers.put("info", this::parseInfo);
        handlers.put("contact", this::parseContact);
        handlers.put("license", this::parseLicense);
        handlers.put("tos", this::parseTermsOfService);
        handlers.put("server", this::parseServer);
        handlers.put("tag", this::parseTag);
        handlers.put("externaldocs", this::parseExternalDocs);
        handlers.put("docs", this::parseExternalDocs);
        handlers.put("link", this::parseLink);
        handlers.put("security", this::parseSecurity);
        handlers.put("scope", this::parseScope);
        handlers.put("schema", this::parseSchema);
        handlers.put("query", tokens -> parseParam("query", tokens));
        handlers.put("path", tokens -> parseParam("path", tokens));
        handlers.put("header", tokens -> parseParam("header", tokens));
        handlers.put("body", this::parseBody);
        handlers.put("ok", tokens -> parseResponse(false, tokens));
        handlers.put("error", tokens -> parseResponse(true, tokens));
        handlers.put("secure", this::parseSecure);
        handlers.put("model", this::parseModel);
        handlers.put("field", this::parseField);
        handlers.put("description", this::parseDescription);
        handlers.put("deprecated", tokens -> Optional.of(new Annotation.Deprecated()));
    }

    /**
     * Parses every annotation line of a comment block.
     *
     * @param text The comment text, possibly spanning several lines and mixing prose with annotations.
     * @return The recognized annotations in line order; never {@code null}.
     */
    public List<Annotation> parse(String text) {
        List<Annotation> annotations = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return annotations;
        }
        for (String line : text.split("\\R")) {
            parseLine(line).ifPresent(annotations::add);
        }
        return annotations;
    }

    /**
     * Parses a single line.
     *
     * @return The annotation, or empty when the line is prose, uses an unknown verb or is malformed.
     */
    public Optional<Annotation> parseLine(String line) {
        if (!isAnnotationLine(line)) {
            return Optional.empty();
        }
        String body = line.trim().substring(MARKER.length());
        int end = 0;
        while (end < body.length() && !Character.isWhitespace(body.charAt(end))) {
            end++;
        }
        String verb = body.substring(0, end);
        Optional<List<Token>> tokens = AnnotationLexer.tokenize(body.substring(end));
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        String upper = verb.toUpperCase(Locale.ROOT);
        if (HTTP_METHODS.contains(upper)) {
            return parseRoute(upper, tokens.get());
        }
        Function<List<Token>, Optional<Annotation>> handler = handlers.get(verb.toLowerCase(Locale.ROOT));
        return handler == null ? Optional.empty() : handler.apply(tokens.get());
    }

    /**
     * @return {@code true} when the line has the shape of an annotation, whether or not its verb is known.
     */
    public static boolean isAnnotationLine(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        return trimmed.length() > MARKER.length()
                && trimmed.startsWith(MARKER)
                && Character.isLetter(trimmed.charAt(MARKER.length()));
    }

    private Optional<Annotation> parseApiVersion(List<Token> tokens) {
        List<String> values = values(tokens);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.ApiVersion(values.get(0)));
    }

    private Optional<Annotation> parseInfo(List<Token> tokens) {
        String title = null;
        String version = null;
        String description = null;
        for (Token token : tokens) {
            if (!token.isValue()) {
                continue;
            }
            if (title == null) {
                title = token.text();
            } else if (version == null && token.isBare()) {
                version = VERSION_PREFIX.matcher(token.text()).lookingAt() ? token.text().substring(1) : token.text();
            } else if (description == null) {
                description = token.text();
            }
        }
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.Info(title, version, description));
    }

    private Optional<Annotation> parseContact(List<Token> tokens) {
        String email = null;
        String url = null;
        List<String> nameParts = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == Token.Type.ANGLE) {
                email = token.text();
            } else if (token.type() == Token.Type.PAREN || (token.isBare() && isUrl(token.text()))) {
                url = token.text();
            } else if (token.isBare() && token.text().contains("@")) {
                email = token.text();
            } else if (token.isValue()) {
                nameParts.add(token.text());
            }
        }
        String name = nameParts.isEmpty() ? null : String.join(" ", nameParts);
        if (name == null && email == null && url == null) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.Contact(name, email, url));
    }

    private Optional<Annotation> parseLicense(List<Token> tokens) {
        String url = null;
        List<String> nameParts = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == Token.Type.PAREN || token.type() == Token.Type.ANGLE
                    || (token.isBare() && isUrl(token.text()))) {
                url = token.text();
            } else if (token.isValue()) {
                nameParts.add(token.text());
            }
        }
        if (nameParts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.License(String.join(" ", nameParts), url));
    }

    private Optional<Annotation> parseTermsOfService(List<Token> tokens) {
        String url = firstLocation(tokens);
        return url == null ? Optional.empty() : Optional.of(new Annotation.TermsOfService(url));
    }

    private Optional<Annotation> parseServer(List<Token> tokens) {
        List<String> values = values(tokens);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.Server(values.get(0), joinFrom(values, 1)));
    }

    private Optional<Annotation> parseTag(List<Token> tokens) {
        List<String> values = values(tokens);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.Tag(values.get(0), joinFrom(values, 1)));
    }

    private Optional<Annotation> parseExternalDocs(List<Token> tokens) {
        List<String> values = values(tokens);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.ExternalDocs(values.get(0), joinFrom(values, 1)));
    }

    private Optional<Annotation> parseLink(List<Token> tokens) {
        String label = null;
        String url = null;
        for (Token token : tokens) {
            if (token.type() == Token.Type.PAREN || token.type() == Token.Type.ANGLE
                    || (token.isBare() && isUrl(token.text()))) {
                url = url == null ? token.text() : url;
            } else if (token.isValue() && label == null) {
                label = token.text();
            }
        }
        if (url == null) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.Link(label == null ? url : label, url));
    }

    private Optional<Annotation> parseSecurity(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(0).type() != Token.Type.COMPOUND) {
            return Optional.empty();
        }
        String name = tokens.get(0).compoundName();
        String kind = SECURITY_KINDS.get(tokens.get(0).compoundType().toLowerCase(Locale.ROOT));
        if (kind == null) {
            return Optional.empty();
        }
        List<String> positional = new ArrayList<>();
        String description = null;
        String bearerFormat = null;
        for (Token token : tokens.subList(1, tokens.size())) {
            if (token.type() == Token.Type.QUOTED) {
                description = description == null ? token.text() : description;
            } else if (token.type() == Token.Type.FLAG && "bearerFormat".equalsIgnoreCase(token.key())) {
                bearerFormat = token.text();
            } else if (token.isBare() || token.type() == Token.Type.ANGLE || token.type() == Token.Type.PAREN) {
                positional.add(token.text());
            }
        }
        String p0 = positional.size() > 0 ? positional.get(0) : null;
        String p1 = positional.size() > 1 ? positional.get(1) : null;
        String p2 = positional.size() > 2 ? positional.get(2) : null;
        switch (kind) {
            case "apiKey":
                return Optional.of(new Annotation.Security(name, kind, p0 == null ? "header" : p0,
                        p1 == null ? name : p1, null, description, null));
            case "http":
                return Optional.of(new Annotation.Security(name, kind, p0 == null ? "bearer" : p0,
                        null, null, description, bearerFormat));
            case "oauth2":
                if (p0 != null && OAUTH_FLOWS.contains(p0)) {
                    return Optional.of(new Annotation.Security(name, kind, p0, p1, p2, description, null));
                }
                return Optional.of(new Annotation.Security(name, kind, "implicit", p0, p1, description, null));
            default:
                return Optional.of(new Annotation.Security(name, kind, null, p0, null, description, null));
        }
    }

    private Optional<Annotation> parseScope(List<Token> tokens) {
        List<String> values = values(tokens);
        if (values.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.Scope(values.get(0), values.get(1), joinFrom(values, 2)));
    }

    private Optional<Annotation> parseSchema(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(0).isBare()) {
            return Optional.empty();
        }
        Token first = tokens.get(0);
        String name = first.compoundName();
        String type = first.compoundType();
        String description = null;
        for (Token token : tokens.subList(1, tokens.size())) {
            if (token.isBare() && type == null) {
                type = token.text();
            } else if (token.type() == Token.Type.QUOTED && description == null) {
                description = token.text();
            }
        }
        return Optional.of(new Annotation.Schema(name, type, description, flag(tokens, "format"),
                ValueParser.parseList(flag(tokens, "enum")), ValueParser.parse(flag(tokens, "example"))));
    }

    private Optional<Annotation> parseRoute(String method, List<Token> tokens) {
        String path = null;
        String operationId = null;
        String summary = null;
        boolean deprecated = false;
        boolean afterArrow = false;
        List<String> tags = new ArrayList<>();
        for (Token token : tokens) {
            switch (token.type()) {
                case ARROW:
                    afterArrow = true;
                    break;
                case TAG:
                    tags.add(token.text());
                    break;
                case QUOTED:
                    if (path == null) {
                        path = token.text();
                    } else if (summary == null) {
                        summary = token.text();
                    }
                    break;
                case WORD:
                case COMPOUND:
                    if (path == null && !afterArrow) {
                        path = token.text();
                    } else if ("deprecated".equalsIgnoreCase(token.text())) {
                        deprecated = true;
                    } else if (operationId == null) {
                        operationId = token.text();
                    }
                    break;
                default:
                    break;
            }
        }
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.Route(method, path, operationId, summary, tags, deprecated));
    }

    private Optional<Annotation> parseParam(String location, List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(0).isBare()) {
            return Optional.empty();
        }
        Token first = tokens.get(0);
        String type = first.compoundType() == null ? "string" : first.compoundType();
        return Optional.of(new Annotation.Param(location, first.compoundName(), type, firstQuoted(tokens),
                hasWord(tokens, "required"), ValueParser.parse(flag(tokens, "default")),
                ValueParser.parse(flag(tokens, "example")), ValueParser.parseList(flag(tokens, "enum")),
                flag(tokens, "format")));
    }

    private Optional<Annotation> parseBody(List<Token> tokens) {
        String schema = null;
        for (Token token : tokens) {
            if (token.isBare() && !"required".equalsIgnoreCase(token.text())) {
                schema = token.text();
                break;
            }
        }
        if (schema == null) {
            return Optional.empty();
        }
        return Optional.of(new Annotation.Body(schema, firstQuoted(tokens), hasWord(tokens, "required")));
    }

    private Optional<Annotation> parseResponse(boolean error, List<Token> tokens) {
        String status = null;
        String schema = null;
        String description = null;
        List<String> prose = new ArrayList<>();
        for (Token token : tokens) {
            if (token.isBare()) {
                if (status == null && schema == null && STATUS.matcher(token.text()).matches()) {
                    status = token.text().toUpperCase(Locale.ROOT).equals("DEFAULT") ? "default" : token.text().toUpperCase(Locale.ROOT);
                } else if (schema == null) {
                    schema = token.text();
                } else {
                    prose.add(token.text());
                }
            } else if (token.type() == Token.Type.QUOTED && description == null) {
                description = token.text();
            }
        }
        if (status == null) {
            if (error) {
                return Optional.empty();
            }
            status = "200";
        }
        if (description == null && !prose.isEmpty()) {
            description = String.join(" ", prose);
        }
        return Optional.of(new Annotation.Response(error, status, schema, description));
    }

    private Optional<Annotation> parseSecure(List<Token> tokens) {
        List<String> names = new ArrayList<>();
        for (String value : values(tokens)) {
            for (String name : value.split(",")) {
                if (!name.isBlank()) {
                    names.add(name.trim());
                }
            }
        }
        return names.isEmpty() ? Optional.empty() : Optional.of(new Annotation.Secure(names));
    }

    private Optional<Annotation> parseModel(List<Token> tokens) {
        String description = firstQuoted(tokens);
        if (description == null) {
            description = joinFrom(values(tokens), 0);
        }
        return Optional.of(new Annotation.Model(description));
    }

    private Optional<Annotation> parseField(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(0).isBare()) {
            return Optional.empty();
        }
        Token first = tokens.get(0);
        return Optional.of(new Annotation.Field(first.compoundName(), first.compoundType(), firstQuoted(tokens),
                hasWord(tokens, "required"), ValueParser.parse(flag(tokens, "example")),
                ValueParser.parseList(flag(tokens, "enum")), flag(tokens, "format")));
    }

    private Optional<Annotation> parseDescription(List<Token> tokens) {
        String text = joinFrom(values(tokens), 0);
        return text == null ? Optional.empty() : Optional.of(new Annotation.Description(text));
    }

    private static List<String> values(List<Token> tokens) {
        List<String> values = new ArrayList<>();
        for (Token token : tokens) {
            if (token.isValue()) {
                values.add(token.text());
            }
        }
        return values;
    }

    private static String joinFrom(List<String> values, int from) {
        if (values.size() <= from) {
            return null;
        }
        String joined = String.join(" ", values.subList(from, values.size())).trim();
        return joined.isEmpty() ? null : joined;
    }

    private static String firstQuoted(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.type() == Token.Type.QUOTED) {
                return token.text();
            }
        }
        return null;
    }

    private static String firstLocation(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.isValue() || token.type() == Token.Type.ANGLE || token.type() == Token.Type.PAREN) {
                return token.text();
            }
        }
        return null;
    }

    private static boolean hasWord(List<Token> tokens, String word) {
        for (Token token : tokens) {
            if (token.type() == Token.Type.WORD && word.equalsIgnoreCase(token.text())) {
                return true;
            }
        }
        return false;
    }

    private static String flag(List<Token> tokens, String key) {
        for (Token token : tokens) {
            if (token.type() == Token.Type.FLAG && key.equalsIgnoreCase(token.key())) {
                return token.text();
            }
        }
        return null;
    }

    private static boolean isUrl(String text) {
        return text.contains("://") || text.startsWith("www.");
    }
}
