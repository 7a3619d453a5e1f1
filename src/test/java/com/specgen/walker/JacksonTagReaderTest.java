package com.specgen.walker;

import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonTagReaderTest {

    private static final String SOURCE = """
            import com.fasterxml.jackson.annotation.*;

            class Tagged {
                String plain;
                @JsonProperty("user_name") String renamed;
                @JsonProperty(value = "v", required = true) String named;
                @JsonProperty("") String blank;
                @JsonIgnore String hidden;
                @JsonIgnore(false) String shown;
                @com.fasterxml.jackson.annotation.JsonIgnore String qualified;
                @JsonInclude(JsonInclude.Include.NON_NULL) String optional;
                @JsonInclude(value = JsonInclude.Include.NON_EMPTY) String optionalNamed;
                @JsonInclude(JsonInclude.Include.ALWAYS) String always;
            }

            record Point(@JsonProperty("x_pos") int x, int y) {}
            """;

    private CompilationUnit unit;
    private JacksonTagReader reader;

    @BeforeEach
    void setUp() {
        StaticJavaParser.getParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        unit = StaticJavaParser.parse(SOURCE);
        reader = new JacksonTagReader();
    }

    private FieldTag field(String name) {
        FieldDeclaration declaration = unit.findFirst(FieldDeclaration.class,
                f -> f.getVariable(0).getNameAsString().equals(name)).orElseThrow();
        return reader.read(declaration, name);
    }

    private FieldTag component(String name) {
        Parameter parameter = unit.findFirst(Parameter.class, p -> p.getNameAsString().equals(name)).orElseThrow();
        return reader.read(parameter, name);
    }

    @Test
    void read_usesDeclaredNameWithoutAnnotations() {
        assertThat(field("plain")).isEqualTo(new FieldTag("plain", false));
    }

    @Test
    void read_jsonPropertyRenames() {
        assertThat(field("renamed").name()).isEqualTo("user_name");
        assertThat(field("named").name()).isEqualTo("v");
        assertThat(field("blank").name()).isEqualTo("blank");
    }

    @Test
    void read_jsonIgnoreExcludes() {
        assertThat(field("hidden").excluded()).isTrue();
        assertThat(field("hidden").name()).isEqualTo(FieldTag.EXCLUDED);
        assertThat(field("qualified").excluded()).isTrue();
        assertThat(field("shown").excluded()).isFalse();
    }

    @Test
    void read_jsonIncludeNonDefaultInclusionsMarkOmitEmpty() {
        assertThat(field("optional").omitEmpty()).isTrue();
        assertThat(field("optionalNamed").omitEmpty()).isTrue();
        assertThat(field("always").omitEmpty()).isFalse();
    }

    @Test
    void read_recordComponents() {
        assertThat(component("x")).isEqualTo(new FieldTag("x_pos", false));
        assertThat(component("y")).isEqualTo(new FieldTag("y", false));
    }
}
