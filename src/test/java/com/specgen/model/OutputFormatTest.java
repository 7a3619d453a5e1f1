package com.specgen.model;

import com.specgen.exception.SpecGenException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputFormatTest {

    @Test
    void fromName_acceptsKnownNamesInAnyCase() {
        assertThat(OutputFormat.fromName("yaml")).isEqualTo(OutputFormat.YAML);
        assertThat(OutputFormat.fromName("YML")).isEqualTo(OutputFormat.YAML);
        assertThat(OutputFormat.fromName("Json")).isEqualTo(OutputFormat.JSON);
    }

    @Test
    void fromName_rejectsOtherNames() {
        assertThatThrownBy(() -> OutputFormat.fromName("xml"))
                .isInstanceOf(SpecGenException.class)
                .hasMessage("Unsupported output format 'xml'. Use 'yaml' or 'json'.");
    }

    @Test
    void detect_usesTheFileExtension() {
        assertThat(OutputFormat.detect(Path.of("api/openapi.json"))).isEqualTo(OutputFormat.JSON);
        assertThat(OutputFormat.detect(Path.of("openapi.yaml"))).isEqualTo(OutputFormat.YAML);
        assertThat(OutputFormat.detect(Path.of("openapi"))).isEqualTo(OutputFormat.YAML);
        assertThat(OutputFormat.detect(null)).isEqualTo(OutputFormat.YAML);
    }
}
