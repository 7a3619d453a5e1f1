package com.specgen.model;

import com.specgen.exception.SpecGenException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * The encodings the generated document can be written in.
 */
public enum OutputFormat {
    YAML,
    JSON;

    /**
     * @param name "yaml", "yml" or "json", in any case.
     * @throws SpecGenException for any other name.
     */
    public static OutputFormat fromName(String name) {
        if (name == null) {
            throw new SpecGenException("Output format must not be null.");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "yaml":
            case "yml":
                return YAML;
            case "json":
                return JSON;
            default:
                throw new SpecGenException("Unsupported output format '" + name + "'. Use 'yaml' or 'json'.");
        }
    }

    /**
     * Picks the format from a file extension, defaulting to YAML.
     */
    public static OutputFormat detect(Path file) {
        if (file != null && file.getFileName() != null
                && file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
            return JSON;
        }
        return YAML;
    }
}
