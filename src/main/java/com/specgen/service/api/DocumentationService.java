package com.specgen.service.api;

import com.specgen.model.SpecState;
import io.swagger.v3.oas.models.OpenAPI;

import java.nio.file.Path;

public interface DocumentationService {
    /**
     * Walks every source file under a directory and collects what its annotations describe.
     * @param sourceRoot The directory to scan.
     * @return The accumulated state of the run.
     */
    SpecState collect(Path sourceRoot);

    /**
     * Collects the annotations under a directory and assembles them into one document.
     * @param sourceRoot The directory to scan.
     * @return The assembled OpenAPI document.
     */
    OpenAPI generate(Path sourceRoot);
}
