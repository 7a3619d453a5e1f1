package com.specgen.service.impl;

import com.specgen.assembler.SpecAssembler;
import com.specgen.exception.SpecGenException;
import com.specgen.model.SpecState;
import com.specgen.service.api.DocumentationService;
import com.specgen.service.api.SourceScanner;
import com.specgen.walker.DeclarationWalker;
import io.swagger.v3.oas.models.OpenAPI;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DocumentationServiceImpl implements DocumentationService {

    @Value("${specgen.default-version:" + SpecState.DEFAULT_OPENAPI_VERSION + "}")
    private String defaultVersion = SpecState.DEFAULT_OPENAPI_VERSION;

    @Value("${specgen.scan.fail-on-error:true}")
    private boolean failOnError = true;

    private final SourceScanner sourceScanner;
    private final DeclarationWalker declarationWalker;
    private final SpecAssembler specAssembler;

    public DocumentationServiceImpl(SourceScanner sourceScanner, DeclarationWalker declarationWalker, SpecAssembler specAssembler) {
        this.sourceScanner = sourceScanner;
        this.declarationWalker = declarationWalker;
        this.specAssembler = specAssembler;
    }

    /**
     * {@inheritDoc}
     * Files are walked one at a time into a single {@link SpecState}. A file that cannot be read or parsed
     * aborts the run, unless {@code specgen.scan.fail-on-error} is {@code false}, in which case it is skipped
     * with a warning.
     */
    @Override
    public SpecState collect(Path sourceRoot) {
        log.info("Collecting annotations from: {}", sourceRoot);
        List<Path> files = sourceScanner.findSourceFiles(sourceRoot);
        SpecState state = new SpecState(defaultVersion);
        int skipped = 0;
        for (Path file : files) {
            try {
                declarationWalker.walk(sourceScanner.parse(file), state);
            } catch (SpecGenException e) {
                if (failOnError) {
                    throw e;
                }
                skipped++;
                log.warn("Skipping {}: {}", file, e.getMessage());
            }
        }
        log.info("Scanned {} files ({} skipped): {} operations, {} models, {} explicit schemas.",
                files.size(), skipped, state.getOperations().size(), state.getGlobalSchemas().size(),
                state.getExplicitSchemas().size());
        return state;
    }

    @Override
    public OpenAPI generate(Path sourceRoot) {
        return specAssembler.assemble(collect(sourceRoot));
    }
}
