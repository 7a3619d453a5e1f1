package com.specgen.walker;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.specgen.annotation.Annotation;
import com.specgen.annotation.AnnotationParser;
import com.specgen.model.OperationRecord;
import com.specgen.model.SourceFile;
import com.specgen.model.SpecState;
import com.specgen.schema.TypeResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Visits the declarations of one parsed source file and accumulates what their annotations describe into a
 * {@link SpecState}.
 * <p>
 * A file is processed in three passes, each in source order:
 * <ol>
 *     <li>every comment block, for API-level annotations and {@code !schema} lines;</li>
 *     <li>every method whose doc comment holds annotations, for one operation per method;</li>
 *     <li>every type whose doc comment holds {@code !model}, for one schema per class or record.</li>
 * </ol>
 */
@Component
@Slf4j
public class DeclarationWalker {

    private final AnnotationParser annotationParser;
    private final TypeResolver typeResolver;
    private final ModelSchemaBuilder modelSchemaBuilder;

    public DeclarationWalker(AnnotationParser annotationParser, TypeResolver typeResolver, SerializationTagReader tagReader) {
        this.annotationParser = annotationParser;
        this.typeResolver = typeResolver;
        this.modelSchemaBuilder = new ModelSchemaBuilder(annotationParser, typeResolver, tagReader);
    }

    /**
     * Walks one file.
     *
     * @param file  The parsed file.
     * @param state The run's accumulator, mutated in place.
     */
    public void walk(SourceFile file, SpecState state) {
        CompilationUnit unit = file.unit();
        CommentBlocks comments = CommentBlocks.of(unit, file.lines());

        SpecStateHandler apiHandler = new SpecStateHandler(state, typeResolver);
        for (CommentBlock block : comments.all()) {
            for (Annotation annotation : annotationParser.parse(block.text())) {
                annotation.accept(apiHandler);
            }
        }

        for (MethodDeclaration method : unit.findAll(MethodDeclaration.class)) {
            comments.docFor(method).ifPresent(doc -> walkMethod(file, method, doc, state));
        }

        for (TypeDeclaration<?> type : unit.findAll(TypeDeclaration.class)) {
            comments.docFor(type)
                    .filter(doc -> CommentBlocks.hasAnnotations(doc.text()))
                    .flatMap(doc -> modelSchemaBuilder.build(type, doc.text(), comments))
                    .ifPresent(record -> {
                        if (state.putGlobalSchema(record)) {
                            log.debug("Found model '{}' in {}", record.getName(), file.path());
                        } else {
                            log.debug("Model '{}' in {} is already known, keeping the first one.", record.getName(), file.path());
                        }
                    });
        }
    }

    private void walkMethod(SourceFile file, MethodDeclaration method, CommentBlock doc, SpecState state) {
        if (!CommentBlocks.hasAnnotations(doc.text())) {
            return;
        }
        List<Annotation> annotations = annotationParser.parse(doc.text());
        if (annotations.isEmpty()) {
            return;
        }
        OperationRecord operation = new OperationFolder(typeResolver).fold(annotations);
        if (operation.getDescription() == null) {
            operation.setDescription(CommentBlocks.prose(doc.text()));
        }
        if (state.addOperation(operation)) {
            log.debug("Found operation {} {} on {}() in {}", operation.getMethod(), operation.getPath(),
                    method.getNameAsString(), file.path());
        } else {
            log.debug("Dropping annotations on {}() in {}: no route annotation.", method.getNameAsString(), file.path());
        }
    }
}
