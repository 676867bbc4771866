package com.smartservice.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.extract.EntityExtractor;
import com.smartservice.core.ir.CompiledDescriptor;
import com.smartservice.core.ir.IrEmitter;
import com.smartservice.core.model.Descriptor;
import com.smartservice.core.parser.DescriptorDocument;
import com.smartservice.core.parser.DescriptorReadException;
import com.smartservice.core.parser.DescriptorReader;
import com.smartservice.core.parser.DescriptorTree;
import com.smartservice.core.parser.ParseOutcome;
import com.smartservice.core.parser.StructuralParser;
import com.smartservice.core.query.ProviderRegistry;
import com.smartservice.core.query.QueryCompiler;
import com.smartservice.core.query.QueryPlan;
import com.smartservice.core.resolve.ReferenceResolver;
import com.smartservice.core.resolve.ResolvedVisualization;
import com.smartservice.core.version.VersionCompatibility;
import com.smartservice.core.version.VersionGate;
import com.smartservice.core.visualization.VisualizationContractRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles service descriptors into {@link CompiledDescriptor}s.
 *
 * <p>Runs Parser → Version Gate → Entity Extractor → Reference Resolver → Query Compiler →
 * IR Emitter. Parse errors stop the attempt after parsing. The version gate and the
 * extractor both run before the attempt stops on their errors, and so do the resolver and
 * the query compiler, so one attempt reports as many independent problems as possible.
 *
 * <p>Immutable and thread-safe; one instance may compile many descriptors concurrently.
 */
public class DescriptorCompiler {

    private static final Logger log = LoggerFactory.getLogger(DescriptorCompiler.class);

    private final CompilerConfig config;
    private final DescriptorReader reader;
    private final StructuralParser parser;
    private final VersionGate versionGate;
    private final EntityExtractor extractor;
    private final ReferenceResolver resolver;
    private final QueryCompiler queryCompiler;
    private final IrEmitter emitter;

    /**
     * Creates a compiler with the provider strategies and visualization contracts found on
     * the class path.
     *
     * @param config compiler configuration
     */
    public DescriptorCompiler(CompilerConfig config) {
        this(config, ProviderRegistry.load(), VisualizationContractRegistry.load());
    }

    public DescriptorCompiler(CompilerConfig config, ProviderRegistry providers,
                              VisualizationContractRegistry contracts) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reader = new DescriptorReader();
        this.parser = new StructuralParser();
        this.versionGate = new VersionGate(config);
        this.extractor = new EntityExtractor(config);
        this.resolver = new ReferenceResolver(config, contracts);
        this.queryCompiler = new QueryCompiler(config, providers);
        this.emitter = new IrEmitter();
    }

    public CompilerConfig getConfig() {
        return config;
    }

    /**
     * Compiles a descriptor file.
     *
     * @param file YAML or JSON descriptor (by extension)
     * @return compilation result
     * @throws DescriptorReadException if the file is missing, unreadable or not well-formed
     */
    public CompilationResult compile(Path file) throws DescriptorReadException {
        log.info("Compiling descriptor {}", file);
        return compile(reader.read(file));
    }

    /**
     * Compiles descriptor content.
     *
     * @param content document text
     * @param format document format
     * @return compilation result
     * @throws DescriptorReadException if the content is not well-formed
     */
    public CompilationResult compile(String content, DescriptorReader.Format format) throws DescriptorReadException {
        return compile(reader.read(content, format));
    }

    /**
     * Compiles a descriptor tree built elsewhere.
     *
     * @param root document root
     * @return compilation result
     */
    public CompilationResult compile(JsonNode root) {
        return compile(new DescriptorDocument(root, List.of()));
    }

    /**
     * Compiles an already-read descriptor document. Repeated keys found by the reader are
     * reported first and stop the attempt together with the extractor's findings.
     *
     * @param document document and reader diagnostics
     * @return compilation result
     */
    public CompilationResult compile(DescriptorDocument document) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        diagnostics.addAll(document.diagnostics());

        ParseOutcome parsed = parser.parse(document.root());
        diagnostics.addAll(parsed.diagnostics());
        Optional<DescriptorTree> tree = parsed.treeOptional();
        if (tree.isEmpty()) {
            return failed(CompilationStage.INIT, diagnostics);
        }

        VersionCompatibility compatibility = versionGate.check(tree.get().service().version(), diagnostics);
        Descriptor descriptor = extractor.extract(tree.get(), diagnostics);
        if (diagnostics.hasFatal()) {
            return failed(compatibility.isCompatible() ? CompilationStage.VERSION_CHECKED : CompilationStage.PARSED,
                diagnostics);
        }

        List<ResolvedVisualization> visualizations = resolver.resolve(descriptor, diagnostics);
        boolean resolved = !diagnostics.hasFatal();
        Map<String, QueryPlan> plans = queryCompiler.compile(descriptor.dataSources(), diagnostics);
        if (diagnostics.hasFatal()) {
            return failed(resolved ? CompilationStage.RESOLVED : CompilationStage.EXTRACTED, diagnostics);
        }

        Optional<CompiledDescriptor> ir = emitter.emit(descriptor, compatibility, visualizations, plans, diagnostics);
        if (ir.isEmpty()) {
            return failed(CompilationStage.COMPILED, diagnostics);
        }
        log.info("Compiled service '{}' with {} warnings", descriptor.service().name(), diagnostics.size());
        return CompilationResult.success(ir.get(), diagnostics.toList());
    }

    private static CompilationResult failed(CompilationStage lastCompleted, DiagnosticCollector diagnostics) {
        log.info("Compilation failed after {} with {} fatal diagnostics", lastCompleted,
            diagnostics.toList().stream().filter(Diagnostic::isFatal).count());
        return CompilationResult.failure(lastCompleted, diagnostics.toList());
    }
}
