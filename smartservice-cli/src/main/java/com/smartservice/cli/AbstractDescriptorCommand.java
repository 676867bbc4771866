package com.smartservice.cli;

import com.smartservice.core.config.CompilerConfig;
import com.smartservice.core.config.ConfigLoader;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.parser.DescriptorReadException;
import com.smartservice.core.pipeline.CompilationResult;
import com.smartservice.core.pipeline.DescriptorCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Shared options and compilation flow of commands that take a descriptor.
 */
abstract class AbstractDescriptorCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractDescriptorCommand.class);

    @Spec
    protected CommandSpec spec;

    @Parameters(index = "0", description = "Descriptor file (YAML, or JSON with a .json extension)")
    protected Path descriptor;

    @Option(
        names = {"-c", "--config"},
        description = "Compiler configuration file (default: ./" + ConfigLoader.DEFAULT_FILE_NAME + " if present)"
    )
    protected Path configFile;

    @Option(names = {"-j", "--parallelism"}, description = "Worker threads for extraction and resolution")
    protected Integer parallelism;

    /**
     * Loads the configuration and compiles the descriptor, printing all diagnostics to stderr.
     *
     * @return result, or empty if the descriptor could not be read
     */
    protected Optional<CompilationResult> compile() {
        CompilerConfig config = loadConfig();
        if (parallelism != null) {
            config = config.withParallelism(parallelism);
        }
        DescriptorCompiler compiler = new DescriptorCompiler(config);

        CompilationResult result;
        try {
            result = compiler.compile(descriptor);
        } catch (DescriptorReadException e) {
            log.debug("Failed to read descriptor {}", descriptor, e);
            err().println("ERROR " + e.getMessage());
            err().flush();
            return Optional.empty();
        }

        for (Diagnostic diagnostic : result.diagnostics()) {
            err().println(diagnostic.format());
        }
        err().flush();
        return Optional.of(result);
    }

    private CompilerConfig loadConfig() {
        if (configFile != null) {
            return ConfigLoader.load(configFile);
        }
        Path defaultFile = Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.exists(defaultFile)) {
            return ConfigLoader.load(defaultFile);
        }
        log.debug("No {} in working directory, using default configuration", ConfigLoader.DEFAULT_FILE_NAME);
        return CompilerConfig.defaults();
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
