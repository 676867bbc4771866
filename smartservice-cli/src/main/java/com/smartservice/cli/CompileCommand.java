package com.smartservice.cli;

import com.smartservice.core.ir.CompiledDescriptor;
import com.smartservice.core.ir.IrWriter;
import com.smartservice.core.pipeline.CompilationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Command to compile a descriptor into its intermediate representation.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print JSON IR
 * smartservice compile air-quality.yaml
 *
 * # Write YAML IR to a file
 * smartservice compile air-quality.yaml -o build/ir.yaml --format yaml
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Compile a service descriptor and emit its intermediate representation",
    mixinStandardHelpOptions = true
)
public class CompileCommand extends AbstractDescriptorCommand {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Option(
        names = "--format",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "json"
    )
    private IrWriter.Format format;

    @Override
    public Integer call() {
        Optional<CompilationResult> compiled = compile();
        if (compiled.isEmpty()) {
            return ExitCodes.MALFORMED;
        }
        CompilationResult result = compiled.get();
        if (!result.succeeded()) {
            err().printf("Compilation failed with %d error(s)%n", result.fatalDiagnostics().size());
            err().flush();
            return ExitCodes.of(result);
        }

        CompiledDescriptor ir = result.orElseThrow();
        IrWriter writer = new IrWriter();
        if (output == null) {
            out().print(writer.serialize(ir, format));
            out().flush();
            return ExitCodes.OK;
        }
        try {
            writer.write(ir, output, format);
        } catch (IOException e) {
            log.error("Failed to write {}: {}", output, e.getMessage());
            err().println("ERROR Failed to write " + output + ": " + e.getMessage());
            err().flush();
            return ExitCodes.INVALID;
        }
        log.info("Wrote {} IR to {}", format, output);
        return ExitCodes.OK;
    }
}
