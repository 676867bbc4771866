package com.smartservice.cli;

import com.smartservice.core.pipeline.CompilationResult;
import picocli.CommandLine.Command;

import java.util.Optional;

/**
 * Command to check a descriptor without emitting its IR.
 */
@Command(
    name = "validate",
    description = "Validate a service descriptor and report its diagnostics",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends AbstractDescriptorCommand {

    @Override
    public Integer call() {
        Optional<CompilationResult> compiled = compile();
        if (compiled.isEmpty()) {
            return ExitCodes.MALFORMED;
        }
        CompilationResult result = compiled.get();
        if (result.succeeded()) {
            out().printf("%s is valid (%d warning(s))%n", descriptor, result.warnings().size());
        } else {
            out().printf("%s is invalid: %d error(s), %d warning(s)%n",
                descriptor, result.fatalDiagnostics().size(), result.warnings().size());
        }
        out().flush();
        return ExitCodes.of(result);
    }
}
