package com.smartservice.cli;

import com.smartservice.core.query.ProviderRegistry;
import com.smartservice.core.query.ProviderStrategy;
import com.smartservice.core.visualization.VisualizationContract;
import com.smartservice.core.visualization.VisualizationContractRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available data providers or visualization types.
 *
 * <p>Discovers provider strategies and visualization contracts via Java Service Provider
 * Interface (SPI) and displays their capabilities.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all providers
 * smartservice list providers
 *
 * # List all visualization types
 * smartservice list visualizations
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available providers or visualization types",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: providers or visualizations"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "providers", "provider" -> listProviders();
            case "visualizations", "visualization" -> listVisualizations();
            default -> {
                log.error("Unknown type: {}. Use: providers or visualizations", type);
                spec.commandLine().getErr().println("Unknown type: " + type + ". Use: providers or visualizations");
                yield ExitCodes.INVALID;
            }
        };
    }

    private int listProviders() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Providers:");
        out.println();

        List<ProviderStrategy> strategies = ProviderRegistry.load().strategies();
        for (ProviderStrategy strategy : strategies) {
            out.printf("  • %s (ID: %s)%n", strategy.getDisplayName(), strategy.getId());
            out.printf("    Capabilities: %s%n", strategy.getCapabilities().stream().sorted().toList());
            out.println();
        }
        if (strategies.isEmpty()) {
            out.println("  No providers found.");
        }
        out.flush();
        return ExitCodes.OK;
    }

    private int listVisualizations() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Visualizations:");
        out.println();

        List<VisualizationContract> contracts = VisualizationContractRegistry.load().contracts();
        for (VisualizationContract contract : contracts) {
            out.printf("  • %s (ID: %s)%n", contract.getDisplayName(), contract.getId());
            out.printf("    Types: %s%n", contract.getSupportedTypes().stream().sorted().toList());
            out.println();
        }
        if (contracts.isEmpty()) {
            out.println("  No visualization types found.");
        }
        out.flush();
        return ExitCodes.OK;
    }
}
