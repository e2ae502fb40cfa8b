package io.fareway.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import io.fareway.core.model.Deadline;
import io.fareway.core.model.ToolResult;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "call", description = "Execute one tool against the configured store and print the result envelope")
public final class CallCommand implements Callable<Integer> {
    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final CliContext context;

    @Parameters(index = "0", description = "Tool name")
    String toolName;

    @Option(names = {"--args"}, description = "Tool arguments as a JSON object", defaultValue = "{}")
    String arguments;

    public CallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Map<String, Object> rawArgs = context.mapper().readValue(arguments, ARGUMENTS);
            ToolResult result = context.dispatcher().execute(
                toolName,
                rawArgs,
                Deadline.after(context.config().requestTimeout())
            );
            System.out.println(context.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
            return result.success() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Call command failed: " + e.getMessage());
            return 2;
        }
    }
}
