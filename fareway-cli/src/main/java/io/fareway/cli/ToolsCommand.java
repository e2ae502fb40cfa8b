package io.fareway.cli;

import io.fareway.core.tool.ToolDescriptor;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "tools", description = "List the registered tools")
public final class ToolsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--json"}, description = "Print the catalogue with input schemas as JSON")
    boolean json;

    public ToolsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        List<ToolDescriptor> tools = context.dispatcher().registry().listAll();
        try {
            if (json) {
                System.out.println(context.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(tools));
                return 0;
            }
            for (ToolDescriptor tool : tools) {
                System.out.printf("%-28s %s%n", tool.name(), tool.description());
            }
            System.out.println(tools.size() + " tools");
            return 0;
        } catch (Exception e) {
            System.err.println("Tools command failed: " + e.getMessage());
            return 1;
        }
    }
}
