package dev.jbang.harvest;

import dev.jbang.harvest.connector.Connector;
import dev.jbang.harvest.connector.ConnectorFactory;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Lists the connectors found on the class path */
@Command(name = "list", description = "List all available connectors", mixinStandardHelpOptions = true)
public class ListCommand implements Callable<Integer> {

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() {
		PrintWriter out = spec.commandLine().getOut();
		Map<String, Connector.Discovery> discoveries = ConnectorFactory.getAvailableConnectorDiscoveries();

		out.println("Available Connectors:");
		out.println("=====================");
		for (Connector.Discovery discovery : discoveries.values()) {
			out.println("  - " + discovery.name() + ": " + discovery.description());
		}
		out.println();
		out.println("Total: " + discoveries.size() + " connectors");
		out.flush();
		return 0;
	}
}
