package dev.jbang.harvest;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Main application class with CLI support */
@Command(
		name = "harvest",
		version = "0.1.0",
		description = "Incrementally harvests records from pluggable sources",
		mixinStandardHelpOptions = true,
		subcommands = {FetchCommand.class, ListCommand.class})
public class Main implements Callable<Integer> {

	@Override
	public Integer call() {
		CommandLine.usage(this, System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
