package works.consoletree.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import works.consoletree.ConsoleTree;
import works.consoletree.RenderSettings;
import works.consoletree.TreeValue;
import works.consoletree.exceptions.TreeRenderException;
import works.consoletree.jackson.JacksonTreeReader;
import works.consoletree.jackson.TreeInputException;

@Command(
	name = "consoletree",
	mixinStandardHelpOptions = true,
	version = "consoletree 0.1.0",
	description = "Draws tree corresponding to the specified JSON file"
)
public class ConsoleTreeCommand implements Callable<Integer> {
	static final int EXIT_FAILURE = 1;

	@Parameters(index = "0", paramLabel = "FILE",
		description = "JSON file to draw. UTF-8 encoding is supported. "
			+ "The content of the JSON file must have a root. If that is not the case, use --add-root option")
	Path file;

	@Option(names = {"-s", "--simple-mode"},
		description = "Whether to use simple mode. In simple mode, array elements are just "
			+ "parented directly under parent array, without indices being shown")
	boolean simpleMode;

	@Option(names = {"-r", "--add-root"}, paramLabel = "NAME",
		description = "Name of the root which will be parent to the content of the JSON file. "
			+ "To be used when the content of the JSON file has no root")
	String rootName;

	@Option(names = {"-v", "--verbose"}, description = "Log details of each step to standard error")
	boolean verbose;

	@Spec
	CommandSpec spec;

	public static void main(String... args) {
		System.exit(commandLine().execute(args));
	}

	public static CommandLine commandLine() {
		return new CommandLine(new ConsoleTreeCommand());
	}

	@Override
	public Integer call() {
		if (verbose) {
			VerboseLogging.enable();
		}
		PrintWriter out = spec.commandLine().getOut();
		PrintWriter err = spec.commandLine().getErr();

		if (!Files.isRegularFile(file)) {
			err.print("Error: Specified file " + file + " does not exist\n");
			err.flush();
			return EXIT_FAILURE;
		}

		TreeValue value;
		try {
			value = new JacksonTreeReader().read(file);
		} catch (TreeInputException e) {
			return fail(err, "Unable to parse JSON", e);
		} catch (IOException e) {
			return fail(err, "Unable to read the input file", e);
		}

		RenderSettings settings = RenderSettings.builder()
			.simpleMode(simpleMode)
			.rootName(rootName)
			.build();
		String drawing;
		try {
			drawing = ConsoleTree.render(value, settings);
		} catch (TreeRenderException e) {
			return fail(err, "Unable to draw the tree", e);
		}

		out.print(drawing + "\n");
		out.flush();
		return CommandLine.ExitCode.OK;
	}

	private static int fail(PrintWriter err, String action, Exception e) {
		LOGGER.debug("{} failed", action, e);
		err.print("Error: " + action + ": " + e.getMessage() + "\n");
		err.flush();
		return EXIT_FAILURE;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleTreeCommand.class);
}
