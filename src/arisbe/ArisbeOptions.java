package arisbe;

import arisbe.transform.TransformCommand;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;
import org.plumelib.options.Options.ArgException;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ArisbeOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Print the version and exit")
	public boolean version = false;

	@Option(value = "-h Print usage information")
	public boolean help = false;

	@Option(value = "-q Only print warnings and errors during execution")
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution")
	public boolean verbose = false;

	@Option(value = "-c Path to the JSON configuration file, if any")
	public String config;

	@Option(value = "-j Print a JSON summary of every graph")
	public boolean json = false;

	@Option(value = "-s Print a text summary of every graph")
	public boolean summary = false;

	@Option(value = "-o Write canonical EGIF to this file instead of standard output")
	public String output;

	@Option(value = "-t Apply a transformation rule, as RULE@TARGET[,TARGET...][=ARGUMENT]; may be repeated")
	public List<String> transform = new ArrayList<>();

	public List<String> inputFilePaths = Collections.emptyList();

	public List<TransformCommand> transformCommands = Collections.emptyList();

	// settings from the configuration file, with command line flags applied on top
	public ArisbeOutputOptions outputOptions = new ArisbeOutputOptions();

	private final Options plumeOptions;
	private final String[] args;

	public void printHelp(PrintStream ps) {
		plumeOptions.printUsage(ps);
	}

	public ArisbeOptions(String[] args) {
		this.plumeOptions = new Options("arisbe [options] file...", this);
		this.args = args;
	}

	public void parse() throws ArisbeOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (ArgException e) {
			throw new ArisbeOptionException(e.getMessage());
		}

		if (version || help) {
			return;
		}
		if (remainingArgs.length == 0) {
			throw new ArisbeOptionException("at least one EGIF file is required");
		}
		inputFilePaths = Arrays.asList(remainingArgs);

		List<TransformCommand> commands = new ArrayList<>();
		for (String command : transform) {
			commands.add(TransformCommand.parse(command));
		}
		transformCommands = commands;

		if (config != null) {
			outputOptions = new ArisbeOutputOptions(readConfig(config));
		}
		if (json) {
			outputOptions.setSummary(ArisbeOutputOptions.SummaryFormat.JSON);
		} else if (summary) {
			outputOptions.setSummary(ArisbeOutputOptions.SummaryFormat.TEXT);
		}
		if (output != null) {
			outputOptions.setDestFile(output);
		}
	}

	static JSONObject readConfig(String configFilePath) throws ArisbeOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new ArisbeOptionException("Error reading configuration file: " + ex.getMessage());
		}

		try {
			return new JSONObject(s);
		} catch (JSONException e) {
			throw new ArisbeOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}
	}
}
