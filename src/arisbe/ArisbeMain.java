package arisbe;

import arisbe.errors.IssueContext;
import arisbe.errors.TopLevelIssueContext;
import arisbe.formatters.EGIFGenerator;
import arisbe.formatters.GraphJsonFormatter;
import arisbe.formatters.GraphSummaryFormatter;
import arisbe.formatters.IndentingWriter;
import arisbe.parser.ParsedEGIF;
import arisbe.passes.EGIFParsingPass;
import arisbe.passes.OptionParsingPass;
import arisbe.passes.TransformationPass;
import arisbe.transform.TransformCommand;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;

public class ArisbeMain {
	public static final int EXIT_OK = 0;
	public static final int EXIT_ISSUES = 1;
	public static final int EXIT_USAGE = 2;

	private final String[] cmdArgs;
	private final PrintStream out;
	private final PrintStream err;
	private static Logger logger;

	public ArisbeMain(String[] args) {
		this(args, System.out, System.err);
	}

	public ArisbeMain(String[] args, PrintStream out, PrintStream err) {
		this.cmdArgs = args;
		this.out = out;
		this.err = err;
		// Get the top Logger instance
		logger = Logger.getLogger("ArisbeMain");
	}

	public static void main(String[] args) {
		int status = new ArisbeMain(args).run();
		if (status == EXIT_OK) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
		}
		System.exit(status);
	}

	// Top-level workhorse method.
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		ArisbeOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			err.println(ctx.format());
			opts.printHelp(err);
			return EXIT_USAGE;
		}
		if (opts.version) {
			out.println("arisbe version " + ArisbeOptions.VERSION);
			return EXIT_OK;
		}
		if (opts.help) {
			opts.printHelp(out);
			return EXIT_OK;
		}

		ArisbeOutputOptions outputOptions = opts.outputOptions;
		StringWriter canonical = new StringWriter();
		for (String inputFilePath : opts.inputFilePaths) {
			Path path = Paths.get(inputFilePath);
			ParsedEGIF parsed = readFile(ctx, path, opts.transformCommands);
			if (parsed == null) {
				continue;
			}
			if (outputOptions.isCanonical()) {
				canonical.write(EGIFGenerator.generate(parsed.getGraph()));
				canonical.write(IndentingWriter.LINE_SEPARATOR);
			}
			switch (outputOptions.getSummary()) {
				case TEXT:
					out.println(summarize(path, parsed));
					break;
				case JSON:
					out.println(GraphJsonFormatter.format(parsed.getGraph(), parsed.getAlphabet()).toString(2));
					break;
				case NONE:
					break;
			}
		}

		if (outputOptions.isCanonical()) {
			writeCanonical(ctx, outputOptions.getDestFile(), canonical.toString());
		}

		if (ctx.hasErrors()) {
			logger.severe("found issues");
			err.println(ctx.format());
			return EXIT_ISSUES;
		}
		return EXIT_OK;
	}

	private ParsedEGIF readFile(TopLevelIssueContext ctx, Path path, List<TransformCommand> transformCommands) {
		logger.info("Opening source file " + path);
		String text;
		try {
			text = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.withFile(path, null).error(new IOErrorIssue(e));
			return null;
		}
		logger.info("Parsing EGIF text");
		IssueContext fileCtx = ctx.withFile(path, text);
		ParsedEGIF parsed = EGIFParsingPass.perform(fileCtx, path, text);
		if (parsed == null) {
			return null;
		}
		logger.fine("Read " + parsed.getGraph().getVertices().size() + " vertices, "
				+ parsed.getGraph().getEdges().size() + " edges and "
				+ parsed.getGraph().getCuts().size() + " cuts from " + path);
		return TransformationPass.perform(fileCtx, logger, parsed, transformCommands);
	}

	private static String summarize(Path path, ParsedEGIF parsed) {
		StringWriter w = new StringWriter();
		try (IndentingWriter iw = new IndentingWriter(w)) {
			iw.write(path + ": ");
			new GraphSummaryFormatter(iw).format(parsed.getGraph(), parsed.getAlphabet());
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	private void writeCanonical(TopLevelIssueContext ctx, String destFile, String text) {
		if (destFile == null) {
			out.print(text);
			out.flush();
			return;
		}
		logger.info("Writing canonical EGIF to \"" + destFile + "\"");
		try {
			FileUtils.writeStringToFile(new File(destFile), text, StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
		}
	}
}
