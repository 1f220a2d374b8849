package arisbe.passes;

import arisbe.ArisbeOptionException;
import arisbe.ArisbeOptions;
import arisbe.OptionParserIssue;
import arisbe.errors.IssueContext;

import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static ArisbeOptions perform(IssueContext ctx, Logger logger, String[] args) {
		ArisbeOptions opts = new ArisbeOptions(args);
		try {
			opts.parse();
		} catch (ArisbeOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		if (opts.quiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.verbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}
}
