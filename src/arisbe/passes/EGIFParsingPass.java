package arisbe.passes;

import arisbe.errors.Issue;
import arisbe.errors.IssueContext;
import arisbe.parser.EGIFParser;
import arisbe.parser.ParsedEGIF;

import java.nio.file.Path;

public class EGIFParsingPass {
	private EGIFParsingPass() {}

	/**
	 * @return the parsed graph and its alphabet, or null if the text has issues, which are reported to ctx
	 */
	public static ParsedEGIF perform(IssueContext ctx, Path inputFileName, String inputFileContents) {
		try {
			return EGIFParser.parseWithAlphabet(inputFileName, inputFileContents);
		} catch (Issue issue) {
			ctx.error(issue);
			return null;
		}
	}
}
