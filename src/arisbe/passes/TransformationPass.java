package arisbe.passes;

import arisbe.errors.Issue;
import arisbe.errors.IssueContext;
import arisbe.model.egi.Alphabet;
import arisbe.model.egi.RelationalGraph;
import arisbe.parser.ParsedEGIF;
import arisbe.transform.TransformCommand;

import java.util.List;
import java.util.logging.Logger;

public class TransformationPass {
	private TransformationPass() {}

	/**
	 * Applies the commands in order, starting from the parsed graph.
	 *
	 * @return the transformed graph with its alphabet, or null if a rule failed, which is reported to ctx
	 */
	public static ParsedEGIF perform(IssueContext ctx, Logger logger, ParsedEGIF parsed,
	                                 List<TransformCommand> commands) {
		if (commands.isEmpty()) {
			return parsed;
		}
		RelationalGraph graph = parsed.getGraph();
		try {
			for (TransformCommand command : commands) {
				logger.fine("Applying " + command.getRule().getDescription() + " (" + command + ")");
				graph = command.apply(parsed, graph);
			}
			return new ParsedEGIF(graph, Alphabet.derive(graph));
		} catch (Issue issue) {
			ctx.error(issue);
			return null;
		}
	}
}
