package arisbe.transform;

import arisbe.ArisbeOptionException;
import arisbe.errors.Issue;
import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.Vertex;
import arisbe.parser.EGIFParser;
import arisbe.parser.ParsedEGIF;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 *
 * One transformation asked for on the command line, written {@code RULE@TARGET[,TARGET...][=ARGUMENT]}.
 *
 * A target is {@value #SHEET} or the line:column where the EGIF text introduced an element: the "(" of a
 * relation, the "~[" of a cut, the "*" of a defining variable or the first occurrence of a constant. The argument
 * is the EGIF text to insert, or the name of the constant to add as an isolated vertex.
 *
 * <pre>
 * erase@ELEMENT                      insert@CUT=EGIF
 * iterate@ELEMENT,CONTEXT            deiterate@ELEMENT
 * add-double-cut@CONTEXT[,ELEMENT...] remove-double-cut@CUT
 * add-vertex@CONTEXT[=CONSTANT]       remove-vertex@VERTEX
 * </pre>
 *
 */
public final class TransformCommand {
	public static final String SHEET = "sheet";

	private static final Pattern POSITION = Pattern.compile("(\\d+):(\\d+)");

	private final String text;
	private final TransformationRule rule;
	private final List<String> targets;
	private final String argument;

	private TransformCommand(String text, TransformationRule rule, List<String> targets, String argument) {
		this.text = text;
		this.rule = rule;
		this.targets = targets;
		this.argument = argument;
	}

	public static TransformCommand parse(String text) throws ArisbeOptionException {
		int at = text.indexOf('@');
		if (at < 0) {
			throw new ArisbeOptionException("transformation " + text + " has no target, expected RULE@TARGET");
		}
		String name = text.substring(0, at);
		TransformationRule rule = TransformationRule.fromCommandName(name);
		if (rule == null) {
			throw new ArisbeOptionException("unknown transformation rule " + name);
		}
		String rest = text.substring(at + 1);
		String argument = null;
		int equals = rest.indexOf('=');
		if (equals >= 0) {
			argument = rest.substring(equals + 1);
			rest = rest.substring(0, equals);
		}
		List<String> targets = Arrays.asList(rest.split(",", -1));
		if (targets.size() < rule.getMinTargets() || targets.size() > rule.getMaxTargets()) {
			throw new ArisbeOptionException(name + " cannot take " + targets.size() + " target(s)");
		}
		for (String target : targets) {
			if (!SHEET.equals(target) && !POSITION.matcher(target).matches()) {
				throw new ArisbeOptionException("bad target '" + target + "' in " + text
						+ ", expected " + SHEET + " or line:column");
			}
		}
		if (rule == TransformationRule.INSERTION && argument == null) {
			throw new ArisbeOptionException(name + " needs the EGIF text to insert after '='");
		}
		if (argument != null && rule != TransformationRule.INSERTION
				&& rule != TransformationRule.ISOLATED_VERTEX_ADDITION) {
			throw new ArisbeOptionException(name + " takes no argument");
		}
		return new TransformCommand(text, rule, Collections.unmodifiableList(targets), argument);
	}

	public TransformationRule getRule() {
		return rule;
	}

	public List<String> getTargets() {
		return targets;
	}

	/**
	 * @return the text after '=', or null if there was none
	 */
	public String getArgument() {
		return argument;
	}

	private String element(ParsedEGIF parsed, int index) {
		String target = targets.get(index);
		if (SHEET.equals(target)) {
			throw new TransformationIssue(rule, "the sheet is not an element");
		}
		Matcher matcher = POSITION.matcher(target);
		if (!matcher.matches()) {
			throw new IllegalStateException("unchecked target " + target);
		}
		String elementId = parsed.getElementAt(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
		if (elementId == null) {
			throw new TransformationIssue(rule, "no relation, cut or vertex starts at " + target);
		}
		return elementId;
	}

	private String context(ParsedEGIF parsed, RelationalGraph graph, int index) {
		if (SHEET.equals(targets.get(index))) {
			return graph.getSheet();
		}
		String elementId = element(parsed, index);
		if (!graph.isContext(elementId)) {
			throw new TransformationIssue(rule, "the element at " + targets.get(index) + " is not a cut");
		}
		return elementId;
	}

	// positions in the inserted text say nothing about the file, so its issues are reported as this rule's
	private RelationalGraph parseInserted() {
		try {
			return EGIFParser.parse(argument);
		} catch (Issue issue) {
			throw new TransformationIssue(rule, "unable to read '" + argument + "': " + issue.getMessage());
		}
	}

	/**
	 * Applies the rule to a graph derived from the parsed one, which supplies the positions of the targets.
	 */
	public RelationalGraph apply(ParsedEGIF parsed, RelationalGraph graph) {
		switch (rule) {
			case ERASURE:
				return Transformations.erase(graph, element(parsed, 0));
			case INSERTION:
				return Transformations.insert(graph, context(parsed, graph, 0), parseInserted());
			case ITERATION:
				return Transformations.iterate(graph, element(parsed, 0), context(parsed, graph, 1));
			case DEITERATION:
				return Transformations.deiterate(graph, element(parsed, 0));
			case DOUBLE_CUT_ADDITION:
				List<String> enclosed = new ArrayList<>();
				for (int i = 1; i < targets.size(); ++i) {
					enclosed.add(element(parsed, i));
				}
				return Transformations.addDoubleCut(graph, context(parsed, graph, 0), enclosed);
			case DOUBLE_CUT_REMOVAL:
				return Transformations.removeDoubleCut(graph, element(parsed, 0));
			case ISOLATED_VERTEX_ADDITION:
				Vertex vertex = argument == null ? Vertex.generic() : Vertex.constant(argument);
				return Transformations.addIsolatedVertex(graph, context(parsed, graph, 0), vertex);
			case ISOLATED_VERTEX_REMOVAL:
				return Transformations.removeIsolatedVertex(graph, element(parsed, 0));
			default:
				throw new IllegalStateException("unhandled rule " + rule);
		}
	}

	@Override
	public String toString() {
		return text;
	}
}
