package arisbe.parser;

import arisbe.lexer.EGIFLexer;
import arisbe.lexer.EGIFToken;
import arisbe.lexer.EGIFTokenType;
import arisbe.model.egi.Alphabet;
import arisbe.model.egi.ContextAncestry;
import arisbe.model.egi.Cut;
import arisbe.model.egi.Edge;
import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.Vertex;
import arisbe.scope.Binding;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 *
 * Reads EGIF text into a {@link RelationalGraph}.
 *
 * The grammar is small enough to parse by recursive descent, one method per rule:
 *
 * <pre>
 * expression := node*
 * node       := relation | cut | bracket | vertex
 * relation   := '(' IDENTIFIER argument* ')'
 * cut        := '~[' node* ']'
 * bracket    := '[' vertex+ ']'
 * vertex     := DEFINING_VARIABLE | BOUND_VARIABLE | CONSTANT
 * </pre>
 *
 * Every rule takes the {@link ParseState} of the current parse and the id of the context it is reading into.
 * Constant vertices are created where they first occur and, once the whole text has been read, moved to the
 * innermost context that encloses all of their occurrences.
 *
 */
public final class EGIFParser {

	private EGIFParser() {}

	public static RelationalGraph parse(String text) {
		return parseWithAlphabet(null, text).getGraph();
	}

	public static RelationalGraph parse(Path file, String text) {
		return parseWithAlphabet(file, text).getGraph();
	}

	public static ParsedEGIF parseWithAlphabet(String text) {
		return parseWithAlphabet(null, text);
	}

	/**
	 * @param file the file the text came from, used only to tag source locations; may be null
	 */
	public static ParsedEGIF parseWithAlphabet(Path file, String text) {
		List<EGIFToken> tokens = new EGIFLexer(file, EGIFLexer.stripComments(text)).readTokens();
		ParseState state = new ParseState(tokens, RelationalGraph.empty());
		String sheet = state.getGraph().getSheet();
		parseExpression(state, sheet);
		state.expect(EGIFTokenType.EOF, "a relation, a cut, a bracket or a vertex");
		state.getScope().close(sheet);
		hoistConstants(state);
		return new ParsedEGIF(state.getGraph(), state.getAlphabet(), state.getLocations());
	}

	private static boolean isVertexToken(EGIFTokenType type) {
		return type == EGIFTokenType.DEFINING_VARIABLE
				|| type == EGIFTokenType.BOUND_VARIABLE
				|| type == EGIFTokenType.CONSTANT;
	}

	private static boolean startsNode(EGIFTokenType type) {
		return type == EGIFTokenType.LPAREN
				|| type == EGIFTokenType.CUT_OPEN
				|| type == EGIFTokenType.LBRACKET
				|| isVertexToken(type);
	}

	public static void parseExpression(ParseState state, String contextId) {
		while (startsNode(state.current().getType())) {
			parseNode(state, contextId);
		}
	}

	public static void parseNode(ParseState state, String contextId) {
		switch (state.current().getType()) {
			case LPAREN:
				parseRelation(state, contextId);
				break;
			case CUT_OPEN:
				parseCut(state, contextId);
				break;
			case LBRACKET:
				parseBracket(state, contextId);
				break;
			case DEFINING_VARIABLE:
			case BOUND_VARIABLE:
			case CONSTANT:
				parseIsolatedVertex(state, contextId);
				break;
			default:
				throw new SyntaxIssue("a relation, a cut, a bracket or a vertex", state.current());
		}
	}

	public static void parseRelation(ParseState state, String contextId) {
		EGIFToken open = state.expect(EGIFTokenType.LPAREN, "'('");
		EGIFToken name = state.expect(EGIFTokenType.IDENTIFIER, "a relation name");
		List<String> arguments = new ArrayList<>();
		while (isVertexToken(state.current().getType())) {
			arguments.add(parseArgument(state, contextId));
		}
		state.expect(EGIFTokenType.RPAREN, "')' closing relation " + name.getValue());
		state.getAlphabet().addRelation(name.getValue(), arguments.size(), name.getLocation());
		Edge edge = Edge.fresh();
		state.setGraph(state.getGraph().addEdge(edge, arguments, name.getValue(), contextId));
		state.recordLocation(edge.getId(), open.getLocation());
	}

	/**
	 * @return the id of the vertex the argument denotes
	 */
	public static String parseArgument(ParseState state, String contextId) {
		EGIFToken token = state.current();
		if (!isVertexToken(token.getType())) {
			throw new SyntaxIssue("a vertex", token);
		}
		state.advance();
		return occurrence(state, token, contextId);
	}

	public static void parseCut(ParseState state, String contextId) {
		EGIFToken open = state.expect(EGIFTokenType.CUT_OPEN, "'~['");
		Cut cut = Cut.fresh();
		state.setGraph(state.getGraph().addCut(cut, contextId));
		state.recordLocation(cut.getId(), open.getLocation());
		parseExpression(state, cut.getId());
		state.expect(EGIFTokenType.RBRACKET, "']' closing the cut");
		state.getScope().close(cut.getId());
	}

	/**
	 * A bracket of defining variables declares them. A bracket of two or more entries, not all of them
	 * defining, is a coreference node: every pair of its entries is joined by an identity edge.
	 */
	public static void parseBracket(ParseState state, String contextId) {
		EGIFToken open = state.expect(EGIFTokenType.LBRACKET, "'['");
		List<EGIFToken> entries = new ArrayList<>();
		while (isVertexToken(state.current().getType())) {
			entries.add(state.advance());
		}
		state.expect(EGIFTokenType.RBRACKET, "']' closing the bracket");

		boolean allDefining = true;
		for (EGIFToken entry : entries) {
			if (entry.getType() != EGIFTokenType.DEFINING_VARIABLE) {
				allDefining = false;
			}
		}
		if (entries.isEmpty() || (!allDefining && entries.size() < 2)) {
			throw new SyntaxIssue("defining variables, or at least two names to corefer", open);
		}

		List<String> vertexIds = new ArrayList<>();
		for (EGIFToken entry : entries) {
			vertexIds.add(occurrence(state, entry, contextId));
		}
		if (allDefining) {
			return;
		}
		for (int i = 0; i < vertexIds.size(); ++i) {
			for (int j = i + 1; j < vertexIds.size(); ++j) {
				state.getAlphabet().addRelation(Alphabet.IDENTITY, 2, open.getLocation());
				state.setGraph(state.getGraph().addEdge(
						Edge.fresh(), Arrays.asList(vertexIds.get(i), vertexIds.get(j)), Alphabet.IDENTITY,
						contextId));
			}
		}
	}

	public static void parseIsolatedVertex(ParseState state, String contextId) {
		EGIFToken token = state.advance();
		String vertexId = occurrence(state, token, contextId);
		if (token.getType() == EGIFTokenType.CONSTANT) {
			state.recordIsolatedConstant(vertexId, contextId);
		}
	}

	private static String occurrence(ParseState state, EGIFToken token, String contextId) {
		switch (token.getType()) {
			case DEFINING_VARIABLE:
				return define(state, token, contextId);
			case BOUND_VARIABLE:
				return resolve(state, token, contextId);
			case CONSTANT:
				return constant(state, token, contextId);
			default:
				throw new SyntaxIssue("a vertex", token);
		}
	}

	private static String define(ParseState state, EGIFToken token, String contextId) {
		String name = token.getValue();
		if (state.getScope().isDefinedInArea(name, contextId)) {
			throw new DuplicateDefinitionIssue(name, contextId, token.getLocation());
		}
		Vertex vertex = Vertex.generic();
		state.setGraph(state.getGraph().addVertexInContext(vertex, contextId));
		state.recordLocation(vertex.getId(), token.getLocation());
		state.getScope().define(name, contextId, vertex.getId());
		return vertex.getId();
	}

	private static String resolve(ParseState state, EGIFToken token, String contextId) {
		String name = token.getValue();
		Binding binding = state.getScope().lookup(name);
		if (binding == null) {
			Binding closed = state.getScope().lookupClosed(name);
			if (closed != null) {
				throw new OutOfScopeVariableIssue(name, closed.getContextId(), contextId, token.getLocation());
			}
			throw new UndefinedVariableIssue(name, token.getLocation());
		}
		// an open binding must belong to a context enclosing the use
		ContextAncestry ancestry = new ContextAncestry(state.getGraph());
		if (!ancestry.isAncestorOrSelf(binding.getContextId(), contextId)) {
			throw new OutOfScopeVariableIssue(name, binding.getContextId(), contextId, token.getLocation());
		}
		return binding.getVertexId();
	}

	private static String constant(ParseState state, EGIFToken token, String contextId) {
		String name = token.getValue();
		String vertexId = state.getConstantVertex(name);
		if (vertexId != null) {
			return vertexId;
		}
		Vertex vertex = Vertex.constant(name);
		state.setGraph(state.getGraph().addVertexInContext(vertex, contextId));
		state.recordLocation(vertex.getId(), token.getLocation());
		state.putConstantVertex(name, vertex.getId());
		state.getAlphabet().addConstant(name);
		return vertex.getId();
	}

	private static void hoistConstants(ParseState state) {
		RelationalGraph graph = state.getGraph();
		Map<String, List<String>> occurrences = new LinkedHashMap<>();
		for (String vertexId : state.getConstants().values()) {
			occurrences.put(vertexId, new ArrayList<>(state.getIsolatedConstantContexts(vertexId)));
		}
		for (Map.Entry<String, List<String>> entry : graph.getNu().entrySet()) {
			String edgeContext = graph.getParentContext(entry.getKey());
			for (String vertexId : entry.getValue()) {
				List<String> contexts = occurrences.get(vertexId);
				if (contexts != null) {
					contexts.add(edgeContext);
				}
			}
		}
		ContextAncestry ancestry = new ContextAncestry(graph);
		for (Map.Entry<String, List<String>> entry : occurrences.entrySet()) {
			graph = graph.relocateVertex(entry.getKey(), ancestry.leastCommonAncestor(entry.getValue()));
		}
		state.setGraph(graph);
	}
}
