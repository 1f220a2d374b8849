package arisbe.parser;

import arisbe.lexer.EGIFToken;
import arisbe.lexer.EGIFTokenType;
import arisbe.model.egi.Alphabet;
import arisbe.model.egi.RelationalGraph;
import arisbe.scope.VariableScope;
import arisbe.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one parse knows: the token cursor, the graph built so far, the variable scope, the constant table
 * and the alphabet. One instance per parse, passed explicitly to every rule.
 */
public class ParseState {
	private final List<EGIFToken> tokens;
	private int position;
	private RelationalGraph graph;
	private final VariableScope scope;
	private final Map<String, String> constants;
	private final Map<String, List<String>> isolatedConstantContexts;
	private final Alphabet alphabet;
	// element id -> where the text introducing it starts
	private final Map<String, SourceLocation> locations;

	/**
	 * @param tokens a token list ending in EOF, as produced by the lexer
	 */
	public ParseState(List<EGIFToken> tokens, RelationalGraph graph) {
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EGIFTokenType.EOF) {
			throw new IllegalArgumentException("token list must end in EOF");
		}
		this.tokens = tokens;
		this.position = 0;
		this.graph = graph;
		this.scope = new VariableScope();
		this.constants = new LinkedHashMap<>();
		this.isolatedConstantContexts = new LinkedHashMap<>();
		this.alphabet = new Alphabet();
		this.locations = new LinkedHashMap<>();
	}

	public EGIFToken current() {
		return tokens.get(position);
	}

	/**
	 * @return the current token; the cursor moves past it unless it is EOF
	 */
	public EGIFToken advance() {
		EGIFToken token = tokens.get(position);
		if (token.getType() != EGIFTokenType.EOF) {
			++position;
		}
		return token;
	}

	public EGIFToken expect(EGIFTokenType type, String expected) {
		if (current().getType() != type) {
			throw new SyntaxIssue(expected, current());
		}
		return advance();
	}

	public RelationalGraph getGraph() {
		return graph;
	}

	public void setGraph(RelationalGraph graph) {
		this.graph = graph;
	}

	public VariableScope getScope() {
		return scope;
	}

	/**
	 * @return the vertex of the constant with this name, or null if the name has not occurred yet
	 */
	public String getConstantVertex(String name) {
		return constants.get(name);
	}

	public void putConstantVertex(String name, String vertexId) {
		constants.put(name, vertexId);
	}

	public Map<String, String> getConstants() {
		return Collections.unmodifiableMap(constants);
	}

	public void recordIsolatedConstant(String vertexId, String contextId) {
		isolatedConstantContexts.computeIfAbsent(vertexId, ignored -> new ArrayList<>()).add(contextId);
	}

	public List<String> getIsolatedConstantContexts(String vertexId) {
		return isolatedConstantContexts.getOrDefault(vertexId, Collections.emptyList());
	}

	public Alphabet getAlphabet() {
		return alphabet;
	}

	public void recordLocation(String elementId, SourceLocation location) {
		locations.put(elementId, location);
	}

	public Map<String, SourceLocation> getLocations() {
		return Collections.unmodifiableMap(locations);
	}
}
