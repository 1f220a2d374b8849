package arisbe.parser;

import arisbe.model.egi.Alphabet;
import arisbe.model.egi.RelationalGraph;
import arisbe.util.SourceLocation;

import java.util.Collections;
import java.util.Map;

/**
 * The result of parsing EGIF text: the graph, its alphabet, and where in the text each relation, cut, defined
 * variable and constant was introduced.
 */
public class ParsedEGIF {
	private final RelationalGraph graph;
	private final Alphabet alphabet;
	private final Map<String, SourceLocation> locations;

	public ParsedEGIF(RelationalGraph graph, Alphabet alphabet) {
		this(graph, alphabet, Collections.emptyMap());
	}

	public ParsedEGIF(RelationalGraph graph, Alphabet alphabet, Map<String, SourceLocation> locations) {
		this.graph = graph;
		this.alphabet = alphabet;
		this.locations = locations;
	}

	public RelationalGraph getGraph() {
		return graph;
	}

	public Alphabet getAlphabet() {
		return alphabet;
	}

	/**
	 * @return the location of the text that introduced the element, or null if it has none
	 */
	public SourceLocation getLocation(String elementId) {
		return locations.get(elementId);
	}

	/**
	 * @return the id of the element whose text starts at the given 1-based line and column, or null
	 */
	public String getElementAt(int line, int column) {
		for (Map.Entry<String, SourceLocation> entry : locations.entrySet()) {
			if (entry.getValue().getLine() == line && entry.getValue().getColumn() == column) {
				return entry.getKey();
			}
		}
		return null;
	}
}
