package arisbe.transform;

import arisbe.model.egi.Cut;
import arisbe.model.egi.Edge;
import arisbe.model.egi.ElementVisitor;
import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.Vertex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 *
 * Describes what a context encloses, up to the names of the vertices inside it. Vertices enclosed by the context
 * are numbered in the order a walk over the enclosed areas meets them; vertices outside it appear under their
 * ids, since a copy has to use the very same ones.
 *
 * Two contexts with equal signatures enclose copies of one subgraph. Some copies whose parts are ordered
 * differently get different signatures, so a mismatch does not prove that the contents differ.
 *
 */
final class SubgraphSignature {
	private final RelationalGraph graph;
	private final Set<String> enclosedVertices;
	private final Map<String, Integer> numbers;

	private SubgraphSignature(RelationalGraph graph, String contextId) {
		this.graph = graph;
		this.enclosedVertices = new HashSet<>();
		Set<String> enclosed = graph.getFullContext(contextId);
		for (Vertex vertex : graph.getVertices()) {
			if (enclosed.contains(vertex.getId())) {
				enclosedVertices.add(vertex.getId());
			}
		}
		this.numbers = new HashMap<>();
	}

	static String of(RelationalGraph graph, String contextId) {
		SubgraphSignature signature = new SubgraphSignature(graph, contextId);
		signature.number(contextId);
		return signature.describeArea(contextId, true);
	}

	private String argument(String vertexId, boolean numbered) {
		if (!enclosedVertices.contains(vertexId)) {
			return "@" + vertexId;
		}
		return numbered ? "#" + numbers.get(vertexId) : "?";
	}

	private static String quote(String constantName) {
		return "\"" + constantName.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

	/**
	 * @param numbered whether enclosed vertices are written with their numbers or all alike
	 */
	private String describe(String elementId, boolean numbered) {
		return graph.getElement(elementId).accept(new ElementVisitor<String, RuntimeException>() {
			@Override
			public String visit(Vertex vertex) {
				String kind = vertex.isConstant() ? quote(vertex.getConstantName()) : "*";
				return numbered ? kind + "#" + numbers.get(vertex.getId()) : kind;
			}

			@Override
			public String visit(Edge edge) {
				StringBuilder result = new StringBuilder("(").append(graph.getRelationName(edge.getId()));
				for (String vertexId : graph.getIncidentVertices(edge.getId())) {
					result.append(' ').append(argument(vertexId, numbered));
				}
				return result.append(')').toString();
			}

			@Override
			public String visit(Cut cut) {
				return "~[" + describeArea(cut.getId(), numbered) + "]";
			}
		});
	}

	private String describeArea(String contextId, boolean numbered) {
		List<String> parts = new ArrayList<>();
		for (String id : graph.getArea(contextId)) {
			parts.add(describe(id, numbered));
		}
		Collections.sort(parts);
		return String.join(" ", parts);
	}

	// numbers the vertices of one area and then those inside its cuts, visiting members by unnumbered shape
	private void number(String contextId) {
		List<String> members = new ArrayList<>(graph.getArea(contextId));
		Map<String, String> shapes = new HashMap<>();
		for (String id : members) {
			shapes.put(id, describe(id, false));
		}
		members.sort(Comparator.comparing(shapes::get));
		for (String id : members) {
			graph.getElement(id).accept(new ElementVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(Vertex vertex) {
					assign(vertex.getId());
					return null;
				}

				@Override
				public Void visit(Edge edge) {
					for (String vertexId : graph.getIncidentVertices(edge.getId())) {
						if (enclosedVertices.contains(vertexId)) {
							assign(vertexId);
						}
					}
					return null;
				}

				@Override
				public Void visit(Cut cut) {
					return null;
				}
			});
		}
		for (String id : members) {
			if (graph.isContext(id)) {
				number(id);
			}
		}
	}

	private void assign(String vertexId) {
		if (!numbers.containsKey(vertexId)) {
			numbers.put(vertexId, numbers.size());
		}
	}
}
