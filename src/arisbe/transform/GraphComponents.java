package arisbe.transform;

import arisbe.model.egi.Cut;
import arisbe.model.egi.Edge;
import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.Vertex;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable copies of the components of a graph, for rules that change several parts of it at once. The result
 * goes back through {@link RelationalGraph#of}, which checks the invariants as usual.
 */
final class GraphComponents {
	private final String sheet;
	private final Map<String, Vertex> vertices = new LinkedHashMap<>();
	private final Map<String, Edge> edges = new LinkedHashMap<>();
	private final Map<String, Cut> cuts = new LinkedHashMap<>();
	private final Map<String, List<String>> nu = new LinkedHashMap<>();
	private final Map<String, String> relationNames;
	private final Map<String, Set<String>> areas = new LinkedHashMap<>();

	GraphComponents(RelationalGraph graph) {
		this.sheet = graph.getSheet();
		for (Vertex vertex : graph.getVertices()) {
			vertices.put(vertex.getId(), vertex);
		}
		for (Edge edge : graph.getEdges()) {
			edges.put(edge.getId(), edge);
		}
		for (Cut cut : graph.getCuts()) {
			cuts.put(cut.getId(), cut);
		}
		for (Map.Entry<String, List<String>> entry : graph.getNu().entrySet()) {
			nu.put(entry.getKey(), new ArrayList<>(entry.getValue()));
		}
		this.relationNames = new LinkedHashMap<>(graph.getRelationNames());
		for (Map.Entry<String, Set<String>> entry : graph.getAreas().entrySet()) {
			areas.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
		}
	}

	/**
	 * Removes the element from its parent's area and drops it. A removed cut takes its area with it, so the
	 * caller removes whatever that area held as well.
	 */
	void remove(String elementId, String parentContextId) {
		Set<String> parentArea = areas.get(parentContextId);
		if (parentArea != null) {
			parentArea.remove(elementId);
		}
		vertices.remove(elementId);
		if (edges.remove(elementId) != null) {
			nu.remove(elementId);
			relationNames.remove(elementId);
		}
		if (cuts.remove(elementId) != null) {
			areas.remove(elementId);
		}
	}

	void addCut(Cut cut, String parentContextId) {
		cuts.put(cut.getId(), cut);
		areas.get(parentContextId).add(cut.getId());
		areas.put(cut.getId(), new LinkedHashSet<>());
	}

	void move(String elementId, String fromContextId, String toContextId) {
		areas.get(fromContextId).remove(elementId);
		areas.get(toContextId).add(elementId);
	}

	/**
	 * Makes every edge that uses one vertex use another in its place.
	 */
	void replaceArgument(String oldVertexId, String newVertexId) {
		for (List<String> arguments : nu.values()) {
			arguments.replaceAll(id -> id.equals(oldVertexId) ? newVertexId : id);
		}
	}

	RelationalGraph build() {
		return RelationalGraph.of(sheet, vertices.values(), edges.values(), cuts.values(), nu, relationNames, areas);
	}
}
