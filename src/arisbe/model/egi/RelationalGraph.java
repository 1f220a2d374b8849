package arisbe.model.egi;

import arisbe.model.egi.InvariantViolationIssue.Invariant;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A relational graph with cuts in the sense of Dau (Mathematical Logic with Diagrams, Definition 12.1):
 * the vertices V, edges E, the argument mapping nu, the sheet of assertion, the cuts Cut and the area mapping,
 * together with the mapping from edges to relation names.
 *
 * Graphs are immutable. Every constructor operation returns a new graph that shares the unchanged parts of the
 * old one, and every graph checks the structural invariants when it is built, raising an
 * {@link InvariantViolationIssue} rather than existing in an inconsistent state. Operations that are asked to
 * do something impossible (place a vertex in a context that does not exist, say) raise a more specific issue
 * before getting that far.
 *
 * Ids are plain strings. Iteration orders follow insertion order so that everything derived from a graph is
 * deterministic. The maps held by a graph are never modified once it is built; operations copy the maps they
 * change and share the rest with the graph they started from.
 */
public final class RelationalGraph {
	private final String sheet;
	private final Map<String, Vertex> vertices;
	private final Map<String, Edge> edges;
	private final Map<String, Cut> cuts;
	private final Map<String, List<String>> nu;
	private final Map<String, String> relationNames;
	private final Map<String, Set<String>> areas;

	// element id -> id of the context whose area holds it
	private final Map<String, String> parents;

	private RelationalGraph(String sheet, Map<String, Vertex> vertices, Map<String, Edge> edges,
	                        Map<String, Cut> cuts, Map<String, List<String>> nu,
	                        Map<String, String> relationNames, Map<String, Set<String>> areas) {
		this.sheet = Objects.requireNonNull(sheet);
		this.vertices = vertices;
		this.edges = edges;
		this.cuts = cuts;
		this.nu = nu;
		this.relationNames = relationNames;
		this.areas = areas;
		this.parents = validate();
	}

	/**
	 * @return the empty graph: a fresh sheet of assertion with nothing on it
	 */
	public static RelationalGraph empty() {
		String sheet = Element.freshId("sheet_");
		Map<String, Set<String>> areas = new LinkedHashMap<>();
		areas.put(sheet, Collections.emptySet());
		return new RelationalGraph(sheet, new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(),
				new LinkedHashMap<>(), new LinkedHashMap<>(), areas);
	}

	/**
	 * Builds a graph from all of its components at once, as a format that does not grow graphs one element at
	 * a time would. Nothing is assumed about the components; the invariants are checked as usual.
	 */
	public static RelationalGraph of(String sheet, Collection<Vertex> vertices, Collection<Edge> edges,
	                                 Collection<Cut> cuts, Map<String, List<String>> nu,
	                                 Map<String, String> relationNames, Map<String, Set<String>> areas) {
		Map<String, Vertex> vertexMap = new LinkedHashMap<>();
		Map<String, Edge> edgeMap = new LinkedHashMap<>();
		Map<String, Cut> cutMap = new LinkedHashMap<>();
		for (Vertex v : vertices) {
			if (vertexMap.put(v.getId(), v) != null) {
				throw new DuplicateElementIssue(v.getId());
			}
		}
		for (Edge e : edges) {
			if (edgeMap.put(e.getId(), e) != null) {
				throw new DuplicateElementIssue(e.getId());
			}
		}
		for (Cut c : cuts) {
			if (cutMap.put(c.getId(), c) != null) {
				throw new DuplicateElementIssue(c.getId());
			}
		}
		Map<String, List<String>> nuCopy = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> entry : nu.entrySet()) {
			nuCopy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
		}
		Map<String, Set<String>> areaCopy = new LinkedHashMap<>();
		for (Map.Entry<String, Set<String>> entry : areas.entrySet()) {
			areaCopy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
		}
		return new RelationalGraph(sheet, vertexMap, edgeMap, cutMap, nuCopy, new LinkedHashMap<>(relationNames),
				areaCopy);
	}

	private Map<String, String> validate() {
		// 1. V, E and Cut are pairwise disjoint and do not contain the sheet
		for (String id : vertices.keySet()) {
			if (edges.containsKey(id) || cuts.containsKey(id)) {
				throw new InvariantViolationIssue(Invariant.DISJOINT_ELEMENT_SETS, "id " + id + " is used by more than one element");
			}
		}
		for (String id : edges.keySet()) {
			if (cuts.containsKey(id)) {
				throw new InvariantViolationIssue(Invariant.DISJOINT_ELEMENT_SETS, "id " + id + " is used by more than one element");
			}
		}
		if (containsElement(sheet)) {
			throw new InvariantViolationIssue(Invariant.DISJOINT_ELEMENT_SETS, "the sheet " + sheet + " is also an element");
		}

		// 2. nu is total over E and only mentions vertices
		for (Map.Entry<String, List<String>> entry : nu.entrySet()) {
			if (!edges.containsKey(entry.getKey())) {
				throw new InvariantViolationIssue(Invariant.NU_MAPPING, "nu maps non-edge " + entry.getKey());
			}
			for (String vertexId : entry.getValue()) {
				if (!vertices.containsKey(vertexId)) {
					throw new InvariantViolationIssue(Invariant.NU_MAPPING,
							"nu maps edge " + entry.getKey() + " to non-vertex " + vertexId);
				}
			}
		}
		for (String edgeId : edges.keySet()) {
			if (!nu.containsKey(edgeId)) {
				throw new InvariantViolationIssue(Invariant.NU_MAPPING, "edge " + edgeId + " has no nu mapping");
			}
		}

		// 3. rel is total over E
		for (String edgeId : relationNames.keySet()) {
			if (!edges.containsKey(edgeId)) {
				throw new InvariantViolationIssue(Invariant.RELATION_NAMES, "relation name given for non-edge " + edgeId);
			}
		}
		for (String edgeId : edges.keySet()) {
			if (relationNames.get(edgeId) == null) {
				throw new InvariantViolationIssue(Invariant.RELATION_NAMES, "edge " + edgeId + " has no relation name");
			}
		}

		// 4. and 5. the areas partition V ∪ E ∪ Cut
		if (!areas.containsKey(sheet)) {
			throw new InvariantViolationIssue(Invariant.AREA_COVERAGE, "the sheet " + sheet + " has no area");
		}
		for (String contextId : areas.keySet()) {
			if (!contextId.equals(sheet) && !cuts.containsKey(contextId)) {
				throw new InvariantViolationIssue(Invariant.AREA_COVERAGE, "area given for non-context " + contextId);
			}
		}
		for (String cutId : cuts.keySet()) {
			if (!areas.containsKey(cutId)) {
				throw new InvariantViolationIssue(Invariant.AREA_COVERAGE, "cut " + cutId + " has no area");
			}
		}
		Map<String, String> parentMap = new LinkedHashMap<>();
		for (Map.Entry<String, Set<String>> entry : areas.entrySet()) {
			for (String elementId : entry.getValue()) {
				if (!containsElement(elementId)) {
					throw new InvariantViolationIssue(Invariant.AREA_COVERAGE,
							"area of " + entry.getKey() + " holds unknown id " + elementId);
				}
				String previous = parentMap.put(elementId, entry.getKey());
				if (previous != null) {
					throw new InvariantViolationIssue(Invariant.DISJOINT_AREAS,
							elementId + " is in the areas of both " + previous + " and " + entry.getKey());
				}
			}
		}
		for (String id : allElementIds()) {
			if (!parentMap.containsKey(id)) {
				throw new InvariantViolationIssue(Invariant.AREA_COVERAGE, id + " is not in any area");
			}
		}

		// 6. c ∉ area^n(c): following parents from any cut must reach the sheet
		for (String cutId : cuts.keySet()) {
			Set<String> seen = new HashSet<>();
			String current = cutId;
			while (!current.equals(sheet)) {
				if (!seen.add(current)) {
					throw new InvariantViolationIssue(Invariant.ACYCLIC_CONTAINMENT,
							"context " + cutId + " is contained in itself");
				}
				current = parentMap.get(current);
			}
		}
		return parentMap;
	}

	private List<String> allElementIds() {
		List<String> ids = new ArrayList<>(vertices.size() + edges.size() + cuts.size());
		ids.addAll(vertices.keySet());
		ids.addAll(edges.keySet());
		ids.addAll(cuts.keySet());
		return ids;
	}

	private void requireContext(String contextId) {
		if (!isContext(contextId)) {
			throw new UnknownContextIssue(contextId);
		}
	}

	private void requireFresh(String id) {
		if (containsElement(id) || sheet.equals(id)) {
			throw new DuplicateElementIssue(id);
		}
	}

	private static Map<String, Set<String>> withAreaMember(Map<String, Set<String>> areas, String contextId,
	                                                       String elementId) {
		Map<String, Set<String>> result = new LinkedHashMap<>(areas);
		Set<String> area = new LinkedHashSet<>(areas.getOrDefault(contextId, Collections.emptySet()));
		area.add(elementId);
		result.put(contextId, Collections.unmodifiableSet(area));
		return result;
	}

	private static Map<String, Set<String>> withoutAreaMember(Map<String, Set<String>> areas, String contextId,
	                                                          String elementId) {
		Map<String, Set<String>> result = new LinkedHashMap<>(areas);
		Set<String> area = new LinkedHashSet<>(areas.get(contextId));
		area.remove(elementId);
		result.put(contextId, Collections.unmodifiableSet(area));
		return result;
	}

	// constructors

	public RelationalGraph addVertex(Vertex vertex) {
		return addVertexInContext(vertex, sheet);
	}

	public RelationalGraph addVertexInContext(Vertex vertex, String contextId) {
		requireContext(contextId);
		requireFresh(vertex.getId());
		Map<String, Vertex> newVertices = new LinkedHashMap<>(vertices);
		newVertices.put(vertex.getId(), vertex);
		return new RelationalGraph(sheet, newVertices, edges, cuts, nu, relationNames,
				withAreaMember(areas, contextId, vertex.getId()));
	}

	public RelationalGraph addEdge(Edge edge, List<String> vertexSequence, String relationName) {
		return addEdge(edge, vertexSequence, relationName, sheet);
	}

	public RelationalGraph addEdge(Edge edge, List<String> vertexSequence, String relationName, String contextId) {
		requireContext(contextId);
		requireFresh(edge.getId());
		for (String vertexId : vertexSequence) {
			if (!vertices.containsKey(vertexId)) {
				throw new UnknownVertexIssue(vertexId);
			}
		}
		Map<String, Edge> newEdges = new LinkedHashMap<>(edges);
		newEdges.put(edge.getId(), edge);
		Map<String, List<String>> newNu = new LinkedHashMap<>(nu);
		newNu.put(edge.getId(), Collections.unmodifiableList(new ArrayList<>(vertexSequence)));
		Map<String, String> newRelationNames = new LinkedHashMap<>(relationNames);
		newRelationNames.put(edge.getId(), relationName);
		return new RelationalGraph(sheet, vertices, newEdges, cuts, newNu, newRelationNames,
				withAreaMember(areas, contextId, edge.getId()));
	}

	public RelationalGraph addCut(Cut cut) {
		return addCut(cut, sheet);
	}

	public RelationalGraph addCut(Cut cut, String parentContextId) {
		requireContext(parentContextId);
		requireFresh(cut.getId());
		Map<String, Cut> newCuts = new LinkedHashMap<>(cuts);
		newCuts.put(cut.getId(), cut);
		Map<String, Set<String>> newAreas = withAreaMember(areas, parentContextId, cut.getId());
		newAreas.put(cut.getId(), Collections.emptySet());
		return new RelationalGraph(sheet, vertices, edges, newCuts, nu, relationNames, newAreas);
	}

	/**
	 * Moves a vertex from the area it is in to the area of another context. Nothing else changes; in
	 * particular the edges incident to the vertex stay where they are.
	 */
	public RelationalGraph relocateVertex(String vertexId, String newContextId) {
		if (!vertices.containsKey(vertexId)) {
			throw new UnknownVertexIssue(vertexId);
		}
		requireContext(newContextId);
		String currentContext = parents.get(vertexId);
		if (currentContext.equals(newContextId)) {
			return this;
		}
		Map<String, Set<String>> newAreas = withoutAreaMember(areas, currentContext, vertexId);
		return new RelationalGraph(sheet, vertices, edges, cuts, nu, relationNames,
				withAreaMember(newAreas, newContextId, vertexId));
	}

	/**
	 * Removes a vertex, an edge or a cut. Removing a cut does not remove what it contains: its area is moved
	 * into the area of the cut's parent. Removing a vertex that an edge still uses violates the nu invariant.
	 */
	public RelationalGraph removeElement(String elementId) {
		String parent = parents.get(elementId);
		return getElement(elementId).accept(new ElementVisitor<RelationalGraph, RuntimeException>() {
			@Override
			public RelationalGraph visit(Vertex vertex) {
				Map<String, Vertex> newVertices = new LinkedHashMap<>(vertices);
				newVertices.remove(elementId);
				return new RelationalGraph(sheet, newVertices, edges, cuts, nu, relationNames,
						withoutAreaMember(areas, parent, elementId));
			}

			@Override
			public RelationalGraph visit(Edge edge) {
				Map<String, Edge> newEdges = new LinkedHashMap<>(edges);
				newEdges.remove(elementId);
				Map<String, List<String>> newNu = new LinkedHashMap<>(nu);
				newNu.remove(elementId);
				Map<String, String> newRelationNames = new LinkedHashMap<>(relationNames);
				newRelationNames.remove(elementId);
				return new RelationalGraph(sheet, vertices, newEdges, cuts, newNu, newRelationNames,
						withoutAreaMember(areas, parent, elementId));
			}

			@Override
			public RelationalGraph visit(Cut cut) {
				Map<String, Cut> newCuts = new LinkedHashMap<>(cuts);
				newCuts.remove(elementId);
				Map<String, Set<String>> newAreas = new LinkedHashMap<>(areas);
				Set<String> parentArea = new LinkedHashSet<>(areas.get(parent));
				parentArea.remove(elementId);
				parentArea.addAll(areas.get(elementId));
				newAreas.put(parent, Collections.unmodifiableSet(parentArea));
				newAreas.remove(elementId);
				return new RelationalGraph(sheet, vertices, edges, newCuts, nu, relationNames, newAreas);
			}
		});
	}

	// element access

	public String getSheet() {
		return sheet;
	}

	public boolean isContext(String id) {
		return sheet.equals(id) || cuts.containsKey(id);
	}

	public boolean containsElement(String id) {
		return vertices.containsKey(id) || edges.containsKey(id) || cuts.containsKey(id);
	}

	public Element getElement(String id) {
		if (vertices.containsKey(id)) {
			return vertices.get(id);
		}
		if (edges.containsKey(id)) {
			return edges.get(id);
		}
		if (cuts.containsKey(id)) {
			return cuts.get(id);
		}
		throw new UnknownElementIssue(id);
	}

	public Vertex getVertex(String id) {
		Vertex vertex = vertices.get(id);
		if (vertex == null) {
			throw new UnknownVertexIssue(id);
		}
		return vertex;
	}

	public Edge getEdge(String id) {
		Edge edge = edges.get(id);
		if (edge == null) {
			throw new UnknownElementIssue(id);
		}
		return edge;
	}

	public Cut getCut(String id) {
		Cut cut = cuts.get(id);
		if (cut == null) {
			throw new UnknownContextIssue(id);
		}
		return cut;
	}

	public String getRelationName(String edgeId) {
		getEdge(edgeId);
		return relationNames.get(edgeId);
	}

	public List<String> getIncidentVertices(String edgeId) {
		getEdge(edgeId);
		return nu.get(edgeId);
	}

	public Collection<Vertex> getVertices() {
		return Collections.unmodifiableCollection(vertices.values());
	}

	public Collection<Edge> getEdges() {
		return Collections.unmodifiableCollection(edges.values());
	}

	public Collection<Cut> getCuts() {
		return Collections.unmodifiableCollection(cuts.values());
	}

	public Map<String, List<String>> getNu() {
		return Collections.unmodifiableMap(nu);
	}

	public Map<String, String> getRelationNames() {
		return Collections.unmodifiableMap(relationNames);
	}

	public Map<String, Set<String>> getAreas() {
		return Collections.unmodifiableMap(areas);
	}

	// areas and contexts

	/**
	 * @return the elements placed directly in the context, not those inside its cuts
	 */
	public Set<String> getArea(String contextId) {
		requireContext(contextId);
		return areas.get(contextId);
	}

	/**
	 * @return every element enclosed by the context at any depth: its area, the areas of the cuts in its area,
	 * and so on
	 */
	public Set<String> getFullContext(String contextId) {
		requireContext(contextId);
		Set<String> result = new LinkedHashSet<>();
		Deque<String> toProcess = new ArrayDeque<>();
		toProcess.add(contextId);
		while (!toProcess.isEmpty()) {
			for (String elementId : areas.get(toProcess.poll())) {
				if (result.add(elementId) && cuts.containsKey(elementId)) {
					toProcess.add(elementId);
				}
			}
		}
		return Collections.unmodifiableSet(result);
	}

	public String getParentContext(String elementId) {
		String parent = parents.get(elementId);
		if (parent == null) {
			throw new UnknownElementIssue(elementId);
		}
		return parent;
	}

	/**
	 * @return the number of cuts strictly enclosing the element
	 */
	public int getNestingDepth(String elementId) {
		int depth = 0;
		String current = getParentContext(elementId);
		while (!current.equals(sheet)) {
			depth++;
			current = parents.get(current);
		}
		return depth;
	}

	/**
	 * @return 0 for the sheet, and for a cut the number of cuts from the sheet down to and including it
	 */
	public int getContextDepth(String contextId) {
		requireContext(contextId);
		if (contextId.equals(sheet)) {
			return 0;
		}
		return getNestingDepth(contextId) + 1;
	}

	public boolean isPositiveContext(String contextId) {
		return getContextDepth(contextId) % 2 == 0;
	}

	public boolean isNegativeContext(String contextId) {
		return !isPositiveContext(contextId);
	}

	public boolean isEvenlyEnclosed(String elementId) {
		return getNestingDepth(elementId) % 2 == 0;
	}

	public boolean isOddlyEnclosed(String elementId) {
		return getNestingDepth(elementId) % 2 == 1;
	}

	// utilities

	public boolean isVertexIsolated(String vertexId) {
		getVertex(vertexId);
		for (List<String> arguments : nu.values()) {
			if (arguments.contains(vertexId)) {
				return false;
			}
		}
		return true;
	}

	public Set<String> getIsolatedVertices() {
		Set<String> used = new HashSet<>();
		for (List<String> arguments : nu.values()) {
			used.addAll(arguments);
		}
		Set<String> isolated = new LinkedHashSet<>();
		for (String vertexId : vertices.keySet()) {
			if (!used.contains(vertexId)) {
				isolated.add(vertexId);
			}
		}
		return Collections.unmodifiableSet(isolated);
	}

	/**
	 * Dau's dominating nodes condition (Definition 12.5): every edge sits in the context of each of its vertices
	 * or somewhere inside it.
	 */
	public boolean hasDominatingNodes() {
		ContextAncestry ancestry = new ContextAncestry(this);
		for (Map.Entry<String, List<String>> entry : nu.entrySet()) {
			String edgeContext = parents.get(entry.getKey());
			for (String vertexId : entry.getValue()) {
				if (!ancestry.isAncestorOrSelf(parents.get(vertexId), edgeContext)) {
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		return Objects.hash(sheet, vertices, edges, cuts, nu, relationNames, areas);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		RelationalGraph other = (RelationalGraph) obj;
		return sheet.equals(other.sheet) && vertices.equals(other.vertices) && edges.equals(other.edges) &&
				cuts.equals(other.cuts) && nu.equals(other.nu) && relationNames.equals(other.relationNames) &&
				areas.equals(other.areas);
	}

	@Override
	public String toString() {
		return "RelationalGraph [sheet=" + sheet + ", vertices=" + vertices.size() + ", edges=" + edges.size() +
				", cuts=" + cuts.size() + "]";
	}
}
