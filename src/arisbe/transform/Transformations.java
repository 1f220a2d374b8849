package arisbe.transform;

import arisbe.model.egi.Alphabet;
import arisbe.model.egi.ContextAncestry;
import arisbe.model.egi.Cut;
import arisbe.model.egi.Edge;
import arisbe.model.egi.Element;
import arisbe.model.egi.ElementVisitor;
import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.UnknownContextIssue;
import arisbe.model.egi.Vertex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 *
 * The eight transformation rules of the calculus for existential graphs (Dau, Mathematical Logic with Diagrams,
 * Definition 14.1). Every rule takes a graph and returns the transformed graph, leaving its argument as it was.
 * A rule whose preconditions do not hold raises a {@link TransformationIssue}; ids that name nothing raise the
 * model's usual issues.
 *
 * A context is positive when it lies inside an even number of cuts, counting the sheet as depth 0. Erasure works
 * in positive contexts only and insertion in negative ones; the remaining rules hold in every context.
 *
 */
public final class Transformations {

	private Transformations() {}

	private static void requireContext(RelationalGraph graph, String contextId) {
		if (!graph.isContext(contextId)) {
			throw new UnknownContextIssue(contextId);
		}
	}

	private static void requireDominatingNodes(RelationalGraph graph, TransformationRule rule) {
		if (!graph.hasDominatingNodes()) {
			throw new TransformationIssue(rule, "the graph has an edge outside the context of one of its vertices");
		}
	}

	/**
	 * @return the element's id together with everything it encloses, if it is a cut
	 */
	private static Set<String> enclosedBy(RelationalGraph graph, String elementId) {
		Set<String> result = new LinkedHashSet<>();
		result.add(elementId);
		if (graph.isContext(elementId)) {
			result.addAll(graph.getFullContext(elementId));
		}
		return result;
	}

	/**
	 * Removes a set of elements closed under enclosure. Fails if an edge left behind still uses one of the
	 * removed vertices.
	 */
	private static RelationalGraph removeAll(RelationalGraph graph, Set<String> removed, TransformationRule rule) {
		for (Map.Entry<String, List<String>> entry : graph.getNu().entrySet()) {
			if (removed.contains(entry.getKey())) {
				continue;
			}
			for (String vertexId : entry.getValue()) {
				if (removed.contains(vertexId)) {
					throw new TransformationIssue(rule,
							"vertex " + vertexId + " is still used by edge " + entry.getKey());
				}
			}
		}
		GraphComponents components = new GraphComponents(graph);
		for (String id : removed) {
			components.remove(id, graph.getParentContext(id));
		}
		return components.build();
	}

	/**
	 * Rule 1. Erases a vertex, an edge or a cut with everything inside it from a positive context. A vertex can
	 * only go once no edge uses it.
	 */
	public static RelationalGraph erase(RelationalGraph graph, String elementId) {
		graph.getElement(elementId);
		String contextId = graph.getParentContext(elementId);
		if (graph.isNegativeContext(contextId)) {
			throw new TransformationIssue(TransformationRule.ERASURE,
					elementId + " lies in negative context " + contextId);
		}
		return removeAll(graph, enclosedBy(graph, elementId), TransformationRule.ERASURE);
	}

	/**
	 * Rule 2. Copies every element of another graph into a negative context, with fresh ids. A constant of the
	 * inserted graph becomes a constant of the same name already visible from the context, if there is one.
	 */
	public static RelationalGraph insert(RelationalGraph graph, String contextId, RelationalGraph inserted) {
		requireContext(graph, contextId);
		if (graph.isPositiveContext(contextId)) {
			throw new TransformationIssue(TransformationRule.INSERTION, "context " + contextId + " is positive");
		}
		ContextAncestry ancestry = new ContextAncestry(graph);
		Map<String, String> ids = new HashMap<>();
		for (Vertex vertex : inserted.getVertices()) {
			if (vertex.isGeneric()) {
				continue;
			}
			for (Vertex existing : graph.getVertices()) {
				if (vertex.getConstantName().equals(existing.getConstantName())
						&& ancestry.isAncestorOrSelf(graph.getParentContext(existing.getId()), contextId)) {
					ids.put(vertex.getId(), existing.getId());
				}
			}
		}
		return copy(graph, inserted, inserted.getSheet(), contextId, ids);
	}

	/**
	 * Rule 2 for a single edge between vertices the graph already has. Each vertex has to be visible from the
	 * negative context the edge goes into.
	 */
	public static RelationalGraph insertEdge(RelationalGraph graph, String contextId, String relationName,
	                                         List<String> vertexIds) {
		requireContext(graph, contextId);
		if (graph.isPositiveContext(contextId)) {
			throw new TransformationIssue(TransformationRule.INSERTION, "context " + contextId + " is positive");
		}
		ContextAncestry ancestry = new ContextAncestry(graph);
		for (String vertexId : vertexIds) {
			graph.getVertex(vertexId);
			if (!ancestry.isAncestorOrSelf(graph.getParentContext(vertexId), contextId)) {
				throw new TransformationIssue(TransformationRule.INSERTION,
						"vertex " + vertexId + " is not visible from context " + contextId);
			}
		}
		return graph.addEdge(Edge.fresh(), vertexIds, relationName, contextId);
	}

	/**
	 * Copies what sourceContext of source encloses into targetContext of target. Source elements already in ids
	 * map to the target elements given there; vertices outside sourceContext that are not in ids are taken to be
	 * vertices of the target itself.
	 */
	private static RelationalGraph copy(RelationalGraph target, RelationalGraph source, String sourceContext,
	                                    String targetContext, Map<String, String> ids) {
		ids.put(sourceContext, targetContext);
		List<String> enclosed = new ArrayList<>(source.getFullContext(sourceContext));
		List<Cut> cuts = new ArrayList<>();
		List<Vertex> vertices = new ArrayList<>();
		List<Edge> edges = new ArrayList<>();
		for (String id : enclosed) {
			source.getElement(id).accept(new ElementVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(Vertex vertex) {
					vertices.add(vertex);
					return null;
				}

				@Override
				public Void visit(Edge edge) {
					edges.add(edge);
					return null;
				}

				@Override
				public Void visit(Cut cut) {
					cuts.add(cut);
					return null;
				}
			});
		}
		// cuts outside in, so that every parent exists before its children
		cuts.sort(Comparator.comparing((Cut c) -> source.getContextDepth(c.getId())));

		RelationalGraph result = target;
		for (Cut cut : cuts) {
			Cut fresh = Cut.fresh();
			result = result.addCut(fresh, ids.get(source.getParentContext(cut.getId())));
			ids.put(cut.getId(), fresh.getId());
		}
		for (Vertex vertex : vertices) {
			if (ids.containsKey(vertex.getId())) {
				continue;
			}
			Vertex fresh = vertex.isGeneric() ? Vertex.generic() : Vertex.constant(vertex.getConstantName());
			result = result.addVertexInContext(fresh, ids.get(source.getParentContext(vertex.getId())));
			ids.put(vertex.getId(), fresh.getId());
		}
		for (Edge edge : edges) {
			List<String> arguments = new ArrayList<>();
			for (String vertexId : source.getIncidentVertices(edge.getId())) {
				arguments.add(ids.getOrDefault(vertexId, vertexId));
			}
			Edge fresh = Edge.fresh();
			result = result.addEdge(fresh, arguments, source.getRelationName(edge.getId()),
					ids.get(source.getParentContext(edge.getId())));
			ids.put(edge.getId(), fresh.getId());
		}
		return result;
	}

	/**
	 * Rule 3. Copies an element into its own context or a context inside it. A copied edge uses the same
	 * vertices as the original; a copied cut gets fresh copies of the vertices it encloses. A copied vertex is
	 * joined to its original by an identity edge.
	 */
	public static RelationalGraph iterate(RelationalGraph graph, String elementId, String targetContextId) {
		requireDominatingNodes(graph, TransformationRule.ITERATION);
		Element element = graph.getElement(elementId);
		requireContext(graph, targetContextId);
		String sourceContext = graph.getParentContext(elementId);
		if (!new ContextAncestry(graph).isAncestorOrSelf(sourceContext, targetContextId)) {
			throw new TransformationIssue(TransformationRule.ITERATION,
					"context " + targetContextId + " is not inside context " + sourceContext + " of " + elementId);
		}
		return element.accept(new ElementVisitor<RelationalGraph, RuntimeException>() {
			@Override
			public RelationalGraph visit(Vertex vertex) {
				Vertex copy = vertex.isGeneric() ? Vertex.generic() : Vertex.constant(vertex.getConstantName());
				return graph.addVertexInContext(copy, targetContextId)
						.addEdge(Edge.fresh(), Arrays.asList(vertex.getId(), copy.getId()), Alphabet.IDENTITY,
								targetContextId);
			}

			@Override
			public RelationalGraph visit(Edge edge) {
				return graph.addEdge(Edge.fresh(), graph.getIncidentVertices(elementId),
						graph.getRelationName(elementId), targetContextId);
			}

			@Override
			public RelationalGraph visit(Cut cut) {
				if (enclosedBy(graph, elementId).contains(targetContextId)) {
					throw new TransformationIssue(TransformationRule.ITERATION,
							"cut " + elementId + " cannot be copied into itself");
				}
				Cut fresh = Cut.fresh();
				return copy(graph.addCut(fresh, targetContextId), graph, elementId, fresh.getId(), new HashMap<>());
			}
		});
	}

	/**
	 * Rule 4. Removes an element that is a copy of another one in the same or an enclosing context, which is what
	 * iteration would have produced. A vertex joined by an identity edge in its own context to a vertex visible
	 * from there is merged into that vertex, and the identity edge goes.
	 */
	public static RelationalGraph deiterate(RelationalGraph graph, String elementId) {
		requireDominatingNodes(graph, TransformationRule.DEITERATION);
		Element element = graph.getElement(elementId);
		String contextId = graph.getParentContext(elementId);
		ContextAncestry ancestry = new ContextAncestry(graph);
		return element.accept(new ElementVisitor<RelationalGraph, RuntimeException>() {
			@Override
			public RelationalGraph visit(Vertex vertex) {
				for (String id : graph.getArea(contextId)) {
					if (!graph.getRelationNames().containsKey(id)
							|| !Alphabet.IDENTITY.equals(graph.getRelationName(id))) {
						continue;
					}
					List<String> pair = graph.getIncidentVertices(id);
					int index = pair.indexOf(elementId);
					if (index < 0) {
						continue;
					}
					String other = pair.get(1 - index);
					if (!other.equals(elementId)
							&& ancestry.isAncestorOrSelf(graph.getParentContext(other), contextId)) {
						GraphComponents components = new GraphComponents(graph);
						components.remove(id, contextId);
						components.replaceArgument(elementId, other);
						components.remove(elementId, contextId);
						return components.build();
					}
				}
				throw new TransformationIssue(TransformationRule.DEITERATION,
						"vertex " + elementId + " is not identified with a vertex of an enclosing context");
			}

			@Override
			public RelationalGraph visit(Edge edge) {
				for (Map.Entry<String, List<String>> entry : graph.getNu().entrySet()) {
					String candidate = entry.getKey();
					if (!candidate.equals(elementId)
							&& entry.getValue().equals(graph.getIncidentVertices(elementId))
							&& graph.getRelationName(candidate).equals(graph.getRelationName(elementId))
							&& ancestry.isAncestorOrSelf(graph.getParentContext(candidate), contextId)) {
						return graph.removeElement(elementId);
					}
				}
				throw new TransformationIssue(TransformationRule.DEITERATION,
						"edge " + elementId + " has no copy in an enclosing context");
			}

			@Override
			public RelationalGraph visit(Cut cut) {
				String signature = SubgraphSignature.of(graph, elementId);
				for (Cut candidate : graph.getCuts()) {
					String candidateId = candidate.getId();
					if (!candidateId.equals(elementId)
							&& ancestry.isAncestorOrSelf(graph.getParentContext(candidateId), contextId)
							&& !graph.getFullContext(candidateId).contains(elementId)
							&& SubgraphSignature.of(graph, candidateId).equals(signature)) {
						return removeAll(graph, enclosedBy(graph, elementId), TransformationRule.DEITERATION);
					}
				}
				throw new TransformationIssue(TransformationRule.DEITERATION,
						"cut " + elementId + " has no copy in an enclosing context");
			}
		});
	}

	public static RelationalGraph addDoubleCut(RelationalGraph graph, String contextId, Collection<String> elementIds) {
		return addDoubleCut(graph, contextId, elementIds, Cut.fresh(), Cut.fresh());
	}

	/**
	 * Rule 5. Puts two nested cuts around some elements of one area. A vertex can only be enclosed together with
	 * every edge that uses it.
	 */
	public static RelationalGraph addDoubleCut(RelationalGraph graph, String contextId, Collection<String> elementIds,
	                                           Cut outer, Cut inner) {
		requireContext(graph, contextId);
		Set<String> area = graph.getArea(contextId);
		Set<String> enclosed = new LinkedHashSet<>();
		for (String id : elementIds) {
			if (!area.contains(id)) {
				throw new TransformationIssue(TransformationRule.DOUBLE_CUT_ADDITION,
						id + " is not in the area of " + contextId);
			}
			enclosed.addAll(enclosedBy(graph, id));
		}
		for (Map.Entry<String, List<String>> entry : graph.getNu().entrySet()) {
			if (enclosed.contains(entry.getKey())) {
				continue;
			}
			for (String vertexId : entry.getValue()) {
				if (enclosed.contains(vertexId)) {
					throw new TransformationIssue(TransformationRule.DOUBLE_CUT_ADDITION,
							"vertex " + vertexId + " is used by edge " + entry.getKey() + ", which stays outside");
				}
			}
		}
		GraphComponents components = new GraphComponents(graph);
		components.addCut(outer, contextId);
		components.addCut(inner, outer.getId());
		for (String id : elementIds) {
			components.move(id, contextId, inner.getId());
		}
		return components.build();
	}

	/**
	 * Rule 6. Removes a cut whose area holds nothing but one other cut, together with that cut, putting what the
	 * inner cut held into the outer cut's context.
	 */
	public static RelationalGraph removeDoubleCut(RelationalGraph graph, String outerCutId) {
		graph.getCut(outerCutId);
		Set<String> area = graph.getArea(outerCutId);
		String innerCutId = area.size() == 1 ? area.iterator().next() : null;
		if (innerCutId == null || !graph.isContext(innerCutId)) {
			throw new TransformationIssue(TransformationRule.DOUBLE_CUT_REMOVAL,
					"cut " + outerCutId + " does not hold exactly one cut and nothing else");
		}
		return graph.removeElement(outerCutId).removeElement(innerCutId);
	}

	/**
	 * Rule 7. Adds a vertex that no edge uses to any context.
	 */
	public static RelationalGraph addIsolatedVertex(RelationalGraph graph, String contextId, Vertex vertex) {
		requireContext(graph, contextId);
		return graph.addVertexInContext(vertex, contextId);
	}

	/**
	 * Rule 8. Removes a vertex that no edge uses from any context.
	 */
	public static RelationalGraph removeIsolatedVertex(RelationalGraph graph, String vertexId) {
		if (!graph.isVertexIsolated(vertexId)) {
			throw new TransformationIssue(TransformationRule.ISOLATED_VERTEX_REMOVAL,
					"vertex " + vertexId + " is used by an edge");
		}
		return graph.removeElement(vertexId);
	}
}
