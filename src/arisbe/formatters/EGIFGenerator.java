package arisbe.formatters;

import arisbe.Unreachable;
import arisbe.model.egi.ContextAncestry;
import arisbe.model.egi.Cut;
import arisbe.model.egi.Edge;
import arisbe.model.egi.ElementVisitor;
import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.Vertex;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 *
 * Writes a {@link RelationalGraph} as EGIF text.
 *
 * Generic vertices are named x, y, z, x1, y1, z1, x2, ... in the order a top-down walk over the contexts first
 * meets them, and each is defined once, in the innermost context enclosing its own context and the contexts of
 * every edge that uses it. Within a context the output lists definitions, isolated constants, edges and then
 * cuts, each in a fixed order, so one graph always produces the same text.
 *
 */
public class EGIFGenerator extends ElementVisitor<Void, IOException> {
	private static final String[] LABEL_LETTERS = {"x", "y", "z"};

	private final IndentingWriter out;
	private final RelationalGraph graph;
	private final ContextAncestry ancestry;
	private final Map<String, Integer> labels;
	private final Map<String, List<String>> definitions;
	private final Map<String, List<String>> isolatedConstants;
	private final Map<String, AreaMembers> areaMembers;

	public EGIFGenerator(IndentingWriter out, RelationalGraph graph) {
		this.out = out;
		this.graph = graph;
		this.ancestry = new ContextAncestry(graph);
		this.labels = new HashMap<>();
		this.definitions = new HashMap<>();
		this.isolatedConstants = new HashMap<>();
		this.areaMembers = new HashMap<>();
		assignLabels(graph.getSheet());
		placeVertices();
	}

	public static String generate(RelationalGraph graph) {
		StringWriter sw = new StringWriter();
		try {
			new EGIFGenerator(new IndentingWriter(sw), graph).writeContext(graph.getSheet());
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	public static String labelFor(int index) {
		String letter = LABEL_LETTERS[index % LABEL_LETTERS.length];
		int round = index / LABEL_LETTERS.length;
		return round == 0 ? letter : letter + round;
	}

	public static String quote(String constantName) {
		return "\"" + constantName.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

	/**
	 * @return the label given to a generic vertex
	 */
	public String getLabel(String vertexId) {
		Integer index = labels.get(vertexId);
		if (index == null) {
			throw new IllegalArgumentException("no label for vertex " + vertexId);
		}
		return labelFor(index);
	}

	// the members of one area, split by kind and put in output order
	private static final class AreaMembers {
		final List<Vertex> vertices = new ArrayList<>();
		final List<Edge> edges = new ArrayList<>();
		final List<Cut> cuts = new ArrayList<>();
	}

	private AreaMembers membersOf(String contextId) {
		AreaMembers cached = areaMembers.get(contextId);
		if (cached != null) {
			return cached;
		}
		AreaMembers members = new AreaMembers();
		List<String> ids = new ArrayList<>(graph.getArea(contextId));
		Collections.sort(ids);
		for (String id : ids) {
			graph.getElement(id).accept(new ElementVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(Vertex vertex) {
					members.vertices.add(vertex);
					return null;
				}

				@Override
				public Void visit(Edge edge) {
					members.edges.add(edge);
					return null;
				}

				@Override
				public Void visit(Cut cut) {
					members.cuts.add(cut);
					return null;
				}
			});
		}
		members.edges.sort(Comparator.comparing((Edge e) -> graph.getRelationName(e.getId()))
				.thenComparing((a, b) -> compareIdLists(
						graph.getIncidentVertices(a.getId()), graph.getIncidentVertices(b.getId())))
				.thenComparing(Edge::getId));
		areaMembers.put(contextId, members);
		return members;
	}

	private static int compareIdLists(List<String> a, List<String> b) {
		for (int i = 0; i < a.size() && i < b.size(); ++i) {
			int c = a.get(i).compareTo(b.get(i));
			if (c != 0) {
				return c;
			}
		}
		return Integer.compare(a.size(), b.size());
	}

	private void label(String vertexId) {
		if (graph.getVertex(vertexId).isGeneric() && !labels.containsKey(vertexId)) {
			labels.put(vertexId, labels.size());
		}
	}

	private void assignLabels(String contextId) {
		AreaMembers members = membersOf(contextId);
		for (Edge edge : members.edges) {
			for (String vertexId : graph.getIncidentVertices(edge.getId())) {
				label(vertexId);
			}
		}
		for (Vertex vertex : members.vertices) {
			label(vertex.getId());
		}
		for (Cut cut : members.cuts) {
			assignLabels(cut.getId());
		}
	}

	private void placeVertices() {
		Map<String, List<String>> uses = new HashMap<>();
		for (Map.Entry<String, List<String>> entry : graph.getNu().entrySet()) {
			String edgeContext = graph.getParentContext(entry.getKey());
			for (String vertexId : entry.getValue()) {
				uses.computeIfAbsent(vertexId, ignored -> new ArrayList<>()).add(edgeContext);
			}
		}
		for (Vertex vertex : graph.getVertices()) {
			String area = graph.getParentContext(vertex.getId());
			List<String> vertexUses = uses.getOrDefault(vertex.getId(), Collections.emptyList());
			if (vertex.isGeneric()) {
				List<String> contexts = new ArrayList<>(vertexUses);
				contexts.add(area);
				definitions.computeIfAbsent(ancestry.leastCommonAncestor(contexts), ignored -> new ArrayList<>())
						.add(vertex.getId());
			} else if (vertexUses.isEmpty() || !area.equals(ancestry.leastCommonAncestor(vertexUses))) {
				isolatedConstants.computeIfAbsent(area, ignored -> new ArrayList<>()).add(vertex.getId());
			}
		}
	}

	public void writeContext(String contextId) throws IOException {
		List<String> defined = new ArrayList<>(definitions.getOrDefault(contextId, Collections.emptyList()));
		defined.sort(Comparator.comparing(labels::get));
		for (String vertexId : defined) {
			out.separate();
			out.write("*");
			out.write(getLabel(vertexId));
		}

		List<String> constants = new ArrayList<>(isolatedConstants.getOrDefault(contextId, Collections.emptyList()));
		constants.sort(Comparator.comparing(id -> graph.getVertex(id).getConstantName()));
		for (String vertexId : constants) {
			graph.getVertex(vertexId).accept(this);
		}

		AreaMembers members = membersOf(contextId);
		for (Edge edge : members.edges) {
			edge.accept(this);
		}
		for (Cut cut : members.cuts) {
			cut.accept(this);
		}
	}

	@Override
	public Void visit(Vertex vertex) throws IOException {
		out.separate();
		if (vertex.isConstant()) {
			out.write(quote(vertex.getConstantName()));
		} else {
			out.write(getLabel(vertex.getId()));
		}
		return null;
	}

	@Override
	public Void visit(Edge edge) throws IOException {
		out.separate();
		out.write("(");
		out.write(graph.getRelationName(edge.getId()));
		for (String vertexId : graph.getIncidentVertices(edge.getId())) {
			graph.getVertex(vertexId).accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(Cut cut) throws IOException {
		out.separate();
		out.write("~[");
		writeContext(cut.getId());
		out.write(" ]");
		return null;
	}
}
