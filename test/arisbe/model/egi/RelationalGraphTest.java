package arisbe.model.egi;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

public class RelationalGraphTest {

	private RelationalGraph graph;
	private String sheet;
	private Vertex socrates;
	private Vertex x;
	private Edge human;
	private Edge mortal;
	private Cut outer;
	private Cut inner;

	// Socrates is on the sheet, *x sits in the outer cut, (human x) in the outer cut and (mortal x) in the inner one
	@Before
	public void setup() {
		socrates = new Vertex("v_socrates", "Socrates");
		x = new Vertex("v_x", null);
		human = new Edge("e_human");
		mortal = new Edge("e_mortal");
		outer = new Cut("c_outer");
		inner = new Cut("c_inner");
		graph = RelationalGraph.empty()
				.addVertex(socrates)
				.addCut(outer)
				.addVertexInContext(x, "c_outer")
				.addEdge(human, Collections.singletonList("v_x"), "human", "c_outer")
				.addCut(inner, "c_outer")
				.addEdge(mortal, Collections.singletonList("v_x"), "mortal", "c_inner");
		sheet = graph.getSheet();
	}

	@Test
	public void emptyGraphHasOnlyTheSheet() {
		RelationalGraph empty = RelationalGraph.empty();
		assertThat(empty.getVertices().isEmpty(), is(true));
		assertThat(empty.getEdges().isEmpty(), is(true));
		assertThat(empty.getCuts().isEmpty(), is(true));
		assertThat(empty.getArea(empty.getSheet()).isEmpty(), is(true));
		assertThat(empty.getSheet().startsWith("sheet_"), is(true));
	}

	@Test
	public void constructorsDoNotChangeTheReceiver() {
		RelationalGraph before = graph;
		RelationalGraph after = graph.addVertex(Vertex.generic());
		assertThat(before.getVertices().size(), is(2));
		assertThat(after.getVertices().size(), is(3));
		assertThat(before, is(not(after)));
	}

	@Test
	public void areasAndParents() {
		assertThat(graph.getArea(sheet).contains("v_socrates"), is(true));
		assertThat(graph.getArea(sheet).contains("c_outer"), is(true));
		assertThat(graph.getArea("c_outer").contains("v_x"), is(true));
		assertThat(graph.getArea("c_outer").contains("e_human"), is(true));
		assertThat(graph.getArea("c_outer").contains("c_inner"), is(true));
		assertThat(graph.getParentContext("e_mortal"), is("c_inner"));
		assertThat(graph.getParentContext("c_inner"), is("c_outer"));
		assertThat(graph.getParentContext("c_outer"), is(sheet));
	}

	@Test
	public void fullContextIsTransitive() {
		assertThat(graph.getFullContext("c_outer"),
				is((Set<String>) new LinkedHashSet<>(Arrays.asList("v_x", "e_human", "c_inner", "e_mortal"))));
		assertThat(graph.getFullContext(sheet).size(), is(6));
		assertThat(graph.getFullContext("c_inner"), is(Collections.singleton("e_mortal")));
	}

	@Test
	public void depthsAndPolarity() {
		assertThat(graph.getContextDepth(sheet), is(0));
		assertThat(graph.getContextDepth("c_outer"), is(1));
		assertThat(graph.getContextDepth("c_inner"), is(2));
		assertThat(graph.getNestingDepth("v_socrates"), is(0));
		assertThat(graph.getNestingDepth("e_mortal"), is(2));
		assertThat(graph.isPositiveContext(sheet), is(true));
		assertThat(graph.isNegativeContext("c_outer"), is(true));
		assertThat(graph.isPositiveContext("c_inner"), is(true));
		assertThat(graph.isOddlyEnclosed("e_human"), is(true));
		assertThat(graph.isEvenlyEnclosed("e_mortal"), is(true));
	}

	@Test
	public void elementAccess() {
		assertThat(graph.getVertex("v_socrates").getConstantName(), is("Socrates"));
		assertThat(graph.getVertex("v_x").isGeneric(), is(true));
		assertThat(graph.getElement("c_inner"), is((Element) inner));
		assertThat(graph.getRelationName("e_human"), is("human"));
		assertThat(graph.getIncidentVertices("e_mortal"), is(Collections.singletonList("v_x")));
		assertThat(graph.isContext(sheet), is(true));
		assertThat(graph.isContext("c_outer"), is(true));
		assertThat(graph.isContext("v_x"), is(false));
	}

	@Test
	public void isolatedVertices() {
		assertThat(graph.isVertexIsolated("v_socrates"), is(true));
		assertThat(graph.isVertexIsolated("v_x"), is(false));
		assertThat(graph.getIsolatedVertices(), is(Collections.singleton("v_socrates")));
	}

	@Test
	public void dominatingNodes() {
		assertThat(graph.hasDominatingNodes(), is(true));
		RelationalGraph loose = graph.addEdge(new Edge("e_loose"), Collections.singletonList("v_x"), "P");
		assertThat(loose.hasDominatingNodes(), is(false));
	}

	@Test
	public void relocateVertex() {
		RelationalGraph moved = graph.relocateVertex("v_x", sheet);
		assertThat(moved.getParentContext("v_x"), is(sheet));
		assertThat(moved.getArea("c_outer").contains("v_x"), is(false));
		assertThat(graph.relocateVertex("v_x", "c_outer"), is(sameInstance(graph)));
	}

	@Test
	public void removeEdge() {
		RelationalGraph removed = graph.removeElement("e_mortal");
		assertThat(removed.getEdges().size(), is(1));
		assertThat(removed.getNu().containsKey("e_mortal"), is(false));
		assertThat(removed.getRelationNames().containsKey("e_mortal"), is(false));
		assertThat(removed.getArea("c_inner").isEmpty(), is(true));
	}

	@Test
	public void removeCutPromotesItsArea() {
		RelationalGraph removed = graph.removeElement("c_outer");
		assertThat(removed.getCuts().size(), is(1));
		assertThat(removed.getParentContext("v_x"), is(sheet));
		assertThat(removed.getParentContext("e_human"), is(sheet));
		assertThat(removed.getParentContext("c_inner"), is(sheet));
		assertThat(removed.getContextDepth("c_inner"), is(1));
	}

	@Test
	public void removeIsolatedVertex() {
		RelationalGraph removed = graph.removeElement("v_socrates");
		assertThat(removed.getVertices().size(), is(1));
		assertThat(removed.getArea(removed.getSheet()).contains("v_socrates"), is(false));
	}

	@Test(expected = InvariantViolationIssue.class)
	public void removeUsedVertex() {
		graph.removeElement("v_x");
	}

	@Test(expected = UnknownElementIssue.class)
	public void removeUnknownElement() {
		graph.removeElement("v_nope");
	}

	@Test(expected = UnknownContextIssue.class)
	public void addVertexToUnknownContext() {
		graph.addVertexInContext(Vertex.generic(), "c_nope");
	}

	@Test(expected = UnknownContextIssue.class)
	public void addVertexToNonContext() {
		graph.addVertexInContext(Vertex.generic(), "v_x");
	}

	@Test(expected = DuplicateElementIssue.class)
	public void addDuplicateVertex() {
		graph.addVertex(new Vertex("v_x", null));
	}

	@Test(expected = DuplicateElementIssue.class)
	public void addCutWithEdgeId() {
		graph.addCut(new Cut("e_human"));
	}

	@Test(expected = UnknownVertexIssue.class)
	public void addEdgeToUnknownVertex() {
		graph.addEdge(Edge.fresh(), Arrays.asList("v_x", "v_nope"), "loves");
	}

	@Test(expected = UnknownVertexIssue.class)
	public void relocateUnknownVertex() {
		graph.relocateVertex("v_nope", sheet);
	}

	@Test
	public void failedOperationLeavesGraphUnchanged() {
		RelationalGraph before = graph;
		try {
			graph.addEdge(Edge.fresh(), Arrays.asList("v_x", "v_nope"), "loves");
			fail("expected an unknown vertex");
		} catch (UnknownVertexIssue issue) {
			assertThat(issue.getVertexId(), is("v_nope"));
		}
		assertThat(graph, is(sameInstance(before)));
		assertThat(graph.getEdges().size(), is(2));
	}

	@Test
	public void nullaryEdge() {
		RelationalGraph g = RelationalGraph.empty().addEdge(new Edge("e_rain"), Collections.<String>emptyList(), "raining");
		assertThat(g.getIncidentVertices("e_rain").isEmpty(), is(true));
		assertThat(g.getRelationName("e_rain"), is("raining"));
	}

	@Test
	public void freshIdsHaveKindPrefixes() {
		assertThat(Vertex.generic().getId().matches("v_[0-9a-f]{8}"), is(true));
		assertThat(Edge.fresh().getId().matches("e_[0-9a-f]{8}"), is(true));
		assertThat(Cut.fresh().getId().matches("c_[0-9a-f]{8}"), is(true));
	}

	@Test
	public void ofAcceptsWellFormedComponents() {
		Map<String, List<String>> nu = new LinkedHashMap<>();
		nu.put("e", Collections.singletonList("v"));
		Map<String, Set<String>> areas = new LinkedHashMap<>();
		areas.put("s", new LinkedHashSet<>(Arrays.asList("v", "c")));
		areas.put("c", Collections.singleton("e"));
		RelationalGraph g = RelationalGraph.of("s", Collections.singletonList(new Vertex("v", null)),
				Collections.singletonList(new Edge("e")), Collections.singletonList(new Cut("c")),
				nu, Collections.singletonMap("e", "P"), areas);
		assertThat(g.getSheet(), is("s"));
		assertThat(g.getParentContext("e"), is("c"));
		assertThat(g.getContextDepth("c"), is(1));
	}

	@Test(expected = DuplicateElementIssue.class)
	public void ofRejectsRepeatedVertices() {
		Map<String, Set<String>> areas = new LinkedHashMap<>();
		areas.put("s", Collections.singleton("v"));
		RelationalGraph.of("s", Arrays.asList(new Vertex("v", null), new Vertex("v", null)),
				Collections.<Edge>emptyList(), Collections.<Cut>emptyList(),
				Collections.<String, List<String>>emptyMap(), Collections.<String, String>emptyMap(), areas);
	}

	@Test(expected = UnsupportedOperationException.class)
	public void viewsAreReadOnly() {
		graph.getNu().put("e_other", Collections.<String>emptyList());
	}
}
