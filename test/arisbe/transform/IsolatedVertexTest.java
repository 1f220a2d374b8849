package arisbe.transform;

import static arisbe.transform.TransformationTestingUtils.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.UnknownContextIssue;
import arisbe.model.egi.UnknownVertexIssue;
import arisbe.model.egi.Vertex;
import arisbe.parser.ParsedEGIF;

public class IsolatedVertexTest {

	@Test
	public void addsGenericVertexToCut() {
		ParsedEGIF parsed = parse("~[ (P \"a\") ]");
		RelationalGraph result = Transformations.addIsolatedVertex(parsed.getGraph(), at(parsed, 1),
				Vertex.generic());
		assertThat(generate(result), is("~[ *x (P \"a\") ]"));
	}

	@Test
	public void addsConstantToSheet() {
		RelationalGraph graph = parse("(P \"a\")").getGraph();
		RelationalGraph result = Transformations.addIsolatedVertex(graph, graph.getSheet(), Vertex.constant("b"));
		assertThat(generate(result), is("\"b\" (P \"a\")"));
	}

	@Test(expected = UnknownContextIssue.class)
	public void unknownContext() {
		Transformations.addIsolatedVertex(parse("(P \"a\")").getGraph(), "c_missing", Vertex.generic());
	}

	@Test
	public void removesIsolatedVertex() {
		ParsedEGIF parsed = parse("*x *y (P y)");
		RelationalGraph result = Transformations.removeIsolatedVertex(parsed.getGraph(), at(parsed, 1));
		assertThat(generate(result), is("*x (P x)"));
	}

	@Test
	public void vertexInUse() {
		ParsedEGIF parsed = parse("*x *y (P y)");
		try {
			Transformations.removeIsolatedVertex(parsed.getGraph(), at(parsed, 4));
			fail("expected TransformationIssue");
		} catch (TransformationIssue issue) {
			assertThat(issue.getRule(), is(TransformationRule.ISOLATED_VERTEX_REMOVAL));
			assertThat(issue.getReason(), containsString("is used by an edge"));
		}
	}

	@Test(expected = UnknownVertexIssue.class)
	public void unknownVertex() {
		Transformations.removeIsolatedVertex(parse("*x").getGraph(), "v_missing");
	}

	@Test(expected = UnknownVertexIssue.class)
	public void edgeIsNoVertex() {
		ParsedEGIF parsed = parse("(P \"a\")");
		Transformations.removeIsolatedVertex(parsed.getGraph(), at(parsed, 1));
	}
}
