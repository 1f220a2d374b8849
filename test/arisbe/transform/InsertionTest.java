package arisbe.transform;

import static arisbe.transform.TransformationTestingUtils.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Collections;

import org.junit.Test;

import arisbe.model.egi.RelationalGraph;
import arisbe.parser.EGIFParser;
import arisbe.parser.ParsedEGIF;

public class InsertionTest {

	@Test
	public void insertsIntoCut() {
		ParsedEGIF parsed = parse("~[ (Q \"a\") ]");
		RelationalGraph result = Transformations.insert(parsed.getGraph(), at(parsed, 1),
				EGIFParser.parse("(P \"a\")"));
		assertThat(generate(result), is("~[ (P \"a\") (Q \"a\") ]"));
		// the inserted "a" is the one already there
		assertThat(result.getVertices().size(), is(1));
	}

	@Test
	public void insertsNestedCutWithItsVariables() {
		ParsedEGIF parsed = parse("~[ ]");
		RelationalGraph result = Transformations.insert(parsed.getGraph(), at(parsed, 1),
				EGIFParser.parse("~[ (P *x) ]"));
		assertThat(generate(result), is("~[ ~[ *x (P x) ] ]"));
	}

	@Test
	public void insertedGraphIsCopied() {
		RelationalGraph inserted = EGIFParser.parse("*x (P x)");
		ParsedEGIF parsed = parse("~[ ]");
		RelationalGraph result = Transformations.insert(parsed.getGraph(), at(parsed, 1), inserted);
		for (String vertexId : inserted.getArea(inserted.getSheet())) {
			assertThat(result.containsElement(vertexId), is(false));
		}
	}

	@Test(expected = TransformationIssue.class)
	public void sheetIsPositive() {
		RelationalGraph graph = parse("(Q \"a\")").getGraph();
		Transformations.insert(graph, graph.getSheet(), EGIFParser.parse("(P \"a\")"));
	}

	@Test(expected = TransformationIssue.class)
	public void doublyNegatedContextIsPositive() {
		ParsedEGIF parsed = parse("~[ ~[ ] ]");
		Transformations.insert(parsed.getGraph(), at(parsed, 4), EGIFParser.parse("(P \"a\")"));
	}

	@Test
	public void insertsEdgeBetweenVisibleVertices() {
		ParsedEGIF parsed = parse("*x ~[ (P x) ]");
		RelationalGraph result = Transformations.insertEdge(parsed.getGraph(), at(parsed, 4), "Q",
				Collections.singletonList(at(parsed, 1)));
		assertThat(generate(result), is("*x ~[ (P x) (Q x) ]"));
	}

	@Test
	public void edgeVertexOutOfSight() {
		ParsedEGIF parsed = parse("~[ *x ] ~[ ]");
		try {
			Transformations.insertEdge(parsed.getGraph(), at(parsed, 9), "Q",
					Collections.singletonList(at(parsed, 4)));
			fail("expected TransformationIssue");
		} catch (TransformationIssue issue) {
			assertThat(issue.getRule(), is(TransformationRule.INSERTION));
			assertThat(issue.getReason(), containsString("is not visible from context"));
		}
	}
}
