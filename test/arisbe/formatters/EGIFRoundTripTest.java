package arisbe.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import arisbe.model.egi.Edge;
import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.Vertex;
import arisbe.parser.EGIFParser;

/**
 * Parses each sample file, writes it back out, parses the result again and compares the two graphs up to the
 * choice of ids.
 */
@RunWith(Parameterized.class)
public class EGIFRoundTripTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{"socrates", },
			{"syllogism", },
			{"love", },
			{"shadowing", },
			{"coreference", },
			{"constants", },
			{"nesting", },
		});
	}

	private final String fileName;

	public EGIFRoundTripTest(String fileName) {
		this.fileName = fileName;
	}

	private static String describeVertex(RelationalGraph graph, String vertexId) {
		Vertex vertex = graph.getVertex(vertexId);
		String kind = vertex.isConstant() ? EGIFGenerator.quote(vertex.getConstantName()) : "_";
		return kind + "@" + graph.getContextDepth(graph.getParentContext(vertexId));
	}

	// an id-free description of a context: its vertices, its edges and, recursively, its cuts, each sorted
	private static String shape(RelationalGraph graph, String contextId) {
		List<String> vertices = new ArrayList<>();
		List<String> edges = new ArrayList<>();
		List<String> cuts = new ArrayList<>();
		for (String id : graph.getArea(contextId)) {
			if (graph.isContext(id)) {
				cuts.add(shape(graph, id));
			} else if (graph.getElement(id) instanceof Edge) {
				List<String> arguments = new ArrayList<>();
				for (String vertexId : graph.getIncidentVertices(id)) {
					arguments.add(describeVertex(graph, vertexId));
				}
				edges.add(graph.getRelationName(id) + arguments);
			} else {
				vertices.add(describeVertex(graph, id));
			}
		}
		Collections.sort(vertices);
		Collections.sort(edges);
		Collections.sort(cuts);
		return "{" + vertices + " " + edges + " " + cuts + "}";
	}

	private String read() throws IOException {
		Path path = Paths.get("test", "egif", fileName + ".egif");
		return FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
	}

	@Test
	public void roundTripPreservesStructure() throws IOException {
		RelationalGraph original = EGIFParser.parse(read());
		String text = EGIFGenerator.generate(original);
		RelationalGraph reparsed = EGIFParser.parse(text);

		assertThat(reparsed.getVertices().size(), is(original.getVertices().size()));
		assertThat(reparsed.getEdges().size(), is(original.getEdges().size()));
		assertThat(reparsed.getCuts().size(), is(original.getCuts().size()));
		assertThat(shape(reparsed, reparsed.getSheet()), is(shape(original, original.getSheet())));
	}

	@Test
	public void parsedGraphsHaveDominatingNodes() throws IOException {
		assertThat(EGIFParser.parse(read()).hasDominatingNodes(), is(true));
	}
}
