package arisbe.formatters;

import arisbe.model.egi.Alphabet;
import arisbe.model.egi.Cut;
import arisbe.model.egi.RelationalGraph;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class GraphSummaryFormatter {
	private final IndentingWriter out;

	public GraphSummaryFormatter(IndentingWriter out) {
		this.out = out;
	}

	public void format(RelationalGraph graph, Alphabet alphabet) throws IOException {
		int maxDepth = 0;
		for (Cut cut : graph.getCuts()) {
			maxDepth = Math.max(maxDepth, graph.getContextDepth(cut.getId()));
		}
		out.write(graph.getVertices().size() + " vertices, " + graph.getEdges().size() + " edges, "
				+ graph.getCuts().size() + " cuts, maximum depth " + maxDepth);
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("isolated vertices: " + graph.getIsolatedVertices().size());
			out.newLine();
			List<String> constants = new ArrayList<>();
			for (String constant : alphabet.getConstants()) {
				constants.add(EGIFGenerator.quote(constant));
			}
			out.write("constants: " + String.join(" ", constants));
			out.newLine();
			List<String> relations = new ArrayList<>();
			for (Map.Entry<String, Integer> entry : alphabet.getRelations().entrySet()) {
				relations.add(entry.getKey() + "/" + entry.getValue());
			}
			out.write("relations: " + String.join(" ", relations));
		}
	}
}
