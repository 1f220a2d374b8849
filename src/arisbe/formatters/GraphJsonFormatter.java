package arisbe.formatters;

import arisbe.model.egi.Alphabet;
import arisbe.model.egi.Cut;
import arisbe.model.egi.Edge;
import arisbe.model.egi.RelationalGraph;
import arisbe.model.egi.Vertex;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Map;

/**
 * Describes a graph as a JSON object: the sheet, every vertex, edge and cut with the context it sits in, and the
 * alphabet.
 */
public class GraphJsonFormatter {
	public static final String POSITIVE = "positive";
	public static final String NEGATIVE = "negative";

	private GraphJsonFormatter() {}

	public static JSONObject format(RelationalGraph graph, Alphabet alphabet) {
		JSONObject result = new JSONObject();
		result.put("sheet", graph.getSheet());

		JSONArray vertices = new JSONArray();
		for (Vertex vertex : graph.getVertices()) {
			JSONObject v = new JSONObject();
			v.put("id", vertex.getId());
			if (vertex.isConstant()) {
				v.put("constant", vertex.getConstantName());
			}
			v.put("context", graph.getParentContext(vertex.getId()));
			vertices.put(v);
		}
		result.put("vertices", vertices);

		JSONArray edges = new JSONArray();
		for (Edge edge : graph.getEdges()) {
			JSONObject e = new JSONObject();
			e.put("id", edge.getId());
			e.put("relation", graph.getRelationName(edge.getId()));
			e.put("arguments", new JSONArray(graph.getIncidentVertices(edge.getId())));
			e.put("context", graph.getParentContext(edge.getId()));
			edges.put(e);
		}
		result.put("edges", edges);

		JSONArray cuts = new JSONArray();
		for (Cut cut : graph.getCuts()) {
			JSONObject c = new JSONObject();
			c.put("id", cut.getId());
			c.put("parent", graph.getParentContext(cut.getId()));
			c.put("depth", graph.getContextDepth(cut.getId()));
			c.put("polarity", graph.isPositiveContext(cut.getId()) ? POSITIVE : NEGATIVE);
			cuts.put(c);
		}
		result.put("cuts", cuts);

		JSONObject relations = new JSONObject();
		for (Map.Entry<String, Integer> entry : alphabet.getRelations().entrySet()) {
			relations.put(entry.getKey(), entry.getValue());
		}
		JSONObject a = new JSONObject();
		a.put("constants", new JSONArray(alphabet.getConstants()));
		a.put("relations", relations);
		result.put("alphabet", a);
		return result;
	}

	public static JSONObject format(RelationalGraph graph) {
		return format(graph, Alphabet.derive(graph));
	}
}
