package arisbe.model.egi;

import arisbe.util.SourceLocation;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The names a graph uses: its constant names and its relation names with their arities. A relation name has one
 * arity; identity ({@value #IDENTITY}) is always binary.
 */
public class Alphabet {
	public static final String IDENTITY = "=";

	private final SortedSet<String> constants;
	private final SortedMap<String, Integer> relations;

	public Alphabet() {
		this.constants = new TreeSet<>();
		this.relations = new TreeMap<>();
	}

	public static Alphabet derive(RelationalGraph graph) {
		Alphabet alphabet = new Alphabet();
		for (Vertex vertex : graph.getVertices()) {
			if (vertex.isConstant()) {
				alphabet.addConstant(vertex.getConstantName());
			}
		}
		for (Map.Entry<String, String> entry : graph.getRelationNames().entrySet()) {
			alphabet.addRelation(entry.getValue(), graph.getIncidentVertices(entry.getKey()).size(),
					SourceLocation.unknown());
		}
		return alphabet;
	}

	public void addConstant(String name) {
		constants.add(name);
	}

	/**
	 * @throws ArityConflictIssue if the relation was already seen with another arity
	 */
	public void addRelation(String name, int arity, SourceLocation location) {
		Integer known = getArity(name);
		if (known != null && known != arity) {
			throw new ArityConflictIssue(name, known, arity, location);
		}
		relations.put(name, arity);
	}

	/**
	 * @return the arity the relation must have, or null if it is unconstrained so far
	 */
	public Integer getArity(String name) {
		Integer arity = relations.get(name);
		if (arity == null && IDENTITY.equals(name)) {
			return 2;
		}
		return arity;
	}

	public SortedSet<String> getConstants() {
		return Collections.unmodifiableSortedSet(constants);
	}

	public SortedMap<String, Integer> getRelations() {
		return Collections.unmodifiableSortedMap(relations);
	}

	@Override
	public String toString() {
		return "Alphabet [constants=" + constants + ", relations=" + relations + "]";
	}
}
