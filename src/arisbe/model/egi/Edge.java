package arisbe.model.egi;

/**
 * One occurrence of a relation. Its name and arguments are held by the graph (rel and nu).
 */
public class Edge extends Element {

	public Edge(String id) {
		super(id);
	}

	public static Edge fresh() {
		return new Edge(freshId("e_"));
	}

	@Override
	public String toString() {
		return "Edge[" + getId() + "]";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
