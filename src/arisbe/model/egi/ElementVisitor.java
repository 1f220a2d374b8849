package arisbe.model.egi;

public abstract class ElementVisitor<T, E extends Throwable> {
	public abstract T visit(Vertex vertex) throws E;
	public abstract T visit(Edge edge) throws E;
	public abstract T visit(Cut cut) throws E;
}
