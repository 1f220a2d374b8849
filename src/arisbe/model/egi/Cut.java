package arisbe.model.egi;

/**
 * A negation boundary. A cut is both an element (of its parent's area) and a context (with an area of its own).
 */
public class Cut extends Element {

	public Cut(String id) {
		super(id);
	}

	public static Cut fresh() {
		return new Cut(freshId("c_"));
	}

	@Override
	public String toString() {
		return "Cut[" + getId() + "]";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
