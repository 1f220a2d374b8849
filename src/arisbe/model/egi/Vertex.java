package arisbe.model.egi;

import java.util.Objects;

/**
 * A vertex is either generic (an unnamed "something", drawn as a line of identity) or a constant carrying a
 * name such as {@code Socrates}.
 */
public class Vertex extends Element {
	private final String constantName;

	public Vertex(String id, String constantName) {
		super(id);
		this.constantName = constantName;
	}

	public static Vertex generic() {
		return new Vertex(freshId("v_"), null);
	}

	public static Vertex constant(String name) {
		return new Vertex(freshId("v_"), Objects.requireNonNull(name));
	}

	public boolean isGeneric() {
		return constantName == null;
	}

	public boolean isConstant() {
		return constantName != null;
	}

	/**
	 * @return the name of a constant vertex, null for a generic one
	 */
	public String getConstantName() {
		return constantName;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), constantName);
	}

	@Override
	public boolean equals(Object obj) {
		return super.equals(obj) && Objects.equals(constantName, ((Vertex) obj).constantName);
	}

	@Override
	public String toString() {
		return isGeneric() ? "Vertex[" + getId() + "]" : "Vertex[" + getId() + " \"" + constantName + "\"]";
	}

	@Override
	public <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
