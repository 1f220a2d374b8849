package arisbe.scope;

import java.util.Objects;

/**
 * The defining occurrence a name currently refers to: the vertex it introduced and the context it was made in.
 */
public class Binding {
	private final String name;
	private final String contextId;
	private final String vertexId;

	public Binding(String name, String contextId, String vertexId) {
		this.name = name;
		this.contextId = contextId;
		this.vertexId = vertexId;
	}

	public String getName() {
		return name;
	}

	public String getContextId() {
		return contextId;
	}

	public String getVertexId() {
		return vertexId;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, contextId, vertexId);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		Binding that = (Binding) obj;
		return name.equals(that.name) && contextId.equals(that.contextId) && vertexId.equals(that.vertexId);
	}

	@Override
	public String toString() {
		return "Binding [" + name + " -> " + vertexId + " in " + contextId + "]";
	}
}
