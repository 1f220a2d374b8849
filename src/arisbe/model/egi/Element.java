package arisbe.model.egi;

import java.util.Objects;
import java.util.UUID;

/**
 *
 * Any member of V ∪ E ∪ Cut in a relational graph with cuts. Elements are pure identities; everything else
 * about them (where they sit, what they connect) lives in the {@link RelationalGraph} that holds them.
 *
 */
public abstract class Element {
	private final String id;

	protected Element(String id) {
		this.id = Objects.requireNonNull(id);
	}

	static String freshId(String prefix) {
		return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
	}

	public String getId() {
		return id;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), id);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		return id.equals(((Element) obj).id);
	}

	public abstract <T, E extends Throwable> T accept(ElementVisitor<T, E> v) throws E;
}
