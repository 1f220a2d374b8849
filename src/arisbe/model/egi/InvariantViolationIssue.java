package arisbe.model.egi;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;

public class InvariantViolationIssue extends Issue {

	/**
	 * The structural constraints of a relational graph with cuts (Dau, Definition 12.1).
	 */
	public enum Invariant {
		DISJOINT_ELEMENT_SETS("vertices, edges, cuts and the sheet must be pairwise disjoint"),
		NU_MAPPING("nu must map every edge, and only edges, to existing vertices"),
		RELATION_NAMES("every edge, and only edges, must carry a relation name"),
		DISJOINT_AREAS("the areas of distinct contexts must be disjoint"),
		AREA_COVERAGE("the areas must together hold exactly the vertices, edges and cuts"),
		ACYCLIC_CONTAINMENT("no context may be contained in itself");

		private final String description;

		Invariant(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Invariant invariant;
	private final String detail;

	public InvariantViolationIssue(Invariant invariant, String detail) {
		this.invariant = invariant;
		this.detail = detail;
	}

	public Invariant getInvariant() {
		return invariant;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
