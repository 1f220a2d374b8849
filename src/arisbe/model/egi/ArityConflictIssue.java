package arisbe.model.egi;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;
import arisbe.util.SourceLocation;

public class ArityConflictIssue extends Issue {
	private final String relationName;
	private final int knownArity;
	private final int conflictingArity;
	private final SourceLocation location;

	public ArityConflictIssue(String relationName, int knownArity, int conflictingArity, SourceLocation location) {
		this.relationName = relationName;
		this.knownArity = knownArity;
		this.conflictingArity = conflictingArity;
		this.location = location;
	}

	public String getRelationName() {
		return relationName;
	}

	public int getKnownArity() {
		return knownArity;
	}

	public int getConflictingArity() {
		return conflictingArity;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public int getOffset() {
		return location.getStartOffset();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
