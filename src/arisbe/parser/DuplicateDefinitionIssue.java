package arisbe.parser;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;
import arisbe.util.SourceLocation;

public class DuplicateDefinitionIssue extends Issue {
	private final String name;
	private final String contextId;
	private final SourceLocation location;

	public DuplicateDefinitionIssue(String name, String contextId, SourceLocation location) {
		this.name = name;
		this.contextId = contextId;
		this.location = location;
	}

	public String getName() {
		return name;
	}

	public String getContextId() {
		return contextId;
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
