package arisbe.parser;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;
import arisbe.util.SourceLocation;

public class UndefinedVariableIssue extends Issue {
	private final String name;
	private final SourceLocation location;

	public UndefinedVariableIssue(String name, SourceLocation location) {
		this.name = name;
		this.location = location;
	}

	public String getName() {
		return name;
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
