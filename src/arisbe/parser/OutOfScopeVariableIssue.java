package arisbe.parser;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;
import arisbe.util.SourceLocation;

/**
 * A bound occurrence of a name whose defining occurrence is in a context that does not enclose the use.
 */
public class OutOfScopeVariableIssue extends Issue {
	private final String name;
	private final String declarationContextId;
	private final String useContextId;
	private final SourceLocation location;

	public OutOfScopeVariableIssue(String name, String declarationContextId, String useContextId,
	                               SourceLocation location) {
		this.name = name;
		this.declarationContextId = declarationContextId;
		this.useContextId = useContextId;
		this.location = location;
	}

	public String getName() {
		return name;
	}

	public String getDeclarationContextId() {
		return declarationContextId;
	}

	public String getUseContextId() {
		return useContextId;
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
