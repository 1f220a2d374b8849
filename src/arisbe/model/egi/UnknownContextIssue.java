package arisbe.model.egi;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;

public class UnknownContextIssue extends Issue {
	private final String contextId;

	public UnknownContextIssue(String contextId) {
		this.contextId = contextId;
	}

	public String getContextId() {
		return contextId;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
