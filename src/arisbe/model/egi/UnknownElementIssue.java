package arisbe.model.egi;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;

public class UnknownElementIssue extends Issue {
	private final String elementId;

	public UnknownElementIssue(String elementId) {
		this.elementId = elementId;
	}

	public String getElementId() {
		return elementId;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
