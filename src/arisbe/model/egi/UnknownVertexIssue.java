package arisbe.model.egi;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;

public class UnknownVertexIssue extends Issue {
	private final String vertexId;

	public UnknownVertexIssue(String vertexId) {
		this.vertexId = vertexId;
	}

	public String getVertexId() {
		return vertexId;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
