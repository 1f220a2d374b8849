package arisbe.transform;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;

/**
 * A transformation rule was asked to do something its preconditions forbid, such as erasing from a negative
 * context.
 */
public class TransformationIssue extends Issue {
	private final TransformationRule rule;
	private final String reason;

	public TransformationIssue(TransformationRule rule, String reason) {
		this.rule = rule;
		this.reason = reason;
	}

	public TransformationRule getRule() {
		return rule;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
