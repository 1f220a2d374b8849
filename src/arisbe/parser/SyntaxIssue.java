package arisbe.parser;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;
import arisbe.lexer.EGIFToken;

public class SyntaxIssue extends Issue {
	private final String expected;
	private final EGIFToken found;

	public SyntaxIssue(String expected, EGIFToken found) {
		this.expected = expected;
		this.found = found;
	}

	public String getExpected() {
		return expected;
	}

	public EGIFToken getFound() {
		return found;
	}

	@Override
	public int getOffset() {
		return found.getLocation().getStartOffset();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
