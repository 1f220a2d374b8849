package arisbe.lexer;

import arisbe.errors.Issue;
import arisbe.errors.IssueVisitor;
import arisbe.util.SourceLocation;

public class LexIssue extends Issue {
	private final char character;
	private final String reason;
	private final SourceLocation location;

	public LexIssue(char character, String reason, SourceLocation location) {
		this.character = character;
		this.reason = reason;
		this.location = location;
	}

	public char getCharacter() {
		return character;
	}

	public String getReason() {
		return reason;
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
