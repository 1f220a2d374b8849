package arisbe.errors;

public abstract class ContextVisitor<T, E extends Throwable> {
	public abstract T visit(SourceFileContext sourceFileContext) throws E;
}
