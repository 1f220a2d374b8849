package arisbe.errors;

/**
 * Where an issue was found, as opposed to what the issue is.
 */
public abstract class Context {
	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E;
}
