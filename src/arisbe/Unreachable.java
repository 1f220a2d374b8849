package arisbe;

/**
 * Thrown where control cannot arrive, such as the IOException handler around a write to a StringWriter.
 */
public class Unreachable extends RuntimeException {
	public Unreachable(Exception cause) {
		super("unreachable: " + cause.getMessage(), cause);
	}
}
