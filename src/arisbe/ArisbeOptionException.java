package arisbe;

public class ArisbeOptionException extends ArisbeException {
	public ArisbeOptionException(String msg) {
		super("Option Error", msg);
	}
}
