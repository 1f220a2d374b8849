package arisbe;

/**
 * Base of every error raised by the graph model, the EGIF tools and the
 * command line front end. A prefix names the kind of failure; the offset is
 * the position in the EGIF text, or -1 when the failure has no position.
 */
public abstract class ArisbeException extends RuntimeException {
	private final int offset;
	private final String msg;
	private final String prefix;

	public ArisbeException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
		this.offset = -1;
	}

	public ArisbeException(String prefix, String msg, int offset) {
		super(prefix + ": " + msg + " at offset " + offset);
		this.prefix = prefix;
		this.offset = offset;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}

	public int getOffset() {
		return offset;
	}
}
