package arisbe.errors;

import arisbe.ArisbeException;
import arisbe.Unreachable;
import arisbe.formatters.IndentingWriter;
import arisbe.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found while building, parsing or generating a graph. Issues are thrown directly by the model and
 * the EGIF tools; tools that want to keep going collect them in an {@link IssueContext}.
 */
public abstract class Issue extends ArisbeException {
	public Issue() {
		super("EGI issue", "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
