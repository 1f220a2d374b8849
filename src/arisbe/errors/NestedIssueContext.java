package arisbe.errors;

public class NestedIssueContext extends IssueContext {

	private final IssueContext parent;
	private final Context context;
	private boolean hasErrors;

	public NestedIssueContext(IssueContext parent, Context context) {
		this.parent = parent;
		this.context = context;
		this.hasErrors = false;
	}

	@Override
	public void error(Issue err) {
		hasErrors = true;
		parent.error(err.withContext(context));
	}

	@Override
	public boolean hasErrors() {
		return hasErrors;
	}

}
