package arisbe.errors;

import java.nio.file.Path;

/**
 * Collects the issues of a run instead of stopping at the first one. Issues reported through a context made by
 * {@link #withContext} or {@link #withFile} are wrapped so that they say where they came from.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract boolean hasErrors();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}

	/**
	 * @param text the contents of the file, or null if it could not be read
	 */
	public IssueContext withFile(Path file, CharSequence text) {
		return withContext(new SourceFileContext(file, text));
	}
}
