package arisbe.errors;

import java.nio.file.Path;

public class SourceFileContext extends Context {
	private final Path file;
	private final CharSequence text;

	public SourceFileContext(Path file, CharSequence text) {
		this.file = file;
		this.text = text;
	}

	public Path getFile() {
		return file;
	}

	/**
	 * @return the contents of the file, or null if it could not be read
	 */
	public CharSequence getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
