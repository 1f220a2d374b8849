package arisbe.formatters;

import arisbe.errors.ContextVisitor;
import arisbe.errors.SourceFileContext;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(SourceFileContext sourceFileContext) throws IOException {
		out.write("in file ");
		out.write(String.valueOf(sourceFileContext.getFile()));
		return null;
	}

}
