package arisbe.formatters;

import arisbe.IOErrorIssue;
import arisbe.OptionParserIssue;
import arisbe.errors.ContextVisitor;
import arisbe.errors.IssueVisitor;
import arisbe.errors.IssueWithContext;
import arisbe.errors.SourceFileContext;
import arisbe.lexer.LexIssue;
import arisbe.model.egi.ArityConflictIssue;
import arisbe.model.egi.DuplicateElementIssue;
import arisbe.model.egi.InvariantViolationIssue;
import arisbe.model.egi.UnknownContextIssue;
import arisbe.model.egi.UnknownElementIssue;
import arisbe.model.egi.UnknownVertexIssue;
import arisbe.parser.DuplicateDefinitionIssue;
import arisbe.parser.OutOfScopeVariableIssue;
import arisbe.parser.SyntaxIssue;
import arisbe.parser.UndefinedVariableIssue;
import arisbe.transform.TransformationIssue;
import arisbe.util.SourceLocation;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;
	// text of the file the issue came from, if known; used to print the offending line
	private final CharSequence sourceText;

	public IssueFormattingVisitor(IndentingWriter out) {
		this(out, null);
	}

	public IssueFormattingVisitor(IndentingWriter out, CharSequence sourceText) {
		this.out = out;
		this.sourceText = sourceText;
	}

	private void writeLocation(SourceLocation location) throws IOException {
		out.write(" ");
		location.writePretty(out);
		if(sourceText != null && !location.isUnknown()) {
			try (IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				location.writeExcerpt(out, sourceText);
			}
		}
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		CharSequence text = issueWithContext.getContext().accept(new ContextVisitor<CharSequence, RuntimeException>() {
			@Override
			public CharSequence visit(SourceFileContext sourceFileContext) {
				return sourceFileContext.getText();
			}
		});
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(new IssueFormattingVisitor(out, text));
		}
		return null;
	}

	@Override
	public Void visit(LexIssue lexIssue) throws IOException {
		out.write("unable to read EGIF text: ");
		out.write(lexIssue.getReason());
		if(lexIssue.getCharacter() != '\0') {
			out.write(" ('" + lexIssue.getCharacter() + "')");
		}
		writeLocation(lexIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(SyntaxIssue syntaxIssue) throws IOException {
		out.write("syntax error: expected ");
		out.write(syntaxIssue.getExpected());
		out.write(" but found ");
		switch(syntaxIssue.getFound().getType()) {
			case EOF:
				out.write("end of input");
				break;
			case CONSTANT:
				out.write("\"" + syntaxIssue.getFound().getValue() + "\"");
				break;
			default:
				out.write("'" + syntaxIssue.getFound().getValue() + "'");
				break;
		}
		writeLocation(syntaxIssue.getFound().getLocation());
		return null;
	}

	@Override
	public Void visit(DuplicateDefinitionIssue duplicateDefinitionIssue) throws IOException {
		out.write("variable ");
		out.write(duplicateDefinitionIssue.getName());
		out.write(" is defined twice in context ");
		out.write(duplicateDefinitionIssue.getContextId());
		writeLocation(duplicateDefinitionIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(UndefinedVariableIssue undefinedVariableIssue) throws IOException {
		out.write("variable ");
		out.write(undefinedVariableIssue.getName());
		out.write(" is used but never defined");
		writeLocation(undefinedVariableIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(OutOfScopeVariableIssue outOfScopeVariableIssue) throws IOException {
		out.write("variable ");
		out.write(outOfScopeVariableIssue.getName());
		out.write(" defined in context ");
		out.write(outOfScopeVariableIssue.getDeclarationContextId());
		out.write(" is not in scope in context ");
		out.write(outOfScopeVariableIssue.getUseContextId());
		writeLocation(outOfScopeVariableIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(UnknownContextIssue unknownContextIssue) throws IOException {
		out.write("unknown context ");
		out.write(unknownContextIssue.getContextId());
		return null;
	}

	@Override
	public Void visit(UnknownVertexIssue unknownVertexIssue) throws IOException {
		out.write("unknown vertex ");
		out.write(unknownVertexIssue.getVertexId());
		return null;
	}

	@Override
	public Void visit(UnknownElementIssue unknownElementIssue) throws IOException {
		out.write("unknown element ");
		out.write(unknownElementIssue.getElementId());
		return null;
	}

	@Override
	public Void visit(DuplicateElementIssue duplicateElementIssue) throws IOException {
		out.write("element ");
		out.write(duplicateElementIssue.getElementId());
		out.write(" already exists");
		return null;
	}

	@Override
	public Void visit(ArityConflictIssue arityConflictIssue) throws IOException {
		out.write("relation ");
		out.write(arityConflictIssue.getRelationName());
		out.write(" has arity ");
		out.write(Integer.toString(arityConflictIssue.getKnownArity()));
		out.write(" but is used with ");
		out.write(Integer.toString(arityConflictIssue.getConflictingArity()));
		out.write(" argument(s)");
		writeLocation(arityConflictIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(InvariantViolationIssue invariantViolationIssue) throws IOException {
		out.write("malformed graph: ");
		out.write(invariantViolationIssue.getInvariant().getDescription());
		out.write(" (");
		out.write(invariantViolationIssue.getDetail());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TransformationIssue transformationIssue) throws IOException {
		out.write("cannot apply ");
		out.write(transformationIssue.getRule().getDescription());
		out.write(": ");
		out.write(transformationIssue.getReason());
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}
}
