package arisbe.errors;

import arisbe.IOErrorIssue;
import arisbe.OptionParserIssue;
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

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(LexIssue lexIssue) throws E;
	public abstract T visit(SyntaxIssue syntaxIssue) throws E;
	public abstract T visit(DuplicateDefinitionIssue duplicateDefinitionIssue) throws E;
	public abstract T visit(UndefinedVariableIssue undefinedVariableIssue) throws E;
	public abstract T visit(OutOfScopeVariableIssue outOfScopeVariableIssue) throws E;
	public abstract T visit(UnknownContextIssue unknownContextIssue) throws E;
	public abstract T visit(UnknownVertexIssue unknownVertexIssue) throws E;
	public abstract T visit(UnknownElementIssue unknownElementIssue) throws E;
	public abstract T visit(DuplicateElementIssue duplicateElementIssue) throws E;
	public abstract T visit(ArityConflictIssue arityConflictIssue) throws E;
	public abstract T visit(InvariantViolationIssue invariantViolationIssue) throws E;
	public abstract T visit(TransformationIssue transformationIssue) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
}
