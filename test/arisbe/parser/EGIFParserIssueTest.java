package arisbe.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import arisbe.errors.Issue;
import arisbe.lexer.LexIssue;
import arisbe.model.egi.ArityConflictIssue;

@RunWith(Parameterized.class)
public class EGIFParserIssueTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			// duplicate definitions, as a defining argument and in a bracket
			{ "*x *x", DuplicateDefinitionIssue.class, 3 },
			{ "[*x] (P *x)", DuplicateDefinitionIssue.class, 8 },
			{ "[*x *x]", DuplicateDefinitionIssue.class, 4 },
			{ "*x ~[ *x ] *x", DuplicateDefinitionIssue.class, 11 },
			// scope
			{ "~[ *x ] (P x)", OutOfScopeVariableIssue.class, 11 },
			{ "~[ *x ] ~[ (P x) ]", OutOfScopeVariableIssue.class, 14 },
			{ "(P y)", UndefinedVariableIssue.class, 3 },
			{ "(P x) *x", UndefinedVariableIssue.class, 3 },
			{ "~[ ~[ (P x) ] ]", UndefinedVariableIssue.class, 9 },
			{ "(P a) (P a b)", UndefinedVariableIssue.class, 3 },
			// arity
			{ "(P *x) (P *y *z)", ArityConflictIssue.class, 8 },
			{ "(= *x)", ArityConflictIssue.class, 1 },
			// grammar
			{ "~[ (P *x)", SyntaxIssue.class, 9 },
			{ "(P *x))", SyntaxIssue.class, 6 },
			{ "]", SyntaxIssue.class, 0 },
			{ "[]", SyntaxIssue.class, 0 },
			{ "*x [x]", SyntaxIssue.class, 3 },
			{ "( )", SyntaxIssue.class, 2 },
			{ "(P ~[ ])", SyntaxIssue.class, 3 },
			{ "(P *x", SyntaxIssue.class, 5 },
			// characters
			{ "(P *x) &", LexIssue.class, 7 },
		});
	}

	private final String input;
	private final Class<? extends Issue> expected;
	private final int offset;

	public EGIFParserIssueTest(String input, Class<? extends Issue> expected, int offset) {
		this.input = input;
		this.expected = expected;
		this.offset = offset;
	}

	@Test
	public void test() {
		try {
			EGIFParser.parse(input);
			fail("expected " + expected.getSimpleName());
		} catch (Issue issue) {
			assertThat(issue, is(instanceOf(expected)));
			assertThat(issue.getOffset(), is(offset));
		}
	}
}
