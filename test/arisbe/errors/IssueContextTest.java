package arisbe.errors;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;

import org.junit.Test;

import arisbe.model.egi.UnknownVertexIssue;

public class IssueContextTest {

	@Test
	public void nestedContextWrapsAndForwards() {
		TopLevelIssueContext top = new TopLevelIssueContext();
		IssueContext first = top.withContext(new SourceFileContext(Paths.get("a.egif"), "(P x)"));
		IssueContext second = top.withFile(Paths.get("b.egif"), "(P x)");
		UnknownVertexIssue issue = new UnknownVertexIssue("v_1");
		first.error(issue);

		assertThat(first.hasErrors(), is(true));
		assertThat(second.hasErrors(), is(false));
		assertThat(top.hasErrors(), is(true));
		IssueWithContext wrapped = (IssueWithContext) top.getIssues().get(0);
		assertThat(wrapped.getIssue(), is((Issue) issue));
		assertThat(wrapped.getCause(), is((Throwable) issue));
		assertThat(((SourceFileContext) wrapped.getContext()).getFile(), is(Paths.get("a.egif")));
	}

	@Test
	public void countsIssues() {
		TopLevelIssueContext top = new TopLevelIssueContext();
		top.error(new UnknownVertexIssue("v_1"));
		top.error(new UnknownVertexIssue("v_2"));
		assertThat(top.format(), is("Detected 2 issue(s):\nunknown vertex v_1\nunknown vertex v_2"));
	}
}
