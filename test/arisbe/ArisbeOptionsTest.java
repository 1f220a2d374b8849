package arisbe;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;

import org.json.JSONObject;
import org.junit.Test;

import arisbe.transform.TransformationRule;

public class ArisbeOptionsTest {

	private static ArisbeOptions parse(String... args) throws ArisbeOptionException {
		ArisbeOptions opts = new ArisbeOptions(args);
		opts.parse();
		return opts;
	}

	@Test
	public void defaults() throws ArisbeOptionException {
		ArisbeOptions opts = parse("a.egif", "b.egif");
		assertThat(opts.inputFilePaths, is(Arrays.asList("a.egif", "b.egif")));
		assertThat(opts.outputOptions.isCanonical(), is(true));
		assertThat(opts.outputOptions.getSummary(), is(ArisbeOutputOptions.SummaryFormat.NONE));
		assertThat(opts.outputOptions.getDestFile(), is(nullValue()));
		assertThat(opts.verbose, is(false));
		assertThat(opts.quiet, is(false));
	}

	@Test
	public void configurationFile() throws ArisbeOptionException {
		ArisbeOptions opts = parse("-c", "test/configs/default.json", "a.egif");
		assertThat(opts.outputOptions.getSummary(), is(ArisbeOutputOptions.SummaryFormat.JSON));
		assertThat(opts.outputOptions.getDestFile(), is("build/out.egif"));
		assertThat(opts.outputOptions.isCanonical(), is(true));
	}

	@Test
	public void flagsOverrideConfiguration() throws ArisbeOptionException {
		ArisbeOptions opts = parse("-c", "test/configs/default.json", "-s", "-o", "other.egif", "a.egif");
		assertThat(opts.outputOptions.getSummary(), is(ArisbeOutputOptions.SummaryFormat.TEXT));
		assertThat(opts.outputOptions.getDestFile(), is("other.egif"));
	}

	@Test
	public void jsonFlag() throws ArisbeOptionException {
		assertThat(parse("-j", "a.egif").outputOptions.getSummary(), is(ArisbeOutputOptions.SummaryFormat.JSON));
		assertThat(parse("--json", "a.egif").outputOptions.getSummary(), is(ArisbeOutputOptions.SummaryFormat.JSON));
	}

	@Test
	public void helpNeedsNoFiles() throws ArisbeOptionException {
		assertThat(parse("-h").help, is(true));
		assertThat(parse("--version").version, is(true));
	}

	@Test(expected = ArisbeOptionException.class)
	public void filesAreRequired() throws ArisbeOptionException {
		parse("-v");
	}

	@Test(expected = ArisbeOptionException.class)
	public void unknownOption() throws ArisbeOptionException {
		parse("--frobnicate", "a.egif");
	}

	@Test
	public void transformations() throws ArisbeOptionException {
		ArisbeOptions opts = parse("-t", "erase@2:1", "--transform", "add-vertex@sheet=b", "a.egif");
		assertThat(opts.transformCommands.size(), is(2));
		assertThat(opts.transformCommands.get(0).getRule(), is(TransformationRule.ERASURE));
		assertThat(opts.transformCommands.get(1).getArgument(), is("b"));
		assertThat(parse("a.egif").transformCommands.isEmpty(), is(true));
	}

	@Test(expected = ArisbeOptionException.class)
	public void badTransformation() throws ArisbeOptionException {
		parse("-t", "erase@here", "a.egif");
	}

	@Test(expected = ArisbeOptionException.class)
	public void unknownSummaryFormat() throws ArisbeOptionException {
		parse("-c", "test/configs/bad_summary.json", "a.egif");
	}

	@Test(expected = ArisbeOptionException.class)
	public void malformedConfiguration() throws ArisbeOptionException {
		parse("-c", "test/configs/malformed.json", "a.egif");
	}

	@Test(expected = ArisbeOptionException.class)
	public void missingConfiguration() throws ArisbeOptionException {
		parse("-c", "test/configs/missing.json", "a.egif");
	}

	@Test
	public void outputSectionIsOptional() throws ArisbeOptionException {
		ArisbeOutputOptions output = new ArisbeOutputOptions(new JSONObject("{}"));
		assertThat(output.isCanonical(), is(true));
		assertThat(output.getSummary(), is(ArisbeOutputOptions.SummaryFormat.NONE));
	}

	@Test
	public void canonicalOutputCanBeTurnedOff() throws ArisbeOptionException {
		ArisbeOutputOptions output = new ArisbeOutputOptions(
				new JSONObject("{\"output\": {\"canonical\": false, \"summary\": \"text\"}}"));
		assertThat(output.isCanonical(), is(false));
		assertThat(output.getSummary(), is(ArisbeOutputOptions.SummaryFormat.TEXT));
	}

	@Test(expected = ArisbeOptionException.class)
	public void wrongFieldType() throws ArisbeOptionException {
		new ArisbeOutputOptions(new JSONObject("{\"output\": {\"canonical\": \"sometimes\"}}"));
	}
}
