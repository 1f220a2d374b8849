package arisbe;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import arisbe.parser.EGIFParser;

public class ArisbeMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@Before
	public void setup() {
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private int run(String... args) {
		return new ArisbeMain(args,
				new PrintStream(out, true),
				new PrintStream(err, true)).run();
	}

	private String out() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void printsCanonicalText() {
		assertThat(run("-q", "test/egif/socrates.egif"), is(ArisbeMain.EXIT_OK));
		assertThat(out().trim(), is("(man \"Socrates\") ~[ *x (man x) ~[ (mortal x) ] ]"));
	}

	@Test
	public void oneLinePerFile() {
		assertThat(run("-q", "test/egif/socrates.egif", "test/egif/love.egif"), is(ArisbeMain.EXIT_OK));
		assertThat(out().split("\n").length, is(2));
	}

	@Test
	public void textSummary() {
		assertThat(run("-q", "-s", "test/egif/socrates.egif"), is(ArisbeMain.EXIT_OK));
		assertThat(out(), containsString("2 vertices, 3 edges, 2 cuts, maximum depth 2"));
		assertThat(out(), containsString("constants: \"Socrates\""));
		assertThat(out(), containsString("relations: man/1 mortal/1"));
	}

	@Test
	public void jsonSummary() {
		assertThat(run("-q", "-j", "test/egif/love.egif"), is(ArisbeMain.EXIT_OK));
		String text = out();
		JSONObject json = new JSONObject(text.substring(text.indexOf('{'), text.lastIndexOf('}') + 1));
		assertThat(json.getJSONArray("cuts").length(), is(3));
		assertThat(json.getJSONObject("alphabet").getJSONObject("relations").getInt("loves"), is(2));
	}

	@Test
	public void writesToDestinationFile() throws IOException {
		File dest = new File(folder.getRoot(), "out.egif");
		assertThat(run("-q", "-o", dest.getPath(), "test/egif/shadowing.egif"), is(ArisbeMain.EXIT_OK));
		assertThat(out(), is(""));
		String written = FileUtils.readFileToString(dest, StandardCharsets.UTF_8);
		assertThat(written.endsWith("\n"), is(true));
		assertThat(EGIFParser.parse(written).getVertices().size(), is(2));
	}

	@Test
	public void reportsScopeIssues() {
		assertThat(run("-q", "test/egif/bad_scope.egif"), is(ArisbeMain.EXIT_ISSUES));
		assertThat(err(), containsString("in file test/egif/bad_scope.egif"));
		assertThat(err(), containsString("is not in scope"));
		assertThat(err(), containsString("(Q x)"));
	}

	@Test
	public void goodFilesStillPrintedNextToBadOnes() {
		assertThat(run("-q", "test/egif/bad_scope.egif", "test/egif/coreference.egif"), is(ArisbeMain.EXIT_ISSUES));
		assertThat(out(), containsString("(orator x)"));
	}

	@Test
	public void missingFile() {
		assertThat(run("-q", "test/egif/no_such_file.egif"), is(ArisbeMain.EXIT_ISSUES));
		assertThat(err(), containsString("IO Error"));
	}

	@Test
	public void transformsBeforePrinting() {
		assertThat(run("-q", "-t", "erase@2:1", "test/egif/socrates.egif"), is(ArisbeMain.EXIT_OK));
		assertThat(out().trim(), is("\"Socrates\" ~[ *x (man x) ~[ (mortal x) ] ]"));
	}

	@Test
	public void transformationsApplyInOrder() {
		assertThat(run("-q", "-s", "--transform", "insert@3:1=(wise \"Socrates\")", "-t", "erase@2:1",
				"test/egif/socrates.egif"), is(ArisbeMain.EXIT_OK));
		assertThat(out(), containsString("~[ *x (man x) (wise \"Socrates\") ~[ (mortal x) ] ]"));
		assertThat(out(), containsString("relations: man/1 mortal/1 wise/1"));
	}

	@Test
	public void refusedTransformation() {
		assertThat(run("-q", "-t", "erase@3:7", "test/egif/socrates.egif"), is(ArisbeMain.EXIT_ISSUES));
		assertThat(err(), containsString("cannot apply erasure"));
		assertThat(err(), containsString("negative context"));
		assertThat(out(), is(""));
	}

	@Test
	public void malformedTransformationIsUsageError() {
		assertThat(run("-t", "erase", "test/egif/socrates.egif"), is(ArisbeMain.EXIT_USAGE));
		assertThat(err(), containsString("expected RULE@TARGET"));
	}

	@Test
	public void usageErrors() {
		assertThat(run(), is(ArisbeMain.EXIT_USAGE));
		assertThat(err(), containsString("at least one EGIF file is required"));
	}

	@Test
	public void unknownOptionIsUsageError() {
		assertThat(run("--frobnicate", "test/egif/socrates.egif"), is(ArisbeMain.EXIT_USAGE));
		assertThat(err(), containsString("unable to parse options"));
		assertThat(err(), containsString("frobnicate"));
		assertThat(out(), is(""));
	}

	@Test
	public void helpGoesToStandardOutput() {
		assertThat(run("-h"), is(ArisbeMain.EXIT_OK));
		assertThat(out(), containsString("arisbe [options] file..."));
		assertThat(out(), containsString("--json"));
	}

	@Test
	public void version() {
		assertThat(run("--version"), is(ArisbeMain.EXIT_OK));
		assertThat(out().trim(), is("arisbe version " + ArisbeOptions.VERSION));
	}
}
