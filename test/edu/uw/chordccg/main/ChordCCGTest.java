package edu.uw.chordccg.main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import uk.co.flamingpenguin.jewel.cli.CliFactory;

import edu.uw.chordccg.main.ChordCCG.CommandLineArguments;

public class ChordCCGTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static final List<String> INPUT = Arrays.asList("# ii-V-I, then a dominant that does not resolve",
			"Dm7|II^D/{c}V^D : \\$x.leftonto($x)=1.0\tG7|V^D/{c}I^T : \\$x.leftonto($x)=1.0\tC|I^T : [<0,0>]=1.0",
			"G7|V^D/{c}I^T : \\$x.leftonto($x)=1.0\tD|II^T : [<2,0>]=1.0");

	private static String run(final List<String> input, final String... args) throws Exception {
		final CommandLineArguments options = CliFactory.parseArguments(CommandLineArguments.class, args);
		final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		final PrintStream out = new PrintStream(bytes, true, "UTF-8");
		assertEquals(2, ChordCCG.run(options, input, out));
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testParse() throws Exception {
		final String output = run(INPUT);
		assertTrue(output.contains("Sequence 1: Dm7 G7 C"));
		assertTrue(output.contains("1) II^D-I^T : [leftonto(leftonto(<0,0>@2))]"));
		assertTrue(output.contains("Sequence 2: G7 D"));
		assertTrue(output.contains("No parses"));
	}

	@Test
	public void testDerivations() throws Exception {
		final String output = run(INPUT, "--derivations");
		assertTrue(output.contains("from >"));
		assertTrue(output.contains("<= \"C\""));
	}

	@Test
	public void testDirected() throws Exception {
		final File trees = folder.newFile("trees.txt");
		Files.write(trees.toPath(), Arrays.asList("(appf 0 (appf 1 2))", "(appf 0 1)"), StandardCharsets.UTF_8);

		final String output = run(INPUT, "-d", trees.getPath());
		assertTrue(output.contains("1) II^D-I^T : [leftonto(leftonto(<0,0>@2))]"));
		assertTrue(output.contains("Directed parse failed: Failed to apply rule >"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDirectedNeedsATreePerSequence() throws Exception {
		final File trees = folder.newFile("trees.txt");
		Files.write(trees.toPath(), Arrays.asList("(appf 0 (appf 1 2))"), StandardCharsets.UTF_8);
		run(INPUT, "-d", trees.getPath());
	}

	@Test
	public void testInputFile() throws Exception {
		final File input = folder.newFile("input.txt");
		Files.write(input.toPath(), INPUT, StandardCharsets.UTF_8);
		final CommandLineArguments options = CliFactory.parseArguments(CommandLineArguments.class, new String[] {
				"-f", input.getPath() });
		assertEquals(input.getPath(), options.getInputFile());
		assertEquals(1, options.getParses());
		assertEquals(0, options.getTimeout());
	}
}
