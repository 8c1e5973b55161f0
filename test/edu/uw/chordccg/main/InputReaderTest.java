package edu.uw.chordccg.main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import java.util.InputMismatchException;
import java.util.List;

import org.junit.Test;

import edu.uw.chordccg.main.InputReader.InputToParser;
import edu.uw.chordccg.syntax.grammar.Category;

public class InputReaderTest {

	private final InputReader reader = new InputReader();

	@Test
	public void testReadInput() {
		final InputToParser input = reader.readInput(
				"C@4|I^T : [<0,0>]=1.0\tG7|V^D : [<1,0>]=0.1|V^D/{c}I^T : \\$x.leftonto($x)=0.9");
		assertEquals(2, input.length());
		assertEquals(Arrays.asList("C", "G7"), input.getTokens());
		assertEquals(Integer.valueOf(4), input.getChords().get(0).getDuration());
		assertNull(input.getChords().get(1).getDuration());
		assertEquals("C@4", input.getChords().get(0).toString());

		// Sorted by probability.
		assertEquals(Category.valueOf("V^D/{c}I^T"), input.getCandidates().get(1).get(0).getObject().getCategory());
		assertEquals(0.9, input.getCandidates().get(1).get(0).getScore(), 0.0001);
		assertEquals(Category.valueOf("V^D"), input.getCandidates().get(1).get(1).getObject().getCategory());
		assertEquals("C G7", input.toString());
	}

	@Test
	public void testReadLines() {
		final List<InputToParser> inputs = reader.readLines(Arrays.asList("# comment", "", "C|I^T : [<0,0>]=1.0",
				"   ", "C|I^T : [<0,0>]=1.0\tC|I^T : [<0,0>]=1.0"));
		assertEquals(2, inputs.size());
		assertEquals(1, inputs.get(0).length());
		assertEquals(2, inputs.get(1).length());
	}

	@Test(expected = InputMismatchException.class)
	public void testMissingCandidates() {
		reader.readInput("C\tG7|V^D : [<1,0>]=1.0");
	}

	@Test(expected = InputMismatchException.class)
	public void testMissingProbability() {
		reader.readInput("C|I^T : [<0,0>]");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidProbability() {
		reader.readInput("C|I^T : [<0,0>]=high");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidDuration() {
		reader.readInput("C@long|I^T : [<0,0>]=1.0");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidSign() {
		reader.readInput("C|I^X : [<0,0>]=1.0");
	}
}
