package edu.uw.chordccg.syntax.tagger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.uw.chordccg.main.InputReader;
import edu.uw.chordccg.main.InputReader.InputToParser;
import edu.uw.chordccg.syntax.grammar.Category;
import edu.uw.chordccg.syntax.grammar.Grammar;
import edu.uw.chordccg.syntax.tagger.Tagger.TaggedSign;

public class PretaggedTaggerTest {

	private final InputToParser input = new InputReader().readInput(
			"C@2|I^T : [<0,0>]=0.4|I^T : [<0,1>]=0.6\tG7|V^D/{c}I^T : \\$x.leftonto($x)=0.9");
	private final Tagger tagger = new PretaggedTagger(input, Grammar.STANDARD);

	@Test
	public void testInput() {
		assertEquals(2, tagger.getInputLength());
		assertEquals(Arrays.asList("C", "G7"), tagger.getInputTokens());
	}

	@Test
	public void testBestCandidates() {
		final List<TaggedSign> signs = tagger.getSigns(0);
		assertEquals(4, signs.size());

		// Highest probability first.
		assertEquals(1, signs.get(0).getStart());
		assertEquals(2, signs.get(0).getEnd());
		assertEquals(0.9, signs.get(0).getProbability(), 0.0001);
		assertEquals("V^D/{c}I^T", signs.get(0).getTag());
		assertEquals(Category.valueOf("V^D/V^D"), signs.get(1).getSign().getCategory());
		assertEquals("V^D/{c}I^T", signs.get(1).getTag());

		final TaggedSign tonic = signs.get(2);
		assertEquals(0, tonic.getStart());
		assertEquals("I^T : [<0,1>@0]", tonic.getSign().toString());
		assertEquals(Integer.valueOf(2), tonic.getSign().getDuration());
		assertEquals(Category.valueOf("I^T/I^T"), signs.get(3).getSign().getCategory());
		assertEquals(Integer.valueOf(2), signs.get(3).getSign().getDuration());
	}

	@Test
	public void testTimesAreChordIndexes() {
		for (final TaggedSign sign : tagger.getSigns(0)) {
			assertEquals(Integer.valueOf(sign.getStart()), sign.getSign().getSemantics().getStartTime());
		}
		// The input's own signs are left alone.
		assertNull(input.getCandidates().get(0).get(0).getObject().getSemantics().getStartTime());
	}

	@Test
	public void testLaterOffsets() {
		final List<TaggedSign> signs = tagger.getSigns(1);
		assertEquals(2, signs.size());
		assertEquals("I^T : [<0,0>@0]", signs.get(0).getSign().toString());
		assertEquals(0.4, signs.get(0).getProbability(), 0.0001);

		assertTrue(tagger.getSigns(2).isEmpty());
	}

	@Test
	public void testSignsAreFreshCopies() {
		final TaggedSign first = tagger.getSigns(0).get(0);
		final TaggedSign again = tagger.getSigns(0).get(0);
		assertTrue(first.getSign() != again.getSign());
		assertTrue(first.getSign().isEquivalentTo(again.getSign()));
	}
}
