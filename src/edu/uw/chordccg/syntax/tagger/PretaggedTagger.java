package edu.uw.chordccg.syntax.tagger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.uw.chordccg.main.InputReader.InputChord;
import edu.uw.chordccg.main.InputReader.InputToParser;
import edu.uw.chordccg.semantics.Semantics;
import edu.uw.chordccg.syntax.grammar.Grammar;
import edu.uw.chordccg.syntax.grammar.Sign;
import edu.uw.chordccg.util.Util.Scored;

/**
 * Returns the candidate signs that came with the input. At offset k, every chord gets its k-th best candidate (if it
 * has one), together with whatever the grammar's lexical expansions derive from it. Each sign's logical form is given
 * the index of its chord as its time.
 */
public class PretaggedTagger extends Tagger {
	private final InputToParser input;
	private final Grammar grammar;

	public PretaggedTagger(final InputToParser input, final Grammar grammar) {
		this.input = input;
		this.grammar = grammar;
	}

	@Override
	public List<TaggedSign> getSigns(final int offset) {
		final List<TaggedSign> result = new ArrayList<>();
		for (int i = 0; i < input.length(); i++) {
			final List<Scored<Sign>> candidates = input.getCandidates().get(i);
			if (offset >= candidates.size()) {
				continue;
			}

			final Scored<Sign> candidate = candidates.get(offset);
			final Sign lexical = makeLexicalSign(candidate.getObject(), i, input.getChords().get(i));
			final String tag = lexical.getCategory().toString();
			for (final Sign sign : grammar.expandLexicalSigns(Collections.singletonList(lexical))) {
				result.add(new TaggedSign(i, i + 1, sign, tag, candidate.getScore()));
			}
		}
		Collections.sort(result);
		return result;
	}

	private static Sign makeLexicalSign(final Sign template, final int index, final InputChord chord) {
		final Semantics semantics = template.getSemantics().copy();
		semantics.setTime(index);
		final Sign sign = new Sign(template.getCategory(), semantics);
		sign.setDuration(chord.getDuration());
		return sign;
	}

	@Override
	public int getInputLength() {
		return input.length();
	}

	@Override
	public List<String> getInputTokens() {
		return input.getTokens();
	}
}
