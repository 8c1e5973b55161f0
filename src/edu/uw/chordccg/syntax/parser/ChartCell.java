package edu.uw.chordccg.syntax.parser;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Equivalence;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import edu.uw.chordccg.syntax.grammar.Category;
import edu.uw.chordccg.syntax.grammar.Sign;

/**
 * The signs found for one span of the input. Holds at most one sign per equivalence class (same category,
 * alpha-equivalent logical form). Adding a sign that is already present leaves the cell unchanged, apart from merging
 * the new sign's derivations into the existing one's.
 */
public class ChartCell implements Serializable {
	private static final long serialVersionUID = 1L;

	private final boolean derivations;
	private final List<Sign> signs = new ArrayList<>();

	// Rebuilt from the signs after deserialization.
	private transient Map<Equivalence.Wrapper<Sign>, Sign> keyToSign;
	private transient ListMultimap<Category, Sign> categoryToSigns;
	private transient List<Category> categories;

	ChartCell(final boolean derivations) {
		this.derivations = derivations;
		buildIndexes();
	}

	private void buildIndexes() {
		keyToSign = new HashMap<>();
		categoryToSigns = ArrayListMultimap.create();
		categories = new ArrayList<>();
		for (final Sign sign : signs) {
			index(sign);
		}
	}

	private void index(final Sign sign) {
		keyToSign.put(Sign.EQUIVALENCE.wrap(sign), sign);
		if (!categoryToSigns.containsKey(sign.getCategory())) {
			categories.add(sign.getCategory());
		}
		categoryToSigns.put(sign.getCategory(), sign);
	}

	/**
	 * Possibly adds a sign to this cell. Returns true if the sign was added, and false if the cell was unchanged.
	 */
	public boolean add(final Sign sign) {
		final Sign existing = keyToSign.get(Sign.EQUIVALENCE.wrap(sign));
		if (existing != null) {
			if (derivations && existing.getDerivationTrace() != null && sign.getDerivationTrace() != null) {
				existing.getDerivationTrace().addRulesFromTrace(sign.getDerivationTrace());
			}
			return false;
		}

		signs.add(sign);
		index(sign);
		return true;
	}

	/**
	 * Adds every sign, returning true if any were new.
	 */
	public boolean addAll(final Collection<Sign> newSigns) {
		boolean added = false;
		for (final Sign sign : newSigns) {
			added = add(sign) || added;
		}
		return added;
	}

	public List<Sign> getSigns() {
		return Collections.unmodifiableList(signs);
	}

	/**
	 * The signs of the cell grouped by category, in the order in which each category first appeared.
	 */
	public List<List<Sign>> getGroupedSigns() {
		final List<List<Sign>> result = new ArrayList<>(categories.size());
		for (final Category category : categories) {
			result.add(Collections.unmodifiableList(categoryToSigns.get(category)));
		}
		return result;
	}

	public List<Category> getCategories() {
		return Collections.unmodifiableList(categories);
	}

	public List<Sign> getSigns(final Category category) {
		return Collections.unmodifiableList(categoryToSigns.get(category));
	}

	public Sign getSign(final int index) {
		return signs.get(index);
	}

	public int size() {
		return signs.size();
	}

	public boolean isEmpty() {
		return signs.isEmpty();
	}

	private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
		in.defaultReadObject();
		buildIndexes();
	}
}
