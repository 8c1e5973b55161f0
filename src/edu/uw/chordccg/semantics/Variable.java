package edu.uw.chordccg.semantics;

import java.io.Serializable;
import java.util.Collection;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;

/**
 * A lambda variable, identified by a name and a numeric index. Two variables are the same variable iff both name and
 * index are equal.
 */
public final class Variable implements Serializable, Comparable<Variable> {
	private static final long serialVersionUID = 1L;

	private final String name;
	private final int index;

	public Variable(final String name, final int index) {
		Preconditions.checkArgument(name != null && !name.isEmpty(), "Variables need a name");
		Preconditions.checkArgument(index >= 0, "Negative variable index: " + index);
		this.name = name;
		this.index = index;
	}

	public Variable(final String name) {
		this(name, 0);
	}

	public String getName() {
		return name;
	}

	public int getIndex() {
		return index;
	}

	/**
	 * Returns the first variable with the same name as start, counting up from index 0, that is not in avoid.
	 */
	public static Variable nextUnused(final Variable start, final Collection<Variable> avoid) {
		int index = 0;
		Variable candidate = new Variable(start.name, index);
		while (avoid.contains(candidate)) {
			index++;
			candidate = new Variable(start.name, index);
		}
		return candidate;
	}

	@Override
	public boolean equals(final Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Variable)) {
			return false;
		}
		final Variable variable = (Variable) other;
		return index == variable.index && name.equals(variable.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, index);
	}

	@Override
	public int compareTo(final Variable other) {
		return ComparisonChain.start().compare(name, other.name).compare(index, other.index).result();
	}

	@Override
	public String toString() {
		return "$" + name + index;
	}
}
