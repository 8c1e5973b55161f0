package edu.uw.chordccg.semantics;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.base.Preconditions;
import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.Sets;

/**
 * A logical form, stored as an arena of nodes addressed by integer ids. Every node records the id of its parent, and
 * replacing a node means rewriting the child slot of its parent. The root node has no parent.
 *
 * Rewriting operations (substitution, alpha-conversion, beta-reduction) mutate the arena in place. Nodes that are
 * replaced stay in the arena, unreachable from the root, until the next {@link #copy()}.
 */
public class Semantics implements Serializable {
	private static final long serialVersionUID = 1L;

	public static final int NONE = -1;

	private static class Node implements Serializable {
		private static final long serialVersionUID = 1L;
		private final NodeType type;
		private int parent = NONE;
		private int[] children;
		private Variable variable;
		private Predicate predicate;
		private EnharmonicCoordinate coordinate;
		private Integer time;

		private Node(final NodeType type, final int[] children) {
			this.type = type;
			this.children = children;
		}
	}

	private final List<Node> nodes = new ArrayList<>();
	private int root = NONE;

	public Semantics() {
	}

	// Construction

	public int variable(final Variable variable) {
		final Node node = new Node(NodeType.VARIABLE, new int[0]);
		node.variable = variable;
		return add(node);
	}

	public int abstraction(final Variable variable, final int body) {
		final Node node = new Node(NodeType.ABSTRACTION, new int[] { body });
		node.variable = variable;
		return add(node);
	}

	/**
	 * Abstracts over each of the variables in turn, the first being outermost.
	 */
	public int abstraction(final List<Variable> variables, final int body) {
		Preconditions.checkArgument(!variables.isEmpty(), "No variables to abstract");
		int result = body;
		for (int i = variables.size() - 1; i >= 0; i--) {
			result = abstraction(variables.get(i), result);
		}
		return result;
	}

	public int application(final int functor, final int argument) {
		return add(new Node(NodeType.APPLICATION, new int[] { functor, argument }));
	}

	public int predicate(final Predicate predicate, final Integer time) {
		final Node node = new Node(NodeType.PREDICATE, new int[0]);
		node.predicate = predicate;
		node.time = time;
		return add(node);
	}

	public int coordinate(final EnharmonicCoordinate coordinate, final Integer time) {
		final Node node = new Node(NodeType.COORDINATE, new int[0]);
		node.coordinate = coordinate;
		node.time = time;
		return add(node);
	}

	public int list(final int... items) {
		return add(new Node(NodeType.LIST, items.clone()));
	}

	public int listCat(final int... lists) {
		return add(new Node(NodeType.LIST_CAT, lists.clone()));
	}

	public int coordination(final int... cadences) {
		return add(new Node(NodeType.COORDINATION, cadences.clone()));
	}

	private int add(final Node node) {
		final int id = nodes.size();
		for (final int child : node.children) {
			Preconditions.checkArgument(child != root, "The root cannot be attached to another node");
			node(child).parent = id;
		}
		nodes.add(node);
		return id;
	}

	private Node node(final int id) {
		Preconditions.checkElementIndex(id, nodes.size(), "node");
		return nodes.get(id);
	}

	// Structure

	public int getRoot() {
		return root;
	}

	public void setRoot(final int node) {
		Preconditions.checkArgument(node(node).parent == NONE, "Only an unattached node can be the root");
		root = node;
	}

	public boolean isEmpty() {
		return root == NONE;
	}

	public NodeType getType(final int node) {
		return node(node).type;
	}

	public int getParent(final int node) {
		return node(node).parent;
	}

	public int getChildCount(final int node) {
		return node(node).children.length;
	}

	public int getChild(final int node, final int index) {
		return node(node).children[index];
	}

	public Variable getVariable(final int node) {
		return node(node).variable;
	}

	public Predicate getPredicate(final int node) {
		return node(node).predicate;
	}

	public EnharmonicCoordinate getCoordinate(final int node) {
		return node(node).coordinate;
	}

	public Integer getTime(final int node) {
		return node(node).time;
	}

	public void setChild(final int parent, final int index, final int child) {
		final Node parentNode = node(parent);
		final int previous = parentNode.children[index];
		if (previous != child && node(previous).parent == parent) {
			node(previous).parent = NONE;
		}
		parentNode.children[index] = child;
		node(child).parent = parent;
	}

	private void setChildren(final int parent, final int[] children) {
		for (final int previous : node(parent).children) {
			if (node(previous).parent == parent) {
				node(previous).parent = NONE;
			}
		}
		node(parent).children = children;
		for (final int child : children) {
			node(child).parent = parent;
		}
	}

	/**
	 * Puts replacement in the place node currently occupies, leaving node without a parent.
	 */
	public void replace(final int node, final int replacement) {
		if (node == replacement) {
			return;
		}
		final int parent = node(node).parent;
		if (parent == NONE) {
			Preconditions.checkState(node == root, "Cannot replace a node that is not in the tree");
			root = replacement;
			node(replacement).parent = NONE;
			return;
		}

		final int[] siblings = node(parent).children;
		for (int i = 0; i < siblings.length; i++) {
			if (siblings[i] == node) {
				setChild(parent, i, replacement);
				return;
			}
		}
		throw new IllegalStateException("Node " + node + " is not a child of its parent " + parent);
	}

	// Copying

	/**
	 * Deep copy of the tree under the root, into a new compact arena.
	 */
	public Semantics copy() {
		final Semantics result = new Semantics();
		if (root != NONE) {
			result.root = result.importSubtree(this, root);
		}
		return result;
	}

	/**
	 * Deep copy of a subtree. The copy has no parent.
	 */
	public int copySubtree(final int node) {
		return importSubtree(this, node);
	}

	/**
	 * Deep copy of a subtree of another logical form into this arena. The copy has no parent.
	 */
	public int importSubtree(final Semantics other, final int node) {
		final Node source = other.node(node);
		final int[] children = new int[source.children.length];
		for (int i = 0; i < children.length; i++) {
			children[i] = importSubtree(other, source.children[i]);
		}
		final Node copy = new Node(source.type, children);
		copy.variable = source.variable;
		copy.predicate = source.predicate;
		copy.coordinate = source.coordinate;
		copy.time = source.time;
		return add(copy);
	}

	// Variables

	public Set<Variable> getVariables() {
		return root == NONE ? new TreeSet<>() : getVariables(root);
	}

	public Set<Variable> getVariables(final int node) {
		final Set<Variable> result = new TreeSet<>();
		collectVariables(node, result, false);
		return result;
	}

	public Set<Variable> getBoundVariables(final int node) {
		final Set<Variable> result = new TreeSet<>();
		collectVariables(node, result, true);
		return result;
	}

	/**
	 * Variables used in the subtree that are not bound anywhere within it.
	 */
	public Set<Variable> getUnboundVariables(final int node) {
		return new TreeSet<>(Sets.difference(getVariables(node), getBoundVariables(node)));
	}

	private void collectVariables(final int node, final Set<Variable> result, final boolean boundOnly) {
		final Node n = node(node);
		if (n.type == NodeType.ABSTRACTION || (n.type == NodeType.VARIABLE && !boundOnly)) {
			result.add(n.variable);
		}
		for (final int child : n.children) {
			collectVariables(child, result, boundOnly);
		}
	}

	/**
	 * Variables occurring outside the scope of any binder for them.
	 */
	private Set<Variable> getFreeVariables(final int node) {
		final Set<Variable> result = new TreeSet<>();
		collectFreeVariables(node, new ArrayDeque<>(), result);
		return result;
	}

	private void collectFreeVariables(final int node, final Deque<Variable> binders, final Set<Variable> result) {
		final Node n = node(node);
		if (n.type == NodeType.VARIABLE) {
			if (!binders.contains(n.variable)) {
				result.add(n.variable);
			}
		} else if (n.type == NodeType.ABSTRACTION) {
			binders.push(n.variable);
			collectFreeVariables(n.children[0], binders, result);
			binders.pop();
		} else {
			for (final int child : n.children) {
				collectFreeVariables(child, binders, result);
			}
		}
	}

	/**
	 * Variables bound by abstractions above this node.
	 */
	public Set<Variable> getAncestorBoundVariables(final int node) {
		final Set<Variable> result = new TreeSet<>();
		int ancestor = node(node).parent;
		while (ancestor != NONE) {
			final Node n = node(ancestor);
			if (n.type == NodeType.ABSTRACTION) {
				result.add(n.variable);
			}
			ancestor = n.parent;
		}
		return result;
	}

	// Rewriting

	/**
	 * Renames every occurrence of source in the subtree, bound or not.
	 */
	public void alphaConvert(final int node, final Variable source, final Variable target) {
		final Node n = node(node);
		if ((n.type == NodeType.VARIABLE || n.type == NodeType.ABSTRACTION) && source.equals(n.variable)) {
			n.variable = target;
		}
		for (final int child : n.children) {
			alphaConvert(child, source, target);
		}
	}

	/**
	 * Renames the abstractions in the subtree that bind variable, along with everything in their scope.
	 */
	private void renameBinders(final int node, final Variable variable, final Variable target) {
		final Node n = node(node);
		if (n.type == NodeType.ABSTRACTION && variable.equals(n.variable)) {
			alphaConvert(node, variable, target);
			return;
		}
		for (final int child : n.children) {
			renameBinders(child, variable, target);
		}
	}

	/**
	 * Replaces every occurrence of source in the subtree with a fresh copy of target.
	 *
	 * @throws InvalidSubstitutionException
	 *             if the subtree contains an abstraction over source
	 */
	public void substitute(final int node, final Variable source, final int target) {
		final Node n = node(node);
		switch (n.type) {
		case VARIABLE:
			if (source.equals(n.variable)) {
				replace(node, copySubtree(target));
			}
			return;
		case ABSTRACTION:
			if (source.equals(n.variable)) {
				throw new InvalidSubstitutionException("Trying to substitute a bound variable: " + toString(target)
						+ " for " + source + " in abstraction " + toString(node));
			}
			substitute(n.children[0], source, target);
			return;
		case APPLICATION:
			try {
				substituteChildren(node, source, target);
			} catch (final InvalidSubstitutionException e) {
				throw new InvalidSubstitutionException(e.getMessage() + ". Within: " + toString(node), e);
			}
			return;
		default:
			substituteChildren(node, source, target);
		}
	}

	/**
	 * Substitutes a copy of target's logical form for every occurrence of source.
	 */
	public void substitute(final Variable source, final Semantics target) {
		Preconditions.checkState(root != NONE, "Empty logical form");
		substitute(root, source, importSubtree(target, target.root));
	}

	private void substituteChildren(final int node, final Variable source, final int target) {
		// Read the slot each time round, since substitution rewrites it.
		for (int i = 0; i < getChildCount(node); i++) {
			substitute(getChild(node, i), source, target);
		}
	}

	/**
	 * Reduces the whole logical form to beta-normal form, in place.
	 */
	public Semantics betaReduce() {
		if (root != NONE) {
			betaReduce(root);
		}
		return this;
	}

	/**
	 * Reduces a subtree to beta-normal form, in place.
	 *
	 * @return the node now occupying the position of the given node
	 */
	public int betaReduce(final int node) {
		final Node n = node(node);
		switch (n.type) {
		case ABSTRACTION:
			betaReduce(n.children[0]);
			return node;
		case APPLICATION:
			return reduceApplication(node);
		case LIST:
			reduceChildren(node);
			return node;
		case LIST_CAT:
			reduceChildren(node);
			return collapseListCat(node);
		case COORDINATION:
			reduceChildren(node);
			flattenCoordination(node);
			return node;
		default:
			return node;
		}
	}

	private void reduceChildren(final int node) {
		for (int i = 0; i < getChildCount(node); i++) {
			betaReduce(getChild(node, i));
		}
	}

	private int reduceApplication(final int node) {
		final int functor = betaReduce(getChild(node, 0));

		if (getType(functor) == NodeType.ABSTRACTION) {
			final int argument = getChild(node, 1);
			final Set<Variable> functorBound = getBoundVariables(functor);
			final Set<Variable> used = Sets.newHashSet(getVariables(argument));
			used.addAll(getVariables(functor));
			used.addAll(getAncestorBoundVariables(node));

			// Bound variables shared with the argument are renamed in the argument.
			for (final Variable clash : Sets.intersection(getBoundVariables(argument), functorBound)) {
				final Variable fresh = Variable.nextUnused(clash, used);
				renameBinders(argument, clash, fresh);
				used.add(fresh);
			}

			// Free variables of the argument must not be captured by binders in the functor.
			for (final Variable clash : Sets.intersection(getFreeVariables(argument), functorBound)) {
				final Variable fresh = Variable.nextUnused(clash, used);
				renameBinders(functor, clash, fresh);
				used.add(fresh);
			}

			substitute(getChild(functor, 0), getVariable(functor), argument);
			final int body = getChild(functor, 0);
			replace(node, body);
			return betaReduce(body);
		}

		final CustomApplication customApplication = getType(functor).getCustomApplication();
		if (customApplication != null) {
			final int argument = betaReduce(getChild(node, 1));
			final int result = customApplication.apply(this, functor, argument);
			if (result == NONE) {
				return node;
			}
			replace(node, result);
			return betaReduce(result);
		}

		betaReduce(getChild(node, 1));
		return node;
	}

	private int collapseListCat(final int node) {
		final int[] lists = node(node).children;
		if (lists.length == 0) {
			return node;
		}
		final List<Integer> items = new ArrayList<>();
		for (final int list : lists) {
			if (getType(list) != NodeType.LIST) {
				return node;
			}
			for (final int item : node(list).children) {
				items.add(item);
			}
		}

		final int first = lists[0];
		setChildren(first, items.stream().mapToInt(Integer::intValue).toArray());
		replace(node, first);
		return first;
	}

	private void flattenCoordination(final int node) {
		final List<Integer> cadences = new ArrayList<>();
		boolean nested = false;
		for (final int child : node(node).children) {
			if (getType(child) == NodeType.COORDINATION) {
				nested = true;
				for (final int cadence : node(child).children) {
					cadences.add(cadence);
				}
			} else {
				cadences.add(child);
			}
		}
		if (nested) {
			setChildren(node, cadences.stream().mapToInt(Integer::intValue).toArray());
		}
	}

	// Time

	/**
	 * Gives the logical form a time, which is stored on its earliest timed element. An existing earlier time is
	 * kept.
	 */
	public void setTime(final Integer time) {
		if (root != NONE) {
			setTime(root, time);
		}
	}

	public void setTime(final int node, final Integer time) {
		final Node n = node(node);
		switch (n.type) {
		case PREDICATE:
		case COORDINATE:
			n.time = earliestTime(time, n.time);
			return;
		case VARIABLE:
			return;
		default:
			if (n.children.length > 0) {
				setTime(n.children[0], time);
			}
		}
	}

	public Integer getStartTime() {
		return root == NONE ? null : getStartTime(root);
	}

	public Integer getStartTime(final int node) {
		final Node n = node(node);
		switch (n.type) {
		case PREDICATE:
		case COORDINATE:
			return n.time;
		case VARIABLE:
			return null;
		default:
			return n.children.length > 0 ? getStartTime(n.children[0]) : null;
		}
	}

	/**
	 * True if both logical forms start at the same time.
	 */
	public boolean simultaneous(final Semantics other) {
		return Objects.equals(getStartTime(), other.getStartTime());
	}

	/**
	 * The earliest non-null time, or null if there is none.
	 */
	public static Integer earliestTime(final Integer... times) {
		Integer result = null;
		for (final Integer time : times) {
			if (time != null && (result == null || time < result)) {
				result = time;
			}
		}
		return result;
	}

	// Comparison

	/**
	 * Equality up to a consistent renaming of variables.
	 */
	public boolean alphaEquivalent(final Semantics other) {
		if (root == NONE || other.root == NONE) {
			return root == other.root;
		}
		return alphaEquivalent(root, other, other.root, new ArrayDeque<>(), HashBiMap.create());
	}

	/**
	 * @param binders
	 *            pairs of variables bound by enclosing abstractions on each side, innermost first
	 * @param free
	 *            the renaming of free variables built up so far, from other's variables to ours
	 */
	private boolean alphaEquivalent(final int node, final Semantics other, final int otherNode,
			final Deque<Variable[]> binders, final BiMap<Variable, Variable> free) {
		final Node ours = node(node);
		final Node theirs = other.node(otherNode);
		if (ours.type != theirs.type || ours.children.length != theirs.children.length) {
			return false;
		}

		switch (ours.type) {
		case VARIABLE:
			for (final Variable[] pair : binders) {
				if (pair[0].equals(ours.variable) || pair[1].equals(theirs.variable)) {
					return pair[0].equals(ours.variable) && pair[1].equals(theirs.variable);
				}
			}
			final Variable mapped = free.get(theirs.variable);
			if (mapped != null) {
				return mapped.equals(ours.variable);
			}
			if (free.containsValue(ours.variable)) {
				return false;
			}
			free.put(theirs.variable, ours.variable);
			return true;
		case ABSTRACTION:
			binders.push(new Variable[] { ours.variable, theirs.variable });
			final boolean result = alphaEquivalent(ours.children[0], other, theirs.children[0], binders, free);
			binders.pop();
			return result;
		case PREDICATE:
		case COORDINATE:
			return sameTerminal(ours, theirs);
		default:
			for (int i = 0; i < ours.children.length; i++) {
				if (!alphaEquivalent(ours.children[i], other, theirs.children[i], binders, free)) {
					return false;
				}
			}
			return true;
		}
	}

	private static boolean sameTerminal(final Node ours, final Node theirs) {
		return ours.predicate == theirs.predicate && Objects.equals(ours.coordinate, theirs.coordinate)
				&& Objects.equals(ours.time, theirs.time);
	}

	private boolean structurallyEqual(final int node, final Semantics other, final int otherNode) {
		final Node ours = node(node);
		final Node theirs = other.node(otherNode);
		if (ours.type != theirs.type || ours.children.length != theirs.children.length
				|| !Objects.equals(ours.variable, theirs.variable) || !sameTerminal(ours, theirs)) {
			return false;
		}
		for (int i = 0; i < ours.children.length; i++) {
			if (!structurallyEqual(ours.children[i], other, theirs.children[i])) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Hash of the shape of the logical form. Variable names are ignored, so alpha-equivalent logical forms have equal
	 * hashes.
	 */
	public int structureHash() {
		return root == NONE ? 0 : structureHash(root);
	}

	private int structureHash(final int node) {
		final Node n = node(node);
		int result = Objects.hash(n.type, n.predicate, n.coordinate, n.time);
		for (final int child : n.children) {
			result = 31 * result + structureHash(child);
		}
		return result;
	}

	@Override
	public boolean equals(final Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Semantics)) {
			return false;
		}
		final Semantics semantics = (Semantics) other;
		if (root == NONE || semantics.root == NONE) {
			return root == semantics.root;
		}
		return structurallyEqual(root, semantics, semantics.root);
	}

	@Override
	public int hashCode() {
		return structureHash();
	}

	// Printing

	@Override
	public String toString() {
		return root == NONE ? "<empty>" : toString(root);
	}

	public String toString(final int node) {
		final StringBuilder result = new StringBuilder();
		toString(node, result);
		return result.toString();
	}

	private void toString(final int node, final StringBuilder result) {
		final Node n = node(node);
		switch (n.type) {
		case VARIABLE:
			result.append(n.variable);
			return;
		case ABSTRACTION:
			result.append("\\");
			int abstraction = node;
			while (getType(getChild(abstraction, 0)) == NodeType.ABSTRACTION) {
				result.append(getVariable(abstraction)).append(",");
				abstraction = getChild(abstraction, 0);
			}
			result.append(getVariable(abstraction)).append(".");
			toString(getChild(abstraction, 0), result);
			return;
		case APPLICATION:
			final int functor = n.children[0];
			if (getType(functor) == NodeType.PREDICATE) {
				appendPredicate(node(functor), result);
				result.append("(");
				toString(n.children[1], result);
				result.append(")");
			} else {
				result.append("(");
				toString(functor, result);
				result.append(" ");
				toString(n.children[1], result);
				result.append(")");
			}
			return;
		case PREDICATE:
			result.append(n.predicate.getName());
			appendTime(n.time, result);
			return;
		case COORDINATE:
			result.append(n.coordinate);
			appendTime(n.time, result);
			return;
		case LIST:
			result.append("[");
			appendAll(n.children, ", ", result);
			result.append("]");
			return;
		case LIST_CAT:
			appendAll(n.children, "+", result);
			return;
		case COORDINATION:
			result.append("(");
			appendAll(n.children, " & ", result);
			result.append(")");
			return;
		default:
			throw new IllegalStateException("Unknown node type: " + n.type);
		}
	}

	/**
	 * Predicates applied to something print as name(argument). Only "now" shows its time.
	 */
	private static void appendPredicate(final Node predicate, final StringBuilder result) {
		result.append(predicate.predicate.getName());
		if (predicate.predicate == Predicate.NOW) {
			appendTime(predicate.time, result);
		}
	}

	private static void appendTime(final Integer time, final StringBuilder result) {
		if (time != null) {
			result.append("@").append(time);
		}
	}

	private void appendAll(final int[] children, final String separator, final StringBuilder result) {
		for (int i = 0; i < children.length; i++) {
			if (i > 0) {
				result.append(separator);
			}
			toString(children[i], result);
		}
	}

	// Combination

	/**
	 * Beta-reduced application of copies of functor and argument.
	 */
	public static Semantics apply(final Semantics functor, final Semantics argument) {
		final Semantics result = new Semantics();
		final int application = result.application(result.importSubtree(functor, functor.root),
				result.importSubtree(argument, argument.root));
		result.setRoot(application);
		return compact(result.betaReduce());
	}

	/**
	 * Beta-reduced \x.(f (g x)), for a variable x not used in either input.
	 */
	public static Semantics compose(final Semantics f, final Semantics g) {
		final Set<Variable> used = Sets.union(f.getVariables(), g.getVariables());
		final Variable x = Variable.nextUnused(new Variable("x"), used);

		final Semantics result = new Semantics();
		final int inner = result.application(result.importSubtree(g, g.root), result.variable(x));
		final int outer = result.application(result.importSubtree(f, f.root), inner);
		result.setRoot(result.abstraction(x, outer));
		return compact(result.betaReduce());
	}

	/**
	 * Beta-reduced concatenation of two paths.
	 */
	public static Semantics concatenate(final Semantics first, final Semantics second) {
		final Semantics result = new Semantics();
		result.setRoot(result.listCat(result.importSubtree(first, first.root),
				result.importSubtree(second, second.root)));
		return compact(result.betaReduce());
	}

	/**
	 * Beta-reduced coordination of two cadences.
	 */
	public static Semantics coordinate(final Semantics first, final Semantics second) {
		final Semantics result = new Semantics();
		result.setRoot(result.coordination(result.importSubtree(first, first.root),
				result.importSubtree(second, second.root)));
		return compact(result.betaReduce());
	}

	// Reduction leaves replaced nodes in the arena. Results that get stored drop them.
	private static Semantics compact(final Semantics semantics) {
		return semantics.copy();
	}

	/**
	 * Number of nodes held in the arena, including any no longer reachable from the root.
	 */
	public int getArenaSize() {
		return nodes.size();
	}

	/**
	 * Number of nodes reachable from the root.
	 */
	public int size() {
		return root == NONE ? 0 : size(root);
	}

	private int size(final int node) {
		int result = 1;
		for (final int child : node(node).children) {
			result += size(child);
		}
		return result;
	}
}
