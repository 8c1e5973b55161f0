package edu.uw.chordccg.semantics;

/**
 * Application behaviour for functors that are not lambda abstractions, such as predicates and coordinations.
 */
public interface CustomApplication {

	/**
	 * Applies functor to argument, both nodes of semantics. Returns the node that should replace the application, or
	 * {@link Semantics#NONE} if the application is already in normal form.
	 */
	int apply(Semantics semantics, int functor, int argument);

	/**
	 * Applied to a path, the functor moves onto the first point of the path.
	 */
	CustomApplication ONTO_PATH = (semantics, functor, argument) -> {
		if (semantics.getType(argument) != NodeType.LIST || semantics.getChildCount(argument) == 0) {
			return Semantics.NONE;
		}
		final int head = semantics.getChild(argument, 0);
		semantics.setChild(argument, 0, semantics.application(functor, head));
		return argument;
	};

	/**
	 * Predicates move onto paths. A "now" predicate also gives its time to a coordinate, to a predicate or
	 * coordination it is applied to, and then disappears.
	 */
	CustomApplication PREDICATE = (semantics, functor, argument) -> {
		final int moved = ONTO_PATH.apply(semantics, functor, argument);
		if (moved != Semantics.NONE || semantics.getPredicate(functor) != Predicate.NOW) {
			return moved;
		}

		final Integer time = semantics.getTime(functor);
		switch (semantics.getType(argument)) {
		case COORDINATE:
			semantics.setTime(argument, time);
			return argument;
		case APPLICATION:
			final int innerFunctor = semantics.getChild(argument, 0);
			final NodeType innerType = semantics.getType(innerFunctor);
			if (innerType == NodeType.PREDICATE || innerType == NodeType.COORDINATION) {
				// Absorbs nested nows as well.
				semantics.setTime(innerFunctor, time);
				return argument;
			}
			return Semantics.NONE;
		case COORDINATION:
			if (semantics.getChildCount(argument) == 0) {
				return Semantics.NONE;
			}
			semantics.setTime(semantics.getChild(argument, 0), time);
			return argument;
		default:
			return Semantics.NONE;
		}
	};
}
