package org.javai.commands.descriptor;

import java.util.List;
import java.util.Objects;
import org.javai.commands.parse.TypeVariant;

/**
 * How well one argument matches one value parameter. Higher
 * {@link #acceptanceLevel()} means a better match; only levels above zero are
 * acceptable.
 */
public sealed interface ArgumentAcceptance {

	int DIRECT_LEVEL = Integer.MAX_VALUE;
	int TYPE_CONVERSION_LEVEL = 20;
	int CONTEXTUAL_CONVERSION_LEVEL = 10;
	int AMBIGUITY_LEVEL = 0;
	int IMPOSSIBLE_LEVEL = -1;

	ArgumentAcceptance DIRECT = new Direct();
	ArgumentAcceptance IMPOSSIBLE = new Impossible();

	int acceptanceLevel();

	default boolean isAcceptable() {
		return acceptanceLevel() > 0;
	}

	/**
	 * The argument's native type already fits; the value is passed through.
	 */
	record Direct() implements ArgumentAcceptance {

		@Override
		public int acceptanceLevel() {
			return DIRECT_LEVEL;
		}
	}

	/**
	 * One of the argument's offered type variants fits.
	 */
	record WithTypeConversion(TypeVariant<?> typeVariant) implements ArgumentAcceptance {

		public WithTypeConversion {
			Objects.requireNonNull(typeVariant, "typeVariant must not be null");
		}

		@Override
		public int acceptanceLevel() {
			return TYPE_CONVERSION_LEVEL;
		}
	}

	/**
	 * The argument context holds a parser for the expected type.
	 */
	record WithContextualConversion(CommandValueArgumentParser<?> parser) implements ArgumentAcceptance {

		public WithContextualConversion {
			Objects.requireNonNull(parser, "parser must not be null");
		}

		@Override
		public int acceptanceLevel() {
			return CONTEXTUAL_CONVERSION_LEVEL;
		}
	}

	/**
	 * Several conversions would apply equally well. Not produced by the first-match
	 * resolver; kept so that a resolver weighing every candidate conversion can report it.
	 */
	record ResolutionAmbiguity(List<TypeVariant<?>> candidates) implements ArgumentAcceptance {

		public ResolutionAmbiguity {
			candidates = List.copyOf(candidates);
		}

		@Override
		public int acceptanceLevel() {
			return AMBIGUITY_LEVEL;
		}
	}

	/**
	 * No path from the argument to the parameter type exists.
	 */
	record Impossible() implements ArgumentAcceptance {

		@Override
		public int acceptanceLevel() {
			return IMPOSSIBLE_LEVEL;
		}
	}
}
