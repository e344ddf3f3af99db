package org.javai.commands.descriptor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup table from target type to {@link CommandValueArgumentParser}, consulted by
 * the resolver when an argument has to be converted from text.
 * <p>
 * Contexts are immutable. Layering is done by composition:
 *
 * <pre>{@code
 * CommandArgumentContext context = BuiltinArgumentParsers.CONTEXT.plus(
 *         CommandArgumentContext.builder()
 *                 .add(Integer.class, new HexIntegerParser())
 *                 .build());
 * }</pre>
 *
 * yields a view where the hexadecimal parser shadows the built-in integer parser
 * and every other lookup falls through to the built-ins.
 *
 * @see SimpleCommandArgumentContext
 * @see BuiltinArgumentParsers#CONTEXT
 */
public interface CommandArgumentContext {

	CommandArgumentContext EMPTY = new SimpleCommandArgumentContext(List.of());

	/**
	 * Finds the parser for {@code type}: a parser registered for exactly that type if
	 * any, otherwise the one registered for the nearest supertype.
	 */
	Optional<CommandValueArgumentParser<?>> get(Class<?> type);

	default Optional<CommandValueArgumentParser<?>> get(TypeDescriptor type) {
		return get(type.classifier());
	}

	/**
	 * All registrations, in lookup precedence order.
	 */
	List<ParserPair<?>> toList();

	default boolean isEmpty() {
		return toList().isEmpty();
	}

	/**
	 * Merges this context with {@code replacer}. A parser from {@code replacer} wins
	 * whenever it has one for the requested type, including through a supertype key.
	 * Neither context is modified.
	 */
	default CommandArgumentContext plus(CommandArgumentContext replacer) {
		Objects.requireNonNull(replacer, "replacer must not be null");
		if (replacer.isEmpty()) {
			return this;
		}
		if (this.isEmpty()) {
			return replacer;
		}
		return new MergedCommandArgumentContext(this, replacer);
	}

	/**
	 * Merges this context with a partial list of registrations; see {@link #plus(CommandArgumentContext)}.
	 */
	default CommandArgumentContext plus(List<ParserPair<?>> replacer) {
		Objects.requireNonNull(replacer, "replacer must not be null");
		return plus(new SimpleCommandArgumentContext(replacer));
	}

	static CommandArgumentContextBuilder builder() {
		return new CommandArgumentContextBuilder();
	}

	/**
	 * A parser registered for a type.
	 *
	 * @param type   the key; primitives are stored as their wrapper type
	 * @param parser parser producing values of {@code type}
	 */
	record ParserPair<T>(Class<T> type, CommandValueArgumentParser<? extends T> parser) {

		public ParserPair {
			Objects.requireNonNull(type, "type must not be null");
			Objects.requireNonNull(parser, "parser must not be null");
		}
	}
}
