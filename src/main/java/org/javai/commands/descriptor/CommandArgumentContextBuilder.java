package org.javai.commands.descriptor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.javai.commands.descriptor.CommandArgumentContext.ParserPair;

/**
 * Builder for {@link SimpleCommandArgumentContext}.
 *
 * <pre>{@code
 * CommandArgumentContext context = CommandArgumentContext.builder()
 *         .add(Integer.class, BuiltinArgumentParsers.INT)
 *         .add(Color.class, raw -> Color.decode(raw))
 *         .build();
 * }</pre>
 *
 * Registering the same type twice keeps the last parser.
 */
public final class CommandArgumentContextBuilder {

	private final List<ParserPair<?>> pairs = new ArrayList<>();

	CommandArgumentContextBuilder() {
	}

	@SuppressWarnings("unchecked")
	public <T> CommandArgumentContextBuilder add(Class<T> type, CommandValueArgumentParser<? extends T> parser) {
		pairs.add(new ParserPair<>((Class<T>) TypeDescriptor.wrap(type), parser));
		return this;
	}

	/**
	 * Registers a parser that ignores the sender.
	 */
	public <T> CommandArgumentContextBuilder add(Class<T> type, Function<String, ? extends T> parser) {
		Objects.requireNonNull(parser, "parser must not be null");
		return add(type, (CommandValueArgumentParser<T>) (raw, sender) -> parser.apply(raw));
	}

	public CommandArgumentContext build() {
		Set<Class<?>> seen = new HashSet<>();
		List<ParserPair<?>> distinct = new ArrayList<>();
		for (int i = pairs.size() - 1; i >= 0; i--) {
			ParserPair<?> pair = pairs.get(i);
			if (seen.add(pair.type())) {
				distinct.add(pair);
			}
		}
		return new SimpleCommandArgumentContext(distinct);
	}
}
