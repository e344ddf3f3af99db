package org.javai.commands.descriptor;

import org.javai.commands.api.CommandSender;
import org.javai.commands.parse.CommandValueArgument;

/**
 * Contextual parser producing a value of type {@code T} from an argument's text.
 * <p>
 * Parsers are registered in a {@link CommandArgumentContext} by target type and are
 * only invoked after the resolver has chosen a variant. A parser rejects bad input by
 * throwing, typically through {@link #illegalArgument(String)}.
 *
 * @param <T> the produced type
 * @see BuiltinArgumentParsers
 */
@FunctionalInterface
public interface CommandValueArgumentParser<T> {

	/**
	 * Parses {@code raw} into a value.
	 *
	 * @param raw    the argument text
	 * @param sender the caller, for parsers whose result depends on who is asking
	 * @throws CommandArgumentParserException if {@code raw} is not acceptable
	 */
	T parse(String raw, CommandSender sender);

	/**
	 * Parses an argument. Uses the raw token when there is one and the value's
	 * string form otherwise.
	 */
	default T parse(CommandValueArgument argument, CommandSender sender) {
		return parse(argument.content(), sender);
	}

	default CommandArgumentParserException illegalArgument(String message) {
		return new CommandArgumentParserException(message);
	}

	default CommandArgumentParserException illegalArgument(String message, Throwable cause) {
		return new CommandArgumentParserException(message, cause);
	}
}
