package org.javai.commands.parse;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.javai.commands.api.CommandSender;

/**
 * Unresolved command call, as produced by the call parser.
 *
 * @param caller         who issued the call
 * @param calleeName     the command name the call targets
 * @param valueArguments explicit arguments in call order
 */
public record CommandCall(
		CommandSender caller,
		String calleeName,
		List<CommandValueArgument> valueArguments
) {

	public CommandCall {
		Objects.requireNonNull(caller, "caller must not be null");
		Objects.requireNonNull(calleeName, "calleeName must not be null");
		valueArguments = valueArguments != null ? List.copyOf(valueArguments) : List.of();
	}

	/**
	 * Convenience for calls whose arguments are all raw text tokens.
	 */
	public static CommandCall ofTokens(CommandSender caller, String calleeName, String... tokens) {
		return new CommandCall(caller, calleeName, Arrays.stream(tokens)
				.map(CommandValueArgument::ofToken)
				.toList());
	}
}
