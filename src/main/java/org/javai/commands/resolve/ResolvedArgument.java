package org.javai.commands.resolve;

import java.util.Objects;
import org.javai.commands.descriptor.CommandValueParameter;
import org.springframework.lang.Nullable;

/**
 * Converted value for one declared parameter.
 *
 * @param parameter the declared parameter
 * @param value     the converted value; an array for a vararg parameter, {@code null} when absent
 * @param present   {@code false} only for an optional parameter the call left out
 */
public record ResolvedArgument(
		CommandValueParameter parameter,
		@Nullable Object value,
		boolean present
) {

	public ResolvedArgument {
		Objects.requireNonNull(parameter, "parameter must not be null");
	}

	public static ResolvedArgument of(CommandValueParameter parameter, Object value) {
		return new ResolvedArgument(parameter, value, true);
	}

	public static ResolvedArgument absent(CommandValueParameter parameter) {
		return new ResolvedArgument(parameter, null, false);
	}
}
