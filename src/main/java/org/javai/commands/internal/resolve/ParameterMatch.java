package org.javai.commands.internal.resolve;

import java.util.List;
import org.javai.commands.descriptor.CommandValueParameter;

/**
 * The arguments a parameter consumed: exactly one for a plain parameter, zero or
 * more for a vararg parameter, none for a skipped optional parameter.
 */
public record ParameterMatch(CommandValueParameter parameter, List<ArgumentMatch> arguments) {

	public ParameterMatch {
		arguments = List.copyOf(arguments);
	}

	public static ParameterMatch skipped(CommandValueParameter parameter) {
		return new ParameterMatch(parameter, List.of());
	}

	public boolean isSkipped() {
		return !parameter.isVararg() && arguments.isEmpty();
	}
}
