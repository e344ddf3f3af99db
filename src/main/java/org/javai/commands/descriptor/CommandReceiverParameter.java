package org.javai.commands.descriptor;

import java.util.Objects;
import org.javai.commands.api.CommandSender;

/**
 * Constraint on the caller of a variant: the caller's runtime type must be a
 * subtype of {@link #type()}, otherwise the variant does not apply.
 *
 * @param isOptional carried for descriptors; the type check applies either way
 * @param type       required caller type
 */
public record CommandReceiverParameter(boolean isOptional, TypeDescriptor type) implements CommandParameter {

	public static final String PARAMETER_NAME = "<receiver>";

	public CommandReceiverParameter {
		Objects.requireNonNull(type, "type must not be null");
		if (type.isArray()) {
			throw new IllegalArgumentException("Receiver type must not be an array. Given " + type);
		}
	}

	public static CommandReceiverParameter of(Class<? extends CommandSender> type) {
		return new CommandReceiverParameter(false, TypeDescriptor.of(type));
	}

	@Override
	public String name() {
		return PARAMETER_NAME;
	}

	@Override
	public String toString() {
		return PARAMETER_NAME + ": " + type;
	}
}
