package org.javai.commands.descriptor;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.lang.Nullable;

/**
 * Base for variants: holds and validates the parameter shape.
 * <p>
 * At most one vararg parameter is allowed and it must come last, since it absorbs
 * every remaining argument.
 */
public abstract class AbstractCommandSignatureVariant implements CommandSignatureVariant {

	@Nullable
	private final CommandReceiverParameter receiverParameter;
	private final List<CommandValueParameter> valueParameters;

	protected AbstractCommandSignatureVariant(@Nullable CommandReceiverParameter receiverParameter,
			List<CommandValueParameter> valueParameters) {
		this.receiverParameter = receiverParameter;
		this.valueParameters = List.copyOf(valueParameters);
		for (int i = 0; i < this.valueParameters.size() - 1; i++) {
			if (this.valueParameters.get(i).isVararg()) {
				throw new IllegalArgumentException(
						"Only the last value parameter may be vararg. Given " + this.valueParameters);
			}
		}
	}

	@Override
	public Optional<CommandReceiverParameter> receiverParameter() {
		return Optional.ofNullable(receiverParameter);
	}

	@Override
	public List<CommandValueParameter> valueParameters() {
		return valueParameters;
	}

	@Override
	public String toString() {
		String parameters = valueParameters.stream()
				.map(Object::toString)
				.collect(Collectors.joining(", "));
		if (receiverParameter == null) {
			return "CommandSignatureVariant(" + parameters + ")";
		}
		return parameters.isEmpty()
				? "CommandSignatureVariant(" + receiverParameter + ")"
				: "CommandSignatureVariant(" + receiverParameter + ", " + parameters + ")";
	}
}
