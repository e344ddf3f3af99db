package org.javai.commands.resolve;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.javai.commands.api.CommandSender;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.javai.commands.parse.CommandCall;
import org.springframework.lang.Nullable;

/**
 * A call bound to exactly one variant with every argument converted, ready to run.
 *
 * @param originalCall           the unresolved call
 * @param variant                the selected variant
 * @param resolvedReceiver       the caller, when the variant declares a receiver parameter
 * @param resolvedValueArguments one entry per declared value parameter, in declaration order
 */
public record ResolvedCommandCall(
		CommandCall originalCall,
		CommandSignatureVariant variant,
		@Nullable CommandSender resolvedReceiver,
		List<ResolvedArgument> resolvedValueArguments
) {

	public ResolvedCommandCall {
		Objects.requireNonNull(originalCall, "originalCall must not be null");
		Objects.requireNonNull(variant, "variant must not be null");
		resolvedValueArguments = List.copyOf(resolvedValueArguments);
	}

	public CommandSender caller() {
		return originalCall.caller();
	}

	public String calleeName() {
		return originalCall.calleeName();
	}

	/**
	 * Converted value of the parameter at {@code index}; {@code null} for an absent optional parameter.
	 */
	@Nullable
	public Object value(int index) {
		return resolvedValueArguments.get(index).value();
	}

	/**
	 * Converted values in declaration order, as passed to a reflective invocation.
	 */
	public Object[] argumentValues() {
		return resolvedValueArguments.stream().map(ResolvedArgument::value).toArray();
	}

	/**
	 * Runs the selected variant's action.
	 */
	public CompletableFuture<Object> call() {
		return variant.call(this);
	}
}
