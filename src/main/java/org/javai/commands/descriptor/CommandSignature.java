package org.javai.commands.descriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.javai.commands.api.CommandAction;
import org.javai.commands.api.CommandSender;
import org.javai.commands.resolve.ResolvedCommandCall;
import org.springframework.lang.Nullable;

/**
 * Variant declared in code with an explicit parameter list.
 *
 * <pre>{@code
 * CommandSignatureVariant add = CommandSignature.builder()
 *         .literal("add")
 *         .required("n", Integer.class)
 *         .onCall(call -> counter.addAsync((Integer) call.value(1)))
 *         .build();
 * }</pre>
 */
public final class CommandSignature extends AbstractCommandSignatureVariant {

	private final CommandAction action;

	public CommandSignature(@Nullable CommandReceiverParameter receiverParameter,
			List<CommandValueParameter> valueParameters, CommandAction action) {
		super(receiverParameter, valueParameters);
		this.action = Objects.requireNonNull(action, "action must not be null");
	}

	@Override
	@SuppressWarnings("unchecked")
	public CompletableFuture<Object> call(ResolvedCommandCall resolvedCommandCall) {
		try {
			// same future instance, so cancelling it reaches the action
			CompletableFuture<?> future = action.invoke(resolvedCommandCall).toCompletableFuture();
			return (CompletableFuture<Object>) future;
		}
		catch (RuntimeException ex) {
			return CompletableFuture.failedFuture(ex);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link CommandSignature}. Parameters are declared in call order.
	 */
	public static final class Builder {

		@Nullable
		private CommandReceiverParameter receiver;
		private final List<CommandValueParameter> parameters = new ArrayList<>();
		@Nullable
		private CommandAction action;

		private Builder() {
		}

		/**
		 * Requires the caller to be a {@code type}.
		 */
		public Builder receiver(Class<? extends CommandSender> type) {
			this.receiver = CommandReceiverParameter.of(type);
			return this;
		}

		/**
		 * Appends a literal that must appear verbatim.
		 */
		public Builder literal(String expectingValue) {
			parameters.add(CommandValueParameter.StringConstant.of(expectingValue));
			return this;
		}

		public Builder required(String name, Class<?> type) {
			parameters.add(CommandValueParameter.UserDefinedType.createRequired(name, type));
			return this;
		}

		public Builder optional(String name, Class<?> type) {
			parameters.add(CommandValueParameter.UserDefinedType.createOptional(name, type));
			return this;
		}

		public Builder vararg(String name, Class<?> elementType) {
			parameters.add(CommandValueParameter.UserDefinedType.createVararg(name, elementType));
			return this;
		}

		public Builder parameter(CommandValueParameter parameter) {
			parameters.add(Objects.requireNonNull(parameter, "parameter must not be null"));
			return this;
		}

		public Builder onCall(CommandAction action) {
			this.action = action;
			return this;
		}

		/**
		 * Binds a synchronous action; its return value completes the call's future.
		 */
		public Builder onCallSync(Function<ResolvedCommandCall, ?> action) {
			Objects.requireNonNull(action, "action must not be null");
			this.action = call -> CompletableFuture.completedFuture(action.apply(call));
			return this;
		}

		public CommandSignature build() {
			if (action == null) {
				throw new IllegalStateException("No action bound; call onCall or onCallSync first");
			}
			return new CommandSignature(receiver, parameters, action);
		}
	}
}
