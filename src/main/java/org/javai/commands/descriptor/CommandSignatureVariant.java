package org.javai.commands.descriptor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.javai.commands.resolve.ResolvedCommandCall;

/**
 * One overload of a command: an optional receiver constraint, an ordered list of
 * value parameters, and the action to run once a call has been resolved against it.
 * <p>
 * The variants registered under one command name form its overload set.
 *
 * @see CommandSignature
 * @see org.javai.commands.bind.AnnotatedSignatureVariants
 */
public interface CommandSignatureVariant {

	Optional<CommandReceiverParameter> receiverParameter();

	List<CommandValueParameter> valueParameters();

	/**
	 * Runs the bound action with the resolved arguments.
	 *
	 * @return a future completing with the action's result
	 */
	CompletableFuture<Object> call(ResolvedCommandCall resolvedCommandCall);
}
