package org.javai.commands.resolve;

import java.util.List;
import org.javai.commands.descriptor.CommandArgumentContext;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.javai.commands.parse.CommandCall;

/**
 * Resolves an unresolved call against the overload set of its callee.
 * <p>
 * Resolution:
 * <ul>
 *   <li>Scores every variant against the call without converting anything</li>
 *   <li>Selects the single best-scoring variant, reporting ties as ambiguity</li>
 *   <li>Converts the arguments the way the winning scores prescribe</li>
 * </ul>
 * Implementations are stateless and safe for concurrent use.
 */
public interface CommandCallResolver {

	/**
	 * @param call     the unresolved call
	 * @param variants every variant registered under {@code call.calleeName()}
	 * @param context  the parsers available for contextual conversion
	 * @return the resolved call, or the reason resolution failed
	 */
	ResolutionResult resolve(CommandCall call, List<? extends CommandSignatureVariant> variants,
			CommandArgumentContext context);
}
