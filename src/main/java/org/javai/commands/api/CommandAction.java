package org.javai.commands.api;

import java.util.concurrent.CompletionStage;
import org.javai.commands.resolve.ResolvedCommandCall;

/**
 * Business logic bound to one signature variant.
 * <p>
 * Actions run asynchronously: the returned stage completes with the action's
 * result (or {@code null}) once the work is done. Cancelling the stage handed
 * out by the executor cancels the stage returned here.
 */
@FunctionalInterface
public interface CommandAction {

	CompletionStage<?> invoke(ResolvedCommandCall call);
}
