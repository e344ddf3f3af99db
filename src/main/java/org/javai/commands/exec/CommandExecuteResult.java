package org.javai.commands.exec;

import java.util.Objects;
import org.javai.commands.parse.CommandCall;
import org.javai.commands.resolve.ResolutionFailure;
import org.javai.commands.resolve.ResolvedCommandCall;
import org.springframework.lang.Nullable;

/**
 * Outcome of executing a command call. Sealed to ensure all outcomes are known.
 * <ul>
 *   <li>{@link Success} - the call resolved and its action completed normally</li>
 *   <li>{@link ExecutionFailed} - the call resolved but its action failed</li>
 *   <li>{@link ResolutionFailed} - the call could not be resolved; no action ran</li>
 * </ul>
 */
public sealed interface CommandExecuteResult {

	String calleeName();

	default boolean isSuccess() {
		return this instanceof Success;
	}

	/**
	 * @param call        the resolved call that ran
	 * @param returnValue what the action completed with
	 */
	record Success(ResolvedCommandCall call, @Nullable Object returnValue) implements CommandExecuteResult {

		public Success {
			Objects.requireNonNull(call, "call must not be null");
		}

		@Override
		public String calleeName() {
			return call.calleeName();
		}
	}

	/**
	 * @param call  the resolved call that ran
	 * @param cause what the action failed with
	 */
	record ExecutionFailed(ResolvedCommandCall call, Throwable cause) implements CommandExecuteResult {

		public ExecutionFailed {
			Objects.requireNonNull(call, "call must not be null");
			Objects.requireNonNull(cause, "cause must not be null");
		}

		@Override
		public String calleeName() {
			return call.calleeName();
		}
	}

	/**
	 * @param call    the unresolved call
	 * @param failure why resolution failed
	 */
	record ResolutionFailed(CommandCall call, ResolutionFailure failure) implements CommandExecuteResult {

		public ResolutionFailed {
			Objects.requireNonNull(call, "call must not be null");
			Objects.requireNonNull(failure, "failure must not be null");
		}

		@Override
		public String calleeName() {
			return call.calleeName();
		}
	}
}
