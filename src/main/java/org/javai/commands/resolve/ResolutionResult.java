package org.javai.commands.resolve;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving a call: a ready-to-run call or the reason resolution failed.
 */
public sealed interface ResolutionResult {

	record Success(ResolvedCommandCall resolvedCommandCall) implements ResolutionResult {

		public Success {
			Objects.requireNonNull(resolvedCommandCall, "resolvedCommandCall must not be null");
		}
	}

	record Failure(ResolutionFailure reason) implements ResolutionResult {

		public Failure {
			Objects.requireNonNull(reason, "reason must not be null");
		}
	}

	static ResolutionResult success(ResolvedCommandCall call) {
		return new Success(call);
	}

	static ResolutionResult failure(ResolutionFailure reason) {
		return new Failure(reason);
	}

	default boolean isSuccess() {
		return this instanceof Success;
	}

	default Optional<ResolvedCommandCall> resolvedCall() {
		return this instanceof Success s ? Optional.of(s.resolvedCommandCall()) : Optional.empty();
	}

	default Optional<ResolutionFailure> failure() {
		return this instanceof Failure f ? Optional.of(f.reason()) : Optional.empty();
	}

	/**
	 * @throws CommandResolutionException carrying the failure if resolution failed
	 */
	default ResolvedCommandCall orElseThrow() {
		if (this instanceof Failure f) {
			throw new CommandResolutionException(f.reason());
		}
		return ((Success) this).resolvedCommandCall();
	}
}
