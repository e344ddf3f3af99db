package org.javai.commands.resolve;

/**
 * Thrown by {@link ResolutionResult#orElseThrow()} when a call could not be resolved.
 */
public class CommandResolutionException extends RuntimeException {

	private final transient ResolutionFailure failure;

	public CommandResolutionException(ResolutionFailure failure) {
		super(failure.message(), failure instanceof ResolutionFailure.ArgumentConversionFailed conversion
				? conversion.cause()
				: null);
		this.failure = failure;
	}

	public ResolutionFailure failure() {
		return failure;
	}
}
