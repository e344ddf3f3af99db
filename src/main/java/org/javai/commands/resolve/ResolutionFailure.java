package org.javai.commands.resolve;

import java.util.List;
import java.util.Objects;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.javai.commands.descriptor.CommandValueParameter;
import org.javai.commands.descriptor.TypeDescriptor;

/**
 * Why a call could not be resolved. Sealed to ensure all failure kinds are known.
 * <ul>
 *   <li>{@link NoMatchingVariant} - every candidate variant was disqualified</li>
 *   <li>{@link AmbiguousVariants} - several variants tied for the best score</li>
 *   <li>{@link ArgumentConversionFailed} - the selected conversion threw when applied</li>
 *   <li>{@link ReceiverRejected} - the caller failed the receiver check of every variant</li>
 * </ul>
 */
public sealed interface ResolutionFailure {

	String calleeName();

	/**
	 * Description suitable for showing to the caller.
	 */
	String message();

	/**
	 * @param calleeName     the command name
	 * @param candidateCount how many variants were considered
	 */
	record NoMatchingVariant(String calleeName, int candidateCount) implements ResolutionFailure {

		@Override
		public String message() {
			return "No signature of command '" + calleeName + "' matches the given arguments ("
					+ candidateCount + " candidate" + (candidateCount == 1 ? "" : "s") + " considered)";
		}
	}

	/**
	 * @param calleeName      the command name
	 * @param candidates      every variant tied at the top score
	 * @param acceptanceLevel the tied score
	 */
	record AmbiguousVariants(
			String calleeName,
			List<CommandSignatureVariant> candidates,
			int acceptanceLevel
	) implements ResolutionFailure {

		public AmbiguousVariants {
			candidates = List.copyOf(candidates);
		}

		@Override
		public String message() {
			StringBuilder sb = new StringBuilder("Call to command '")
					.append(calleeName)
					.append("' is ambiguous between ")
					.append(candidates.size())
					.append(" signatures:");
			for (CommandSignatureVariant candidate : candidates) {
				sb.append("\n  ").append(candidate);
			}
			return sb.toString();
		}
	}

	/**
	 * @param calleeName the command name
	 * @param parameter  the parameter whose argument failed to convert
	 * @param rawToken   the argument's text
	 * @param cause      what the parser or type variant raised
	 */
	record ArgumentConversionFailed(
			String calleeName,
			CommandValueParameter parameter,
			String rawToken,
			Throwable cause
	) implements ResolutionFailure {

		public ArgumentConversionFailed {
			Objects.requireNonNull(cause, "cause must not be null");
		}

		@Override
		public String message() {
			String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
			return "Invalid argument '" + rawToken + "' for " + parameter + " of command '" + calleeName + "': "
					+ reason;
		}
	}

	/**
	 * @param calleeName     the command name
	 * @param callerType     runtime type of the caller
	 * @param candidateCount how many variants were considered
	 */
	record ReceiverRejected(String calleeName, TypeDescriptor callerType, int candidateCount)
			implements ResolutionFailure {

		@Override
		public String message() {
			return "Command '" + calleeName + "' cannot be called by a " + callerType;
		}
	}
}
