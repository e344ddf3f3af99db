package org.javai.commands.resolve;

import java.util.Objects;
import org.javai.commands.descriptor.TypeHierarchy;

/**
 * Configuration for {@link DefaultCommandCallResolver}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * CommandResolutionConfig config = CommandResolutionConfig.defaults();
 *
 * // Custom configuration
 * CommandResolutionConfig config = CommandResolutionConfig.builder()
 *         .typeHierarchy(myHierarchy)
 *         .reportReceiverRejection(false)
 *         .build();
 * }</pre>
 *
 * @param typeHierarchy           the subtype relation used for every compatibility check
 * @param reportReceiverRejection whether to report {@link ResolutionFailure.ReceiverRejected} when
 *                                every variant failed its receiver check, instead of folding it into
 *                                {@link ResolutionFailure.NoMatchingVariant}
 */
public record CommandResolutionConfig(
		TypeHierarchy typeHierarchy,
		boolean reportReceiverRejection
) {

	public CommandResolutionConfig {
		Objects.requireNonNull(typeHierarchy, "typeHierarchy must not be null");
	}

	public static CommandResolutionConfig defaults() {
		return new CommandResolutionConfig(TypeHierarchy.classBased(), true);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link CommandResolutionConfig}.
	 */
	public static class Builder {
		private TypeHierarchy typeHierarchy = TypeHierarchy.classBased();
		private boolean reportReceiverRejection = true;

		private Builder() {}

		public Builder typeHierarchy(TypeHierarchy typeHierarchy) {
			this.typeHierarchy = typeHierarchy;
			return this;
		}

		public Builder reportReceiverRejection(boolean reportReceiverRejection) {
			this.reportReceiverRejection = reportReceiverRejection;
			return this;
		}

		public CommandResolutionConfig build() {
			return new CommandResolutionConfig(typeHierarchy, reportReceiverRejection);
		}
	}
}
