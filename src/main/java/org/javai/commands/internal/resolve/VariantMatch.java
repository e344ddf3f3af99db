package org.javai.commands.internal.resolve;

import java.util.List;
import org.javai.commands.descriptor.ArgumentAcceptance;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.springframework.lang.Nullable;

/**
 * Score of one variant against one call.
 *
 * @param variant          the scored variant
 * @param disqualification why the variant cannot accept the call, {@code null} if it can
 * @param acceptanceLevel  lowest acceptance level over all consumed arguments
 * @param parameterMatches per-parameter consumption, empty when disqualified
 */
public record VariantMatch(
		CommandSignatureVariant variant,
		@Nullable Disqualification disqualification,
		int acceptanceLevel,
		List<ParameterMatch> parameterMatches
) {

	public VariantMatch {
		parameterMatches = List.copyOf(parameterMatches);
	}

	static VariantMatch disqualified(CommandSignatureVariant variant, Disqualification reason) {
		return new VariantMatch(variant, reason, ArgumentAcceptance.IMPOSSIBLE_LEVEL, List.of());
	}

	public boolean isAcceptable() {
		return disqualification == null && acceptanceLevel > 0;
	}
}
