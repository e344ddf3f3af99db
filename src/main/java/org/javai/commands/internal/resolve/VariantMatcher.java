package org.javai.commands.internal.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.commands.descriptor.ArgumentAcceptance;
import org.javai.commands.descriptor.CommandReceiverParameter;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.javai.commands.descriptor.CommandValueParameter;
import org.javai.commands.descriptor.TypeDescriptor;
import org.javai.commands.parse.CommandCall;
import org.javai.commands.parse.CommandValueArgument;

/**
 * Scores a variant against a call.
 * <p>
 * Parameters are walked left to right against the arguments:
 * <ul>
 *   <li>a plain or literal parameter consumes one argument</li>
 *   <li>a vararg parameter consumes every remaining argument, possibly none</li>
 *   <li>an optional parameter with no argument left is skipped without affecting the score</li>
 * </ul>
 * A variant whose caller check fails, which rejects an argument, lacks a required
 * argument, or leaves arguments unconsumed is disqualified. Otherwise its score is
 * the weakest acceptance among the consumed arguments.
 */
public final class VariantMatcher {

	private final ArgumentMatcher argumentMatcher;

	public VariantMatcher(ArgumentMatcher argumentMatcher) {
		this.argumentMatcher = Objects.requireNonNull(argumentMatcher, "argumentMatcher must not be null");
	}

	public VariantMatch match(CommandCall call, CommandSignatureVariant variant) {
		Optional<CommandReceiverParameter> receiver = variant.receiverParameter();
		if (receiver.isPresent() && !acceptsCaller(receiver.get(), call)) {
			return VariantMatch.disqualified(variant, Disqualification.RECEIVER_MISMATCH);
		}

		List<CommandValueArgument> arguments = call.valueArguments();
		List<ParameterMatch> parameterMatches = new ArrayList<>();
		int level = ArgumentAcceptance.DIRECT_LEVEL;
		int cursor = 0;

		for (CommandValueParameter parameter : variant.valueParameters()) {
			if (parameter.isVararg()) {
				List<ArgumentMatch> consumed = new ArrayList<>();
				for (; cursor < arguments.size(); cursor++) {
					ArgumentMatch match = accept(parameter, arguments.get(cursor));
					if (!match.acceptance().isAcceptable()) {
						return VariantMatch.disqualified(variant, Disqualification.ARGUMENT_MISMATCH);
					}
					level = Math.min(level, match.acceptance().acceptanceLevel());
					consumed.add(match);
				}
				parameterMatches.add(new ParameterMatch(parameter, consumed));
				continue;
			}

			if (cursor >= arguments.size()) {
				if (parameter.isOptional()) {
					parameterMatches.add(ParameterMatch.skipped(parameter));
					continue;
				}
				return VariantMatch.disqualified(variant, Disqualification.MISSING_ARGUMENT);
			}

			ArgumentMatch match = accept(parameter, arguments.get(cursor++));
			if (!match.acceptance().isAcceptable()) {
				return VariantMatch.disqualified(variant, Disqualification.ARGUMENT_MISMATCH);
			}
			level = Math.min(level, match.acceptance().acceptanceLevel());
			parameterMatches.add(new ParameterMatch(parameter, List.of(match)));
		}

		if (cursor < arguments.size()) {
			return VariantMatch.disqualified(variant, Disqualification.TOO_MANY_ARGUMENTS);
		}
		return new VariantMatch(variant, null, level, parameterMatches);
	}

	private boolean acceptsCaller(CommandReceiverParameter receiver, CommandCall call) {
		TypeDescriptor callerType = TypeDescriptor.of(call.caller().getClass());
		return argumentMatcher.hierarchy().isSubtypeOrEqual(callerType, receiver.type());
	}

	private ArgumentMatch accept(CommandValueParameter parameter, CommandValueArgument argument) {
		return new ArgumentMatch(argument, argumentMatcher.accepting(parameter, argument));
	}
}
