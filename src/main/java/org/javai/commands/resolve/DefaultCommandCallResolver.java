package org.javai.commands.resolve;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.commands.descriptor.ArgumentAcceptance;
import org.javai.commands.descriptor.CommandArgumentContext;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.javai.commands.descriptor.CommandValueParameter;
import org.javai.commands.descriptor.SignatureVariantJsonMapper;
import org.javai.commands.descriptor.TypeDescriptor;
import org.javai.commands.internal.resolve.ArgumentMatch;
import org.javai.commands.internal.resolve.ArgumentMatcher;
import org.javai.commands.internal.resolve.Disqualification;
import org.javai.commands.internal.resolve.ParameterMatch;
import org.javai.commands.internal.resolve.VariantMatch;
import org.javai.commands.internal.resolve.VariantMatcher;
import org.javai.commands.parse.CommandCall;
import org.javai.commands.parse.CommandValueArgument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Default resolver that binds a {@link CommandCall} to one of its callee's variants.
 * <p>
 * This resolver:
 * <ul>
 *   <li>Scores each variant; a variant's score is its weakest argument acceptance</li>
 *   <li>Picks the unique best-scoring variant; a tie is reported, never broken by declaration order</li>
 *   <li>Converts each argument as its acceptance prescribes: pass-through, offered type
 *   variant, or contextual parser</li>
 * </ul>
 * <p>
 * Scoring never fails. Only the conversions applied after selection can, and their
 * failure is reported as {@link ResolutionFailure.ArgumentConversionFailed}.
 */
public class DefaultCommandCallResolver implements CommandCallResolver {

	private static final Logger logger = LoggerFactory.getLogger(DefaultCommandCallResolver.class);

	private final CommandResolutionConfig config;

	public DefaultCommandCallResolver() {
		this(CommandResolutionConfig.defaults());
	}

	public DefaultCommandCallResolver(CommandResolutionConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	@Override
	public ResolutionResult resolve(CommandCall call, List<? extends CommandSignatureVariant> variants,
			CommandArgumentContext context) {
		Objects.requireNonNull(call, "call must not be null");
		Objects.requireNonNull(variants, "variants must not be null");
		Objects.requireNonNull(context, "context must not be null");

		VariantMatcher matcher = new VariantMatcher(new ArgumentMatcher(context, config.typeHierarchy()));
		List<VariantMatch> acceptable = new ArrayList<>();
		int receiverMismatches = 0;
		for (CommandSignatureVariant variant : variants) {
			VariantMatch match = matcher.match(call, variant);
			if (match.isAcceptable()) {
				acceptable.add(match);
			}
			else {
				if (match.disqualification() == Disqualification.RECEIVER_MISMATCH) {
					receiverMismatches++;
				}
				logger.trace("Variant {} of '{}' disqualified: {}", variant, call.calleeName(),
						match.disqualification());
			}
		}

		if (acceptable.isEmpty()) {
			if (logger.isDebugEnabled()) {
				logger.debug("No variant of '{}' accepts {}; candidates: {}", call.calleeName(),
						call.valueArguments(), SignatureVariantJsonMapper.toJsonArray(variants));
			}
			return ResolutionResult.failure(noMatch(call, variants.size(), receiverMismatches));
		}

		int best = acceptable.stream().mapToInt(VariantMatch::acceptanceLevel).max().getAsInt();
		List<VariantMatch> top = acceptable.stream()
				.filter(match -> match.acceptanceLevel() == best)
				.toList();
		if (top.size() > 1) {
			List<CommandSignatureVariant> candidates = top.stream().map(VariantMatch::variant).toList();
			logger.warn("Ambiguous call to '{}': {} variants tied at acceptance level {}: {}",
					call.calleeName(), candidates.size(), best, candidates);
			return ResolutionResult.failure(
					new ResolutionFailure.AmbiguousVariants(call.calleeName(), candidates, best));
		}

		VariantMatch selected = top.get(0);
		logger.debug("Resolved '{}' to {} (acceptance level {})", call.calleeName(), selected.variant(), best);
		return convert(call, selected);
	}

	private ResolutionFailure noMatch(CommandCall call, int candidateCount, int receiverMismatches) {
		if (config.reportReceiverRejection() && candidateCount > 0 && receiverMismatches == candidateCount) {
			return new ResolutionFailure.ReceiverRejected(call.calleeName(),
					TypeDescriptor.of(call.caller().getClass()), candidateCount);
		}
		return new ResolutionFailure.NoMatchingVariant(call.calleeName(), candidateCount);
	}

	private ResolutionResult convert(CommandCall call, VariantMatch selected) {
		List<ResolvedArgument> resolved = new ArrayList<>();
		for (ParameterMatch parameterMatch : selected.parameterMatches()) {
			CommandValueParameter parameter = parameterMatch.parameter();
			if (parameterMatch.isSkipped()) {
				resolved.add(ResolvedArgument.absent(parameter));
				continue;
			}

			if (parameter.isVararg()) {
				List<ArgumentMatch> arguments = parameterMatch.arguments();
				Object array = Array.newInstance(parameter.type().classifier().getComponentType(), arguments.size());
				for (int i = 0; i < arguments.size(); i++) {
					ConversionOutcome outcome = convertArgument(call, parameter, arguments.get(i));
					if (!outcome.success()) {
						return ResolutionResult.failure(outcome.failure());
					}
					try {
						Array.set(array, i, outcome.value());
					}
					catch (IllegalArgumentException ex) {
						return ResolutionResult.failure(new ResolutionFailure.ArgumentConversionFailed(
								call.calleeName(), parameter, arguments.get(i).argument().content(), ex));
					}
				}
				resolved.add(ResolvedArgument.of(parameter, array));
				continue;
			}

			ConversionOutcome outcome = convertArgument(call, parameter, parameterMatch.arguments().get(0));
			if (!outcome.success()) {
				return ResolutionResult.failure(outcome.failure());
			}
			resolved.add(new ResolvedArgument(parameter, outcome.value(), true));
		}

		CommandSignatureVariant variant = selected.variant();
		return ResolutionResult.success(new ResolvedCommandCall(
				call,
				variant,
				variant.receiverParameter().isPresent() ? call.caller() : null,
				resolved));
	}

	private ConversionOutcome convertArgument(CommandCall call, CommandValueParameter parameter, ArgumentMatch match) {
		CommandValueArgument argument = match.argument();
		ArgumentAcceptance acceptance = match.acceptance();
		Object value;
		try {
			if (acceptance instanceof ArgumentAcceptance.Direct) {
				value = argument.value();
			}
			else if (acceptance instanceof ArgumentAcceptance.WithTypeConversion typeConversion) {
				value = typeConversion.typeVariant().mapValue(argument);
			}
			else if (acceptance instanceof ArgumentAcceptance.WithContextualConversion contextual) {
				value = contextual.parser().parse(argument, call.caller());
			}
			else {
				throw new IllegalStateException("Argument " + argument + " was not accepted: " + acceptance);
			}
		}
		catch (RuntimeException ex) {
			logger.debug("Conversion of {} for {} of '{}' failed: {}", argument, parameter, call.calleeName(),
					ex.toString());
			return ConversionOutcome.failure(
					new ResolutionFailure.ArgumentConversionFailed(call.calleeName(), parameter, argument.content(), ex));
		}

		String mismatch = acceptance instanceof ArgumentAcceptance.Direct
				? null
				: checkConvertedValue(parameter.matchingType(), value);
		if (mismatch != null) {
			return ConversionOutcome.failure(new ResolutionFailure.ArgumentConversionFailed(
					call.calleeName(), parameter, argument.content(), new IllegalStateException(mismatch)));
		}
		return ConversionOutcome.success(value);
	}

	/**
	 * A parser registered for a supertype, or a type variant, may produce a value the
	 * parameter cannot take. Returns null if the value fits, otherwise an error message.
	 */
	@Nullable
	private String checkConvertedValue(TypeDescriptor expected, @Nullable Object value) {
		if (value == null) {
			return expected.nullable() ? null : "Conversion produced null for non-null type " + expected;
		}
		TypeDescriptor actual = TypeDescriptor.of(value.getClass());
		if (!config.typeHierarchy().isSubtypeOrEqual(actual, expected)) {
			return "Conversion produced a " + actual + " where " + expected + " is expected";
		}
		return null;
	}

	private record ConversionOutcome(boolean success, @Nullable Object value, @Nullable ResolutionFailure failure) {
		static ConversionOutcome success(@Nullable Object value) {
			return new ConversionOutcome(true, value, null);
		}

		static ConversionOutcome failure(ResolutionFailure failure) {
			return new ConversionOutcome(false, null, failure);
		}
	}
}
