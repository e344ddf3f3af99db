package org.javai.commands.internal.resolve;

import java.util.Objects;
import java.util.Optional;
import org.javai.commands.descriptor.ArgumentAcceptance;
import org.javai.commands.descriptor.CommandArgumentContext;
import org.javai.commands.descriptor.CommandValueArgumentParser;
import org.javai.commands.descriptor.CommandValueParameter;
import org.javai.commands.descriptor.TypeDescriptor;
import org.javai.commands.descriptor.TypeHierarchy;
import org.javai.commands.parse.CommandValueArgument;
import org.javai.commands.parse.TypeVariant;

/**
 * Computes the {@link ArgumentAcceptance} of one argument for one parameter.
 * <p>
 * For a typed parameter the checks run in order and the first that applies wins:
 * <ol>
 *   <li>the argument's native type fits: {@link ArgumentAcceptance.Direct}</li>
 *   <li>an offered type variant fits, first in offer order: {@link ArgumentAcceptance.WithTypeConversion}</li>
 *   <li>the context has a parser for the expected type: {@link ArgumentAcceptance.WithContextualConversion}</li>
 *   <li>otherwise {@link ArgumentAcceptance.Impossible}</li>
 * </ol>
 * A literal parameter accepts only an argument whose raw token is exactly its literal.
 * Nothing here invokes a parser or a type variant.
 */
public final class ArgumentMatcher {

	private final CommandArgumentContext context;
	private final TypeHierarchy hierarchy;

	public ArgumentMatcher(CommandArgumentContext context, TypeHierarchy hierarchy) {
		this.context = Objects.requireNonNull(context, "context must not be null");
		this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy must not be null");
	}

	public ArgumentAcceptance accepting(CommandValueParameter parameter, CommandValueArgument argument) {
		if (parameter instanceof CommandValueParameter.StringConstant constant) {
			return constant.expectingValue().equals(argument.rawToken())
					? ArgumentAcceptance.DIRECT
					: ArgumentAcceptance.IMPOSSIBLE;
		}
		return acceptingType(parameter.matchingType(), argument);
	}

	private ArgumentAcceptance acceptingType(TypeDescriptor expected, CommandValueArgument argument) {
		if (hierarchy.isSubtypeOrEqual(argument.type(), expected)) {
			return ArgumentAcceptance.DIRECT;
		}
		for (TypeVariant<?> typeVariant : argument.typeVariants()) {
			if (hierarchy.isSubtypeOrEqual(typeVariant.outType(), expected)) {
				return new ArgumentAcceptance.WithTypeConversion(typeVariant);
			}
		}
		Optional<CommandValueArgumentParser<?>> parser = context.get(expected);
		if (parser.isPresent()) {
			return new ArgumentAcceptance.WithContextualConversion(parser.get());
		}
		return ArgumentAcceptance.IMPOSSIBLE;
	}

	public TypeHierarchy hierarchy() {
		return hierarchy;
	}
}
