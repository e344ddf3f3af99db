package org.javai.commands.parse;

import java.util.function.Function;
import org.javai.commands.descriptor.TypeDescriptor;

/**
 * An alternative typed representation that an argument offers for itself.
 * <p>
 * When an argument's native type does not fit a parameter, the resolver checks
 * the offered variants in order and uses the first whose {@link #outType()} fits,
 * before it considers parsing the argument's text.
 *
 * @param <T> the produced type
 */
public interface TypeVariant<T> {

	TypeDescriptor outType();

	/**
	 * Produces the value for {@code argument}. Called only after the variant has
	 * been selected; any exception surfaces as a conversion failure.
	 */
	T mapValue(CommandValueArgument argument);

	static <T> TypeVariant<T> of(Class<T> outType, Function<? super CommandValueArgument, ? extends T> mapper) {
		return new FunctionTypeVariant<>(TypeDescriptor.of(outType), mapper);
	}

	/**
	 * Offers the argument's textual content as a {@code String}.
	 */
	static TypeVariant<String> contentString() {
		return FunctionTypeVariant.CONTENT_STRING;
	}
}
