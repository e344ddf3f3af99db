package org.javai.commands.parse;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.javai.commands.descriptor.TypeDescriptor;
import org.springframework.lang.Nullable;

/**
 * One argument of a {@link CommandCall}, as produced by the call parser.
 * <p>
 * An argument always carries a value. A token read from raw text carries the
 * token itself as a {@code String} value and also remembers it as
 * {@link #rawToken()}; an argument built from an already-typed object may or
 * may not have a raw textual form. Callers may offer extra typed views of the
 * value through {@link #typeVariants()}; these are consulted before falling back
 * to contextual parsing of the raw text.
 *
 * @param type         native type of {@code value}
 * @param value        the carried value
 * @param rawToken     the untyped text the argument was read from, if any
 * @param typeVariants offered alternative representations, in preference order
 */
public record CommandValueArgument(
		TypeDescriptor type,
		Object value,
		@Nullable String rawToken,
		List<TypeVariant<?>> typeVariants
) {

	public CommandValueArgument {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(value, "value must not be null");
		typeVariants = typeVariants != null ? List.copyOf(typeVariants) : List.of();
	}

	/**
	 * Argument for a raw text token. Its native type is {@code String}.
	 */
	public static CommandValueArgument ofToken(String rawToken) {
		Objects.requireNonNull(rawToken, "rawToken must not be null");
		return new CommandValueArgument(TypeDescriptor.of(String.class), rawToken, rawToken, List.of());
	}

	/**
	 * Argument for an already-typed value without a textual form.
	 */
	public static CommandValueArgument of(Object value, TypeVariant<?>... typeVariants) {
		return new CommandValueArgument(TypeDescriptor.of(value.getClass()), value, null, Arrays.asList(typeVariants));
	}

	/**
	 * Argument for an already-typed value that was read from {@code rawToken}.
	 */
	public static CommandValueArgument of(Object value, String rawToken, TypeVariant<?>... typeVariants) {
		return new CommandValueArgument(TypeDescriptor.of(value.getClass()), value, rawToken,
				Arrays.asList(typeVariants));
	}

	/**
	 * Textual content: the raw token when present, otherwise the value's string form.
	 */
	public String content() {
		return rawToken != null ? rawToken : String.valueOf(value);
	}

	@Override
	public String toString() {
		return rawToken != null ? "'" + rawToken + "'" : value + ": " + type;
	}
}
