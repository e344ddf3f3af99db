package org.javai.commands.descriptor;

import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * A declared value parameter. Sealed to the two parameter kinds the resolver knows how
 * to match:
 * <ul>
 *   <li>{@link UserDefinedType} - a typed parameter, possibly optional or vararg</li>
 *   <li>{@link StringConstant} - a literal that matches exactly one token</li>
 * </ul>
 */
public sealed interface CommandValueParameter extends CommandParameter {

	/**
	 * Whether this parameter absorbs all remaining arguments as one array value.
	 */
	boolean isVararg();

	/**
	 * The type a single argument is matched against: the element type for a vararg
	 * parameter, the declared type otherwise.
	 */
	default TypeDescriptor matchingType() {
		return isVararg() ? type().requireElementType() : type();
	}

	/**
	 * An ordinary typed parameter.
	 *
	 * @param name       parameter name, if known
	 * @param type       declared type; an array type when {@code isVararg}
	 * @param isOptional whether calls may leave the parameter out
	 * @param isVararg   whether the parameter absorbs all remaining arguments
	 */
	record UserDefinedType(
			@Nullable String name,
			TypeDescriptor type,
			boolean isOptional,
			boolean isVararg
	) implements CommandValueParameter {

		public UserDefinedType {
			Objects.requireNonNull(type, "type must not be null");
			if (isVararg && !type.isArray()) {
				throw new IllegalArgumentException("type must be an array type if vararg. Given " + type);
			}
		}

		public static UserDefinedType createRequired(String name, Class<?> type) {
			return new UserDefinedType(name, TypeDescriptor.of(type), false, false);
		}

		/**
		 * Optional parameters receive {@code null} when left out, so their type is nullable.
		 */
		public static UserDefinedType createOptional(String name, Class<?> type) {
			return new UserDefinedType(name, TypeDescriptor.nullable(type), true, false);
		}

		public static UserDefinedType createVararg(String name, Class<?> elementType) {
			return new UserDefinedType(name, TypeDescriptor.arrayOf(TypeDescriptor.of(elementType)), false, true);
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder();
			if (isVararg) {
				sb.append("vararg ");
			}
			sb.append(name).append(": ").append(isVararg ? type.requireElementType() : type);
			if (isOptional) {
				sb.append(" = ...");
			}
			return sb.toString();
		}
	}

	/**
	 * A literal parameter that only matches an argument whose raw token equals
	 * {@code expectingValue} exactly. Never optional, never vararg.
	 *
	 * @param name           parameter name, if any
	 * @param expectingValue the literal; non-blank and free of whitespace
	 */
	record StringConstant(@Nullable String name, String expectingValue) implements CommandValueParameter {

		private static final TypeDescriptor STRING_TYPE = TypeDescriptor.of(String.class);

		public StringConstant {
			Objects.requireNonNull(expectingValue, "expectingValue must not be null");
			if (expectingValue.chars().allMatch(StringConstant::isSpace)) {
				throw new IllegalArgumentException("expectingValue must not be blank");
			}
			if (expectingValue.chars().anyMatch(StringConstant::isSpace)) {
				throw new IllegalArgumentException("expectingValue must not contain whitespace");
			}
		}

		// Unicode space separators such as U+00A0 count too
		private static boolean isSpace(int c) {
			return Character.isWhitespace(c) || Character.isSpaceChar(c);
		}

		public static StringConstant of(String expectingValue) {
			return new StringConstant(null, expectingValue);
		}

		@Override
		public TypeDescriptor type() {
			return STRING_TYPE;
		}

		@Override
		public boolean isOptional() {
			return false;
		}

		@Override
		public boolean isVararg() {
			return false;
		}

		@Override
		public String toString() {
			return "<" + expectingValue + ">";
		}
	}
}
