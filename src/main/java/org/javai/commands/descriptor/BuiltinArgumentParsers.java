package org.javai.commands.descriptor;

import java.util.Locale;
import org.javai.commands.api.CommandSender;

/**
 * Parsers for the primitive wrapper types and {@code String}.
 *
 * @see #CONTEXT
 */
public final class BuiltinArgumentParsers {

	public static final CommandValueArgumentParser<Integer> INT = new NumberParser<>("an integer") {
		@Override
		Integer convert(String raw) {
			return Integer.valueOf(raw);
		}
	};

	public static final CommandValueArgumentParser<Long> LONG = new NumberParser<>("a long integer") {
		@Override
		Long convert(String raw) {
			return Long.valueOf(raw);
		}
	};

	public static final CommandValueArgumentParser<Short> SHORT = new NumberParser<>("a short integer") {
		@Override
		Short convert(String raw) {
			return Short.valueOf(raw);
		}
	};

	public static final CommandValueArgumentParser<Byte> BYTE = new NumberParser<>("a byte") {
		@Override
		Byte convert(String raw) {
			return Byte.valueOf(raw);
		}
	};

	public static final CommandValueArgumentParser<Double> DOUBLE = new NumberParser<>("a decimal number") {
		@Override
		Double convert(String raw) {
			return Double.valueOf(raw);
		}
	};

	public static final CommandValueArgumentParser<Float> FLOAT = new NumberParser<>("a decimal number") {
		@Override
		Float convert(String raw) {
			return Float.valueOf(raw);
		}
	};

	/**
	 * Accepts true/yes/on/enabled and false/no/off/disabled, ignoring case.
	 */
	public static final CommandValueArgumentParser<Boolean> BOOLEAN = new CommandValueArgumentParser<>() {
		@Override
		public Boolean parse(String raw, CommandSender sender) {
			return switch (raw.trim().toLowerCase(Locale.ROOT)) {
				case "true", "yes", "on", "enabled" -> Boolean.TRUE;
				case "false", "no", "off", "disabled" -> Boolean.FALSE;
				default -> throw illegalArgument("Cannot parse '" + raw + "' as a boolean");
			};
		}
	};

	public static final CommandValueArgumentParser<String> STRING = (raw, sender) -> raw;

	/**
	 * Context holding every built-in parser.
	 */
	public static final CommandArgumentContext CONTEXT = CommandArgumentContext.builder()
			.add(Integer.class, INT)
			.add(Long.class, LONG)
			.add(Short.class, SHORT)
			.add(Byte.class, BYTE)
			.add(Double.class, DOUBLE)
			.add(Float.class, FLOAT)
			.add(Boolean.class, BOOLEAN)
			.add(String.class, STRING)
			.build();

	private BuiltinArgumentParsers() {
	}

	private abstract static class NumberParser<N extends Number> implements CommandValueArgumentParser<N> {

		private final String description;

		NumberParser(String description) {
			this.description = description;
		}

		abstract N convert(String raw);

		@Override
		public N parse(String raw, CommandSender sender) {
			try {
				return convert(raw.trim());
			}
			catch (NumberFormatException ex) {
				throw illegalArgument("Cannot parse '" + raw + "' as " + description, ex);
			}
		}
	}
}
