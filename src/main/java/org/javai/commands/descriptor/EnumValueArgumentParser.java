package org.javai.commands.descriptor;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.commands.api.CommandSender;

/**
 * Parses enum constants by name, ignoring case.
 *
 * @param <E> the enum type
 */
public final class EnumValueArgumentParser<E extends Enum<E>> implements CommandValueArgumentParser<E> {

	private final Class<E> type;

	public EnumValueArgumentParser(Class<E> type) {
		this.type = Objects.requireNonNull(type, "type must not be null");
	}

	@Override
	public E parse(String raw, CommandSender sender) {
		String candidate = raw.trim();
		for (E constant : type.getEnumConstants()) {
			if (constant.name().equalsIgnoreCase(candidate)) {
				return constant;
			}
		}
		String allowed = Arrays.stream(type.getEnumConstants())
				.map(Enum::name)
				.collect(Collectors.joining(", "));
		throw illegalArgument("Cannot parse '" + raw + "' as " + type.getSimpleName() + ": allowed values are " + allowed);
	}
}
