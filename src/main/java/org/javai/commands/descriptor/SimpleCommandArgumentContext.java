package org.javai.commands.descriptor;

import java.util.List;
import java.util.Optional;
import org.javai.commands.descriptor.CommandArgumentContext.ParserPair;

/**
 * List-backed {@link CommandArgumentContext}.
 * <p>
 * Lookup tries an exact key first. Otherwise every key assignable from the requested
 * type is a candidate and the most specific one wins; between unrelated candidates
 * the one earlier in the list wins. {@link CommandArgumentContextBuilder} orders the
 * list most-recent-first, so a later registration takes precedence.
 */
public final class SimpleCommandArgumentContext implements CommandArgumentContext {

	private final List<ParserPair<?>> list;

	public SimpleCommandArgumentContext(List<ParserPair<?>> list) {
		this.list = List.copyOf(list);
	}

	@Override
	public Optional<CommandValueArgumentParser<?>> get(Class<?> type) {
		Class<?> key = TypeDescriptor.wrap(type);
		for (ParserPair<?> pair : list) {
			if (TypeDescriptor.wrap(pair.type()) == key) {
				return Optional.of(pair.parser());
			}
		}
		ParserPair<?> nearest = null;
		for (ParserPair<?> pair : list) {
			Class<?> candidate = TypeDescriptor.wrap(pair.type());
			if (!candidate.isAssignableFrom(key)) {
				continue;
			}
			if (nearest == null || isStrictSupertype(TypeDescriptor.wrap(nearest.type()), candidate)) {
				nearest = pair;
			}
		}
		return nearest != null ? Optional.of(nearest.parser()) : Optional.empty();
	}

	private static boolean isStrictSupertype(Class<?> supertype, Class<?> subtype) {
		return supertype != subtype && supertype.isAssignableFrom(subtype);
	}

	@Override
	public List<ParserPair<?>> toList() {
		return list;
	}

	@Override
	public String toString() {
		return "SimpleCommandArgumentContext" + list.stream().map(p -> p.type().getSimpleName()).toList();
	}
}
