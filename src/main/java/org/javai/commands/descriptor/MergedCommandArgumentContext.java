package org.javai.commands.descriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.commands.descriptor.CommandArgumentContext.ParserPair;

/**
 * Read-only overlay of two contexts, created by {@link CommandArgumentContext#plus(CommandArgumentContext)}.
 */
final class MergedCommandArgumentContext implements CommandArgumentContext {

	private final CommandArgumentContext base;
	private final CommandArgumentContext replacer;

	MergedCommandArgumentContext(CommandArgumentContext base, CommandArgumentContext replacer) {
		this.base = base;
		this.replacer = replacer;
	}

	@Override
	public Optional<CommandValueArgumentParser<?>> get(Class<?> type) {
		Optional<CommandValueArgumentParser<?>> replaced = replacer.get(type);
		return replaced.isPresent() ? replaced : base.get(type);
	}

	@Override
	public List<ParserPair<?>> toList() {
		List<ParserPair<?>> pairs = new ArrayList<>(replacer.toList());
		pairs.addAll(base.toList());
		return List.copyOf(pairs);
	}

	@Override
	public String toString() {
		return base + " + " + replacer;
	}
}
