package org.javai.commands.api;

/**
 * Identity of whoever issued a command call.
 * <p>
 * The resolver only looks at the runtime type of a sender: a signature variant
 * may declare a receiver parameter requiring the caller to be of a specific
 * sender type (for example a console, or a user with a particular capability).
 */
public interface CommandSender {

	/**
	 * Human-readable name used in diagnostics.
	 */
	String name();
}
