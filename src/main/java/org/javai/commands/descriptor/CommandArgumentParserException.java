package org.javai.commands.descriptor;

/**
 * Thrown by a {@link CommandValueArgumentParser} when an argument cannot be parsed.
 */
public class CommandArgumentParserException extends RuntimeException {

	public CommandArgumentParserException(String message) {
		super(message);
	}

	public CommandArgumentParserException(String message, Throwable cause) {
		super(message, cause);
	}
}
