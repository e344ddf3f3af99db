package org.javai.commands.internal.resolve;

import org.javai.commands.descriptor.ArgumentAcceptance;
import org.javai.commands.parse.CommandValueArgument;

/**
 * One consumed argument with its acceptance.
 */
public record ArgumentMatch(CommandValueArgument argument, ArgumentAcceptance acceptance) {
}
