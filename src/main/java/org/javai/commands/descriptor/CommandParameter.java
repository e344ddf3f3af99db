package org.javai.commands.descriptor;

import org.springframework.lang.Nullable;

/**
 * A declared parameter of a {@link CommandSignatureVariant}: either a value
 * parameter matched against call arguments or the receiver parameter matched
 * against the caller.
 */
public sealed interface CommandParameter permits CommandValueParameter, CommandReceiverParameter {

	@Nullable
	String name();

	boolean isOptional();

	TypeDescriptor type();
}
