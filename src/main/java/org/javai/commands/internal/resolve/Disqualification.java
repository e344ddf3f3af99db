package org.javai.commands.internal.resolve;

/**
 * Why a variant cannot accept a call.
 */
public enum Disqualification {
	RECEIVER_MISMATCH,
	ARGUMENT_MISMATCH,
	MISSING_ARGUMENT,
	TOO_MANY_ARGUMENTS
}
