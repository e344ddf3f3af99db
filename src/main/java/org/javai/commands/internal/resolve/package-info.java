/**
 * Scoring internals of call resolution.
 * <p>
 * Applications work with {@link org.javai.commands.resolve.CommandCallResolver};
 * the matchers here are shared by its implementations.
 */
@org.springframework.lang.NonNullApi
package org.javai.commands.internal.resolve;
