/**
 * Call resolution: selecting one variant for an unresolved call and producing a
 * {@link org.javai.commands.resolve.ResolvedCommandCall}, or a
 * {@link org.javai.commands.resolve.ResolutionFailure} explaining why none applies.
 */
@org.springframework.lang.NonNullApi
package org.javai.commands.resolve;
