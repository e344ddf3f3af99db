/**
 * Public entry points for declaring commands: the caller identity, the bound
 * action, and the annotations read by
 * {@link org.javai.commands.bind.AnnotatedSignatureVariants}.
 */
@org.springframework.lang.NonNullApi
package org.javai.commands.api;
