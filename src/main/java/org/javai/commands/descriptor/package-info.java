/**
 * Declarations the resolver works from: type descriptors and the type hierarchy,
 * parameters, signature variants, argument acceptance levels, and the argument
 * context of contextual parsers.
 */
@org.springframework.lang.NonNullApi
package org.javai.commands.descriptor;
