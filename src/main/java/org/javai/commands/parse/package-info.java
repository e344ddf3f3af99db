/**
 * Unresolved calls and their arguments, as handed over by the call parser.
 */
@org.springframework.lang.NonNullApi
package org.javai.commands.parse;
