/**
 * Binding annotated methods to signature variants.
 */
@org.springframework.lang.NonNullApi
package org.javai.commands.bind;
