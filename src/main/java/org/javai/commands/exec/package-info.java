/**
 * Running resolved calls.
 */
@org.springframework.lang.NonNullApi
package org.javai.commands.exec;
