package org.javai.commands.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a command signature variant.
 * <p>
 * Example:
 *
 * <pre>
 * {@code
 * @SubCommand({"add", "plus"})
 * public void add(ConsoleSender sender, int amount) {
 *     ...
 * }
 * }
 * </pre>
 *
 * Each name produces one variant whose first value parameter is a literal
 * matching exactly that name. Without names the method becomes a single variant
 * with no leading literal.
 * <p>
 * A first method parameter whose type implements
 * {@link CommandSender} becomes the receiver parameter; a Java varargs method
 * declares a vararg value parameter.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface SubCommand {

	/**
	 * Literal names that select this variant, e.g. {@code {"add", "plus"}}.
	 */
	String[] value() default {};
}
