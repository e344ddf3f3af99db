package org.javai.commands.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface CommandParam {

	/**
	 * Parameter name shown in diagnostics. Defaults to the compiled parameter name.
	 */
	String name() default "";

	/**
	 * Whether the parameter may be left out of a call. Optional parameters
	 * receive {@code null} when absent, so they must not be primitives.
	 */
	boolean optional() default false;
}
