package org.javai.commands.bind;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.javai.commands.api.CommandParam;
import org.javai.commands.api.CommandSender;
import org.javai.commands.api.SubCommand;
import org.javai.commands.descriptor.CommandReceiverParameter;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.javai.commands.descriptor.CommandValueParameter;
import org.javai.commands.descriptor.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds signature variants from the {@link SubCommand}-annotated methods of a bean.
 * <p>
 * Parameter types are captured as {@link TypeDescriptor}s once, when the variants are
 * built; resolution never inspects the methods again.
 *
 * <pre>{@code
 * List<CommandSignatureVariant> variants = AnnotatedSignatureVariants.fromBean(new CounterCommands());
 * }</pre>
 */
public final class AnnotatedSignatureVariants {

	private static final Logger logger = LoggerFactory.getLogger(AnnotatedSignatureVariants.class);

	private AnnotatedSignatureVariants() {
	}

	/**
	 * @return one variant per name of every annotated public method, ordered by method name
	 * @throws IllegalArgumentException if an annotated method cannot be expressed as a variant
	 */
	public static List<CommandSignatureVariant> fromBean(Object bean) {
		List<Method> methods = Arrays.stream(bean.getClass().getMethods())
				.filter(method -> method.isAnnotationPresent(SubCommand.class))
				.filter(method -> !Modifier.isStatic(method.getModifiers()))
				.sorted(Comparator.comparing(Method::getName).thenComparingInt(Method::getParameterCount))
				.toList();

		List<CommandSignatureVariant> variants = new ArrayList<>();
		for (Method method : methods) {
			variants.addAll(fromMethod(bean, method));
		}
		logger.debug("Built {} signature variants from {}", variants.size(), bean.getClass().getName());
		return List.copyOf(variants);
	}

	private static List<CommandSignatureVariant> fromMethod(Object bean, Method method) {
		Parameter[] parameters = method.getParameters();
		CommandReceiverParameter receiver = null;
		int first = 0;
		if (parameters.length > 0 && CommandSender.class.isAssignableFrom(parameters[0].getType())) {
			receiver = new CommandReceiverParameter(false, TypeDescriptor.of(parameters[0].getType()));
			first = 1;
		}

		List<CommandValueParameter> declared = new ArrayList<>();
		for (int i = first; i < parameters.length; i++) {
			boolean vararg = method.isVarArgs() && i == parameters.length - 1;
			declared.add(createValueParameter(method, parameters[i], vararg));
		}

		method.setAccessible(true);
		String[] names = method.getAnnotation(SubCommand.class).value();
		if (names.length == 0) {
			return List.of(new MethodSignatureVariant(receiver, declared, bean, method, 0));
		}
		List<CommandSignatureVariant> variants = new ArrayList<>();
		for (String name : names) {
			List<CommandValueParameter> withLiteral = new ArrayList<>();
			withLiteral.add(CommandValueParameter.StringConstant.of(name));
			withLiteral.addAll(declared);
			variants.add(new MethodSignatureVariant(receiver, withLiteral, bean, method, 1));
		}
		return variants;
	}

	private static CommandValueParameter createValueParameter(Method method, Parameter parameter, boolean vararg) {
		CommandParam annotation = parameter.getAnnotation(CommandParam.class);
		String name = annotation != null && !annotation.name().isBlank() ? annotation.name() : parameter.getName();
		boolean optional = annotation != null && annotation.optional();
		Class<?> type = parameter.getType();

		if (optional) {
			if (type.isPrimitive()) {
				throw new IllegalArgumentException("Optional parameter '" + name + "' of " + method
						+ " must not be primitive");
			}
			if (vararg) {
				throw new IllegalArgumentException("Vararg parameter '" + name + "' of " + method
						+ " cannot be optional");
			}
			return new CommandValueParameter.UserDefinedType(name, TypeDescriptor.nullable(type), true, false);
		}
		return new CommandValueParameter.UserDefinedType(name, TypeDescriptor.of(type), false, vararg);
	}
}
