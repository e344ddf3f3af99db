package org.javai.commands.bind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.javai.commands.descriptor.AbstractCommandSignatureVariant;
import org.javai.commands.descriptor.CommandReceiverParameter;
import org.javai.commands.descriptor.CommandValueParameter;
import org.javai.commands.resolve.ResolvedCommandCall;
import org.springframework.lang.Nullable;

/**
 * Variant backed by an annotated method, invoked reflectively on its bean.
 * <p>
 * Method arguments are the resolved receiver (if declared) followed by the
 * resolved values of every parameter after the leading literal, if any.
 */
public final class MethodSignatureVariant extends AbstractCommandSignatureVariant {

	private final Object bean;
	private final Method originMethod;
	private final int literalCount;

	MethodSignatureVariant(@Nullable CommandReceiverParameter receiverParameter,
			List<CommandValueParameter> valueParameters, Object bean, Method originMethod, int literalCount) {
		super(receiverParameter, valueParameters);
		this.bean = Objects.requireNonNull(bean, "bean must not be null");
		this.originMethod = Objects.requireNonNull(originMethod, "originMethod must not be null");
		this.literalCount = literalCount;
	}

	public Method originMethod() {
		return originMethod;
	}

	public Object bean() {
		return bean;
	}

	@Override
	@SuppressWarnings("unchecked")
	public CompletableFuture<Object> call(ResolvedCommandCall resolvedCommandCall) {
		Object[] values = resolvedCommandCall.argumentValues();
		boolean hasReceiver = receiverParameter().isPresent();
		Object[] invokeArgs = new Object[originMethod.getParameterCount()];
		int index = 0;
		if (hasReceiver) {
			invokeArgs[index++] = resolvedCommandCall.resolvedReceiver();
		}
		for (int i = literalCount; i < values.length; i++) {
			invokeArgs[index++] = values[i];
		}

		try {
			Object returnValue = originMethod.invoke(bean, invokeArgs);
			if (returnValue instanceof CompletionStage<?> stage) {
				CompletableFuture<?> future = stage.toCompletableFuture();
				return (CompletableFuture<Object>) future;
			}
			return CompletableFuture.completedFuture(returnValue);
		}
		catch (InvocationTargetException ex) {
			return CompletableFuture.failedFuture(ex.getCause() != null ? ex.getCause() : ex);
		}
		catch (IllegalAccessException | IllegalArgumentException ex) {
			return CompletableFuture.failedFuture(ex);
		}
	}
}
