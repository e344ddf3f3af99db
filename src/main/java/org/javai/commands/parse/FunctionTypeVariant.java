package org.javai.commands.parse;

import java.util.Objects;
import java.util.function.Function;
import org.javai.commands.descriptor.TypeDescriptor;

final class FunctionTypeVariant<T> implements TypeVariant<T> {

	static final TypeVariant<String> CONTENT_STRING =
			new FunctionTypeVariant<>(TypeDescriptor.of(String.class), CommandValueArgument::content);

	private final TypeDescriptor outType;
	private final Function<? super CommandValueArgument, ? extends T> mapper;

	FunctionTypeVariant(TypeDescriptor outType, Function<? super CommandValueArgument, ? extends T> mapper) {
		this.outType = Objects.requireNonNull(outType, "outType must not be null");
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	@Override
	public TypeDescriptor outType() {
		return outType;
	}

	@Override
	public T mapValue(CommandValueArgument argument) {
		return mapper.apply(argument);
	}

	@Override
	public String toString() {
		return "TypeVariant[" + outType + "]";
	}
}
