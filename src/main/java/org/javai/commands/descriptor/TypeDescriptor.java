package org.javai.commands.descriptor;

import java.util.Map;
import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * Structural type of a parameter or argument: a nominal classifier, a
 * nullability flag and, for array types, the element descriptor.
 * <p>
 * Primitive classifiers are normalized to their wrapper types so that
 * {@code int} and {@code Integer} describe the same nominal type. Array
 * classifiers keep their runtime class ({@code int[]} stays {@code int[]}) so a
 * vararg value can be materialized with the right component type.
 *
 * @param classifier  the nominal type
 * @param nullable    whether {@code null} is a legal value
 * @param elementType element descriptor, present iff {@code classifier} is an array class
 */
public record TypeDescriptor(
		Class<?> classifier,
		boolean nullable,
		@Nullable TypeDescriptor elementType
) {

	private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
			int.class, Integer.class,
			long.class, Long.class,
			short.class, Short.class,
			byte.class, Byte.class,
			double.class, Double.class,
			float.class, Float.class,
			boolean.class, Boolean.class,
			char.class, Character.class,
			void.class, Void.class);

	public TypeDescriptor {
		Objects.requireNonNull(classifier, "classifier must not be null");
		classifier = wrap(classifier);
		if (classifier.isArray() != (elementType != null)) {
			throw new IllegalArgumentException(
					"elementType must be given exactly when the classifier is an array. Given " + classifier.getName());
		}
		if (elementType != null && elementType.classifier() != wrap(classifier.getComponentType())) {
			throw new IllegalArgumentException("elementType " + elementType + " does not match the component type of "
					+ classifier.getSimpleName());
		}
	}

	/**
	 * Non-null descriptor for the given class. Array classes get an element descriptor.
	 */
	public static TypeDescriptor of(Class<?> type) {
		if (type.isArray()) {
			return new TypeDescriptor(type, false, of(type.getComponentType()));
		}
		return new TypeDescriptor(type, false, null);
	}

	/**
	 * Nullable descriptor for the given class.
	 */
	public static TypeDescriptor nullable(Class<?> type) {
		return of(type).asNullable();
	}

	/**
	 * Array-of-T descriptor, the declared type of a vararg parameter whose elements are {@code element}.
	 */
	public static TypeDescriptor arrayOf(TypeDescriptor element) {
		return new TypeDescriptor(element.classifier().arrayType(), false, element);
	}

	/**
	 * Wrapper class for a primitive, the class itself otherwise.
	 */
	public static Class<?> wrap(Class<?> type) {
		return type.isPrimitive() ? WRAPPERS.get(type) : type;
	}

	public boolean isArray() {
		return elementType != null;
	}

	/**
	 * Element type of an array descriptor.
	 *
	 * @throws IllegalStateException if this descriptor is not an array
	 */
	public TypeDescriptor requireElementType() {
		if (elementType == null) {
			throw new IllegalStateException(this + " is not an array type");
		}
		return elementType;
	}

	public TypeDescriptor asNullable() {
		return nullable ? this : new TypeDescriptor(classifier, true, elementType);
	}

	public TypeDescriptor asNonNull() {
		return nullable ? new TypeDescriptor(classifier, false, elementType) : this;
	}

	@Override
	public String toString() {
		String base = elementType != null
				? "Array<" + elementType + ">"
				: classifier.getSimpleName();
		return nullable ? base + "?" : base;
	}
}
