package org.javai.commands.descriptor;

/**
 * {@link TypeHierarchy} over Java classes.
 * <ul>
 *   <li>A nullable type is never a subtype of a non-null type.</li>
 *   <li>Arrays are covariant in their element type and unrelated to non-array types
 *   other than {@code Object}.</li>
 *   <li>Everything else follows {@link Class#isAssignableFrom(Class)} on the
 *   (wrapper-normalized) classifiers.</li>
 * </ul>
 */
final class ClassTypeHierarchy implements TypeHierarchy {

	static final ClassTypeHierarchy INSTANCE = new ClassTypeHierarchy();

	private ClassTypeHierarchy() {
	}

	@Override
	public boolean isSubtypeOrEqual(TypeDescriptor subtype, TypeDescriptor supertype) {
		if (subtype.nullable() && !supertype.nullable()) {
			return false;
		}
		if (supertype.classifier() == Object.class) {
			return true;
		}
		if (subtype.isArray() || supertype.isArray()) {
			return subtype.isArray() && supertype.isArray()
					&& isSubtypeOrEqual(subtype.requireElementType(), supertype.requireElementType());
		}
		return supertype.classifier().isAssignableFrom(subtype.classifier());
	}

	@Override
	public String toString() {
		return "ClassTypeHierarchy";
	}
}
