package org.javai.commands.descriptor;

/**
 * The subtype relation between {@link TypeDescriptor}s supplied by the host.
 * <p>
 * This is the only type algebra the resolver depends on. Implementations must be
 * reflexive and transitive.
 */
@FunctionalInterface
public interface TypeHierarchy {

	/**
	 * @return whether a value of {@code subtype} may be used where {@code supertype} is expected
	 */
	boolean isSubtypeOrEqual(TypeDescriptor subtype, TypeDescriptor supertype);

	/**
	 * Hierarchy backed by the Java class hierarchy.
	 */
	static TypeHierarchy classBased() {
		return ClassTypeHierarchy.INSTANCE;
	}
}
