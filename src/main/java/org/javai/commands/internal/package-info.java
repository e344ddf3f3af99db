/**
 * Internal implementation details of the command resolution library.
 * <p>
 * <b>WARNING:</b> Types in this package and its sub-packages are not part of the
 * public API and may change without notice between versions. External code should
 * not depend on these types directly.
 */
@org.springframework.lang.NonNullApi
package org.javai.commands.internal;
