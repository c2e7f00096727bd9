/**
 * Failures raised while rendering a tree.
 * <p>
 * {@link works.consoletree.exceptions.TreeContentException} subclasses describe bad input;
 * {@link works.consoletree.exceptions.TreeLayoutException} subclasses indicate bugs.
 */
package works.consoletree.exceptions;
