package org.imagerecovery.denoising.utilities;

/**
 *
 *  Thrown when two arrays combined element by element do not share the same shape.
 *
 *	@version    Oct 2026
 *
 */
public class ShapeMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public ShapeMismatchException(String message) {
		super(message);
	}

	public ShapeMismatchException(int[] expected, int[] found) {
		super("array shapes must agree: "+Numerics.shapeString(expected)+" vs. "+Numerics.shapeString(found));
	}
}
