package org.imagerecovery.denoising.utilities;

/**
 *
 *  Thrown when an operation is requested on an axis the array does not have.
 *
 *	@version    Oct 2026
 *
 */
public class AxisOutOfBoundsException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public AxisOutOfBoundsException(String message) {
		super(message);
	}

	public AxisOutOfBoundsException(int axis, int rank) {
		super("axis "+axis+" does not exist in an array of rank "+rank);
	}
}
