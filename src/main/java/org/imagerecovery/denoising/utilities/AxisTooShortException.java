package org.imagerecovery.denoising.utilities;

/**
 *
 *  Thrown when a wrapping shift is requested on an axis of length 1 or less.
 *
 *	@version    Oct 2026
 *
 */
public class AxisTooShortException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public AxisTooShortException(String message) {
		super(message);
	}

	public AxisTooShortException(int axis, int length) {
		super("cannot shift along axis "+axis+" of length "+length+" (length must be > 1)");
	}
}
