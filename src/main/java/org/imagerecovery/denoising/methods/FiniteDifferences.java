package org.imagerecovery.denoising.methods;

import org.imagerecovery.denoising.structures.*;
import org.imagerecovery.denoising.utilities.*;

/**
 *
 *  Forward and transposed finite differences with periodic (wrapping) boundaries.
 *	<p>
 *  The two operators are adjoint: for arrays A, B of identical shape and any axis X,
 *  sum(forwardDifference(A,X)*B) == sum(A*backwardDifference(B,X)).
 *	<p>
 *  The ChannelBundle methods are the bundle-level API and apply the same operator
 *  to each channel; the solver calls the array methods on folded [x,y,channel] stacks.
 *
 *	@version    Oct 2026
 *
 */
public class FiniteDifferences {

	/**
	 *  shift towards the growing indices: index 0 receives the last index
	 */
	public static final ImageArray positiveShift(ImageArray array, int axis) {
		checkShiftable(array, axis);
		return array.roll(axis, 1);
	}

	/**
	 *  shift towards the shrinking indices: the last index receives index 0
	 */
	public static final ImageArray negativeShift(ImageArray array, int axis) {
		checkShiftable(array, axis);
		return array.roll(axis, -1);
	}

	/** d[i] = a[i] - a[i-1], wrapping */
	public static final ImageArray forwardDifference(ImageArray array, int axis) {
		return array.subtract(positiveShift(array, axis));
	}

	/** d[i] = a[i] - a[i+1], wrapping: the transpose of the forward difference */
	public static final ImageArray backwardDifference(ImageArray array, int axis) {
		return array.subtract(negativeShift(array, axis));
	}

	public static final ImageArray dx(ImageArray array) { return forwardDifference(array, 0); }
	public static final ImageArray dxTransposed(ImageArray array) { return backwardDifference(array, 0); }
	public static final ImageArray dy(ImageArray array) { return forwardDifference(array, 1); }
	public static final ImageArray dyTransposed(ImageArray array) { return backwardDifference(array, 1); }

	public static final ChannelBundle forwardDifference(ChannelBundle bundle, int axis) {
		return new ChannelBundle(forwardDifference(bundle.getRed(), axis),
								 forwardDifference(bundle.getGreen(), axis),
								 forwardDifference(bundle.getBlue(), axis));
	}

	public static final ChannelBundle backwardDifference(ChannelBundle bundle, int axis) {
		return new ChannelBundle(backwardDifference(bundle.getRed(), axis),
								 backwardDifference(bundle.getGreen(), axis),
								 backwardDifference(bundle.getBlue(), axis));
	}

	public static final ChannelBundle dx(ChannelBundle bundle) { return forwardDifference(bundle, 0); }
	public static final ChannelBundle dxTransposed(ChannelBundle bundle) { return backwardDifference(bundle, 0); }
	public static final ChannelBundle dy(ChannelBundle bundle) { return forwardDifference(bundle, 1); }
	public static final ChannelBundle dyTransposed(ChannelBundle bundle) { return backwardDifference(bundle, 1); }

	/**
	 *  the discrete divergence, adjoint of the gradient (dx,dy)
	 */
	public static final ImageArray divergence(ImageArray a, ImageArray b) {
		return dxTransposed(a).add(dyTransposed(b));
	}

	public static final ChannelBundle divergence(ChannelBundle a, ChannelBundle b) {
		return dxTransposed(a).add(dyTransposed(b));
	}

	static void checkShiftable(ImageArray array, int axis) {
		if (axis<0 || axis>=array.getRank()) throw new AxisOutOfBoundsException(axis, array.getRank());
		if (array.getLength(axis)<=1) throw new AxisTooShortException(axis, array.getLength(axis));
	}
}
