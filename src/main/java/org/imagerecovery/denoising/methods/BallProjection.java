package org.imagerecovery.denoising.methods;

import org.imagerecovery.denoising.structures.*;
import org.imagerecovery.denoising.utilities.*;

import org.apache.commons.math3.util.FastMath;

/**
 *
 *  Pointwise projection of a 2D vector field (a,b) onto the unit Euclidean ball:
 *  a' = a / max(1,|(a,b)|), b' = b / max(1,|(a,b)|).
 *	<p>
 *  The coupled variants compute a single length per pixel over all channels
 *  (vectorial total variation, Bredies 2014), the plain variant treats every
 *  element on its own, which amounts to projecting each channel independently.
 *	<p>
 *  The ChannelBundle methods are the bundle-level API, for callers holding separate
 *  color channels. The solver works on folded [x,y,channel] arrays with projectOnAxis,
 *  which gives the same result as projectCoupled.
 *
 *	@version    Oct 2026
 *
 */
public class BallProjection {

	/** sqrt(a^2 + b^2) for each element */
	public static final ImageArray vectorLength(ImageArray a, ImageArray b) {
		return sqrt(PowerNorm.squared(a).add(PowerNorm.squared(b)));
	}

	/**
	 *  @return {a', b'}, the projected components
	 */
	public static final ImageArray[] project(ImageArray a, ImageArray b) {
		ImageArray max = atLeastOne(vectorLength(a, b));
		return new ImageArray[]{a.divide(max), b.divide(max)};
	}

	/** sqrt(sum_c a_c^2 + b_c^2) for each pixel */
	public static final ImageArray vectorLengthAcrossChannels(ChannelBundle a, ChannelBundle b) {
		ChannelBundle len = PowerNorm.squared(a).add(PowerNorm.squared(b));
		return sqrt(len.getRed().add(len.getGreen()).add(len.getBlue()));
	}

	/**
	 *  projection with one length per pixel shared by the three channels
	 *  @return {a', b'}, the projected components
	 */
	public static final ChannelBundle[] projectCoupled(ChannelBundle a, ChannelBundle b) {
		ImageArray max = atLeastOne(vectorLengthAcrossChannels(a, b));
		return new ChannelBundle[]{a.divide(max), b.divide(max)};
	}

	/**
	 *  projection of each channel on its own
	 *  @return {a', b'}, the projected components
	 */
	public static final ChannelBundle[] projectEachChannel(ChannelBundle a, ChannelBundle b) {
		ImageArray[] red = project(a.getRed(), b.getRed());
		ImageArray[] green = project(a.getGreen(), b.getGreen());
		ImageArray[] blue = project(a.getBlue(), b.getBlue());
		return new ChannelBundle[]{new ChannelBundle(red[0], green[0], blue[0]),
								   new ChannelBundle(red[1], green[1], blue[1])};
	}

	/**
	 *  vector length summed along an axis (e.g. the color axis): the axis is kept with length 1
	 */
	public static final ImageArray vectorLengthOnAxis(ImageArray a, ImageArray b, int axis) {
		if (axis<0 || axis>=a.getRank()) throw new AxisOutOfBoundsException(axis, a.getRank());
		return sqrt(PowerNorm.squared(a).add(PowerNorm.squared(b)).sumAlongAxis(axis));
	}

	/**
	 *  projection coupled along an axis: every element along that axis shares the same length
	 *  @return {a', b'}, the projected components
	 */
	public static final ImageArray[] projectOnAxis(ImageArray a, ImageArray b, int axis) {
		ImageArray max = atLeastOne(vectorLengthOnAxis(a, b, axis))
									.repeatAlongAxis(axis, a.getLength(axis));
		return new ImageArray[]{a.divide(max), b.divide(max)};
	}

	private static ImageArray sqrt(ImageArray array) {
		double[] values = array.toArray();
		for (int xyz=0;xyz<values.length;xyz++) values[xyz] = FastMath.sqrt(values[xyz]);
		return new ImageArray(values, array.getShape());
	}

	/** max(1,len) */
	private static ImageArray atLeastOne(ImageArray len) {
		double[] values = len.toArray();
		for (int xyz=0;xyz<values.length;xyz++) values[xyz] = Numerics.max(1.0, values[xyz]);
		return new ImageArray(values, len.getShape());
	}
}
