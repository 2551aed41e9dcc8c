package org.imagerecovery.denoising.methods;

import org.imagerecovery.denoising.structures.*;

import org.apache.commons.math3.util.FastMath;

/**
 *
 *  Elementwise powers and Euclidean (Frobenius) norms of arrays and channel bundles.
 *	<p>
 *  Negative values raised to non-integer exponents give NaN, which is propagated.
 *
 *	@version    Oct 2026
 *
 */
public class PowerNorm {

	public static final ImageArray squared(ImageArray array) {
		return array.multiply(array);
	}

	public static final ImageArray power(ImageArray array, int n) {
		double[] values = array.toArray();
		for (int xyz=0;xyz<values.length;xyz++) values[xyz] = FastMath.pow(values[xyz], n);
		return new ImageArray(values, array.getShape());
	}

	public static final ImageArray power(ImageArray array, double n) {
		double[] values = array.toArray();
		for (int xyz=0;xyz<values.length;xyz++) values[xyz] = FastMath.pow(values[xyz], n);
		return new ImageArray(values, array.getShape());
	}

	/** sqrt(sum(a*a)) */
	public static final double norm(ImageArray array) {
		return FastMath.sqrt(squared(array).sum());
	}

	public static final ChannelBundle squared(ChannelBundle bundle) {
		return bundle.multiply(bundle);
	}

	public static final ChannelBundle power(ChannelBundle bundle, int n) {
		return new ChannelBundle(power(bundle.getRed(), n), power(bundle.getGreen(), n), power(bundle.getBlue(), n));
	}

	public static final ChannelBundle power(ChannelBundle bundle, double n) {
		return new ChannelBundle(power(bundle.getRed(), n), power(bundle.getGreen(), n), power(bundle.getBlue(), n));
	}

	/** norm over all the channels together */
	public static final double norm(ChannelBundle bundle) {
		return FastMath.sqrt(squared(bundle).sum());
	}
}
