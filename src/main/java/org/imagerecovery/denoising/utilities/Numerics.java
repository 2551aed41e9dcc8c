package org.imagerecovery.denoising.utilities;

import org.apache.commons.math3.util.FastMath;

/**
 *
 *  Small numerical helpers shared by the array operators.
 *
 *	@version    Oct 2026
 *
 */
public class Numerics {

	public static final double square(double x) { return x*x; }

	public static final double max(double a, double b) { return FastMath.max(a,b); }

	public static final double min(double a, double b) { return FastMath.min(a,b); }

	public static final int max(int a, int b) { return FastMath.max(a,b); }

	/** clamp a value into [lo,hi] */
	public static final double bounded(double x, double lo, double hi) {
		if (x<lo) return lo;
		else if (x>hi) return hi;
		else return x;
	}

	public static final int product(int[] dims) {
		int n = 1;
		for (int d=0;d<dims.length;d++) n *= dims[d];
		return n;
	}

	public static final String shapeString(int[] dims) {
		StringBuilder str = new StringBuilder("[");
		for (int d=0;d<dims.length;d++) {
			if (d>0) str.append(" x ");
			str.append(dims[d]);
		}
		return str.append("]").toString();
	}
}
