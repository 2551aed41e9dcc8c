package org.imagerecovery.denoising.structures;

import java.util.Arrays;

import org.imagerecovery.denoising.utilities.*;

import Jama.Matrix;

/**
 *
 *  Dense n-dimensional array of doubles, stored as a flat buffer with the first
 *  axis varying fastest (xyz = x + nx*y + nx*ny*z).
 *	<p>
 *  Arrays cannot be modified once built: buffers are copied in and out, and
 *  every operation returns a new array. Binary operations require identical
 *  shapes, scalars are applied to every element.
 *
 *	@version    Oct 2026
 *
 */
public class ImageArray {

	private final int[] dims;
	private final int[] strides;
	private final double[] data;

	/**
	 *  wrap a buffer: the buffer is not copied, only used internally
	 */
	private ImageArray(int[] dims_, double[] data_, boolean wrapped) {
		if (dims_.length==0) throw new AxisOutOfBoundsException("arrays must have at least one axis");
		for (int d=0;d<dims_.length;d++) if (dims_[d]<1)
			throw new IllegalArgumentException("invalid array dimensions "+Numerics.shapeString(dims_));
		if (data_.length!=Numerics.product(dims_))
			throw new ShapeMismatchException("buffer of size "+data_.length+" does not fit dimensions "+Numerics.shapeString(dims_));
		dims = dims_.clone();
		data = data_;
		strides = new int[dims.length];
		strides[0] = 1;
		for (int d=1;d<dims.length;d++) strides[d] = strides[d-1]*dims[d-1];
	}

	/**
	 *  create an array from a flat buffer (copied) and its dimensions
	 */
	public ImageArray(double[] values, int... dims) {
		this(dims, values.clone(), true);
	}

	public static ImageArray zeros(int... dims) {
		return new ImageArray(dims, new double[Numerics.product(dims)], true);
	}

	public static ImageArray filled(double value, int... dims) {
		double[] values = new double[Numerics.product(dims)];
		Arrays.fill(values, value);
		return new ImageArray(dims, values, true);
	}

	/**
	 *  build a 2D array from values[x][y]
	 */
	public static ImageArray fromValues(double[][] values) {
		int nx = values.length;
		int ny = values[0].length;
		double[] flat = new double[nx*ny];
		for (int x=0;x<nx;x++) {
			if (values[x].length!=ny) throw new ShapeMismatchException("do not accept jagged arrays");
			for (int y=0;y<ny;y++) flat[x+nx*y] = values[x][y];
		}
		return new ImageArray(new int[]{nx,ny}, flat, true);
	}

	/**
	 *  build a 2D array from a matrix: axis 0 follows the rows, axis 1 the columns
	 */
	public static ImageArray fromMatrix(Matrix mtx) {
		return fromValues(mtx.getArray());
	}

	public final Matrix toMatrix() {
		if (dims.length!=2) throw new ShapeMismatchException("only 2D arrays convert to a matrix, not "+Numerics.shapeString(dims));
		double[][] values = new double[dims[0]][dims[1]];
		for (int x=0;x<dims[0];x++) for (int y=0;y<dims[1];y++) values[x][y] = data[x+dims[0]*y];
		return new Matrix(values);
	}

	/**
	 *  stack 2D channels of identical shape into a 3D array, channels on the last axis
	 */
	public static ImageArray stack(ImageArray... channels) {
		int[] shape = channels[0].dims;
		if (shape.length!=2) throw new ShapeMismatchException("only 2D channels can be stacked, not "+Numerics.shapeString(shape));
		int nxy = channels[0].data.length;
		double[] values = new double[nxy*channels.length];
		for (int c=0;c<channels.length;c++) {
			if (!Arrays.equals(shape, channels[c].dims)) throw new ShapeMismatchException(shape, channels[c].dims);
			System.arraycopy(channels[c].data, 0, values, c*nxy, nxy);
		}
		return new ImageArray(new int[]{shape[0],shape[1],channels.length}, values, true);
	}

	/**
	 *  extract one 2D channel of a 3D array
	 */
	public final ImageArray channel(int c) {
		if (dims.length!=3) throw new AxisOutOfBoundsException(2, dims.length);
		if (c<0 || c>=dims[2]) throw new IndexOutOfBoundsException("channel "+c+" of "+dims[2]);
		int nxy = dims[0]*dims[1];
		double[] values = new double[nxy];
		System.arraycopy(data, c*nxy, values, 0, nxy);
		return new ImageArray(new int[]{dims[0],dims[1]}, values, true);
	}

	// shape information
	public final int[] getShape() { return dims.clone(); }
	public final int getRank() { return dims.length; }
	public final int size() { return data.length; }

	public final int getLength(int axis) {
		checkAxis(axis);
		return dims[axis];
	}

	public final boolean sameShape(ImageArray that) {
		return Arrays.equals(dims, that.dims);
	}

	final void checkAxis(int axis) {
		if (axis<0 || axis>=dims.length) throw new AxisOutOfBoundsException(axis, dims.length);
	}

	private int index(int[] coords) {
		if (coords.length!=dims.length)
			throw new IllegalArgumentException(coords.length+" coordinates given for an array of rank "+dims.length);
		int xyz = 0;
		for (int d=0;d<dims.length;d++) {
			if (coords[d]<0 || coords[d]>=dims[d])
				throw new IndexOutOfBoundsException("coordinate "+coords[d]+" along axis "+d+" of length "+dims[d]);
			xyz += coords[d]*strides[d];
		}
		return xyz;
	}

	public final double get(int... coords) { return data[index(coords)]; }

	/** flat access, first axis fastest */
	public final double getValue(int xyz) { return data[xyz]; }

	/** a copy of the flat buffer */
	public final double[] toArray() { return data.clone(); }

	// elementwise operations
	private static final int ADD = 0;
	private static final int SUBTRACT = 1;
	private static final int MULTIPLY = 2;
	private static final int DIVIDE = 3;

	private static double apply(int op, double a, double b) {
		if (op==ADD) return a+b;
		else if (op==SUBTRACT) return a-b;
		else if (op==MULTIPLY) return a*b;
		else return a/b;
	}

	private ImageArray combine(ImageArray that, int op) {
		if (!sameShape(that)) throw new ShapeMismatchException(dims, that.dims);
		double[] result = new double[data.length];
		for (int xyz=0;xyz<data.length;xyz++) result[xyz] = apply(op, data[xyz], that.data[xyz]);
		return new ImageArray(dims, result, true);
	}

	private ImageArray combine(double scalar, int op) {
		double[] result = new double[data.length];
		for (int xyz=0;xyz<data.length;xyz++) result[xyz] = apply(op, data[xyz], scalar);
		return new ImageArray(dims, result, true);
	}

	public final ImageArray add(ImageArray that) { return combine(that, ADD); }
	public final ImageArray subtract(ImageArray that) { return combine(that, SUBTRACT); }
	public final ImageArray multiply(ImageArray that) { return combine(that, MULTIPLY); }
	public final ImageArray divide(ImageArray that) { return combine(that, DIVIDE); }

	public final ImageArray add(double val) { return combine(val, ADD); }
	public final ImageArray subtract(double val) { return combine(val, SUBTRACT); }
	public final ImageArray multiply(double val) { return combine(val, MULTIPLY); }
	public final ImageArray divide(double val) { return combine(val, DIVIDE); }

	public final double sum() {
		double sum = 0.0;
		for (int xyz=0;xyz<data.length;xyz++) sum += data[xyz];
		return sum;
	}

	/**
	 *  circular shift along an axis: the value at index i moves to index i+offset,
	 *  values falling off one edge come back on the opposite edge
	 */
	public final ImageArray roll(int axis, int offset) {
		checkAxis(axis);
		int n = dims[axis];
		int stride = strides[axis];
		double[] result = new double[data.length];
		for (int xyz=0;xyz<data.length;xyz++) {
			int c = (xyz/stride)%n;
			int src = Math.floorMod(c-offset, n);
			result[xyz] = data[xyz + (src-c)*stride];
		}
		return new ImageArray(dims, result, true);
	}

	/**
	 *  sum the values along an axis, the axis is kept with length 1
	 */
	public final ImageArray sumAlongAxis(int axis) {
		checkAxis(axis);
		int[] reduced = dims.clone();
		reduced[axis] = 1;
		double[] result = new double[data.length/dims[axis]];
		int stride = strides[axis];
		for (int xyz=0;xyz<data.length;xyz++) {
			int low = xyz%stride;
			int high = xyz/(stride*dims[axis]);
			result[low + stride*high] += data[xyz];
		}
		return new ImageArray(reduced, result, true);
	}

	/**
	 *  repeat an axis of length 1 the given number of times
	 */
	public final ImageArray repeatAlongAxis(int axis, int count) {
		checkAxis(axis);
		if (dims[axis]!=1) throw new ShapeMismatchException("only an axis of length 1 can be repeated, not "+dims[axis]);
		int[] expanded = dims.clone();
		expanded[axis] = count;
		int stride = strides[axis];
		double[] result = new double[data.length*count];
		for (int xyz=0;xyz<result.length;xyz++) {
			int low = xyz%stride;
			int high = xyz/(stride*count);
			result[xyz] = data[low + stride*high];
		}
		return new ImageArray(expanded, result, true);
	}

	public boolean equals(Object obj) {
		if (this==obj) return true;
		if (!(obj instanceof ImageArray)) return false;
		ImageArray that = (ImageArray)obj;
		return Arrays.equals(dims, that.dims) && Arrays.equals(data, that.data);
	}

	public int hashCode() {
		return 31*Arrays.hashCode(dims) + Arrays.hashCode(data);
	}

	public String toString() {
		if (data.length<100) return "ImageArray "+Numerics.shapeString(dims)+" "+Arrays.toString(data);
		else return "ImageArray "+Numerics.shapeString(dims)+" [ ... ]";
	}
}
