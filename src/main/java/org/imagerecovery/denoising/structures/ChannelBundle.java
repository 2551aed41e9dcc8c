package org.imagerecovery.denoising.structures;

import org.imagerecovery.denoising.utilities.*;

/**
 *
 *  Three 2D arrays of a color image (red, green, blue) sharing one shape.
 *  Arithmetic is lifted to every channel and returns a new bundle. The channels
 *  are immutable arrays, so a bundle cannot change once built.
 *
 *	@version    Oct 2026
 *
 */
public class ChannelBundle {

	public static final int RED = 0;
	public static final int GREEN = 1;
	public static final int BLUE = 2;
	public static final int CHANNELS = 3;

	private final int[] shape;
	private final ImageArray[] channels;

	public ChannelBundle(ImageArray red, ImageArray green, ImageArray blue) {
		if (red.getRank()!=2) throw new ShapeMismatchException("channels must be 2D arrays, not "+Numerics.shapeString(red.getShape()));
		if (!red.sameShape(green)) throw new ShapeMismatchException(red.getShape(), green.getShape());
		if (!red.sameShape(blue)) throw new ShapeMismatchException(red.getShape(), blue.getShape());
		shape = red.getShape();
		channels = new ImageArray[]{red, green, blue};
	}

	public static ChannelBundle zeros(int width, int height) {
		return new ChannelBundle(ImageArray.zeros(width,height), ImageArray.zeros(width,height), ImageArray.zeros(width,height));
	}

	/**
	 *  unfold a 3D array with three channels on its last axis
	 */
	public static ChannelBundle fromArray(ImageArray array) {
		if (array.getRank()!=3 || array.getLength(2)!=CHANNELS)
			throw new ShapeMismatchException("expected a [width x height x 3] array, not "+Numerics.shapeString(array.getShape()));
		return new ChannelBundle(array.channel(RED), array.channel(GREEN), array.channel(BLUE));
	}

	/**
	 *  fold the channels into a 3D array, channels on the last axis
	 */
	public final ImageArray toArray() {
		return ImageArray.stack(channels);
	}

	public final int[] getShape() { return shape.clone(); }
	public final int getWidth() { return shape[0]; }
	public final int getHeight() { return shape[1]; }

	public final ImageArray getChannel(int c) { return channels[c]; }
	public final ImageArray getRed() { return channels[RED]; }
	public final ImageArray getGreen() { return channels[GREEN]; }
	public final ImageArray getBlue() { return channels[BLUE]; }

	public final boolean sameShape(ChannelBundle that) {
		return channels[RED].sameShape(that.channels[RED]);
	}

	public final ChannelBundle add(ChannelBundle that) {
		checkShape(that);
		return new ChannelBundle(channels[RED].add(that.channels[RED]),
								 channels[GREEN].add(that.channels[GREEN]),
								 channels[BLUE].add(that.channels[BLUE]));
	}

	public final ChannelBundle subtract(ChannelBundle that) {
		checkShape(that);
		return new ChannelBundle(channels[RED].subtract(that.channels[RED]),
								 channels[GREEN].subtract(that.channels[GREEN]),
								 channels[BLUE].subtract(that.channels[BLUE]));
	}

	public final ChannelBundle multiply(ChannelBundle that) {
		checkShape(that);
		return new ChannelBundle(channels[RED].multiply(that.channels[RED]),
								 channels[GREEN].multiply(that.channels[GREEN]),
								 channels[BLUE].multiply(that.channels[BLUE]));
	}

	public final ChannelBundle divide(ChannelBundle that) {
		checkShape(that);
		return new ChannelBundle(channels[RED].divide(that.channels[RED]),
								 channels[GREEN].divide(that.channels[GREEN]),
								 channels[BLUE].divide(that.channels[BLUE]));
	}

	// a single array is applied to every channel
	public final ChannelBundle add(ImageArray that) {
		return new ChannelBundle(channels[RED].add(that), channels[GREEN].add(that), channels[BLUE].add(that));
	}

	public final ChannelBundle subtract(ImageArray that) {
		return new ChannelBundle(channels[RED].subtract(that), channels[GREEN].subtract(that), channels[BLUE].subtract(that));
	}

	public final ChannelBundle multiply(ImageArray that) {
		return new ChannelBundle(channels[RED].multiply(that), channels[GREEN].multiply(that), channels[BLUE].multiply(that));
	}

	public final ChannelBundle divide(ImageArray that) {
		return new ChannelBundle(channels[RED].divide(that), channels[GREEN].divide(that), channels[BLUE].divide(that));
	}

	public final ChannelBundle add(double val) {
		return new ChannelBundle(channels[RED].add(val), channels[GREEN].add(val), channels[BLUE].add(val));
	}

	public final ChannelBundle subtract(double val) {
		return new ChannelBundle(channels[RED].subtract(val), channels[GREEN].subtract(val), channels[BLUE].subtract(val));
	}

	public final ChannelBundle multiply(double val) {
		return new ChannelBundle(channels[RED].multiply(val), channels[GREEN].multiply(val), channels[BLUE].multiply(val));
	}

	public final ChannelBundle divide(double val) {
		return new ChannelBundle(channels[RED].divide(val), channels[GREEN].divide(val), channels[BLUE].divide(val));
	}

	/** sum over all the channels */
	public final double sum() {
		return channels[RED].sum() + channels[GREEN].sum() + channels[BLUE].sum();
	}

	private void checkShape(ChannelBundle that) {
		if (!sameShape(that)) throw new ShapeMismatchException(shape, that.shape);
	}

	public boolean equals(Object obj) {
		if (this==obj) return true;
		if (!(obj instanceof ChannelBundle)) return false;
		ChannelBundle that = (ChannelBundle)obj;
		return channels[RED].equals(that.channels[RED])
			&& channels[GREEN].equals(that.channels[GREEN])
			&& channels[BLUE].equals(that.channels[BLUE]);
	}

	public int hashCode() {
		return 31*(31*channels[RED].hashCode() + channels[GREEN].hashCode()) + channels[BLUE].hashCode();
	}

	public String toString() {
		return "ChannelBundle "+Numerics.shapeString(shape);
	}
}
