package org.imagerecovery.denoising.utilities;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

import org.imagerecovery.denoising.structures.*;

/**
 *
 *  Conversions between 8-bit images and real valued arrays, x along the image width
 *  and y along its height. Going back to 8 bits clamps to [0,255] and truncates.
 *
 *	@version    Oct 2026
 *
 */
public class ImageConversion {

	public static final int MAX_VALUE = 255;

	/**
	 *  split a color image into its red, green and blue channels
	 */
	public static final ChannelBundle toChannels(BufferedImage image) {
		int nx = image.getWidth();
		int ny = image.getHeight();
		double[] red = new double[nx*ny];
		double[] green = new double[nx*ny];
		double[] blue = new double[nx*ny];
		for (int x=0;x<nx;x++) for (int y=0;y<ny;y++) {
			int rgb = image.getRGB(x,y);
			red[x+nx*y] = (rgb >> 16) & 0xFF;
			green[x+nx*y] = (rgb >> 8) & 0xFF;
			blue[x+nx*y] = rgb & 0xFF;
		}
		return new ChannelBundle(new ImageArray(red, nx,ny), new ImageArray(green, nx,ny), new ImageArray(blue, nx,ny));
	}

	/**
	 *  a [width x height x channels] array: one channel for grayscale images, three otherwise
	 */
	public static final ImageArray toArray(BufferedImage image) {
		if (image.getType()==BufferedImage.TYPE_BYTE_GRAY) {
			int nx = image.getWidth();
			int ny = image.getHeight();
			double[] gray = new double[nx*ny];
			for (int x=0;x<nx;x++) for (int y=0;y<ny;y++) gray[x+nx*y] = image.getRaster().getSample(x,y,0);
			return new ImageArray(gray, nx,ny,1);
		}
		return toChannels(image).toArray();
	}

	public static final BufferedImage toRgbImage(ChannelBundle bundle) {
		int nx = bundle.getWidth();
		int ny = bundle.getHeight();
		BufferedImage image = new BufferedImage(nx, ny, BufferedImage.TYPE_INT_RGB);
		for (int x=0;x<nx;x++) for (int y=0;y<ny;y++) {
			int r = narrow(bundle.getRed().get(x,y));
			int g = narrow(bundle.getGreen().get(x,y));
			int b = narrow(bundle.getBlue().get(x,y));
			image.setRGB(x, y, (r << 16) | (g << 8) | b);
		}
		return image;
	}

	/**
	 *  a grayscale image from a 2D array, or from a 3D array with its channels averaged
	 */
	public static final BufferedImage toGrayImage(ImageArray array) {
		ImageArray flat = array;
		if (array.getRank()==3) flat = array.sumAlongAxis(2).divide(array.getLength(2));
		else if (array.getRank()!=2) throw new ShapeMismatchException("expected a 2D or 3D array, not "+Numerics.shapeString(array.getShape()));
		int nx = flat.getLength(0);
		int ny = flat.getLength(1);
		BufferedImage image = new BufferedImage(nx, ny, BufferedImage.TYPE_BYTE_GRAY);
		WritableRaster raster = image.getRaster();
		for (int x=0;x<nx;x++) for (int y=0;y<ny;y++) {
			raster.setSample(x, y, 0, narrow(flat.getValue(x+nx*y)));
		}
		return image;
	}

	/**
	 *  replace one channel (ChannelBundle.RED, GREEN or BLUE) of a color image in place
	 */
	public static final void updateChannel(BufferedImage image, int channel, ImageArray values) {
		if (channel<0 || channel>=ChannelBundle.CHANNELS) throw new IndexOutOfBoundsException("no channel "+channel);
		int[] shape = new int[]{image.getWidth(), image.getHeight()};
		if (values.getRank()!=2 || values.getLength(0)!=shape[0] || values.getLength(1)!=shape[1])
			throw new ShapeMismatchException(shape, values.getShape());
		int shift = 16 - 8*channel;
		for (int x=0;x<shape[0];x++) for (int y=0;y<shape[1];y++) {
			int rgb = image.getRGB(x,y);
			rgb = (rgb & ~(0xFF << shift)) | (narrow(values.get(x,y)) << shift);
			image.setRGB(x, y, rgb);
		}
	}

	/**
	 *  back to 8 bits: NaN gives 0, values are clamped then truncated (not rounded)
	 */
	public static final int narrow(double val) {
		if (Double.isNaN(val)) return 0;
		return (int)Numerics.bounded(val, 0, MAX_VALUE);
	}
}
