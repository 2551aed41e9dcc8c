package org.imagerecovery.denoising.utilities;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.awt.image.BufferedImage;

import org.imagerecovery.denoising.structures.ChannelBundle;
import org.imagerecovery.denoising.structures.ImageArray;
import org.junit.Test;

public class ImageConversionTest {

    private static BufferedImage colorImage()
    {
        BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < 3; x++) for (int y = 0; y < 2; y++) {
            image.setRGB(x, y, (10 * x << 16) | (20 * y << 8) | (x + 3 * y));
        }
        return image;
    }

    @Test
    public void testNarrowClampsAndTruncates()
    {
        assertEquals(12, ImageConversion.narrow(12.9));
        assertEquals(0, ImageConversion.narrow(-5.0));
        assertEquals(255, ImageConversion.narrow(300.0));
        assertEquals(255, ImageConversion.narrow(255.0));
        assertEquals(0, ImageConversion.narrow(Double.NaN));
    }

    @Test
    public void testChannelsFollowImageAxes()
    {
        ChannelBundle bundle = ImageConversion.toChannels(colorImage());
        assertArrayEquals(new int[]{3, 2}, bundle.getShape());
        assertEquals(20, bundle.getRed().get(2, 1), 0);
        assertEquals(20, bundle.getGreen().get(2, 1), 0);
        assertEquals(5, bundle.getBlue().get(2, 1), 0);

        ImageArray stack = ImageConversion.toArray(colorImage());
        assertArrayEquals(new int[]{3, 2, 3}, stack.getShape());
        assertEquals(bundle, ChannelBundle.fromArray(stack));
    }

    @Test
    public void testColorRoundTrip()
    {
        BufferedImage image = colorImage();
        BufferedImage back = ImageConversion.toRgbImage(ImageConversion.toChannels(image));
        for (int x = 0; x < 3; x++) for (int y = 0; y < 2; y++) {
            assertEquals(image.getRGB(x, y), back.getRGB(x, y));
        }
    }

    @Test
    public void testRgbImageIsNarrowed()
    {
        ChannelBundle bundle = new ChannelBundle(ImageArray.filled(12.9, 2, 2), ImageArray.filled(-5, 2, 2), ImageArray.filled(300, 2, 2));
        BufferedImage image = ImageConversion.toRgbImage(bundle);
        assertEquals((12 << 16) | 255, image.getRGB(1, 1) & 0xFFFFFF);
    }

    @Test
    public void testGrayImages()
    {
        ImageArray values = ImageArray.fromValues(new double[][]{{0, 100.7}, {254.2, 400}});
        BufferedImage gray = ImageConversion.toGrayImage(values);
        assertEquals(BufferedImage.TYPE_BYTE_GRAY, gray.getType());
        assertEquals(100, gray.getRaster().getSample(0, 1, 0));
        assertEquals(254, gray.getRaster().getSample(1, 0, 0));
        assertEquals(255, gray.getRaster().getSample(1, 1, 0));

        ImageArray back = ImageConversion.toArray(gray);
        assertArrayEquals(new int[]{2, 2, 1}, back.getShape());
        assertEquals(100, back.get(0, 1, 0), 0);

        // channels averaged before narrowing
        ImageArray stack = ImageArray.stack(ImageArray.filled(10, 2, 2), ImageArray.filled(20, 2, 2));
        assertEquals(15, ImageConversion.toGrayImage(stack).getRaster().getSample(1, 1, 0));

        ImageArray bright = ImageArray.stack(ImageArray.filled(200, 2, 2), ImageArray.filled(220, 2, 2), ImageArray.filled(240, 2, 2));
        assertEquals(220, ImageConversion.toGrayImage(bright).getRaster().getSample(0, 0, 0));
    }

    @Test
    public void testUpdateChannelKeepsOtherChannels()
    {
        BufferedImage image = colorImage();
        ImageConversion.updateChannel(image, ChannelBundle.GREEN, ImageArray.filled(77.5, 3, 2));
        ChannelBundle bundle = ImageConversion.toChannels(image);
        assertEquals(ImageArray.filled(77, 3, 2), bundle.getGreen());
        assertEquals(ImageConversion.toChannels(colorImage()).getRed(), bundle.getRed());
        assertEquals(ImageConversion.toChannels(colorImage()).getBlue(), bundle.getBlue());
    }

    @Test(expected = ShapeMismatchException.class)
    public void testUpdateChannelNeedsMatchingSize()
    {
        ImageConversion.updateChannel(colorImage(), ChannelBundle.RED, ImageArray.zeros(2, 3));
    }
}
