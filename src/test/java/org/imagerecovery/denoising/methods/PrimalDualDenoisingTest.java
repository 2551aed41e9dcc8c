package org.imagerecovery.denoising.methods;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import org.imagerecovery.denoising.structures.ChannelBundle;
import org.imagerecovery.denoising.structures.ImageArray;
import org.imagerecovery.denoising.utilities.AxisOutOfBoundsException;
import org.imagerecovery.denoising.utilities.AxisTooShortException;
import org.junit.Test;

import Jama.Matrix;

public class PrimalDualDenoisingTest {

    private static final double LAMBDA = 0.0259624705;
    private static final double TAU = 1.0 / Math.sqrt(2.0);
    private static final double SIGMA = 1.0 / (8.0 * TAU);
    private static final double GAMMA = 0.35 * LAMBDA;

    private final Random random = new Random(1234L);

    private ImageArray noisyImage(int nx, int ny)
    {
        double[] values = new double[nx * ny];
        for (int i = 0; i < values.length; i++) values[i] = random.nextInt(256);
        return new ImageArray(values, nx, ny);
    }

    private PrimalDualDenoising solver(ImageArray input, int maxIter, double threshold)
    {
        return new PrimalDualDenoising(input, LAMBDA, TAU, SIGMA, GAMMA, maxIter, threshold);
    }

    @Test
    public void testWeightedAverage()
    {
        ImageArray v = ImageArray.filled(2, 2, 2);
        ImageArray u0 = ImageArray.filled(8, 2, 2);
        // (2 + 0.5*8) / 1.5
        ImageArray avg = PrimalDualDenoising.weightedAverage(v, u0, 0.25, 2.0);
        assertArrayEquals(ImageArray.filled(4, 2, 2).toArray(), avg.toArray(), 1e-15);

        // elements equal to the input are kept exactly
        ImageArray mixed = new ImageArray(new double[]{37.3, 37.3, 2, 2}, 2, 2);
        ImageArray input = new ImageArray(new double[]{37.3, 37.3, 8, 8}, 2, 2);
        ImageArray kept = PrimalDualDenoising.weightedAverage(mixed, input, 0.3, 0.0259624705);
        assertEquals(37.3, kept.get(0, 0), 0);
        assertEquals(37.3, kept.get(1, 0), 0);
        assertTrue(kept.get(0, 1) > 2 && kept.get(0, 1) < 8);
    }

    @Test
    public void testUniformImageIsAFixedPoint()
    {
        for (double level : new double[]{100, 37.3, 0.1}) {
            ImageArray flat = ImageArray.filled(level, 8, 6);
            PrimalDualDenoising algo = solver(flat, 500, 1e-10);
            ImageArray result = algo.solve();

            assertEquals(1, algo.getIterations());
            assertEquals(0, algo.getConvergence(), 0);
            assertEquals(flat, result);
        }
    }

    @Test
    public void testZeroImageStopsOnUndefinedConvergence()
    {
        PrimalDualDenoising algo = solver(ImageArray.zeros(5, 5), 1000, 0);
        ImageArray result = algo.solve();

        assertEquals(1, algo.getIterations());
        assertTrue(Double.isNaN(algo.getConvergence()));
        assertEquals(ImageArray.zeros(5, 5), result);
    }

    @Test
    public void testIterationCapIsExact()
    {
        ImageArray noisy = noisyImage(12, 10);
        for (int k = 1; k <= 6; k++) {
            PrimalDualDenoising algo = solver(noisy, k, 0);
            algo.solve();
            assertEquals(k, algo.getIterations());
        }
    }

    @Test
    public void testDenoisingSmoothsTheImage()
    {
        // two flat halves plus noise
        double[] values = new double[32 * 32];
        for (int y = 0; y < 32; y++) for (int x = 0; x < 32; x++) {
            values[x + 32 * y] = (x < 16 ? 60 : 190) + random.nextInt(41) - 20;
        }
        ImageArray noisy = new ImageArray(values, 32, 32);
        PrimalDualDenoising algo = solver(noisy, 200, 1e-6);
        assertNull(algo.exportResult());
        ImageArray result = algo.solve();

        assertTrue(algo.getIterations() >= 1 && algo.getIterations() <= 200);
        double before = PowerNorm.norm(FiniteDifferences.dx(noisy)) + PowerNorm.norm(FiniteDifferences.dy(noisy));
        double after = PowerNorm.norm(FiniteDifferences.dx(result)) + PowerNorm.norm(FiniteDifferences.dy(result));
        assertTrue("gradient not reduced: " + before + " -> " + after, after < before);
        assertEquals(result, algo.exportResult());
    }

    @Test(expected = AxisTooShortException.class)
    public void testSingleRowIsRejected()
    {
        solver(ImageArray.filled(5, 1, 9), 10, 1e-10).solve();
    }

    @Test(expected = AxisTooShortException.class)
    public void testSingleColumnIsRejected()
    {
        solver(ImageArray.filled(5, 9, 1), 10, 1e-10).solve();
    }

    @Test(expected = AxisOutOfBoundsException.class)
    public void testVectorIsRejected()
    {
        solver(ImageArray.filled(5, 9), 10, 1e-10).solve();
    }

    @Test(expected = AxisOutOfBoundsException.class)
    public void testFourAxesAreRejected()
    {
        solver(ImageArray.zeros(3, 3, 3, 3), 10, 1e-10).solve();
    }

    @Test
    public void testMatrixShapeIsPreserved()
    {
        double[][] values = new double[3][5];
        for (int i = 0; i < 3; i++) for (int j = 0; j < 5; j++) values[i][j] = random.nextInt(256);
        Matrix result = PrimalDualDenoising.denoise(new Matrix(values), LAMBDA, TAU, SIGMA, GAMMA, 20, 1e-10);
        assertEquals(3, result.getRowDimension());
        assertEquals(5, result.getColumnDimension());
    }

    @Test
    public void testCoupledChannelsDifferFromSeparateChannels()
    {
        ChannelBundle input = new ChannelBundle(noisyImage(10, 10), ImageArray.zeros(10, 10), noisyImage(10, 10));

        ChannelBundle coupled = PrimalDualDenoising.denoiseMultichannel(input, LAMBDA, TAU, SIGMA, GAMMA, 30, 0);
        ChannelBundle separate = PrimalDualDenoising.denoiseEachChannel(input, LAMBDA, TAU, SIGMA, GAMMA, 30, 0);

        assertArrayEquals(input.getShape(), coupled.getShape());
        // a channel without structure stays flat either way
        assertEquals(ImageArray.zeros(10, 10), coupled.getGreen());
        assertEquals(ImageArray.zeros(10, 10), separate.getGreen());

        double gap = PowerNorm.norm(coupled.getRed().subtract(separate.getRed()));
        assertTrue("coupled and separate results coincide", gap > 1e-6);
    }

    @Test
    public void testParallelChannelsMatchSequentialSolves()
    {
        ChannelBundle input = new ChannelBundle(noisyImage(9, 7), noisyImage(9, 7), noisyImage(9, 7));
        ChannelBundle parallel = PrimalDualDenoising.denoiseEachChannel(input, LAMBDA, TAU, SIGMA, GAMMA, 25, 1e-8);
        for (int c = 0; c < ChannelBundle.CHANNELS; c++) {
            ImageArray sequential = solver(input.getChannel(c), 25, 1e-8).solve();
            assertEquals(sequential, parallel.getChannel(c));
        }
    }

    @Test
    public void testStackChannelsAreSolvedApart()
    {
        ImageArray stack = ImageArray.stack(noisyImage(6, 5), noisyImage(6, 5), ImageArray.filled(3, 6, 5), noisyImage(6, 5));
        PrimalDualDenoising[] solved = PrimalDualDenoising.solveEachChannel(stack, LAMBDA, TAU, SIGMA, GAMMA, 12, 1e-8);
        assertEquals(4, solved.length);
        for (int c = 0; c < 4; c++) {
            PrimalDualDenoising sequential = solver(stack.channel(c), 12, 1e-8);
            assertEquals(sequential.solve(), solved[c].exportResult());
            assertEquals(sequential.getIterations(), solved[c].getIterations());
        }
        // the flat channel stops at once
        assertEquals(1, solved[2].getIterations());
    }

    @Test(expected = AxisOutOfBoundsException.class)
    public void testStackSolveNeedsChannels()
    {
        PrimalDualDenoising.solveEachChannel(noisyImage(6, 5), LAMBDA, TAU, SIGMA, GAMMA, 12, 1e-8);
    }

    @Test(expected = AxisTooShortException.class)
    public void testParallelChannelsRejectThinImages()
    {
        ChannelBundle thin = new ChannelBundle(ImageArray.zeros(1, 4), ImageArray.zeros(1, 4), ImageArray.zeros(1, 4));
        PrimalDualDenoising.denoiseEachChannel(thin, LAMBDA, TAU, SIGMA, GAMMA, 10, 1e-10);
    }
}
