package org.imagerecovery.denoising.methods;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.imagerecovery.denoising.structures.*;
import org.imagerecovery.denoising.utilities.*;

import Jama.Matrix;

/**
 *
 *  Total variation denoising with the accelerated primal-dual algorithm of
 *  Chambolle and Pock (2011, Algorithm 2), extended to color images by coupling
 *  the channels in the dual projection (Bredies, 2014).
 *	<p>
 *  The input is a 2D image or a 3D stack [x,y,channel]; for a stack, the dual
 *  projection is shared by all channels of a pixel. Step sizes should satisfy
 *  tau*sigma*L^2 <= 1 with L^2 <= 8 for the discrete gradient.
 *	<p>
 *  Initialization: the primal and extrapolated variables start from the input and
 *  the dual variables from the gradient of the input, rather than from zero.
 *
 *	@version    Oct 2026
 *
 */
public class PrimalDualDenoising {

	// axes
	private static final int X = 0;
	private static final int Y = 1;
	private static final int C = 2;

	// input and parameters
	private ImageArray input;
	private double lambda;
	private double tau;
	private double sigma;
	private double gamma;
	private int maxIter;
	private double convergenceThreshold;

	// output
	private ImageArray result = null;
	private int iterations = 0;
	private double convergence = Double.NaN;

	// for debug and display
	private static final boolean debug=true;

	/**
	 *  @param input_ the noisy image: 2D, or 3D with channels on the last axis
	 *  @param lambda_ data fidelity weight (close to 0: smooth, large: close to the input)
	 *  @param tau_ initial primal step
	 *  @param sigma_ initial dual step
	 *  @param gamma_ acceleration rate, usually 0.35*lambda
	 *  @param maxIter_ maximum number of iterations
	 *  @param convergenceThreshold_ stop when |u_n - u_n-1|/|u_n-1| falls below
	 */
	public PrimalDualDenoising(ImageArray input_, double lambda_, double tau_, double sigma_,
								double gamma_, int maxIter_, double convergenceThreshold_) {
		input = input_;
		lambda = lambda_;
		tau = tau_;
		sigma = sigma_;
		gamma = gamma_;
		maxIter = maxIter_;
		convergenceThreshold = convergenceThreshold_;
	}

	public final ImageArray exportResult() { return result; }
	public final int getIterations() { return iterations; }
	public final double getConvergence() { return convergence; }

	/**
	 *  (v + t*l*u0) / (1 + t*l): pulls a gradient step back towards the noisy input.
	 *  Elements already equal to the input are returned as they are.
	 */
	public static final ImageArray weightedAverage(ImageArray v, ImageArray u0, double t, double l) {
		if (!v.sameShape(u0)) throw new ShapeMismatchException(u0.getShape(), v.getShape());
		double[] avg = v.toArray();
		double[] orig = u0.toArray();
		for (int xyz=0;xyz<avg.length;xyz++) {
			if (avg[xyz]!=orig[xyz]) avg[xyz] = (avg[xyz] + t*l*orig[xyz])/(1.0 + t*l);
		}
		return new ImageArray(avg, v.getShape());
	}

	/**
	 *  check that every spatial axis can be differentiated
	 */
	public static final void checkImageSize(ImageArray image) {
		if (image.getRank()<2 || image.getRank()>3)
			throw new AxisOutOfBoundsException("expected a 2D image or a 3D [x,y,channel] stack, not "
												+Numerics.shapeString(image.getShape()));
		if (image.getLength(X)<2 || image.getLength(Y)<2)
			throw new AxisTooShortException("image too small to denoise: "+Numerics.shapeString(image.getShape())
												+" (both dimensions must be at least 2 pixels)");
	}

	/**
	 *  main loop
	 */
	public final ImageArray solve() {
		checkImageSize(input);
		boolean coupled = (input.getRank()==3);

		// local copies: the step sizes change along the iterations
		double t = tau;
		double s = sigma;
		double theta;

		ImageArray current = input;
		ImageArray previous;
		ImageArray currentBar = input;
		ImageArray dualA = FiniteDifferences.forwardDifference(current, X);
		ImageArray dualB = FiniteDifferences.forwardDifference(current, Y);

		int iter = 1;
		double ratio;
		while (true) {
			// dual update and projection on the unit ball
			dualA = dualA.add(FiniteDifferences.forwardDifference(currentBar, X).multiply(s));
			dualB = dualB.add(FiniteDifferences.forwardDifference(currentBar, Y).multiply(s));
			ImageArray[] projected;
			if (coupled) projected = BallProjection.projectOnAxis(dualA, dualB, C);
			else projected = BallProjection.project(dualA, dualB);
			dualA = projected[0];
			dualB = projected[1];

			// primal update
			previous = current;
			ImageArray div = FiniteDifferences.backwardDifference(dualA, X)
							.add(FiniteDifferences.backwardDifference(dualB, Y));
			current = weightedAverage(current.subtract(div.multiply(t)), input, t, lambda);

			// acceleration
			theta = 1.0/(1.0 + 2.0*gamma*t);
			t *= theta;
			s /= theta;

			// extrapolation
			currentBar = current.add(current.subtract(previous).multiply(theta));

			// convergence: NaN when the previous estimate is identically zero and unchanged
			ratio = PowerNorm.norm(current.subtract(previous))/PowerNorm.norm(previous);
			if (Double.isNaN(ratio) || ratio<convergenceThreshold || iter>=maxIter) break;
			iter++;
		}
		if (debug) System.out.print("primal-dual: returned at iteration "+iter+" (convergence: "+ratio+")\n");

		result = current;
		iterations = iter;
		convergence = ratio;
		return result;
	}

	/**
	 *  single channel denoising of a matrix
	 */
	public static final Matrix denoise(Matrix input, double lambda, double tau, double sigma,
										double gamma, int maxIter, double convergenceThreshold) {
		PrimalDualDenoising algo = new PrimalDualDenoising(ImageArray.fromMatrix(input),
										lambda, tau, sigma, gamma, maxIter, convergenceThreshold);
		return algo.solve().toMatrix();
	}

	/**
	 *  color denoising with channels coupled in the dual projection
	 */
	public static final ChannelBundle denoiseMultichannel(ChannelBundle input, double lambda, double tau, double sigma,
										double gamma, int maxIter, double convergenceThreshold) {
		PrimalDualDenoising algo = new PrimalDualDenoising(input.toArray(),
										lambda, tau, sigma, gamma, maxIter, convergenceThreshold);
		return ChannelBundle.fromArray(algo.solve());
	}

	/**
	 *  color denoising with each channel processed on its own, in parallel
	 */
	public static final ChannelBundle denoiseEachChannel(ChannelBundle input, double lambda, double tau, double sigma,
										double gamma, int maxIter, double convergenceThreshold) {
		PrimalDualDenoising[] solved = solveEachChannel(input.toArray(),
										lambda, tau, sigma, gamma, maxIter, convergenceThreshold);
		return new ChannelBundle(solved[ChannelBundle.RED].exportResult(),
								 solved[ChannelBundle.GREEN].exportResult(),
								 solved[ChannelBundle.BLUE].exportResult());
	}

	/**
	 *  solve every channel of a [x,y,channel] stack independently, one thread per channel
	 *  @return the solvers, in channel order, with their results and iteration counts
	 */
	public static final PrimalDualDenoising[] solveEachChannel(ImageArray stack, double lambda, double tau, double sigma,
										double gamma, int maxIter, double convergenceThreshold) {
		if (stack.getRank()!=3) throw new AxisOutOfBoundsException(2, stack.getRank());
		checkImageSize(stack);
		int nc = stack.getLength(C);
		final PrimalDualDenoising[] solvers = new PrimalDualDenoising[nc];
		for (int c=0;c<nc;c++) solvers[c] = new PrimalDualDenoising(stack.channel(c),
										lambda, tau, sigma, gamma, maxIter, convergenceThreshold);

		ExecutorService threads = Executors.newFixedThreadPool(nc);
		try {
			List<Future<ImageArray>> results = new ArrayList<>(nc);
			for (int c=0;c<nc;c++) {
				final PrimalDualDenoising solver = solvers[c];
				Callable<ImageArray> task = () -> solver.solve();
				results.add(threads.submit(task));
			}
			for (int c=0;c<nc;c++) results.get(c).get();
			return solvers;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("channel denoising interrupted", e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException) throw (RuntimeException)e.getCause();
			throw new IllegalStateException("channel denoising failed", e.getCause());
		} finally {
			threads.shutdownNow();
		}
	}
}
