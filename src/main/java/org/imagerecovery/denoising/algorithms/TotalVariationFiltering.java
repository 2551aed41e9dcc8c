package org.imagerecovery.denoising.algorithms;

import org.imagerecovery.denoising.structures.*;
import org.imagerecovery.denoising.utilities.*;
import org.imagerecovery.denoising.methods.*;

import org.apache.commons.math3.util.FastMath;

/**
 *
 *  This algorithm uses a total variation algorithm to denoise 2D grayscale or color images
 *
 *	@version    Oct 2026
 *
 */

public class TotalVariationFiltering {

	// images dimensions
	private 	int 		nx,ny,nc=1, nxy;

	// parameters
	private 	float[] 	inputImage;
	private 	double 		lambda = 0.0259624705;		// data fidelity weight
	private 	double 		tauStep = 1.0/FastMath.sqrt(2.0);		// primal step
	private 	double 		sigmaStep = Double.NaN;		// dual step (default 1/(8 tau))
	private 	double 		gamma = Double.NaN;		// acceleration (default 0.35 lambda)
	private 	double 		convergenceThreshold = 1e-10;		// relative change for stopping
	private 	int 		maxIter = 500;		// maximum number of iterations

	public static final String[] channelModes = {"coupled","per-channel"};
	private		String		channelMode = "coupled";

	private float[] filterImage;
	private float[] residualImage;
	private int iterations = 0;

	// for debug and display
	private static final boolean		debug=true;
	private static final boolean		verbose=true;


	public final void setImage(float[] val) { inputImage = val; }

	public final void setLambda(double val) { lambda = val; }
	public final void setTauStep(double val) { tauStep = val; }
	public final void setSigmaStep(double val) { sigmaStep = val; }
	public final void setGamma(double val) { gamma = val; }
	public final void setConvergenceThreshold(double val) { convergenceThreshold = val; }
	public final void setMaxIter(int val) { maxIter = val; }
	public final void setChannelMode(String val) { channelMode = val; }

	public final void setDimensions(int x, int y) { nx=x; ny=y; nc=1; nxy=nx*ny; }
	public final void setDimensions(int x, int y, int c) { nx=x; ny=y; nc=c; nxy=nx*ny; }
	public final void setDimensions(int[] dim) { nx=dim[0]; ny=dim[1]; if (dim.length>2) nc=dim[2]; else nc=1; nxy=nx*ny; }

	// to be used for JIST definitions, generic info / help
	public final String getPackage() { return "Image Recovery"; }
	public final String getCategory() { return "Filtering"; }
	public final String getLabel() { return "Total Variation Denoising"; }
	public final String getName() { return "TotalVariationDenoising"; }

	public final String[] getAlgorithmAuthors() { return new String[]{"Image Recovery developers"}; }
	public final String getAffiliation() { return "Image Recovery"; }
	public final String getDescription() { return "Total variation denoising with the accelerated primal-dual algorithm of (Chambolle and Pock, 2011), color coupling from (Bredies, 2014)"; }
	public final String getLongDescription() { return getDescription(); }

	public final String getVersion() { return "1.0"; };

	public final double getLambda() { return lambda; }
	public final double getTauStep() { return tauStep; }
	public final double getConvergenceThreshold() { return convergenceThreshold; }
	public final int getMaxIter() { return maxIter; }
	public final String getChannelMode() { return channelMode; }

	// effective parameters
	public final double getSigmaStep() { return Double.isNaN(sigmaStep) ? 1.0/(8.0*tauStep) : sigmaStep; }
	public final double getGamma() { return Double.isNaN(gamma) ? 0.35*lambda : gamma; }

	// create outputs
	public final float[] getFilteredImage() { return filterImage; }
	public final float[] getResidualImage() { return residualImage; }
	public final int getIterations() { return iterations; }

	public final void execute() {
		if (inputImage==null) throw new IllegalStateException("no input image set");
		if (inputImage.length!=nxy*nc)
			throw new ShapeMismatchException("image of size "+inputImage.length+" does not fit dimensions "+nx+" x "+ny+" x "+nc);
		if (!channelMode.equals(channelModes[0]) && !channelMode.equals(channelModes[1]))
			throw new IllegalArgumentException("unknown channel mode: "+channelMode);

		double sigma = getSigmaStep();
		double gam = getGamma();
		if (tauStep*sigma*8.0>1.0 && verbose)
			System.out.print("warning: tau*sigma*8 = "+(tauStep*sigma*8.0)+" > 1, the iterations may not converge\n");

		double[] values = new double[nxy*nc];
		for (int xyc=0;xyc<nxy*nc;xyc++) values[xyc] = inputImage[xyc];
		ImageArray image;
		if (nc==1) image = new ImageArray(values, nx, ny);
		else image = new ImageArray(values, nx, ny, nc);

		if (debug) System.out.print("total variation: "+nx+" x "+ny+" x "+nc+", mode: "+channelMode+"\n");

		ImageArray denoised;
		if (nc==1 || channelMode.equals(channelModes[0])) {
			PrimalDualDenoising algo = new PrimalDualDenoising(image, lambda, tauStep, sigma, gam, maxIter, convergenceThreshold);
			denoised = algo.solve();
			iterations = algo.getIterations();
		} else {
			// independent channels, solved concurrently
			PrimalDualDenoising[] solved = PrimalDualDenoising.solveEachChannel(image, lambda, tauStep, sigma, gam, maxIter, convergenceThreshold);
			ImageArray[] channels = new ImageArray[nc];
			iterations = 0;
			for (int c=0;c<nc;c++) {
				channels[c] = solved[c].exportResult();
				iterations = Numerics.max(iterations, solved[c].getIterations());
			}
			denoised = ImageArray.stack(channels);
		}

		filterImage = new float[nxy*nc];
		residualImage = new float[nxy*nc];
		for (int xyc=0;xyc<nxy*nc;xyc++) {
			filterImage[xyc] = (float)denoised.getValue(xyc);
			residualImage[xyc] = (float)(values[xyc] - denoised.getValue(xyc));
		}
		if (debug) System.out.print("Done\n");

		return;
    }

}
