/**
 * XPS Fit
 * ShirleyBackground.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

/**
 * Result of a Shirley background iteration. A curve that did not converge
 * is still usable; {@link #isConverged()} lets the caller report it.
 */
public final class ShirleyBackground {

	private final double[] background;
	private final boolean converged;
	private final int iterations;

	ShirleyBackground(final double[] background, final boolean converged,
		final int iterations)
	{
		this.background = background;
		this.converged = converged;
		this.iterations = iterations;
	}

	public double[] getBackground() {
		return background.clone();
	}

	public boolean isConverged() {
		return converged;
	}

	public int getIterations() {
		return iterations;
	}
}
