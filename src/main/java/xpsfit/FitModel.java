/**
 * XPS Fit
 * FitModel.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

/**
 * Numeric fit state of the peaks of one {@link Region}. Peaks hold no
 * parameters themselves; everything is looked up here by peak identity.
 * <p>
 * Parameter names are {@code center}, {@code fwhm} and {@code area}; the
 * derived {@code height} can be read but not set. Constraint argument names
 * are {@code min}, {@code max}, {@code expr} and {@code value}.
 * </p>
 */
public interface FitModel {

	/**
	 * Adds a peak. Missing starting values are estimated from the region
	 * data not yet explained by the other peaks.
	 *
	 * @param initial starting values, or null to estimate all of them
	 * @throws IllegalArgumentException if {@code modelName} is unknown
	 */
	void register(Peak peak, String modelName, PeakParameters initial);

	/** Drops the peak and every tie other peaks have to it. */
	void deregister(Peak peak);

	/** Switches the profile of a registered peak, keeping its parameters. */
	void reinit(Peak peak, String modelName);

	boolean isRegistered(Peak peak);

	/** @return the parameter value, or null if the peak is not registered */
	Double getParameter(Peak peak, String attr);

	void setParameter(Peak peak, String attr, double value);

	/**
	 * @return the profile of {@code peak} over the region energy axis, or
	 *         null if no fit has succeeded since the last structural change
	 *         or the peak is not registered
	 */
	double[] evaluate(Peak peak);

	/** @return the sum of all profiles, or null as for {@link #evaluate} */
	double[] evaluateRegionTotal();

	/** @return true if the optimizer converged */
	boolean fitRegion();

	boolean isFitted();

	/**
	 * Called by the region after its slice or background was recomputed. A
	 * previous fit no longer describes the data afterwards.
	 */
	void dataChanged();

	/**
	 * Updates the constraint of one parameter. Null arguments leave the
	 * corresponding part unchanged, an infinite bound removes it, and an
	 * empty expression removes a tie.
	 *
	 * @throws IllegalArgumentException if the expression cannot be parsed,
	 *           refers to an unknown peak or to a tied parameter
	 */
	void setConstraint(Peak peak, String attr, Double min, Double max,
		String expr);

	Object getConstraint(Peak peak, String attr, String argname);
}
