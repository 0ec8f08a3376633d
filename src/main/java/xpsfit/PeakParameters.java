/**
 * XPS Fit
 * PeakParameters.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

/**
 * Starting values for a peak. Any of them may be null, in which case the
 * fit model estimates it from the data.
 */
public final class PeakParameters {

	private final Double center;
	private final Double fwhm;
	private final Double area;

	public PeakParameters(final Double center, final Double fwhm,
		final Double area)
	{
		this.center = center;
		this.fwhm = fwhm;
		this.area = area;
	}

	public Double getCenter() {
		return center;
	}

	public Double getFwhm() {
		return fwhm;
	}

	public Double getArea() {
		return area;
	}

	public boolean isComplete() {
		return center != null && fwhm != null && area != null;
	}

	@Override
	public String toString() {
		return "center=" + center + ", fwhm=" + fwhm + ", area=" + area;
	}
}
