/**
 * XPS Fit
 * PeakShape.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import org.apache.commons.math3.analysis.function.Gaussian;
import org.apache.commons.math3.util.FastMath;

/**
 * Peak profiles parametrized by center, full width at half maximum and
 * area.
 */
public enum PeakShape {

	GAUSSIAN("Gaussian") {

		@Override
		double value(final double x, final double center, final double fwhm,
			final double area)
		{
			final double sd = fwhm / SD_TO_FWHM;
			final double norm = area / (sd * FastMath.sqrt(2 * FastMath.PI));
			return new Gaussian(norm, center, sd).value(x);
		}
	},

	LORENTZIAN("Lorentzian") {

		@Override
		double value(final double x, final double center, final double fwhm,
			final double area)
		{
			final double gamma = fwhm / 2;
			final double dx = x - center;
			return area / FastMath.PI * gamma / (dx * dx + gamma * gamma);
		}
	},

	/** Equal mix of Gaussian and Lorentzian sharing area and width. */
	PSEUDO_VOIGT("PseudoVoigt") {

		@Override
		double value(final double x, final double center, final double fwhm,
			final double area)
		{
			return ETA * LORENTZIAN.value(x, center, fwhm, area) + (1 - ETA) *
				GAUSSIAN.value(x, center, fwhm, area);
		}
	};

	static final double SD_TO_FWHM = 2 * FastMath.sqrt(2 * FastMath.log(2));
	static final double ETA = 0.5;

	private final String modelName;

	PeakShape(final String modelName) {
		this.modelName = modelName;
	}

	/** Value at {@code x}; {@code fwhm} must be positive. */
	abstract double value(double x, double center, double fwhm, double area);

	double[] curve(final double[] x, final double center, final double fwhm,
		final double area)
	{
		final double[] y = new double[x.length];
		for (int i = 0; i < x.length; i++)
			y[i] = value(x[i], center, fwhm, area);
		return y;
	}

	double height(final double fwhm, final double area) {
		return value(0, 0, fwhm, area);
	}

	/** Area giving a profile of maximum {@code height}. */
	double area(final double fwhm, final double height) {
		return height / value(0, 0, fwhm, 1.0);
	}

	public String getModelName() {
		return modelName;
	}

	/** @throws IllegalArgumentException for unknown model names */
	public static PeakShape fromName(final String modelName) {
		for (final PeakShape s : values()) {
			if (s.modelName.equalsIgnoreCase(modelName)) return s;
		}
		throw new IllegalArgumentException("Unknown peak model: " + modelName);
	}
}
