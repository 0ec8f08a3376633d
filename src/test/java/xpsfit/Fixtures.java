/**
 * XPS Fit
 * Fixtures.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.HashMap;
import java.util.Map;

/** Spectra shared by the tests. */
final class Fixtures {

	/** Descending axis 10 .. 1. */
	static final double[] STEP_ENERGY = { 10, 9, 8, 7, 6, 5, 4, 3, 2, 1 };
	static final double[] STEP_INTENSITY = { 1, 1, 1, 5, 10, 10, 5, 1, 1, 1 };

	private Fixtures() {}

	static Map<String, Object> data(final double[] energy,
		final double[] intensity)
	{
		final Map<String, Object> data = new HashMap<>();
		data.put(Spectrum.ENERGY, energy);
		data.put(Spectrum.INTENSITY, intensity);
		data.put(Spectrum.NAME, "C 1s");
		data.put(Spectrum.EIS_REGION, 3);
		data.put(Spectrum.SWEEPS, 4);
		return data;
	}

	static Spectrum stepSpectrum() {
		return new Spectrum(data(STEP_ENERGY.clone(), STEP_INTENSITY.clone()));
	}

	/** Axis from 290 down to 280 eV in 0.05 eV steps. */
	static double[] axis() {
		final double[] e = new double[201];
		for (int i = 0; i < e.length; i++)
			e[i] = 290 - i * 0.05;
		return e;
	}

	/** Sum of Gaussians given as center, fwhm, area triplets. */
	static double[] gaussians(final double[] x, final double... cfa) {
		final double[] y = new double[x.length];
		for (int k = 0; k < cfa.length; k += 3) {
			for (int i = 0; i < x.length; i++)
				y[i] += PeakShape.GAUSSIAN.value(x[i], cfa[k], cfa[k + 1], cfa[k + 2]);
		}
		return y;
	}
}
