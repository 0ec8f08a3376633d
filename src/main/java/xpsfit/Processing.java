/**
 * XPS Fit
 * Processing.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.Arrays;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Array algorithms used by the spectrum pipeline: normalization, smoothing,
 * backgrounds and energy axis lookups. All methods return new arrays and
 * leave their arguments untouched.
 */
public final class Processing {

	/** Normalization value meaning "divide by the maximum". */
	public static final double NORM_AUTO = 1.0;
	public static final double SHIRLEY_TOLERANCE = 1e-5;
	public static final int SHIRLEY_MAX_ITERATIONS = 20;

	private Processing() {}

	/**
	 * Scales {@code x}. A {@code norm} of 0 leaves the values unchanged, a
	 * positive value other than {@link #NORM_AUTO} divides by it, anything
	 * else divides by the maximum of {@code x}.
	 */
	public static double[] normalize(final double[] x, final double norm) {
		if (norm == 0) return x.clone();
		final RealVector v = new ArrayRealVector(x);
		if (norm > 0 && norm != NORM_AUTO) return v.mapDivide(norm).toArray();
		final double max = v.getMaxValue();
		// all-zero or all-negative data has no meaningful maximum
		if (max <= 0 || Double.isNaN(max)) return x.clone();
		return v.mapDivide(max).toArray();
	}

	/**
	 * Centered moving average with a box of {@code window} samples. The
	 * ends are padded with the first and last averaged value so the result
	 * has the length of {@code x}. Windows of 0 or 1 return a copy.
	 */
	public static double[] movingAverage(final double[] x, final int window) {
		if (window < 0) throw new NotPositiveException(window);
		final int n = x.length;
		if (window <= 1 || n == 0) return x.clone();
		final int w = FastMath.min(window, n);

		final double[] cumsum = new double[n + 1];
		for (int i = 0; i < n; i++)
			cumsum[i + 1] = cumsum[i] + x[i];
		final int valid = n - w + 1;
		final double[] smoothed = new double[valid];
		for (int i = 0; i < valid; i++)
			smoothed[i] = (cumsum[i + w] - cumsum[i]) / w;

		final int left = w / 2;
		final double[] out = new double[n];
		Arrays.fill(out, 0, left, smoothed[0]);
		System.arraycopy(smoothed, 0, out, left, valid);
		Arrays.fill(out, left + valid, n, smoothed[valid - 1]);
		return out;
	}

	/** Straight line from the first to the last sample. */
	public static double[] linear(final double[] intensity) {
		final int n = intensity.length;
		if (n == 0) throw new NoDataException();
		final double[] out = new double[n];
		if (n == 1) {
			out[0] = intensity[0];
			return out;
		}
		final double first = intensity[0];
		final double step = (intensity[n - 1] - first) / (n - 1);
		for (int i = 0; i < n; i++)
			out[i] = first + step * i;
		out[n - 1] = intensity[n - 1];
		return out;
	}

	/** Shirley background with the default tolerance and iteration limit. */
	public static double[] shirley(final double[] energy,
		final double[] intensity)
	{
		return shirley(energy, intensity, SHIRLEY_TOLERANCE,
			SHIRLEY_MAX_ITERATIONS).getBackground();
	}

	/**
	 * Iterative Shirley background. The integration runs from the high
	 * energy end, so ascending input is reversed internally and the result
	 * is returned in the orientation of the input. Data whose integral
	 * vanishes (flat or zero amplitude) gets a flat background at the last
	 * intensity sample.
	 *
	 * @param energy energy axis, ascending or descending
	 * @param intensity intensities, same length as {@code energy}
	 * @param tol convergence threshold on the L2 norm of the update, relative
	 *          to the first intensity sample
	 * @param maxit maximum number of iterations
	 */
	public static ShirleyBackground shirley(final double[] energy,
		final double[] intensity, final double tol, final int maxit)
	{
		if (energy.length != intensity.length) throw new DimensionMismatchException(
			intensity.length, energy.length);
		final int n = energy.length;
		if (n == 0) throw new NoDataException();
		if (maxit < 0) throw new NotPositiveException(maxit);

		final boolean reversed = n > 1 && energy[0] < energy[n - 1];
		final double[] e = energy.clone();
		final double[] y = intensity.clone();
		if (reversed) {
			ArrayUtils.reverse(e);
			ArrayUtils.reverse(y);
		}

		final double first = y[0];
		final double last = y[n - 1];
		double[] background = new double[n];
		Arrays.fill(background, last);
		if (n < 2) return new ShirleyBackground(background, true, 0);

		final double spacing = (e[n - 1] - e[0]) / (n - 1);
		final double scale = first == 0 ? 1.0 : first;
		final double[] subtracted = new double[n];
		final double[] integral = new double[n];

		boolean converged = false;
		int iteration = 0;
		while (iteration < maxit) {
			iteration++;
			double sum = 0;
			for (int i = 0; i < n; i++) {
				subtracted[i] = y[i] - background[i];
				sum += subtracted[i];
			}
			double cumsum = 0;
			for (int i = 0; i < n; i++) {
				cumsum += subtracted[i];
				integral[i] = spacing * (sum - cumsum - 0.5 * (subtracted[i] +
					subtracted[n - 1]));
			}
			if (integral[0] == 0) {
				Arrays.fill(background, last);
				converged = true;
				break;
			}

			final double[] next = new double[n];
			for (int i = 0; i < n; i++)
				next[i] = (first - last) * integral[i] / integral[0] + last;
			final double change = new ArrayRealVector(next).subtract(
				new ArrayRealVector(background)).getNorm() / FastMath.abs(scale);
			background = next;
			if (change < tol) {
				converged = true;
				break;
			}
		}

		if (reversed) ArrayUtils.reverse(background);
		return new ShirleyBackground(background, converged, iteration);
	}

	/** @return true if the axis increases from its first to its last sample */
	public static boolean isAscending(final double[] axis) {
		return axis.length > 1 && axis[0] < axis[axis.length - 1];
	}

	/**
	 * Binary search on a monotonic axis of either direction. Returns the
	 * index of the first sample not before {@code value} in axis order,
	 * clamped to the valid index range.
	 */
	public static int searchIndex(final double[] axis, final double value) {
		final int n = axis.length;
		if (n == 0) throw new NoDataException();
		final boolean ascending = isAscending(axis);
		int lo = 0;
		int hi = n;
		while (lo < hi) {
			final int mid = (lo + hi) >>> 1;
			final boolean before = ascending ? axis[mid] < value : axis[mid] > value;
			if (before) lo = mid + 1;
			else hi = mid;
		}
		return FastMath.min(lo, n - 1);
	}

	/** Index of the sample closest to {@code value}. */
	public static int nearestIndex(final double[] axis, final double value) {
		if (axis.length == 0) throw new NoDataException();
		int best = 0;
		double bestDist = Double.POSITIVE_INFINITY;
		for (int i = 0; i < axis.length; i++) {
			final double d = FastMath.abs(axis[i] - value);
			if (d < bestDist) {
				bestDist = d;
				best = i;
			}
		}
		return best;
	}

	/**
	 * Energy of the highest intensity sample inside the span between
	 * {@code e1} and {@code e2} (in either order). If no sample lies in the
	 * span, the sample closest to its center is used.
	 */
	public static double energyAtMaximum(final double[] energy,
		final double[] intensity, final double e1, final double e2)
	{
		if (energy.length != intensity.length) throw new DimensionMismatchException(
			intensity.length, energy.length);
		final double lo = FastMath.min(e1, e2);
		final double hi = FastMath.max(e1, e2);
		int best = -1;
		for (int i = 0; i < energy.length; i++) {
			if (energy[i] < lo || energy[i] > hi) continue;
			if (best < 0 || intensity[i] > intensity[best]) best = i;
		}
		if (best < 0) best = nearestIndex(energy, (lo + hi) / 2);
		return energy[best];
	}
}
