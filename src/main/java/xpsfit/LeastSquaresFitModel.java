/**
 * XPS Fit
 * LeastSquaresFitModel.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.time.StopWatch;
import org.apache.commons.math3.analysis.MultivariateMatrixFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;
import org.scijava.log.LogService;

/**
 * Fits the sum of the peak profiles of one region to its background
 * subtracted intensity with a Levenberg-Marquardt optimizer.
 * <p>
 * Bounds are enforced by clamping every trial point. A tied parameter is
 * computed from another peak's parameter and is not varied by the
 * optimizer. Accepted expressions are a plain number, {@code B.center},
 * {@code B.center + 1.5}, {@code B.fwhm - 0.2}, {@code 0.5 * B.area} and
 * {@code B.area * 0.5}.
 * </p>
 */
public class LeastSquaresFitModel implements FitModel {

	private static final String[] PARAMETERS = { Peak.CENTER, Peak.FWHM,
		Peak.AREA };
	private static final int CENTER = 0;
	private static final int FWHM = 1;
	private static final int AREA = 2;
	private static final double FWHM_FLOOR = 1e-9;

	private final Region region;
	private final LogService log;
	private final Map<Peak, Component> components = new LinkedHashMap<>();
	private boolean fitted = false;
	private double rms = Double.NaN;

	public LeastSquaresFitModel(final Region region) {
		this.region = region;
		this.log = region.log();
	}

	private static int index(final String attr) {
		for (int i = 0; i < PARAMETERS.length; i++) {
			if (PARAMETERS[i].equals(attr)) return i;
		}
		throw new IllegalArgumentException("Unknown peak parameter: " + attr);
	}

	private Component component(final Peak peak) {
		final Component c = components.get(peak);
		if (c == null) throw new IllegalArgumentException(peak +
			" is not registered");
		return c;
	}

	@Override
	public void register(final Peak peak, final String modelName,
		final PeakParameters initial)
	{
		if (components.containsKey(peak)) throw new IllegalArgumentException(
			peak + " is already registered");
		final Component c = new Component(PeakShape.fromName(modelName));
		final PeakParameters start = initial == null ? new PeakParameters(null,
			null, null) : initial;
		if (start.getFwhm() != null && !(start.getFwhm() > 0))
			throw new IllegalArgumentException("FWHM must be positive: " + start
				.getFwhm());

		final double[] guess = start.isComplete() ? null : new ParameterGuesser(
			region.getEnergy(), residual(), c.shape).guess(start.getCenter());
		c.values[CENTER] = start.getCenter() != null ? start.getCenter()
			: guess[CENTER];
		c.values[FWHM] = start.getFwhm() != null ? start.getFwhm() : guess[FWHM];
		c.values[AREA] = start.getArea() != null ? start.getArea() : guess[AREA];
		components.put(peak, c);
		fitted = false;
	}

	@Override
	public void deregister(final Peak peak) {
		if (!components.containsKey(peak)) return;
		// ties to the peak are replaced by their current value
		for (final Map.Entry<Peak, Component> e : components.entrySet()) {
			final Component c = e.getValue();
			for (int i = 0; i < c.ties.length; i++) {
				if (c.ties[i] != null && c.ties[i].ref == peak) {
					log.info("Dropping tie " + e.getKey().getName() + "." +
						PARAMETERS[i] + " = " + c.ties[i].expr);
					c.values[i] = c.ties[i].value(components);
					c.ties[i] = null;
				}
			}
		}
		components.remove(peak);
		fitted = false;
	}

	@Override
	public void reinit(final Peak peak, final String modelName) {
		component(peak).shape = PeakShape.fromName(modelName);
		fitted = false;
	}

	@Override
	public boolean isRegistered(final Peak peak) {
		return components.containsKey(peak);
	}

	@Override
	public Double getParameter(final Peak peak, final String attr) {
		final Component c = components.get(peak);
		if (c == null) return null;
		final double[] v = resolved(c);
		if (Peak.HEIGHT.equals(attr)) return c.shape.height(v[FWHM], v[AREA]);
		return v[index(attr)];
	}

	@Override
	public void setParameter(final Peak peak, final String attr,
		final double value)
	{
		final Component c = component(peak);
		final int i = index(attr);
		if (c.ties[i] != null) throw new IllegalArgumentException(peak.getName() +
			"." + attr + " is tied to " + c.ties[i].expr);
		if (i == FWHM && !(value > 0)) throw new IllegalArgumentException(
			"FWHM must be positive: " + value);
		c.values[i] = value;
	}

	@Override
	public double[] evaluate(final Peak peak) {
		final Component c = components.get(peak);
		if (!fitted || c == null) return null;
		final double[] v = resolved(c);
		return c.shape.curve(region.getEnergy(), v[CENTER], v[FWHM], v[AREA]);
	}

	@Override
	public double[] evaluateRegionTotal() {
		if (!fitted) return null;
		return total(region.getEnergy());
	}

	@Override
	public boolean isFitted() {
		return fitted;
	}

	@Override
	public void dataChanged() {
		fitted = false;
	}

	/** Root mean square residual of the last successful fit. */
	public double getRms() {
		return rms;
	}

	private double[] total(final double[] x) {
		final RealVector sum = new ArrayRealVector(x.length);
		for (final Component c : components.values()) {
			final double[] v = resolved(c);
			sum.combineToSelf(1, 1, new ArrayRealVector(c.shape.curve(x,
				v[CENTER], v[FWHM], v[AREA]), false));
		}
		return sum.toArray();
	}

	/** Region data not explained by the registered peaks. */
	private double[] residual() {
		return new ArrayRealVector(region.getSubtractedIntensity(), false)
			.subtract(new ArrayRealVector(total(region.getEnergy()), false))
			.toArray();
	}

	/** Current values with ties applied. */
	private double[] resolved(final Component c) {
		final double[] v = c.values.clone();
		for (int i = 0; i < v.length; i++) {
			if (c.ties[i] != null) v[i] = c.ties[i].value(components);
		}
		v[FWHM] = FastMath.max(v[FWHM], FWHM_FLOOR);
		return v;
	}

	@Override
	public boolean fitRegion() {
		if (components.isEmpty()) {
			log.warn("No peaks to fit in " + region.getName());
			return false;
		}
		final double[] x = region.getEnergy();
		final double[] y = region.getSubtractedIntensity();

		final List<Component> order = new ArrayList<>(components.values());
		final List<int[]> free = new ArrayList<>();
		for (int k = 0; k < order.size(); k++) {
			for (int i = 0; i < PARAMETERS.length; i++) {
				if (order.get(k).ties[i] == null) free.add(new int[] { k, i });
			}
		}
		if (free.isEmpty()) {
			fitted = true;
			rms = rms(y, total(x));
			return true;
		}
		if (x.length < free.size()) {
			log.warn("Not enough data points (" + x.length + ") for " + free
				.size() + " free parameters in " + region.getName());
			return false;
		}

		final double[] start = new double[free.size()];
		for (int j = 0; j < start.length; j++)
			start[j] = order.get(free.get(j)[0]).values[free.get(j)[1]];
		final Problem fn = new Problem(x, order, free);
		final BoundsValidator validator = new BoundsValidator(order, free);

		final LeastSquaresProblem problem = new LeastSquaresBuilder()
			.parameterValidator(validator).maxEvaluations(Integer.MAX_VALUE)
			.maxIterations(region.getSpectrum().getPreferences()
				.getFitMaxIterations()).lazyEvaluation(false).start(validator.validate(
					new ArrayRealVector(start))).target(y).model(fn, fn.jacobian())
			.build();

		final StopWatch sw = new StopWatch();
		sw.start();
		final Optimum optimum;
		try {
			optimum = getOptimizer().optimize(problem);
		}
		catch (final MathIllegalStateException e) {
			log.warn("Fit of " + region.getName() + " failed: " + e.getMessage());
			return false;
		}
		sw.stop();

		fn.apply(optimum.getPoint().toArray());
		fitted = true;
		rms = optimum.getRMS();
		log.info(String.format("%s: %d peaks, RMS %.4g after %d iterations. " +
			"Time elapsed: %.1f s", region.getName(), order.size(), rms, optimum
				.getIterations(), sw.getTime() / 1000.0));
		return true;
	}

	protected LeastSquaresOptimizer getOptimizer() {
		return new LevenbergMarquardtOptimizer().withCostRelativeTolerance(1e-10)
			.withParameterRelativeTolerance(1e-10);
	}

	private static double rms(final double[] y, final double[] model) {
		return new ArrayRealVector(y, false).getDistance(new ArrayRealVector(model,
			false)) / FastMath.sqrt(FastMath.max(1, y.length));
	}

	@Override
	public void setConstraint(final Peak peak, final String attr,
		final Double min, final Double max, final String expr)
	{
		final Component c = component(peak);
		final int i = index(attr);
		// nothing is stored until the whole constraint is valid
		Double lower = c.min[i];
		Double upper = c.max[i];
		if (min != null) lower = Double.isInfinite(min) ? null : min;
		if (max != null) upper = Double.isInfinite(max) ? null : max;
		if (lower != null && upper != null && lower > upper)
			throw new IllegalArgumentException("Lower bound " + lower +
				" above upper bound " + upper + " for " + attr);
		Tie tie = c.ties[i];
		if (expr != null) tie = expr.trim().isEmpty() ? null : parseTie(peak, i,
			expr);

		c.min[i] = lower;
		c.max[i] = upper;
		c.ties[i] = tie;
		c.values[i] = c.clamp(i, c.values[i]);
		fitted = false;
	}

	@Override
	public Object getConstraint(final Peak peak, final String attr,
		final String argname)
	{
		final Component c = component(peak);
		final int i = index(attr);
		switch (argname) {
			case Peak.MIN:
				return c.min[i];
			case Peak.MAX:
				return c.max[i];
			case Peak.EXPR:
				return c.ties[i] == null ? null : c.ties[i].expr;
			case "value":
				return resolved(c)[i];
			default:
				throw new IllegalArgumentException("Unknown constraint argument: " +
					argname);
		}
	}

	// -- Ties --

	private static final String NUM =
		"[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?";
	private static final String REF = "([A-Za-z]+)\\.(center|fwhm|area)";
	private static final Pattern NUMBER = Pattern.compile("\\s*(" + NUM +
		")\\s*");
	private static final Pattern SCALED_LEFT = Pattern.compile("\\s*(" + NUM +
		")\\s*\\*\\s*" + REF + "\\s*");
	private static final Pattern SCALED_RIGHT = Pattern.compile("\\s*" + REF +
		"\\s*\\*\\s*(" + NUM + ")\\s*");
	private static final Pattern SHIFTED = Pattern.compile("\\s*" + REF +
		"\\s*(?:([-+])\\s*(" + NUM + "))?\\s*");

	private Tie parseTie(final Peak owner, final int param, final String expr) {
		Matcher m = NUMBER.matcher(expr);
		if (m.matches()) return new Tie(expr, null, -1, 0, Double.parseDouble(m
			.group(1)));

		String refName;
		String refAttr;
		double factor = 1;
		double offset = 0;
		if ((m = SCALED_LEFT.matcher(expr)).matches()) {
			factor = Double.parseDouble(m.group(1));
			refName = m.group(2);
			refAttr = m.group(3);
		}
		else if ((m = SCALED_RIGHT.matcher(expr)).matches()) {
			refName = m.group(1);
			refAttr = m.group(2);
			factor = Double.parseDouble(m.group(3));
		}
		else if ((m = SHIFTED.matcher(expr)).matches()) {
			refName = m.group(1);
			refAttr = m.group(2);
			if (m.group(3) != null) {
				offset = Double.parseDouble(m.group(4));
				if (m.group(3).equals("-")) offset = -offset;
			}
		}
		else throw new IllegalArgumentException("Invalid expression: " + expr);

		Peak ref = null;
		for (final Peak p : components.keySet()) {
			if (p.getName().equals(refName)) ref = p;
		}
		if (ref == null) throw new IllegalArgumentException("Unknown peak " +
			refName + " in expression: " + expr);
		if (ref == owner) throw new IllegalArgumentException(
			"Expression refers to its own peak: " + expr);
		final int refParam = index(refAttr);
		if (components.get(ref).ties[refParam] != null)
			throw new IllegalArgumentException(refName + "." + refAttr +
				" is itself tied: " + expr);
		for (final Component c : components.values()) {
			for (final Tie t : c.ties) {
				if (t != null && t.ref == owner && t.param == param)
					throw new IllegalArgumentException(owner.getName() + "." +
						PARAMETERS[param] + " is referenced by another expression");
			}
		}
		return new Tie(expr, ref, refParam, factor, offset);
	}

	/** Fit state of one peak. */
	private static final class Component {

		private PeakShape shape;
		private final double[] values = new double[PARAMETERS.length];
		private final Double[] min = new Double[PARAMETERS.length];
		private final Double[] max = new Double[PARAMETERS.length];
		private final Tie[] ties = new Tie[PARAMETERS.length];

		private Component(final PeakShape shape) {
			this.shape = shape;
		}

		private double clamp(final int i, final double v) {
			double out = v;
			if (min[i] != null) out = FastMath.max(out, min[i]);
			if (max[i] != null) out = FastMath.min(out, max[i]);
			if (i == FWHM) out = FastMath.max(out, FWHM_FLOOR);
			return out;
		}
	}

	/** {@code factor * ref + offset}, or {@code offset} alone without ref. */
	private static final class Tie {

		private final String expr;
		private final Peak ref;
		private final int param;
		private final double factor;
		private final double offset;

		private Tie(final String expr, final Peak ref, final int param,
			final double factor, final double offset)
		{
			this.expr = expr.trim();
			this.ref = ref;
			this.param = param;
			this.factor = factor;
			this.offset = offset;
		}

		private double value(final Map<Peak, Component> components) {
			if (ref == null) return offset;
			return factor * components.get(ref).values[param] + offset;
		}
	}

	/** Clamps the free parameters to their bounds. */
	private static final class BoundsValidator implements ParameterValidator {

		private final List<Component> order;
		private final List<int[]> free;

		private BoundsValidator(final List<Component> order,
			final List<int[]> free)
		{
			this.order = order;
			this.free = free;
		}

		@Override
		public RealVector validate(final RealVector params) {
			final RealVector out = params.copy();
			for (int j = 0; j < free.size(); j++) {
				final int[] f = free.get(j);
				out.setEntry(j, order.get(f[0]).clamp(f[1], params.getEntry(j)));
			}
			return out;
		}
	}

	/**
	 * Model values over the region axis as a function of the free
	 * parameters; the Jacobian is taken by forward differences.
	 */
	private final class Problem implements MultivariateVectorFunction {

		private final double[] x;
		private final List<Component> order;
		private final List<int[]> free;

		private Problem(final double[] x, final List<Component> order,
			final List<int[]> free)
		{
			this.x = x;
			this.order = order;
			this.free = free;
		}

		/** Writes the free parameters back into the components. */
		private void apply(final double[] point) {
			for (int j = 0; j < point.length; j++) {
				final int[] f = free.get(j);
				order.get(f[0]).values[f[1]] = point[j];
			}
		}

		@Override
		public double[] value(final double[] point) {
			final double[] saved = new double[point.length];
			for (int j = 0; j < point.length; j++) {
				final int[] f = free.get(j);
				saved[j] = order.get(f[0]).values[f[1]];
			}
			apply(point);
			try {
				return total(x);
			}
			finally {
				apply(saved);
			}
		}

		private MultivariateMatrixFunction jacobian() {
			return new MultivariateMatrixFunction() {

				@Override
				public double[][] value(final double[] point) {
					final double[] y0 = Problem.this.value(point);
					final double[][] jac = new double[x.length][point.length];
					for (int j = 0; j < point.length; j++) {
						final double h = 1e-7 * FastMath.max(FastMath.abs(point[j]), 1e-3);
						final double[] shifted = point.clone();
						shifted[j] += h;
						final double[] y1 = Problem.this.value(shifted);
						for (int i = 0; i < x.length; i++)
							jac[i][j] = (y1[i] - y0[i]) / h;
					}
					return jac;
				}
			};
		}
	}

	/**
	 * Estimates a starting point for a new peak from the data not yet
	 * explained by other peaks: the center at the maximum, the FWHM from the
	 * half-maximum crossings on both sides, and the area from height and
	 * FWHM.
	 */
	static class ParameterGuesser {

		private final double[] x;
		private final double[] y;
		private final PeakShape shape;

		ParameterGuesser(final double[] x, final double[] y,
			final PeakShape shape)
		{
			this.x = x;
			this.y = y;
			this.shape = shape;
		}

		/**
		 * @param center fixed center, or null to use the highest sample
		 * @return center, FWHM and area
		 */
		double[] guess(final Double center) {
			final int n = x.length;
			int pkPos = 0;
			if (center != null) pkPos = Processing.nearestIndex(x, center);
			else {
				for (int i = 1; i < n; i++) {
					if (y[i] > y[pkPos]) pkPos = i;
				}
			}
			final double mean = center != null ? center : x[pkPos];
			final double span = FastMath.abs(x[n - 1] - x[0]);
			double height = y[pkPos];
			if (!(height > 0)) height = 1e-3 * FastMath.max(new ArrayRealVector(y)
				.getLInfNorm(), 1.0);
			final double hm = height / 2.0;

			// Right side, check 3 consecutive points for smoothing
			double rwhm = Double.NaN;
			for (int p = pkPos; p < n && Double.isNaN(rwhm); p++) {
				if (below(p, hm) && below(p + 1, hm) && below(p + 2, hm)) rwhm =
					FastMath.abs(x[p] - mean);
			}
			// Left side
			double lwhm = Double.NaN;
			for (int p = pkPos; p >= 0 && Double.isNaN(lwhm); p--) {
				if (below(p, hm) && below(p - 1, hm) && below(p - 2, hm)) lwhm =
					FastMath.abs(mean - x[p]);
			}

			double fwhm;
			if (!Double.isNaN(rwhm) && !Double.isNaN(lwhm)) fwhm = 2 * FastMath.min(
				lwhm, rwhm);
			else if (!Double.isNaN(rwhm)) fwhm = 2 * rwhm;
			else if (!Double.isNaN(lwhm)) fwhm = 2 * lwhm;
			else fwhm = span / 4;
			if (!(fwhm > 0)) fwhm = span > 0 ? span / 4 : 1.0;

			return new double[] { mean, fwhm, shape.area(fwhm, height) };
		}

		// Samples beyond the ends count as below.
		private boolean below(final int i, final double level) {
			return i < 0 || i >= y.length || y[i] < level;
		}
	}
}
