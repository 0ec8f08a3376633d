/**
 * XPS Fit
 * Region.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.util.FastMath;
import org.scijava.log.LogService;

/**
 * Energy sub-range of a {@link Spectrum} with its own background and peaks.
 * <p>
 * {@code emin} and {@code emax} are kept as given; the slice always spans
 * the samples between the numerically smaller and larger bound, whichever
 * direction the energy axis runs in. Slice and background are recomputed
 * eagerly whenever their inputs change.
 * </p>
 */
public class Region {

	public static final String EMIN = "emin";
	public static final String EMAX = "emax";
	public static final String BGTYPE = "bgtype";
	public static final String NAME = "name";
	public static final String PEAKS = "peaks";
	public static final String PEAK_COUNTER = "peak_counter";
	public static final String SPECTRUM_CHANGED = "spectrum_changed";

	private final long sid = Identifiers.next();
	private final Spectrum spectrum;
	private final LogService log;
	private final EventChannel channel;
	private final FitModel model;

	private double emin;
	private double emax;
	private BackgroundType bgtype;
	private String name;

	private int lo = -1;
	private int hi = -1;
	private double[] energy;
	private double[] intensity;
	private Optional<double[]> background = Optional.empty();
	private long generation = 0;

	private final List<Peak> peaks = new ArrayList<>();
	private int peakCounter = 0;

	Region(final Spectrum spectrum, final double emin, final double emax,
		final BackgroundType bgtype, final String name,
		final FitModelFactory factory)
	{
		if (spectrum == null) throw new MissingFieldException("Region",
			"spectrum");
		if (bgtype == null) throw new MissingFieldException("Region", BGTYPE);
		this.spectrum = spectrum;
		this.log = spectrum.log();
		this.channel = new EventChannel(this, log);
		this.emin = emin;
		this.emax = emax;
		this.bgtype = bgtype;
		this.name = name;
		slice(true);
		computeBackground();
		this.model = factory.create(this);
	}

	/**
	 * Locates both bounds on the processed axis and copies the samples in
	 * between, both ends included.
	 *
	 * @return true if the cached slice changed
	 */
	private boolean slice(final boolean force) {
		final double[] axis = spectrum.energyView();
		final int i1 = Processing.searchIndex(axis, FastMath.min(emin, emax));
		final int i2 = Processing.searchIndex(axis, FastMath.max(emin, emax));
		final int newLo = FastMath.min(i1, i2);
		final int newHi = FastMath.max(i1, i2);
		if (!force && newLo == lo && newHi == hi) return false;
		lo = newLo;
		hi = newHi;
		energy = Arrays.copyOfRange(axis, lo, hi + 1);
		intensity = Arrays.copyOfRange(spectrum.intensityView(), lo, hi + 1);
		return true;
	}

	private void computeBackground() {
		switch (bgtype) {
			case LINEAR:
				background = Optional.of(Processing.linear(intensity));
				break;
			case SHIRLEY:
				final FitPreferences prefs = spectrum.getPreferences();
				final ShirleyBackground sb = Processing.shirley(energy, intensity,
					prefs.getShirleyTolerance(), prefs.getShirleyMaxIterations());
				if (!sb.isConverged()) log.warn("shirley: Max iterations (" + sb
					.getIterations() + ") exceeded before convergence in " + name +
					" of " + spectrum.getName());
				background = Optional.of(sb.getBackground());
				break;
			default:
				background = Optional.empty();
		}
		generation++;
	}

	/**
	 * Applies the given changes; null arguments are left untouched. Emits
	 * {@link EventKind#CHANGED_REGION} with the keys that actually changed.
	 */
	private void update(final Double newEmin, final Double newEmax,
		final BackgroundType newBgtype, final boolean spectrumChanged)
	{
		final Map<String, Object> changed = new LinkedHashMap<>();
		boolean rangeChanged = false;
		if (newEmin != null && newEmin.doubleValue() != emin) {
			emin = newEmin;
			changed.put(EMIN, emin);
			rangeChanged = true;
		}
		if (newEmax != null && newEmax.doubleValue() != emax) {
			emax = newEmax;
			changed.put(EMAX, emax);
			rangeChanged = true;
		}
		boolean bgChanged = false;
		if (newBgtype != null && newBgtype != bgtype) {
			bgtype = newBgtype;
			changed.put(BGTYPE, bgtype.getLabel());
			bgChanged = true;
		}
		if (spectrumChanged) changed.put(SPECTRUM_CHANGED, true);
		if (changed.isEmpty()) return;

		boolean sliceChanged = false;
		if (rangeChanged || spectrumChanged) sliceChanged = slice(spectrumChanged);
		if (sliceChanged || bgChanged) {
			computeBackground();
			model.dataChanged();
		}
		channel.emit(EventKind.CHANGED_REGION, changed);
	}

	/** Called by the owning spectrum after its processed arrays changed. */
	void spectrumChanged() {
		update(null, null, null, true);
	}

	public long getSid() {
		return sid;
	}

	public Spectrum getSpectrum() {
		return spectrum;
	}

	public FitModel getFitModel() {
		return model;
	}

	LogService log() {
		return log;
	}

	public String getName() {
		return name;
	}

	public void setName(final String name) {
		if (name == null || name.equals(this.name)) return;
		this.name = name;
		channel.emit(EventKind.CHANGED_REGION, EventChannel.fields(NAME, name));
	}

	public double getEmin() {
		return emin;
	}

	public void setEmin(final double emin) {
		update(emin, null, null, false);
	}

	public double getEmax() {
		return emax;
	}

	public void setEmax(final double emax) {
		update(null, emax, null, false);
	}

	public void setRange(final double emin, final double emax) {
		update(emin, emax, null, false);
	}

	public BackgroundType getBgtype() {
		return bgtype;
	}

	public void setBgtype(final BackgroundType bgtype) {
		if (bgtype == null) throw new NullPointerException("bgtype");
		update(null, null, bgtype, false);
	}

	/** Incremented on every recomputation of the background. */
	public long getGeneration() {
		return generation;
	}

	/** Index of the first sample of the slice in the spectrum arrays. */
	public int getStartIndex() {
		return lo;
	}

	/** Index of the last sample of the slice, inclusive. */
	public int getEndIndex() {
		return hi;
	}

	public double[] getEnergy() {
		return energy.clone();
	}

	public double[] getIntensity() {
		return intensity.clone();
	}

	/** Empty for {@link BackgroundType#NONE}. */
	public Optional<double[]> getBackground() {
		return background.map(double[]::clone);
	}

	/** Slice intensity minus the background, the data peaks are fitted to. */
	public double[] getSubtractedIntensity() {
		if (!background.isPresent()) return intensity.clone();
		return new ArrayRealVector(intensity).subtract(new ArrayRealVector(
			background.get())).toArray();
	}

	/**
	 * @return the background at the sample closest to {@code e}, or null if
	 *         the region has no background
	 */
	public Double backgroundFromEnergy(final double e) {
		if (!background.isPresent()) return null;
		return background.get()[Processing.nearestIndex(energy, e)];
	}

	// -- Peaks --

	public List<Peak> getPeaks() {
		return Collections.unmodifiableList(new ArrayList<>(peaks));
	}

	public Peak addPeak() {
		return addPeak(spectrum.getPreferences().getPeakModel(), null);
	}

	public Peak addPeak(final String modelName) {
		return addPeak(modelName, null);
	}

	/**
	 * Creates a peak named by the next letter sequence and registers it with
	 * the fit model.
	 *
	 * @param initial starting values, or null to estimate them
	 */
	public Peak addPeak(final String modelName, final PeakParameters initial) {
		return added(createPeak(nextPeakName(), modelName, initial));
	}

	/**
	 * Creates a peak from a mapping with optional {@code name},
	 * {@code model_name}, {@code center}, {@code fwhm}, {@code area} and
	 * {@code constraints}. Expressions may only refer to existing peaks.
	 *
	 * @throws IllegalArgumentException if a peak of that name exists
	 */
	public Peak addPeak(final Map<String, ?> data) {
		final Peak peak = restorePeak(data);
		restoreConstraints(peak, data);
		return added(peak);
	}

	/**
	 * Restores the peaks of a region mapping. Constraints are applied once
	 * every peak is registered, so expressions may refer to later peaks.
	 */
	void restorePeaks(final Map<String, ?> data) {
		peakCounter = FastMath.max(peakCounter, MapValues.getInt(data,
			PEAK_COUNTER, 0));
		final List<Map<String, ?>> maps = MapValues.getMapList(data, PEAKS);
		final List<Peak> restored = new ArrayList<>(maps.size());
		for (final Map<String, ?> m : maps)
			restored.add(restorePeak(m));
		for (int i = 0; i < maps.size(); i++)
			restoreConstraints(restored.get(i), maps.get(i));
		for (final Peak p : restored)
			added(p);
	}

	private Peak restorePeak(final Map<String, ?> data) {
		String peakName = MapValues.getString(data, Peak.NAME, "");
		if (peakName.isEmpty()) peakName = nextPeakName();
		else {
			if (getPeak(peakName) != null) throw new IllegalArgumentException(
				"Duplicate peak name " + peakName + " in " + name);
			// later peaks must not reuse a restored label
			peakCounter = FastMath.max(peakCounter, peakIndex(peakName) + 1);
		}
		final String modelName = MapValues.getString(data, Peak.MODEL_NAME,
			spectrum.getPreferences().getPeakModel());
		final PeakParameters initial = new PeakParameters(MapValues
			.getNullableDouble(data, Peak.CENTER), MapValues.getNullableDouble(data,
				Peak.FWHM), MapValues.getNullableDouble(data, Peak.AREA));
		return createPeak(peakName, modelName, initial);
	}

	private void restoreConstraints(final Peak peak,
		final Map<String, ?> data)
	{
		final Map<String, ?> constraints = MapValues.getMap(data,
			Peak.CONSTRAINTS);
		for (final String attr : constraints.keySet()) {
			final Map<String, ?> c = MapValues.getMap(constraints, attr);
			model.setConstraint(peak, attr, MapValues.getNullableDouble(c,
				Peak.MIN), MapValues.getNullableDouble(c, Peak.MAX), MapValues
					.getString(c, Peak.EXPR, null));
		}
	}

	private Peak createPeak(final String peakName, final String modelName,
		final PeakParameters initial)
	{
		final Peak peak = new Peak(this, peakName, modelName);
		model.register(peak, modelName, initial);
		peaks.add(peak);
		for (final ModelListener l : channel.getListeners())
			peak.subscribe(l);
		return peak;
	}

	private Peak added(final Peak peak) {
		channel.emit(EventKind.ADD_PEAK, EventChannel.fields("peak", peak));
		return peak;
	}

	private String nextPeakName() {
		return peakLabel(peakCounter++);
	}

	/** A, B, ..., Z, AA, AB, ... for index 0, 1, ... */
	static String peakLabel(final int index) {
		final StringBuilder sb = new StringBuilder();
		int i = index + 1;
		while (i > 0) {
			i--;
			sb.insert(0, (char) ('A' + i % 26));
			i /= 26;
		}
		return sb.toString();
	}

	/** Inverse of {@link #peakLabel}; -1 for names outside the sequence. */
	static int peakIndex(final String label) {
		if (label.isEmpty() || label.length() > 6) return -1;
		int index = 0;
		for (int k = 0; k < label.length(); k++) {
			final char ch = label.charAt(k);
			if (ch < 'A' || ch > 'Z') return -1;
			index = index * 26 + (ch - 'A' + 1);
		}
		return index - 1;
	}

	/**
	 * Deregisters the peak from the fit model and removes it.
	 *
	 * @return false if the peak does not belong to this region
	 */
	public boolean removePeak(final Peak peak) {
		if (!peaks.remove(peak)) return false;
		model.deregister(peak);
		for (final ModelListener l : channel.getListeners())
			peak.unsubscribe(l);
		channel.emit(EventKind.REMOVE_PEAK, EventChannel.fields("peak", peak));
		return true;
	}

	public void clearPeaks() {
		for (final Peak p : new ArrayList<>(peaks))
			removePeak(p);
	}

	public Peak getPeak(final String peakName) {
		for (final Peak p : peaks) {
			if (p.getName().equals(peakName)) return p;
		}
		return null;
	}

	/** Runs the fit model on this region and reports the outcome. */
	public boolean fit() {
		final boolean success = model.fitRegion();
		channel.emit(EventKind.FIT, EventChannel.fields("success", success));
		return success;
	}

	/** Sum of the fitted peaks, or null before a successful fit. */
	public double[] getFitIntensity() {
		return model.evaluateRegionTotal();
	}

	// -- Subscriptions --

	/** Subscribes to this region and all of its current and future peaks. */
	public void subscribe(final ModelListener listener) {
		channel.subscribe(listener);
		for (final Peak p : peaks)
			p.subscribe(listener);
	}

	public void unsubscribe(final ModelListener listener) {
		channel.unsubscribe(listener);
		for (final Peak p : peaks)
			p.unsubscribe(listener);
	}

	public List<ModelListener> getListeners() {
		return channel.getListeners();
	}

	Map<String, Object> toMap() {
		final Map<String, Object> map = new LinkedHashMap<>();
		map.put(NAME, name);
		map.put(EMIN, emin);
		map.put(EMAX, emax);
		map.put(BGTYPE, bgtype.getLabel());
		map.put(PEAK_COUNTER, peakCounter);
		final ArrayList<Map<String, Object>> peakMaps = new ArrayList<>();
		for (final Peak p : peaks)
			peakMaps.add(p.toMap());
		map.put(PEAKS, peakMaps);
		return map;
	}

	@Override
	public String toString() {
		return name + " [" + emin + ", " + emax + "] of " + spectrum.getName();
	}
}
