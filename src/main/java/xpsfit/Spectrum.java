/**
 * XPS Fit
 * Spectrum.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.util.FastMath;
import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

/**
 * One measured energy/intensity curve with its metadata, processing
 * parameters and regions.
 * <p>
 * The processed arrays are {@code energy = raw energy + calibration} and
 * {@code intensity = movingAverage(normalize(raw intensity, norm),
 * smoothness)}. They are recomputed as soon as one of the parameters
 * changes, before regions are updated and before the change event goes out.
 * </p>
 */
public class Spectrum {

	public static final String ENERGY = "energy";
	public static final String INTENSITY = "intensity";
	public static final String NAME = "name";
	public static final String NOTES = "notes";
	public static final String EIS_REGION = "eis_region";
	public static final String FNAME = "fname";
	public static final String SWEEPS = "sweeps";
	public static final String DWELLTIME = "dwelltime";
	public static final String PASSENERGY = "passenergy";
	public static final String VISIBILITY = "visibility";
	public static final String SMOOTHNESS = "smoothness";
	public static final String CALIBRATION = "calibration";
	public static final String NORM = "norm";
	public static final String REGIONS = "regions";
	public static final String REGION_COUNTER = "region_counter";

	/** Spectrum, background, region markers and peak overlays. */
	public static final String DEFAULT_VISIBILITY = "dbrp";

	@Parameter
	private LogService log;

	private final long sid = Identifiers.next();
	private final EventChannel channel;
	private final FitPreferences prefs;
	private FitModelFactory fitModelFactory = LeastSquaresFitModel::new;

	private final double[] rawEnergy;
	private final double[] rawIntensity;
	private double[] energy;
	private double[] intensity;
	private long generation = 0;

	private String name;
	private String notes;
	private int eisRegion;
	private String fname;
	private int sweeps;
	private double dwelltime;
	private double passenergy;
	private String visibility;

	private int smoothness;
	private double calibration;
	private double norm;

	private final List<Region> regions = new ArrayList<>();
	private static final Pattern REGION_NAME = Pattern.compile(
		"Region (\\d{1,9})");

	private int regionCounter = 0;

	public Spectrum(final Map<String, ?> data) {
		this(data, new FitPreferences(), Logging.fallback());
	}

	public Spectrum(final Map<String, ?> data, final Context context) {
		this(data, new FitPreferences(), context);
	}

	public Spectrum(final Map<String, ?> data, final FitPreferences prefs,
		final Context context)
	{
		context.inject(this);
		this.prefs = prefs;
		this.channel = new EventChannel(this, log);
		this.rawEnergy = MapValues.array(data, ENERGY, "Spectrum");
		this.rawIntensity = MapValues.array(data, INTENSITY, "Spectrum");
		init(data);
	}

	public Spectrum(final Map<String, ?> data, final FitPreferences prefs,
		final LogService log)
	{
		this.log = log;
		this.prefs = prefs;
		this.channel = new EventChannel(this, log);
		this.rawEnergy = MapValues.array(data, ENERGY, "Spectrum");
		this.rawIntensity = MapValues.array(data, INTENSITY, "Spectrum");
		init(data);
	}

	private void init(final Map<String, ?> data) {
		if (rawEnergy.length != rawIntensity.length)
			throw new DimensionMismatchException(rawIntensity.length,
				rawEnergy.length);
		if (rawEnergy.length == 0) throw new NoDataException();

		eisRegion = MapValues.getInt(data, EIS_REGION, 0);
		name = MapValues.getString(data, NAME, "");
		if (name.isEmpty()) name = "(R " + eisRegion + ")";
		notes = MapValues.getString(data, NOTES, "");
		fname = MapValues.getString(data, FNAME, "");
		sweeps = MapValues.getInt(data, SWEEPS, 0);
		if (sweeps < 0) throw new NotPositiveException(sweeps);
		dwelltime = MapValues.getDouble(data, DWELLTIME, 0.0);
		passenergy = MapValues.getDouble(data, PASSENERGY, 0.0);
		visibility = MapValues.getString(data, VISIBILITY, "");
		smoothness = MapValues.getInt(data, SMOOTHNESS, 0);
		if (smoothness < 0) throw new NotPositiveException(smoothness);
		calibration = MapValues.getDouble(data, CALIBRATION, 0.0);
		norm = MapValues.getDouble(data, NORM, 0.0);

		computeEnergy();
		computeIntensity();

		regionCounter = MapValues.getInt(data, REGION_COUNTER, 0);
		for (final Map<String, ?> r : MapValues.getMapList(data, REGIONS))
			restoreRegion(r);
	}

	private void computeEnergy() {
		energy = new ArrayRealVector(rawEnergy).mapAdd(calibration).toArray();
		generation++;
	}

	private void computeIntensity() {
		intensity = Processing.movingAverage(Processing.normalize(rawIntensity,
			norm), smoothness);
		generation++;
	}

	/** Re-slices every region, then notifies subscribers. */
	private void processingChanged(final String attr, final Object value) {
		for (final Region r : new ArrayList<>(regions))
			r.spectrumChanged();
		changed(attr, value);
	}

	private void changed(final String attr, final Object value) {
		channel.emit(EventKind.CHANGED_SPECTRUM, EventChannel.fields("attr", attr,
			"value", value));
	}

	public long getSid() {
		return sid;
	}

	/** Incremented on every recomputation of the processed arrays. */
	public long getGeneration() {
		return generation;
	}

	public FitPreferences getPreferences() {
		return prefs;
	}

	LogService log() {
		return log;
	}

	/** Calibrated energy axis. */
	public double[] getEnergy() {
		return energy.clone();
	}

	/** Normalized and smoothed intensities. */
	public double[] getIntensity() {
		return intensity.clone();
	}

	public double[] getRawEnergy() {
		return rawEnergy.clone();
	}

	public double[] getRawIntensity() {
		return rawIntensity.clone();
	}

	// No copies, for slicing by the owned regions.
	double[] energyView() {
		return energy;
	}

	double[] intensityView() {
		return intensity;
	}

	public int size() {
		return rawEnergy.length;
	}

	public double getCalibration() {
		return calibration;
	}

	public void setCalibration(final double calibration) {
		if (calibration == this.calibration) return;
		this.calibration = calibration;
		computeEnergy();
		processingChanged(CALIBRATION, calibration);
	}

	public int getSmoothness() {
		return smoothness;
	}

	public void setSmoothness(final int smoothness) {
		if (smoothness < 0) throw new NotPositiveException(smoothness);
		if (smoothness == this.smoothness) return;
		this.smoothness = smoothness;
		computeIntensity();
		processingChanged(SMOOTHNESS, smoothness);
	}

	public double getNorm() {
		return norm;
	}

	/**
	 * @param norm 0 to switch normalization off, {@link Processing#NORM_AUTO}
	 *          to divide by the maximum, another positive value to divide by
	 *          it
	 */
	public void setNorm(final double norm) {
		if (norm == this.norm) return;
		this.norm = norm;
		computeIntensity();
		processingChanged(NORM, norm);
	}

	/**
	 * Energy of the highest processed intensity between {@code e1} and
	 * {@code e2}.
	 */
	public double getEnergyAtMaximum(final double e1, final double e2) {
		return Processing.energyAtMaximum(energy, intensity, e1, e2);
	}

	/**
	 * Calibration that moves the maximum found between {@code e1} and
	 * {@code e2} to {@code target}.
	 */
	public double calibrationFor(final double e1, final double e2,
		final double target)
	{
		return target - getEnergyAtMaximum(e1, e2) + calibration;
	}

	public String getName() {
		return name;
	}

	public void setName(final String name) {
		if (Objects.equals(name, this.name)) return;
		this.name = name;
		changed(NAME, name);
	}

	public String getNotes() {
		return notes;
	}

	public void setNotes(final String notes) {
		if (Objects.equals(notes, this.notes)) return;
		this.notes = notes;
		changed(NOTES, notes);
	}

	public int getEisRegion() {
		return eisRegion;
	}

	public void setEisRegion(final int eisRegion) {
		if (eisRegion == this.eisRegion) return;
		this.eisRegion = eisRegion;
		changed(EIS_REGION, eisRegion);
	}

	public String getFname() {
		return fname;
	}

	public void setFname(final String fname) {
		if (Objects.equals(fname, this.fname)) return;
		this.fname = fname;
		changed(FNAME, fname);
	}

	public int getSweeps() {
		return sweeps;
	}

	public void setSweeps(final int sweeps) {
		if (sweeps < 0) throw new NotPositiveException(sweeps);
		if (sweeps == this.sweeps) return;
		this.sweeps = sweeps;
		changed(SWEEPS, sweeps);
	}

	public double getDwelltime() {
		return dwelltime;
	}

	public void setDwelltime(final double dwelltime) {
		if (dwelltime == this.dwelltime) return;
		this.dwelltime = dwelltime;
		changed(DWELLTIME, dwelltime);
	}

	public double getPassenergy() {
		return passenergy;
	}

	public void setPassenergy(final double passenergy) {
		if (passenergy == this.passenergy) return;
		this.passenergy = passenergy;
		changed(PASSENERGY, passenergy);
	}

	public String getVisibility() {
		return visibility;
	}

	public void setVisibility(final String visibility) {
		final String v = visibility == null ? "" : visibility;
		if (v.equals(this.visibility)) return;
		this.visibility = v;
		changed(VISIBILITY, v);
	}

	/** @param flag one of {@code d}, {@code b}, {@code r}, {@code p} */
	public boolean isVisible(final char flag) {
		return visibility.indexOf(flag) >= 0;
	}

	public void plot() {
		setVisibility(DEFAULT_VISIBILITY);
	}

	public void unplot() {
		setVisibility("");
	}

	public FitModelFactory getFitModelFactory() {
		return fitModelFactory;
	}

	/** Used for regions created from now on. */
	public void setFitModelFactory(final FitModelFactory fitModelFactory) {
		if (fitModelFactory == null) throw new NullPointerException(
			"fitModelFactory");
		this.fitModelFactory = fitModelFactory;
	}

	// -- Regions --

	public List<Region> getRegions() {
		return Collections.unmodifiableList(new ArrayList<>(regions));
	}

	public Region addRegion(final double emin, final double emax) {
		return addRegion(emin, emax, prefs.getBackgroundType());
	}

	public Region addRegion(final double emin, final double emax,
		final BackgroundType bgtype)
	{
		return addRegion(emin, emax, bgtype, fitModelFactory);
	}

	public Region addRegion(final double emin, final double emax,
		final BackgroundType bgtype, final FitModelFactory factory)
	{
		return attach(new Region(this, emin, emax, bgtype, nextRegionName(),
			factory));
	}

	/**
	 * Creates a region from a mapping with {@code emin}, {@code emax} and
	 * optionally {@code bgtype}, {@code name} and {@code peaks}.
	 */
	public Region addRegion(final Map<String, ?> data) {
		final Region region = restoreRegion(data);
		channel.emit(EventKind.ADD_REGION, EventChannel.fields("region", region));
		return region;
	}

	private Region restoreRegion(final Map<String, ?> data) {
		final double emin = MapValues.requiredDouble(data, Region.EMIN, "Region");
		final double emax = MapValues.requiredDouble(data, Region.EMAX, "Region");
		final BackgroundType bgtype = BackgroundType.fromLabel(MapValues
			.getString(data, Region.BGTYPE, prefs.getBackgroundType().getLabel()));
		String regionName = MapValues.getString(data, Region.NAME, "");
		if (regionName.isEmpty()) regionName = nextRegionName();
		else {
			// later regions must not reuse a restored number
			final Matcher m = REGION_NAME.matcher(regionName);
			if (m.matches()) regionCounter = FastMath.max(regionCounter, Integer
				.parseInt(m.group(1)));
		}

		final Region region = new Region(this, emin, emax, bgtype, regionName,
			fitModelFactory);
		regions.add(region);
		for (final ModelListener l : channel.getListeners())
			region.subscribe(l);
		region.restorePeaks(data);
		return region;
	}

	private Region attach(final Region region) {
		regions.add(region);
		for (final ModelListener l : channel.getListeners())
			region.subscribe(l);
		channel.emit(EventKind.ADD_REGION, EventChannel.fields("region", region));
		return region;
	}

	private String nextRegionName() {
		regionCounter++;
		return "Region " + regionCounter;
	}

	/**
	 * Removes the region together with its peaks.
	 *
	 * @return false if the region does not belong to this spectrum
	 */
	public boolean removeRegion(final Region region) {
		if (!regions.contains(region)) return false;
		region.clearPeaks();
		regions.remove(region);
		for (final ModelListener l : channel.getListeners())
			region.unsubscribe(l);
		channel.emit(EventKind.REMOVE_REGION, EventChannel.fields("region",
			region));
		return true;
	}

	public void clearRegions() {
		for (final Region r : new ArrayList<>(regions))
			removeRegion(r);
	}

	// -- Subscriptions --

	/** Subscribes to this spectrum and all of its current and future regions. */
	public void subscribe(final ModelListener listener) {
		channel.subscribe(listener);
		for (final Region r : regions)
			r.subscribe(listener);
	}

	public void unsubscribe(final ModelListener listener) {
		channel.unsubscribe(listener);
		for (final Region r : regions)
			r.unsubscribe(listener);
	}

	public List<ModelListener> getListeners() {
		return channel.getListeners();
	}

	/** Raw arrays, metadata, parameters and regions, as accepted by the constructor. */
	public Map<String, Object> toMap() {
		final Map<String, Object> map = new LinkedHashMap<>();
		map.put(ENERGY, rawEnergy.clone());
		map.put(INTENSITY, rawIntensity.clone());
		map.put(NAME, name);
		map.put(NOTES, notes);
		map.put(EIS_REGION, eisRegion);
		map.put(FNAME, fname);
		map.put(SWEEPS, sweeps);
		map.put(DWELLTIME, dwelltime);
		map.put(PASSENERGY, passenergy);
		map.put(VISIBILITY, visibility);
		map.put(SMOOTHNESS, smoothness);
		map.put(CALIBRATION, calibration);
		map.put(NORM, norm);
		final ArrayList<Map<String, Object>> regionMaps = new ArrayList<>();
		for (final Region r : regions)
			regionMaps.add(r.toMap());
		map.put(REGIONS, regionMaps);
		map.put(REGION_COUNTER, regionCounter);
		return map;
	}

	@Override
	public String toString() {
		return "Spectrum " + sid + " (" + name + ")";
	}
}
