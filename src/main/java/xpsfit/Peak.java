/**
 * XPS Fit
 * Peak.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named fit component of a {@link Region}. All numeric values live in the
 * region's {@link FitModel}; getters return null while the model has no
 * value for this peak.
 */
public class Peak {

	public static final String NAME = "name";
	public static final String MODEL_NAME = "model_name";
	public static final String CENTER = "center";
	public static final String FWHM = "fwhm";
	public static final String AREA = "area";
	public static final String HEIGHT = "height";
	public static final String CONSTRAINTS = "constraints";
	public static final String MIN = "min";
	public static final String MAX = "max";
	public static final String EXPR = "expr";

	private final long sid = Identifiers.next();
	private final Region region;
	private final Spectrum spectrum;
	private final EventChannel channel;
	private String name;
	private String modelName;

	Peak(final Region region, final String name, final String modelName) {
		if (region == null) throw new MissingFieldException("Peak", "region");
		this.region = region;
		this.spectrum = region.getSpectrum();
		this.channel = new EventChannel(this, region.log());
		this.name = name;
		this.modelName = modelName;
	}

	private FitModel model() {
		return region.getFitModel();
	}

	private void changed(final String attr) {
		channel.emit(EventKind.CHANGED_PEAK, EventChannel.fields("attr", attr));
	}

	public long getSid() {
		return sid;
	}

	public Region getRegion() {
		return region;
	}

	public Spectrum getSpectrum() {
		return spectrum;
	}

	public String getName() {
		return name;
	}

	public void setName(final String name) {
		if (name == null || name.equals(this.name)) return;
		this.name = name;
		changed(NAME);
	}

	public String getModelName() {
		return modelName;
	}

	/** Switches the profile family, keeping the current parameters. */
	public void setModelName(final String modelName) {
		if (modelName == null || modelName.equals(this.modelName)) return;
		model().reinit(this, modelName);
		this.modelName = modelName;
		changed(MODEL_NAME);
	}

	public Double getCenter() {
		return model().getParameter(this, CENTER);
	}

	public void setCenter(final double center) {
		model().setParameter(this, CENTER, center);
		changed(CENTER);
	}

	public Double getFwhm() {
		return model().getParameter(this, FWHM);
	}

	public void setFwhm(final double fwhm) {
		model().setParameter(this, FWHM, fwhm);
		changed(FWHM);
	}

	public Double getArea() {
		return model().getParameter(this, AREA);
	}

	public void setArea(final double area) {
		model().setParameter(this, AREA, area);
		changed(AREA);
	}

	/** Profile maximum, derived from area and FWHM. */
	public Double getHeight() {
		return model().getParameter(this, HEIGHT);
	}

	/** @see FitModel#setConstraint */
	public void setConstraint(final String attr, final Double min,
		final Double max, final String expr)
	{
		model().setConstraint(this, attr, min, max, expr);
		changed(attr);
	}

	public Object getConstraint(final String attr, final String argname) {
		return model().getConstraint(this, attr, argname);
	}

	/** Fitted profile over the region, or null before a successful fit. */
	public double[] getFitIntensity() {
		return model().evaluate(this);
	}

	public void subscribe(final ModelListener listener) {
		channel.subscribe(listener);
	}

	public void unsubscribe(final ModelListener listener) {
		channel.unsubscribe(listener);
	}

	public List<ModelListener> getListeners() {
		return channel.getListeners();
	}

	Map<String, Object> toMap() {
		final Map<String, Object> map = new LinkedHashMap<>();
		map.put(NAME, name);
		map.put(MODEL_NAME, modelName);
		map.put(CENTER, getCenter());
		map.put(FWHM, getFwhm());
		map.put(AREA, getArea());
		final Map<String, Object> constraints = new LinkedHashMap<>();
		for (final String attr : new String[] { CENTER, FWHM, AREA }) {
			final Map<String, Object> c = new LinkedHashMap<>();
			for (final String arg : new String[] { MIN, MAX, EXPR }) {
				final Object v = getConstraint(attr, arg);
				if (v != null) c.put(arg, v);
			}
			if (!c.isEmpty()) constraints.put(attr, c);
		}
		if (!constraints.isEmpty()) map.put(CONSTRAINTS, constraints);
		return map;
	}

	@Override
	public String toString() {
		return "Peak " + name + " (" + modelName + ") in " + region.getName();
	}
}
