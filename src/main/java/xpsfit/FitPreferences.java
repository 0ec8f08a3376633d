/**
 * XPS Fit
 * FitPreferences.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.io.File;
import java.util.prefs.Preferences;

/**
 * User settings for background and fit computations, read from and written
 * to a {@link Preferences} node. A fresh instance holds the defaults.
 */
public class FitPreferences {

	private static final String SHIRLEYTOL = "shirleyTol";
	private static final String SHIRLEYMAXIT = "shirleyMaxIt";
	private static final String BGTYPE = "bgType";
	private static final String PEAKMODEL = "peakModel";
	private static final String FITMAXIT = "fitMaxIt";
	private static final String PROJECTFILE = "projectFile";

	static final String DEFAULT_PEAK_MODEL = "PseudoVoigt";
	static final int DEFAULT_FIT_MAX_ITERATIONS = 1000;

	private double shirleyTolerance = Processing.SHIRLEY_TOLERANCE;
	private int shirleyMaxIterations = Processing.SHIRLEY_MAX_ITERATIONS;
	private BackgroundType backgroundType = BackgroundType.SHIRLEY;
	private String peakModel = DEFAULT_PEAK_MODEL;
	private int fitMaxIterations = DEFAULT_FIT_MAX_ITERATIONS;
	private String projectFile = "";

	/** Node used by the application, keyed by this package. */
	public static Preferences userNode() {
		return Preferences.userRoot().node(FitPreferences.class.getPackage()
			.getName().replace('.', '/'));
	}

	/**
	 * Reads all settings from {@code prefs}. Keys that are not set, or hold a
	 * value the setters reject, keep their default value.
	 */
	public static FitPreferences load(final Preferences prefs) {
		final FitPreferences p = new FitPreferences();
		final double tol = prefs.getDouble(SHIRLEYTOL, p.shirleyTolerance);
		if (tol > 0) p.setShirleyTolerance(tol);
		final int shirleyMaxIt = prefs.getInt(SHIRLEYMAXIT,
			p.shirleyMaxIterations);
		if (shirleyMaxIt >= 1) p.setShirleyMaxIterations(shirleyMaxIt);
		final String bg = prefs.get(BGTYPE, p.backgroundType.getLabel());
		for (final BackgroundType t : BackgroundType.values()) {
			if (t.getLabel().equalsIgnoreCase(bg.trim())) p.setBackgroundType(t);
		}
		final String model = prefs.get(PEAKMODEL, p.peakModel);
		for (final PeakShape shape : PeakShape.values()) {
			if (shape.getModelName().equalsIgnoreCase(model)) p.setPeakModel(model);
		}
		final int fitMaxIt = prefs.getInt(FITMAXIT, p.fitMaxIterations);
		if (fitMaxIt >= 1) p.setFitMaxIterations(fitMaxIt);
		p.projectFile = prefs.get(PROJECTFILE, p.projectFile);
		return p;
	}

	/** Create/Update the node keys. */
	public void save(final Preferences prefs) {
		prefs.putDouble(SHIRLEYTOL, shirleyTolerance);
		prefs.putInt(SHIRLEYMAXIT, shirleyMaxIterations);
		prefs.put(BGTYPE, backgroundType.getLabel());
		prefs.put(PEAKMODEL, peakModel);
		prefs.putInt(FITMAXIT, fitMaxIterations);
		prefs.put(PROJECTFILE, projectFile);
	}

	public double getShirleyTolerance() {
		return shirleyTolerance;
	}

	public void setShirleyTolerance(final double shirleyTolerance) {
		if (!(shirleyTolerance > 0)) throw new IllegalArgumentException(
			"Shirley tolerance must be positive: " + shirleyTolerance);
		this.shirleyTolerance = shirleyTolerance;
	}

	public int getShirleyMaxIterations() {
		return shirleyMaxIterations;
	}

	public void setShirleyMaxIterations(final int shirleyMaxIterations) {
		if (shirleyMaxIterations < 1) throw new IllegalArgumentException(
			"Shirley iteration limit must be at least 1: " + shirleyMaxIterations);
		this.shirleyMaxIterations = shirleyMaxIterations;
	}

	public BackgroundType getBackgroundType() {
		return backgroundType;
	}

	public void setBackgroundType(final BackgroundType backgroundType) {
		this.backgroundType = backgroundType;
	}

	public String getPeakModel() {
		return peakModel;
	}

	public void setPeakModel(final String peakModel) {
		PeakShape.fromName(peakModel);
		this.peakModel = peakModel;
	}

	public int getFitMaxIterations() {
		return fitMaxIterations;
	}

	public void setFitMaxIterations(final int fitMaxIterations) {
		if (fitMaxIterations < 1) throw new IllegalArgumentException(
			"Fit iteration limit must be at least 1: " + fitMaxIterations);
		this.fitMaxIterations = fitMaxIterations;
	}

	/** @return the last project file, or null if none was recorded */
	public File getProjectFile() {
		return projectFile.isEmpty() ? null : new File(projectFile);
	}

	public void setProjectFile(final File file) {
		projectFile = file == null ? "" : file.getPath();
	}
}
