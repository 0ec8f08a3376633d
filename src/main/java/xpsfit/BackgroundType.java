/**
 * XPS Fit
 * BackgroundType.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

/** Background models a region can subtract before fitting. */
public enum BackgroundType {
	NONE("none"), LINEAR("linear"), SHIRLEY("shirley");

	private final String label;

	BackgroundType(final String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @param label one of {@code none}, {@code linear}, {@code shirley}
	 *          (case-insensitive)
	 * @throws IllegalArgumentException for any other label
	 */
	public static BackgroundType fromLabel(final String label) {
		if (label == null) throw new IllegalArgumentException(
			"Background type must not be null");
		for (final BackgroundType t : values()) {
			if (t.label.equalsIgnoreCase(label.trim())) return t;
		}
		throw new IllegalArgumentException("Unknown background type: " + label);
	}

	@Override
	public String toString() {
		return label;
	}
}
