/**
 * XPS Fit
 * EventKind.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

/**
 * Kinds of change notifications emitted by the data model. The field names
 * each kind carries are listed next to it.
 */
public enum EventKind {
	/** {@code attr}, {@code value} */
	CHANGED_SPECTRUM,
	/** any of {@code emin}, {@code emax}, {@code bgtype}, {@code spectrum_changed} */
	CHANGED_REGION,
	/** optional {@code attr} */
	CHANGED_PEAK,
	/** {@code region} */
	ADD_REGION,
	/** {@code region} */
	REMOVE_REGION,
	/** {@code peak} */
	ADD_PEAK,
	/** {@code peak} */
	REMOVE_PEAK,
	/** {@code success} */
	FIT,
	/** {@code index} */
	ADD_SPECTRUM,
	/** {@code index} */
	REMOVE_SPECTRUM,
	CLEAR_CONTAINER,
	/** Re-render hint, no data changed. */
	PLOT;

	/** Name as used in the event payloads of the persisted projects. */
	public String key() {
		return name().toLowerCase();
	}
}
