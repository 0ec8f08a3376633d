/**
 * XPS Fit
 * ProjectStore.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Reads and writes projects as ordered lists of raw spectrum mappings. */
public interface ProjectStore {

	/** @return one mapping per spectrum, in project order */
	List<Map<String, Object>> load(File file) throws IOException;

	/** Writes all spectra and clears the container's altered flag. */
	void save(SpectrumContainer container, File file) throws IOException;

	/**
	 * Replaces the content of {@code container} with the spectra stored in
	 * {@code file} and clears its altered flag.
	 */
	void open(SpectrumContainer container, File file) throws IOException;
}
