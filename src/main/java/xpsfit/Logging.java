/**
 * XPS Fit
 * Logging.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;

/** Log service for objects created outside of a SciJava context. */
final class Logging {

	private static LogService fallback;

	private Logging() {}

	static synchronized LogService fallback() {
		if (fallback == null) fallback = new StderrLogService();
		return fallback;
	}
}
