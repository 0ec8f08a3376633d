/**
 * XPS Fit
 * Identifiers.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.concurrent.atomic.AtomicLong;

/** Process-wide id source for spectra, regions and peaks. */
final class Identifiers {

	private static final AtomicLong counter = new AtomicLong();

	private Identifiers() {}

	static long next() {
		return counter.incrementAndGet();
	}
}
