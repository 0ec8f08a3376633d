/**
 * XPS Fit
 * ModelListener.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

/** Receives change notifications from spectra, regions, peaks and containers. */
@FunctionalInterface
public interface ModelListener {

	void modelChanged(ModelEvent event);
}
