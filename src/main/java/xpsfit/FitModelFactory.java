/**
 * XPS Fit
 * FitModelFactory.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

/** Creates the fit model of a newly created region. */
@FunctionalInterface
public interface FitModelFactory {

	FitModel create(Region region);
}
