/**
 * XPS Fit
 * MissingFieldException.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

/**
 * Thrown when an entity is built from a mapping (or a parent reference) that
 * lacks a required entry.
 */
public class MissingFieldException extends IllegalArgumentException {

	private static final long serialVersionUID = 4720715862003145919L;

	private final String field;

	public MissingFieldException(final String owner, final String field) {
		super("missing key for " + owner + " init: " + field);
		this.field = field;
	}

	public String getField() {
		return field;
	}
}
