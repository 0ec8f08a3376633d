/**
 * XPS Fit
 * ModelEvent.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single change notification: what happened, on which entity, and the
 * changed values.
 */
public final class ModelEvent {

	private final EventKind kind;
	private final Object source;
	private final Map<String, Object> fields;

	ModelEvent(final EventKind kind, final Object source,
		final Map<String, ?> fields)
	{
		this.kind = kind;
		this.source = source;
		this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	public EventKind getKind() {
		return kind;
	}

	public Object getSource() {
		return source;
	}

	public Map<String, Object> getFields() {
		return fields;
	}

	public boolean has(final String field) {
		return fields.containsKey(field);
	}

	public Object get(final String field) {
		return fields.get(field);
	}

	@Override
	public String toString() {
		return kind.key() + " " + fields + " from " + source;
	}
}
