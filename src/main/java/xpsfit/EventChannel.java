/**
 * XPS Fit
 * EventChannel.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.scijava.log.LogService;

/**
 * Ordered, synchronous listener list owned by one entity. Emission nested
 * more than {@link #MAX_DEPTH} levels deep on the same channel is dropped.
 */
final class EventChannel {

	/** Depth of the Spectrum, Region, Peak tree. */
	static final int MAX_DEPTH = 3;

	private final Object owner;
	private final LogService log;
	private final List<ModelListener> listeners = new ArrayList<>();
	private int depth = 0;

	EventChannel(final Object owner, final LogService log) {
		this.owner = owner;
		this.log = log;
	}

	/** @return false if the listener was already subscribed */
	boolean subscribe(final ModelListener listener) {
		if (listener == null) throw new NullPointerException("listener");
		if (listeners.contains(listener)) return false;
		listeners.add(listener);
		return true;
	}

	boolean unsubscribe(final ModelListener listener) {
		return listeners.remove(listener);
	}

	List<ModelListener> getListeners() {
		return Collections.unmodifiableList(new ArrayList<>(listeners));
	}

	void emit(final EventKind kind) {
		emit(kind, Collections.<String, Object> emptyMap());
	}

	void emit(final EventKind kind, final Map<String, ?> fields) {
		if (depth >= MAX_DEPTH) {
			log.warn("Dropped nested " + kind.key() + " event from " + owner +
				" (depth " + depth + ")");
			return;
		}
		final ModelEvent event = new ModelEvent(kind, owner, fields);
		final List<ModelListener> snapshot = new ArrayList<>(listeners);
		depth++;
		try {
			for (final ModelListener l : snapshot)
				l.modelChanged(event);
		}
		finally {
			depth--;
		}
	}

	/** Builds an ordered field map from alternating names and values. */
	static Map<String, Object> fields(final Object... keyValues) {
		if (keyValues.length % 2 != 0) throw new IllegalArgumentException(
			"Odd number of key/value arguments: " + keyValues.length);
		final Map<String, Object> map = new LinkedHashMap<>();
		for (int i = 0; i < keyValues.length; i += 2)
			map.put((String) keyValues[i], keyValues[i + 1]);
		return map;
	}
}
