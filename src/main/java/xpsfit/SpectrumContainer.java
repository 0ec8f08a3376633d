/**
 * XPS Fit
 * SpectrumContainer.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

/**
 * Ordered collection of spectra of one project. Listeners subscribed here
 * also receive the events of every contained spectrum, region and peak.
 * Any change below or to the container sets the {@code altered} flag;
 * clearing it is left to whoever saves or loads the project.
 */
public class SpectrumContainer implements Iterable<Spectrum> {

	@Parameter
	private LogService log;

	private final List<Spectrum> spectra = new ArrayList<>();
	private final EventChannel channel;
	private boolean altered = false;

	// Runs before user listeners, so they already see the flag set.
	private final ModelListener alteredHook = event -> {
		if (event.getKind() != EventKind.PLOT) altered = true;
	};

	public SpectrumContainer() {
		this.log = Logging.fallback();
		this.channel = new EventChannel(this, log);
	}

	public SpectrumContainer(final Context context) {
		context.inject(this);
		this.channel = new EventChannel(this, log);
	}

	public boolean isAltered() {
		return altered;
	}

	public void setAltered(final boolean altered) {
		this.altered = altered;
	}

	public int size() {
		return spectra.size();
	}

	public boolean isEmpty() {
		return spectra.isEmpty();
	}

	public Spectrum get(final int index) {
		return spectra.get(index);
	}

	/** @return the spectrum with this id, or null */
	public Spectrum getBySid(final long sid) {
		final int i = getIndexBySid(sid);
		return i < 0 ? null : spectra.get(i);
	}

	/** @return the position of the spectrum with this id, or -1 */
	public int getIndexBySid(final long sid) {
		for (int i = 0; i < spectra.size(); i++) {
			if (spectra.get(i).getSid() == sid) return i;
		}
		return -1;
	}

	public boolean contains(final Spectrum spectrum) {
		return spectra.contains(spectrum);
	}

	public List<Spectrum> getSpectra() {
		return Collections.unmodifiableList(new ArrayList<>(spectra));
	}

	@Override
	public Iterator<Spectrum> iterator() {
		return getSpectra().iterator();
	}

	public void append(final Spectrum spectrum) {
		insert(spectra.size(), spectrum);
	}

	/**
	 * @throws IllegalArgumentException if a spectrum with the same id is
	 *           already contained
	 */
	public void insert(final int index, final Spectrum spectrum) {
		if (getIndexBySid(spectrum.getSid()) >= 0)
			throw new IllegalArgumentException("Duplicate spectrum id " + spectrum
				.getSid());
		spectra.add(index, spectrum);
		spectrum.subscribe(alteredHook);
		for (final ModelListener l : channel.getListeners())
			spectrum.subscribe(l);
		altered = true;
		channel.emit(EventKind.ADD_SPECTRUM, EventChannel.fields("index", index));
	}

	/**
	 * Removes the spectrum and drops its regions.
	 *
	 * @return false if the spectrum is not contained
	 */
	public boolean remove(final Spectrum spectrum) {
		final int index = spectra.indexOf(spectrum);
		if (index < 0) return false;
		spectra.remove(index);
		detach(spectrum);
		altered = true;
		channel.emit(EventKind.REMOVE_SPECTRUM, EventChannel.fields("index",
			index));
		return true;
	}

	public void clear() {
		for (final Spectrum s : new ArrayList<>(spectra))
			detach(s);
		spectra.clear();
		altered = true;
		channel.emit(EventKind.CLEAR_CONTAINER);
	}

	private void detach(final Spectrum spectrum) {
		spectrum.unsubscribe(alteredHook);
		for (final ModelListener l : channel.getListeners())
			spectrum.unsubscribe(l);
		spectrum.clearRegions();
	}

	/** Makes only the given spectra visible, then asks for a redraw. */
	public void showOnly(final Collection<Spectrum> visible) {
		for (final Spectrum s : spectra) {
			if (visible.contains(s)) s.plot();
			else s.unplot();
		}
		channel.emit(EventKind.PLOT);
	}

	/** Subscribes to the container and to everything it contains. */
	public void subscribe(final ModelListener listener) {
		channel.subscribe(listener);
		for (final Spectrum s : spectra)
			s.subscribe(listener);
	}

	public void unsubscribe(final ModelListener listener) {
		channel.unsubscribe(listener);
		for (final Spectrum s : spectra)
			s.unsubscribe(listener);
	}
}
