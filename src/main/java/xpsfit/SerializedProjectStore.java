/**
 * XPS Fit
 * SerializedProjectStore.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.StreamCorruptedException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

/**
 * Stores projects with Java object serialization: a format tag, the number
 * of spectra, then one {@link Spectrum#toMap()} mapping per spectrum.
 */
public class SerializedProjectStore implements ProjectStore {

	static final String FORMAT = "xps-fit project";
	static final int VERSION = 1;

	@Parameter
	private LogService log;

	private final FitPreferences prefs;

	public SerializedProjectStore() {
		this(new FitPreferences(), Logging.fallback());
	}

	public SerializedProjectStore(final FitPreferences prefs,
		final LogService log)
	{
		this.prefs = prefs;
		this.log = log;
	}

	public SerializedProjectStore(final FitPreferences prefs,
		final Context context)
	{
		context.inject(this);
		this.prefs = prefs;
	}

	@Override
	public List<Map<String, Object>> load(final File file) throws IOException {
		log.info("Loading " + file.getPath() + " ...");
		try (ObjectInputStream ois = new ObjectInputStream(new FileInputStream(
			file)))
		{
			final Object format = ois.readObject();
			if (!FORMAT.equals(format)) throw new StreamCorruptedException(
				"Not a project file: " + file.getPath());
			final int version = ois.readInt();
			if (version > VERSION) throw new InvalidClassException(FORMAT,
				"unsupported version " + version);
			final int count = ois.readInt();
			final List<Map<String, Object>> out = new ArrayList<>(count);
			for (int i = 0; i < count; i++)
				out.add(readMap(ois.readObject()));
			return out;
		}
		catch (final ClassNotFoundException e) {
			throw new IOException("Unknown class in " + file.getPath(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> readMap(final Object o)
		throws StreamCorruptedException
	{
		if (!(o instanceof Map)) throw new StreamCorruptedException(
			"Expected a spectrum mapping, found " + (o == null ? "null" : o
				.getClass().getName()));
		return (Map<String, Object>) o;
	}

	@Override
	public void save(final SpectrumContainer container, final File file)
		throws IOException
	{
		final File parent = file.getAbsoluteFile().getParentFile();
		if (parent != null) parent.mkdirs();
		log.info("Saving to " + file.getPath() + " ...");
		try (ObjectOutputStream oos = new ObjectOutputStream(new FileOutputStream(
			file)))
		{
			oos.writeObject(FORMAT);
			oos.writeInt(VERSION);
			oos.writeInt(container.size());
			for (final Spectrum s : container)
				oos.writeObject(s.toMap());
		}
		container.setAltered(false);
		prefs.setProjectFile(file);
	}

	@Override
	public void open(final SpectrumContainer container, final File file)
		throws IOException
	{
		final List<Map<String, Object>> data = load(file);
		final List<Spectrum> spectra = new ArrayList<>(data.size());
		for (final Map<String, Object> m : data)
			spectra.add(new Spectrum(m, prefs, log));
		container.clear();
		for (final Spectrum s : spectra)
			container.append(s);
		container.setAltered(false);
		prefs.setProjectFile(file);
		log.info("Loaded " + spectra.size() + " spectra from " + file.getPath());
	}
}
