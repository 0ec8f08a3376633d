/**
 * XPS Fit
 * SerializedProjectStoreTest.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.ObjectOutputStream;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SerializedProjectStoreTest {

	@TempDir
	File dir;

	private SpectrumContainer project() {
		final SpectrumContainer container = new SpectrumContainer();
		final double[] e = Fixtures.axis();
		final Spectrum s = new Spectrum(Fixtures.data(e, Fixtures.gaussians(e,
			285, 1.2, 10)));
		s.setNotes("sputtered");
		s.setCalibration(0.5);
		final Region r = s.addRegion(288, 282, BackgroundType.LINEAR);
		r.setName("main");
		final Peak p = r.addPeak("Gaussian");
		p.setCenter(285.3);
		p.setFwhm(1.1);
		p.setArea(9);
		container.append(s);
		container.append(Fixtures.stepSpectrum());
		return container;
	}

	@Test
	void testSaveAndOpen() throws IOException {
		final FitPreferences prefs = new FitPreferences();
		final SerializedProjectStore store = new SerializedProjectStore(prefs,
			Logging.fallback());
		final SpectrumContainer saved = project();
		final File file = new File(dir, "sub/project.xps");
		store.save(saved, file);
		assertTrue(file.isFile());
		assertFalse(saved.isAltered());
		assertEquals(file, prefs.getProjectFile());

		final SpectrumContainer opened = new SpectrumContainer();
		opened.append(Fixtures.stepSpectrum());
		store.open(opened, file);
		assertFalse(opened.isAltered());
		assertEquals(2, opened.size());

		final Spectrum s = opened.get(0);
		final Spectrum orig = saved.get(0);
		assertEquals("sputtered", s.getNotes());
		assertEquals(0.5, s.getCalibration(), 0.0);
		assertArrayEquals(orig.getRawEnergy(), s.getRawEnergy(), 0.0);
		assertArrayEquals(orig.getRawIntensity(), s.getRawIntensity(), 0.0);
		assertArrayEquals(orig.getEnergy(), s.getEnergy(), 1e-12);
		assertNotEquals(orig.getSid(), s.getSid());

		assertEquals(1, s.getRegions().size());
		final Region r = s.getRegions().get(0);
		assertEquals("main", r.getName());
		assertEquals(BackgroundType.LINEAR, r.getBgtype());
		final Peak p = r.getPeaks().get(0);
		assertEquals("A", p.getName());
		assertEquals("Gaussian", p.getModelName());
		assertEquals(285.3, p.getCenter(), 1e-12);
		assertEquals(1.1, p.getFwhm(), 1e-12);
		assertEquals(9, p.getArea(), 1e-12);

		// the loaded project is live
		s.setName("renamed");
		assertTrue(opened.isAltered());
	}

	@Test
	void testLoadMappings() throws IOException {
		final SerializedProjectStore store = new SerializedProjectStore();
		final File file = new File(dir, "project.xps");
		store.save(project(), file);
		final List<Map<String, Object>> data = store.load(file);
		assertEquals(2, data.size());
		assertEquals("C 1s", data.get(1).get(Spectrum.NAME));
	}

	@Test
	void testForeignFileRejected() throws IOException {
		final File file = new File(dir, "other.bin");
		try (ObjectOutputStream oos = new ObjectOutputStream(new FileOutputStream(
			file)))
		{
			oos.writeObject("something else");
		}
		final SpectrumContainer container = new SpectrumContainer();
		final Spectrum kept = Fixtures.stepSpectrum();
		container.append(kept);
		assertThrows(IOException.class, () -> new SerializedProjectStore().open(
			container, file));
		assertSame(kept, container.get(0));
	}

	@Test
	void testNewerVersionRejected() throws IOException {
		final File file = new File(dir, "future.xps");
		try (ObjectOutputStream oos = new ObjectOutputStream(new FileOutputStream(
			file)))
		{
			oos.writeObject(SerializedProjectStore.FORMAT);
			oos.writeInt(SerializedProjectStore.VERSION + 1);
			oos.writeInt(0);
		}
		assertThrows(IOException.class, () -> new SerializedProjectStore().load(
			file));
	}

	@Test
	void testMissingFile() {
		assertThrows(IOException.class, () -> new SerializedProjectStore().load(
			new File(dir, "missing.xps")));
	}
}
