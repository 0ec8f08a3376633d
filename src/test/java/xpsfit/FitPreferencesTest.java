/**
 * XPS Fit
 * FitPreferencesTest.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FitPreferencesTest {

	private Preferences node;

	@BeforeEach
	void setUp() {
		node = Preferences.userRoot().node("xpsfit-test/" + System.nanoTime());
	}

	@AfterEach
	void tearDown() throws BackingStoreException {
		node.removeNode();
	}

	@Test
	void testDefaults() {
		final FitPreferences p = new FitPreferences();
		assertEquals(Processing.SHIRLEY_TOLERANCE, p.getShirleyTolerance(), 0.0);
		assertEquals(Processing.SHIRLEY_MAX_ITERATIONS, p
			.getShirleyMaxIterations());
		assertEquals(BackgroundType.SHIRLEY, p.getBackgroundType());
		assertEquals("PseudoVoigt", p.getPeakModel());
		assertEquals(1000, p.getFitMaxIterations());
		assertNull(p.getProjectFile());
	}

	@Test
	void testEmptyNodeGivesDefaults() {
		final FitPreferences p = FitPreferences.load(node);
		assertEquals(BackgroundType.SHIRLEY, p.getBackgroundType());
		assertEquals(1000, p.getFitMaxIterations());
	}

	@Test
	void testSaveAndLoad() {
		final FitPreferences p = new FitPreferences();
		p.setShirleyTolerance(1e-7);
		p.setShirleyMaxIterations(50);
		p.setBackgroundType(BackgroundType.LINEAR);
		p.setPeakModel("Gaussian");
		p.setFitMaxIterations(200);
		p.setProjectFile(new File("runs", "a.xps"));
		p.save(node);

		final FitPreferences q = FitPreferences.load(node);
		assertEquals(1e-7, q.getShirleyTolerance(), 0.0);
		assertEquals(50, q.getShirleyMaxIterations());
		assertEquals(BackgroundType.LINEAR, q.getBackgroundType());
		assertEquals("Gaussian", q.getPeakModel());
		assertEquals(200, q.getFitMaxIterations());
		assertEquals(new File("runs", "a.xps"), q.getProjectFile());
	}

	@Test
	void testUnknownBackgroundFallsBack() {
		node.put("bgType", "polynomial");
		assertEquals(BackgroundType.SHIRLEY, FitPreferences.load(node)
			.getBackgroundType());
	}

	@Test
	void testInvalidValues() {
		final FitPreferences p = new FitPreferences();
		assertThrows(IllegalArgumentException.class, () -> p.setShirleyTolerance(
			0));
		assertThrows(IllegalArgumentException.class, () -> p
			.setShirleyMaxIterations(0));
		assertThrows(IllegalArgumentException.class, () -> p.setFitMaxIterations(
			-1));
		assertThrows(IllegalArgumentException.class, () -> p.setPeakModel(
			"Voigt"));
		assertEquals("PseudoVoigt", p.getPeakModel());
	}

	@Test
	void testBackgroundUsedForNewRegions() {
		final FitPreferences p = new FitPreferences();
		p.setBackgroundType(BackgroundType.LINEAR);
		final Spectrum s = new Spectrum(Fixtures.data(Fixtures.STEP_ENERGY,
			Fixtures.STEP_INTENSITY), p, Logging.fallback());
		assertEquals(BackgroundType.LINEAR, s.addRegion(9, 2).getBgtype());
	}

	@Test
	void testInvalidStoredValuesFallBack() {
		node.putDouble("shirleyTol", -1);
		node.putInt("shirleyMaxIt", 0);
		node.put("peakModel", "Voigt");
		node.putInt("fitMaxIt", 0);
		final FitPreferences p = FitPreferences.load(node);
		assertEquals(Processing.SHIRLEY_TOLERANCE, p.getShirleyTolerance(), 0.0);
		assertEquals(Processing.SHIRLEY_MAX_ITERATIONS, p
			.getShirleyMaxIterations());
		assertEquals("PseudoVoigt", p.getPeakModel());
		assertEquals(1000, p.getFitMaxIterations());
	}
}
