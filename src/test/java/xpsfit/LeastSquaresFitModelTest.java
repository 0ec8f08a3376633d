/**
 * XPS Fit
 * LeastSquaresFitModelTest.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.junit.jupiter.api.Test;

class LeastSquaresFitModelTest {

	private static Region region(final double... cfa) {
		final double[] e = Fixtures.axis();
		final Map<String, Object> data = Fixtures.data(e, Fixtures.gaussians(e,
			cfa));
		return new Spectrum(data).addRegion(289, 281, BackgroundType.NONE);
	}

	@Test
	void testSingleGaussianIsRecovered() {
		final Region r = region(285, 1.2, 10);
		final Peak a = r.addPeak("Gaussian");
		assertNull(a.getFitIntensity());

		assertTrue(r.fit());
		assertEquals(285, a.getCenter(), 1e-3);
		assertEquals(1.2, a.getFwhm(), 1e-3);
		assertEquals(10, a.getArea(), 1e-2);
		assertEquals(new ArrayRealVector(r.getIntensity()).getMaxValue(), a
			.getHeight(), 1e-3);

		final double[] fit = r.getFitIntensity();
		assertEquals(r.getEnergy().length, fit.length);
		assertArrayEquals(r.getIntensity(), fit, 1e-3);
		assertArrayEquals(fit, a.getFitIntensity(), 1e-12);
		assertTrue(((LeastSquaresFitModel) r.getFitModel()).getRms() < 1e-3);
	}

	@Test
	void testTwoPeaksAreRecovered() {
		final Region r = region(284, 1.0, 5, 286.5, 1.0, 3);
		final Peak a = r.addPeak("Gaussian");
		final Peak b = r.addPeak("Gaussian");
		assertEquals(284, a.getCenter(), 0.1);
		assertEquals(286.5, b.getCenter(), 0.1);

		assertTrue(r.fit());
		assertEquals(284, a.getCenter(), 1e-3);
		assertEquals(286.5, b.getCenter(), 1e-3);
		assertEquals(5, a.getArea(), 1e-2);
		assertEquals(3, b.getArea(), 1e-2);
	}

	@Test
	void testGivenStartValuesAreKept() {
		final Region r = region(285, 1.2, 10);
		final Peak a = r.addPeak("Lorentzian", new PeakParameters(284.0, 2.0,
			null));
		assertEquals(284.0, a.getCenter(), 0.0);
		assertEquals(2.0, a.getFwhm(), 0.0);
		assertTrue(a.getArea() > 0);
	}

	@Test
	void testBoundsAreRespected() {
		final Region r = region(285, 1.2, 10);
		final Peak a = r.addPeak("Gaussian");
		a.setConstraint(Peak.CENTER, null, 284.8, null);
		assertTrue(a.getCenter() <= 284.8);
		r.fit();
		assertTrue(a.getCenter() <= 284.8);
		assertEquals(284.8, a.getConstraint(Peak.CENTER, "max"));
		assertNull(a.getConstraint(Peak.CENTER, "min"));
	}

	@Test
	void testTiedParameterFollowsReference() {
		final Region r = region(284, 1.0, 5, 286.5, 1.0, 3);
		final Peak a = r.addPeak("Gaussian");
		final Peak b = r.addPeak("Gaussian");
		b.setConstraint(Peak.CENTER, null, null, "A.center + 2.5");
		b.setConstraint(Peak.FWHM, null, null, "1.0 * A.fwhm");
		assertEquals("A.center + 2.5", b.getConstraint(Peak.CENTER, "expr"));
		assertEquals(a.getCenter() + 2.5, b.getCenter(), 1e-12);

		assertTrue(r.fit());
		assertEquals(284, a.getCenter(), 1e-3);
		assertEquals(a.getCenter() + 2.5, b.getCenter(), 1e-12);
		assertEquals(a.getFwhm(), b.getFwhm(), 1e-12);
		assertThrows(IllegalArgumentException.class, () -> b.setCenter(280));
	}

	@Test
	void testInvalidExpressions() {
		final Region r = region(284, 1.0, 5, 286.5, 1.0, 3);
		final Peak a = r.addPeak("Gaussian");
		final Peak b = r.addPeak("Gaussian");
		final Peak c = r.addPeak("Gaussian");
		assertThrows(IllegalArgumentException.class, () -> a.setConstraint(
			Peak.CENTER, null, null, "A.center + 1"));
		assertThrows(IllegalArgumentException.class, () -> a.setConstraint(
			Peak.CENTER, null, null, "Q.center"));
		assertThrows(IllegalArgumentException.class, () -> a.setConstraint(
			Peak.CENTER, null, null, "sqrt(B.center)"));
		assertThrows(IllegalArgumentException.class, () -> a.setConstraint(
			"width", null, null, null));

		b.setConstraint(Peak.AREA, null, null, "0.5 * A.area");
		assertThrows(IllegalArgumentException.class, () -> c.setConstraint(
			Peak.AREA, null, null, "B.area"));
		assertThrows(IllegalArgumentException.class, () -> a.setConstraint(
			Peak.AREA, null, null, "C.area"));
		b.setConstraint(Peak.AREA, null, null, "");
		assertNull(b.getConstraint(Peak.AREA, "expr"));
	}

	@Test
	void testNumericExpressionFixesParameter() {
		final Region r = region(285, 1.2, 10);
		final Peak a = r.addPeak("Gaussian");
		a.setConstraint(Peak.FWHM, null, null, "1.2");
		assertTrue(r.fit());
		assertEquals(1.2, a.getFwhm(), 0.0);
		assertEquals(285, a.getCenter(), 1e-3);
	}

	@Test
	void testStructuralChangesInvalidateFit() {
		final Region r = region(284, 1.0, 5, 286.5, 1.0, 3);
		final Peak a = r.addPeak("Gaussian");
		final Peak b = r.addPeak("Gaussian");
		b.setConstraint(Peak.CENTER, null, null, "A.center + 2.5");
		assertTrue(r.fit());
		assertNotNull(r.getFitIntensity());

		r.removePeak(a);
		final FitModel model = r.getFitModel();
		assertFalse(model.isRegistered(a));
		assertNull(model.evaluate(a));
		assertNull(a.getCenter());
		assertNull(r.getFitIntensity());
		// the tie to the removed peak is gone, its last value is kept
		assertNull(b.getConstraint(Peak.CENTER, "expr"));
		assertEquals(286.5, b.getCenter(), 1e-3);
	}

	@Test
	void testModelChangeInvalidatesFit() {
		final Region r = region(285, 1.2, 10);
		final Peak a = r.addPeak("Gaussian");
		assertTrue(r.fit());
		assertNotNull(a.getFitIntensity());
		a.setModelName("Lorentzian");
		assertEquals("Lorentzian", a.getModelName());
		assertNull(a.getFitIntensity());
		assertEquals(285, a.getCenter(), 1e-3);
	}

	@Test
	void testNothingToFit() {
		final Region r = region(285, 1.2, 10);
		assertFalse(r.fit());
		assertNull(r.getFitIntensity());
	}

	@Test
	void testUnknownModelName() {
		final Region r = region(285, 1.2, 10);
		assertThrows(IllegalArgumentException.class, () -> r.addPeak("Voigt"));
		assertTrue(r.getPeaks().isEmpty());
	}

	@Test
	void testPseudoVoigtProfile() {
		final double g = PeakShape.GAUSSIAN.height(1.0, 1.0);
		final double l = PeakShape.LORENTZIAN.height(1.0, 1.0);
		assertEquals(0.5 * (g + l), PeakShape.PSEUDO_VOIGT.height(1.0, 1.0),
			1e-12);
		assertEquals(2 / Math.PI, l, 1e-12);
		// half maximum at center +- fwhm/2
		assertEquals(g / 2, PeakShape.GAUSSIAN.value(0.5, 0, 1.0, 1.0), 1e-12);
		assertEquals(l / 2, PeakShape.LORENTZIAN.value(-0.5, 0, 1.0, 1.0), 1e-12);
	}

	@Test
	void testRejectedConstraintChangesNothing() {
		final Region r = region(284, 1.0, 5, 286.5, 1.0, 3);
		final Peak a = r.addPeak("Gaussian");
		r.addPeak("Gaussian");
		a.setConstraint(Peak.CENTER, null, 287.0, null);
		assertThrows(IllegalArgumentException.class, () -> a.setConstraint(
			Peak.CENTER, 288.0, null, null));
		assertNull(a.getConstraint(Peak.CENTER, "min"));
		assertEquals(287.0, a.getConstraint(Peak.CENTER, "max"));

		assertThrows(IllegalArgumentException.class, () -> a.setConstraint(
			Peak.CENTER, 283.0, null, "Q.center"));
		assertNull(a.getConstraint(Peak.CENTER, "min"));
		assertNull(a.getConstraint(Peak.CENTER, "expr"));
	}

	@Test
	void testDataChangesInvalidateFit() {
		final Region r = region(285, 1.2, 10);
		final Peak a = r.addPeak("Gaussian");
		assertTrue(r.fit());
		r.setBgtype(BackgroundType.LINEAR);
		assertNull(r.getFitIntensity());
		assertNull(a.getFitIntensity());

		assertTrue(r.fit());
		r.getSpectrum().setCalibration(0.2);
		assertNull(r.getFitIntensity());

		assertTrue(r.fit());
		r.setRange(288, 282);
		assertNull(r.getFitIntensity());

		assertTrue(r.fit());
		r.setName("C 1s main");
		assertNotNull(r.getFitIntensity());
	}
}
