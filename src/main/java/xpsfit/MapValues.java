/**
 * XPS Fit
 * MapValues.java
 * author: Rick Ziraldo, 2017
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package xpsfit;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.linear.RealVector;

/** Typed reads from the raw mappings produced by importers and stores. */
final class MapValues {

	private MapValues() {}

	static double[] array(final Map<String, ?> data, final String key,
		final String owner)
	{
		final Object v = data.get(key);
		if (v == null) throw new MissingFieldException(owner, key);
		if (v instanceof double[]) return ((double[]) v).clone();
		if (v instanceof RealVector) return ((RealVector) v).toArray();
		if (v instanceof List) {
			final List<?> list = (List<?>) v;
			final double[] out = new double[list.size()];
			for (int i = 0; i < out.length; i++)
				out[i] = number(list.get(i), key).doubleValue();
			return out;
		}
		throw new MathIllegalArgumentException(LocalizedFormats.SIMPLE_MESSAGE,
			"Not a numeric array for " + key + ": " + v.getClass().getName());
	}

	static double requiredDouble(final Map<String, ?> data, final String key,
		final String owner)
	{
		final Object v = data.get(key);
		if (v == null) throw new MissingFieldException(owner, key);
		return number(v, key).doubleValue();
	}

	static double getDouble(final Map<String, ?> data, final String key,
		final double def)
	{
		final Object v = data.get(key);
		return v == null ? def : number(v, key).doubleValue();
	}

	static Double getNullableDouble(final Map<String, ?> data,
		final String key)
	{
		final Object v = data.get(key);
		return v == null ? null : number(v, key).doubleValue();
	}

	static int getInt(final Map<String, ?> data, final String key,
		final int def)
	{
		final Object v = data.get(key);
		return v == null ? def : number(v, key).intValue();
	}

	static String getString(final Map<String, ?> data, final String key,
		final String def)
	{
		final Object v = data.get(key);
		return v == null ? def : v.toString();
	}

	@SuppressWarnings("unchecked")
	static List<Map<String, ?>> getMapList(final Map<String, ?> data,
		final String key)
	{
		final Object v = data.get(key);
		if (v == null) return Collections.emptyList();
		if (!(v instanceof List)) throw new MathIllegalArgumentException(
			LocalizedFormats.SIMPLE_MESSAGE, "Not a list for " + key);
		return (List<Map<String, ?>>) v;
	}

	/** @return the nested mapping under {@code key}, or an empty one */
	@SuppressWarnings("unchecked")
	static Map<String, ?> getMap(final Map<String, ?> data, final String key) {
		final Object v = data.get(key);
		if (v == null) return Collections.emptyMap();
		if (!(v instanceof Map)) throw new MathIllegalArgumentException(
			LocalizedFormats.SIMPLE_MESSAGE, "Not a mapping for " + key);
		return (Map<String, ?>) v;
	}

	private static Number number(final Object v, final String key) {
		if (v instanceof Number) return (Number) v;
		if (v instanceof String) {
			try {
				return Double.valueOf(((String) v).trim());
			}
			catch (final NumberFormatException e) {
				throw new MathIllegalArgumentException(LocalizedFormats.SIMPLE_MESSAGE,
					"Invalid token for " + key + ": " + v);
			}
		}
		throw new MathIllegalArgumentException(LocalizedFormats.SIMPLE_MESSAGE,
			"Not a number for " + key + ": " + v);
	}
}
