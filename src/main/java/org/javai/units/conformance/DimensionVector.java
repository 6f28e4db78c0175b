package org.javai.units.conformance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expected dimension exponents of a conformance case, written as a sequence of
 * {@code <label><signed int>} pairs in any order, e.g. {@code T-2L} or
 * {@code CM-1Ch-1}. A missing count means 1; zero counts are dropped. The engine
 * never computes these vectors; they are oracles for embedding systems.
 *
 * @param exponents non-zero exponent per dimension
 */
public record DimensionVector(Map<Dimension, Integer> exponents) {

	public static final DimensionVector DIMENSIONLESS = new DimensionVector(Map.of());

	// longest label first so "Ch" is never read as "C" followed by junk
	private static final List<Dimension> BY_LABEL_LENGTH;

	static {
		List<Dimension> dims = new ArrayList<>(List.of(Dimension.values()));
		dims.sort(Comparator.comparingInt((Dimension d) -> d.label().length()).reversed());
		BY_LABEL_LENGTH = Collections.unmodifiableList(dims);
	}

	public DimensionVector {
		Objects.requireNonNull(exponents, "exponents must not be null");
		EnumMap<Dimension, Integer> kept = new EnumMap<>(Dimension.class);
		exponents.forEach((dimension, exponent) -> {
			if (exponent != null && exponent != 0) {
				kept.put(dimension, exponent);
			}
		});
		exponents = Collections.unmodifiableMap(kept);
	}

	/**
	 * @throws ConformanceFormatException on an unknown label, a dangling sign or a repeated label
	 */
	public static DimensionVector parse(String text) {
		Objects.requireNonNull(text, "text must not be null");
		EnumMap<Dimension, Integer> exponents = new EnumMap<>(Dimension.class);
		int pos = 0;
		while (pos < text.length()) {
			int start = pos;
			Dimension dimension = labelAt(text, pos);
			if (dimension == null) {
				throw new ConformanceFormatException("Unknown dimension label in '" + text + "'", pos);
			}
			pos += dimension.label().length();
			int countStart = pos;
			if (pos < text.length() && text.charAt(pos) == '-') {
				pos++;
			}
			int digitsStart = pos;
			while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
				pos++;
			}
			int exponent;
			if (pos == digitsStart) {
				if (pos != countStart) {
					throw new ConformanceFormatException("Digits expected after '-' in '" + text + "'", pos);
				}
				exponent = 1;
			} else {
				try {
					exponent = Integer.parseInt(text.substring(countStart, pos));
				} catch (NumberFormatException e) {
					throw new ConformanceFormatException("Exponent out of range in '" + text + "'", countStart);
				}
			}
			if (exponents.containsKey(dimension)) {
				throw new ConformanceFormatException("Dimension " + dimension.label() + " given twice in '" + text + "'", start);
			}
			exponents.put(dimension, exponent);
		}
		return new DimensionVector(exponents);
	}

	public int exponentOf(Dimension dimension) {
		return exponents.getOrDefault(dimension, 0);
	}

	public boolean isDimensionless() {
		return exponents.isEmpty();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		exponents.forEach((dimension, exponent) -> {
			sb.append(dimension.label());
			if (exponent != 1) {
				sb.append(exponent);
			}
		});
		return sb.toString();
	}

	private static Dimension labelAt(String text, int pos) {
		for (Dimension dimension : BY_LABEL_LENGTH) {
			if (text.startsWith(dimension.label(), pos)) {
				return dimension;
			}
		}
		return null;
	}
}
