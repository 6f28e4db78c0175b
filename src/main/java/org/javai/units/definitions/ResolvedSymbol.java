package org.javai.units.definitions;

import java.util.List;
import java.util.Objects;

/**
 * A symbol split into its prefixes (possibly none) and the unit they apply to.
 */
public record ResolvedSymbol(List<Prefix> prefixes, UnitDefinition unit) {

	public ResolvedSymbol {
		prefixes = prefixes != null ? List.copyOf(prefixes) : List.of();
		Objects.requireNonNull(unit, "unit must not be null");
	}

	/**
	 * Sum of the prefix scales, i.e. the base-10 exponent the prefixes contribute.
	 */
	public int totalScale() {
		int scale = 0;
		for (Prefix prefix : prefixes) {
			scale += prefix.scale();
		}
		return scale;
	}
}
