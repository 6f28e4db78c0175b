package org.javai.units.conformance;

/**
 * Labels of the dimension vector used by conformance fixtures, in printing order.
 */
public enum Dimension {
	TIME("T"),
	LENGTH("L"),
	MASS("M"),
	CURRENT("I"),
	TEMPERATURE("Θ"),
	AMOUNT("N"),
	LUMINOUS_INTENSITY("J"),
	CHARGE("Ch"),
	CURRENCY("C");

	private final String label;

	Dimension(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
