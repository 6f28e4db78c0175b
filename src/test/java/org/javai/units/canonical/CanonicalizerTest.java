package org.javai.units.canonical;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.units.UnitCodec;
import org.javai.units.ast.Atom;
import org.javai.units.ast.AtomKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CanonicalizerTest {

	private static final UnitCodec CODEC = UnitCodec.withBundledDefinitions();

	private static CanonicalForm canonical(String text) {
		return Canonicalizer.canonicalize(CODEC.parse(text));
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"W/(m K)        | W m^-1 K^-1",
			"km             | 1000 m",
			"mm             | 0.001 m",
			"km^2           | 1000000 m^2",
			"m^0.5 m^0.5    | m",
			"(m/s)/s        | m s^-2",
			"m/(s/(kg/A))   | m kg s^-1 A^-1",
			"2^0.5 2^0.5    | 2",
			"{chem: CO2}/{chem: CO2} | 1",
			"m/m            | 1",
			"kMm            | 1000000000 m",
			"um             | µm",
			"hm^0.5         | 10 m^0.5",
			"cm^0.5         | 0.1 m^0.5",
			"km^0.5 m^0.5   | 10 10^0.5 m",
			"4^0.5 m        | 2 m",
			"8^0.25 2^0.25  | 2",
			"0.25^0.5 s     | 0.5 s",
	})
	void equivalentExpressions(String left, String right) {
		assertThat(canonical(left)).isEqualTo(canonical(right));
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"kg      | 1000 g",
			"m       | {m}",
			"m       | 2 m",
			"L       | l",
			"{chem: CO2} | {CO2}",
	})
	void distinctExpressions(String left, String right) {
		assertThat(canonical(left)).isNotEqualTo(canonical(right));
	}

	@Test
	void cancelledAtomsAreDropped() {
		CanonicalForm form = canonical("m/m");

		assertThat(form.hasNoAtoms()).isTrue();
		assertThat(form).isEqualTo(CanonicalForm.ONE);
	}

	@Test
	void denominatorNegatesExponents() {
		CanonicalForm form = canonical("kg m s^-2/A");

		assertThat(form.exponentOf(Atom.unit("kg"))).isEqualTo(Rational.ONE);
		assertThat(form.exponentOf(Atom.unit("s"))).isEqualTo(Rational.of(-2));
		assertThat(form.exponentOf(Atom.unit("A"))).isEqualTo(Rational.MINUS_ONE);
		assertThat(form.exponentOf(Atom.unit("K"))).isEqualTo(Rational.ZERO);
	}

	@Test
	void marksBecomeAtomsOfTheirKind() {
		CanonicalForm form = canonical("{currency: USD}/h");

		assertThat(form.exponentOf(new Atom(AtomKind.CURRENCY, "USD"))).isEqualTo(Rational.ONE);
		assertThat(form).hasToString("h^-1 {currency: USD}");
	}

	@Test
	void prefixScalesFoldIntoTheCoefficient() {
		assertThat(canonical("km/s")).hasToString("1000 m s^-1");
		assertThat(canonical("3 mm").coefficient()).isEqualTo(Coefficient.of(Rational.of(3, 1000)));
	}

	@Test
	void radicalCoefficientsReduceToPrimeBases() {
		assertThat(canonical("hm^0.5")).hasToString("10 m^(1/2)");
		assertThat(canonical("km^0.5 m^0.5")).hasToString("10 * 2^(1/2) * 5^(1/2) m");
		assertThat(canonical("10^0.5 m")).hasToString("2^(1/2) * 5^(1/2) m");
		assertThat(canonical("4^0.5 m").coefficient().isExact()).isTrue();
	}

	@Test
	void canonicalizingIsIdempotent() {
		CanonicalForm form = canonical("2^0.5 kg^0.5 m/(s K)");

		assertThat(Canonicalizer.canonicalize(form)).isEqualTo(form);
		assertThat(Canonicalizer.canonicalize(Canonicalizer.canonicalize(form))).isEqualTo(form);
	}

	@Test
	void equivalenceOfTrees() {
		assertThat(Canonicalizer.equivalent(CODEC.parse("N m"), CODEC.parse("m N"))).isTrue();
		assertThat(Canonicalizer.equivalent(CODEC.parse("N m"), CODEC.parse("J"))).isFalse();
	}

	@Test
	void divisionByZeroFails() {
		assertThatThrownBy(() -> canonical("m/0")).isInstanceOf(ArithmeticException.class);
		assertThatThrownBy(() -> canonical("0^-1 m")).isInstanceOf(ArithmeticException.class);
	}

	@Test
	void zeroCoefficientIsAllowed() {
		assertThat(canonical("0 m").coefficient().rational()).isEqualTo(Rational.ZERO);
	}
}
