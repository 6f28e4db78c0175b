package org.javai.units.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.units.ast.Expression;
import org.javai.units.ast.Factor;
import org.javai.units.ast.FactorValue;
import org.javai.units.definitions.DefinitionsRegistry;
import org.javai.units.definitions.DefinitionsTable;
import org.javai.units.polish.PolishNotation;
import org.junit.jupiter.api.Test;

/**
 * Tests for the recursive descent unit parser. Expected trees are stated in
 * Polish notation.
 */
class UnitParserTest {

	private static final DefinitionsTable TABLE = DefinitionsRegistry.bundled();

	private static Expression parse(String input) {
		return new UnitParser(new UnitTokenizer(input, TABLE).tokenize()).parse();
	}

	private static String polish(String input) {
		return PolishNotation.write(parse(input));
	}

	@Test
	void parsesProducts() {
		assertThat(polish("kg m s^-2")).isEqualTo("(* kg m (^ s -2))");
		assertThat(polish("3 {chem: CO2}")).isEqualTo("(* 3 (chem 'CO2'))");
	}

	@Test
	void parsesSingleFactorDenominator() {
		Expression expression = parse("m/s");

		assertThat(expression.numerator()).hasSize(1);
		assertThat(expression.denominator()).isInstanceOf(Factor.class);
		assertThat(polish("m/s^2")).isEqualTo("(/ (* m) (^ s 2))");
	}

	@Test
	void parsesParenthesizedDenominator() {
		assertThat(polish("W/(m K)")).isEqualTo("(/ (* W) (* m K))");
		assertThat(polish("J/(mol K)")).isEqualTo("(/ (* J) (* mol K))");
	}

	@Test
	void parsesNumeratorGroups() {
		assertThat(polish("(m/s)/Hz")).isEqualTo("(/ (* (/ (* m) s)) Hz)");
		assertThat(polish("(kg m) s")).isEqualTo("(* (* kg m) s)");
	}

	@Test
	void nestedGroupsStartAfresh() {
		assertThat(polish("m/(s/(kg/A))")).isEqualTo("(/ (* m) (/ (* s) (/ (* kg) A)))");
	}

	@Test
	void parsingDoesNotMergeAtoms() {
		Expression expression = parse("m m");

		assertThat(expression.numerator()).hasSize(2);
		assertThat(expression.numerator()).allSatisfy(term ->
				assertThat(((Factor) term).value()).isInstanceOf(FactorValue.PrefixedUnit.class));
	}

	@Test
	void rejectsDoubleDivision() {
		assertThatThrownBy(() -> parse("m/s/s"))
				.isInstanceOf(UnitSyntaxException.class)
				.hasMessageContaining("Only one '/'")
				.satisfies(e -> assertThat(((UnitSyntaxException) e).offset()).isEqualTo(3));
	}

	@Test
	void rejectsUnparenthesizedProductDenominator() {
		assertThatThrownBy(() -> parse("W/m K"))
				.isInstanceOf(UnitSyntaxException.class)
				.hasMessageContaining("must be parenthesized")
				.satisfies(e -> assertThat(((UnitSyntaxException) e).offset()).isEqualTo(4));
	}

	@Test
	void rejectsUnbalancedParentheses() {
		assertThatThrownBy(() -> parse("(m/s"))
				.isInstanceOf(UnitSyntaxException.class)
				.hasMessage("Unclosed '(' at offset 0");
		assertThatThrownBy(() -> parse("m/s)"))
				.isInstanceOf(UnitSyntaxException.class)
				.hasMessage("Unmatched ')' at offset 3");
	}

	@Test
	void rejectsEmptyTermLists() {
		assertThatThrownBy(() -> parse(""))
				.isInstanceOf(UnitSyntaxException.class)
				.hasMessage("Empty expression at offset 0");
		assertThatThrownBy(() -> parse("m ()"))
				.isInstanceOf(UnitSyntaxException.class)
				.hasMessageContaining("Empty parentheses");
		assertThatThrownBy(() -> parse("/s"))
				.isInstanceOf(UnitSyntaxException.class)
				.hasMessageContaining("Numerator expected");
		assertThatThrownBy(() -> parse("m/"))
				.isInstanceOf(UnitSyntaxException.class)
				.hasMessage("Denominator expected after '/' at offset 2");
	}

	@Test
	void requiresEofTerminatedTokens() {
		assertThatThrownBy(() -> new UnitParser(List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
