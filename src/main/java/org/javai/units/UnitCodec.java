package org.javai.units;

import java.util.List;
import java.util.Objects;
import org.javai.units.ast.Expression;
import org.javai.units.ast.Term;
import org.javai.units.canonical.CanonicalForm;
import org.javai.units.canonical.Canonicalizer;
import org.javai.units.definitions.DefinitionsRegistry;
import org.javai.units.definitions.DefinitionsTable;
import org.javai.units.generate.GeneratorOptions;
import org.javai.units.generate.UnitGenerator;
import org.javai.units.parse.TokenizerOptions;
import org.javai.units.parse.UnitParser;
import org.javai.units.parse.UnitToken;
import org.javai.units.parse.UnitTokenizer;
import org.javai.units.polish.PolishNotation;
import org.javai.units.text.Latin1Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point tying the definitions table, tokenizer, parser, canonicalizer and
 * generator together.
 * <p>
 * A codec is immutable and holds no per-call state, so one instance may serve any
 * number of threads.
 *
 * <pre>{@code
 * UnitCodec codec = UnitCodec.builder()
 *         .table(DefinitionsRegistry.bundled())
 *         .generatorOptions(GeneratorOptions.defaults())
 *         .build();
 *
 * Expression conductivity = codec.parse("W/(m K)");
 * String text = codec.generate(conductivity);
 * boolean same = codec.equivalent("W/(m K)", "W m^-1 K^-1");
 * }</pre>
 */
public final class UnitCodec {

	private static final Logger logger = LoggerFactory.getLogger(UnitCodec.class);

	private final DefinitionsTable table;
	private final TokenizerOptions tokenizerOptions;
	private final GeneratorOptions generatorOptions;
	private final UnitGenerator generator;

	private UnitCodec(DefinitionsTable table, TokenizerOptions tokenizerOptions, GeneratorOptions generatorOptions) {
		this.table = Objects.requireNonNull(table, "table must not be null");
		this.tokenizerOptions = tokenizerOptions != null ? tokenizerOptions : TokenizerOptions.defaults();
		this.generatorOptions = generatorOptions != null ? generatorOptions : GeneratorOptions.defaults();
		this.generator = new UnitGenerator(table, this.generatorOptions);
	}

	/**
	 * A codec over the bundled canonical definitions with default options.
	 */
	public static UnitCodec withBundledDefinitions() {
		return new UnitCodec(DefinitionsRegistry.bundled(), null, null);
	}

	public static UnitCodec of(DefinitionsTable table) {
		return new UnitCodec(table, null, null);
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<UnitToken> tokenize(String text) {
		return new UnitTokenizer(text, table, tokenizerOptions).tokenize();
	}

	/**
	 * Parse unit text into an expression tree.
	 *
	 * @throws UnitsException subclass carrying the offset of the failure
	 */
	public Expression parse(String text) {
		Expression expression = new UnitParser(tokenize(text)).parse();
		if (logger.isTraceEnabled()) {
			logger.trace("Parsed '{}' as {}", text, PolishNotation.write(expression));
		}
		return expression;
	}

	/**
	 * Parse Latin-1 encoded unit text.
	 */
	public Expression parse(byte[] latin1) {
		return parse(Latin1Text.decode(latin1));
	}

	public String generate(Term term) {
		return generator.generate(term);
	}

	/**
	 * Render with options other than the codec's own.
	 */
	public String generate(Term term, GeneratorOptions options) {
		return new UnitGenerator(table, options).generate(term);
	}

	public CanonicalForm canonicalize(Term term) {
		return Canonicalizer.canonicalize(term);
	}

	public CanonicalForm canonicalize(String text) {
		return canonicalize(parse(text));
	}

	/**
	 * Whether two texts reduce to the same canonical form.
	 */
	public boolean equivalent(String left, String right) {
		return canonicalize(left).equals(canonicalize(right));
	}

	public String toPolish(Term term) {
		return PolishNotation.write(term);
	}

	public Expression fromPolish(String polish) {
		return PolishNotation.read(polish, table);
	}

	public DefinitionsTable table() {
		return table;
	}

	public TokenizerOptions tokenizerOptions() {
		return tokenizerOptions;
	}

	public GeneratorOptions generatorOptions() {
		return generatorOptions;
	}

	public static final class Builder {
		private DefinitionsTable table;
		private TokenizerOptions tokenizerOptions = TokenizerOptions.defaults();
		private GeneratorOptions generatorOptions = GeneratorOptions.defaults();

		private Builder() {}

		public Builder table(DefinitionsTable table) {
			this.table = table;
			return this;
		}

		public Builder tokenizerOptions(TokenizerOptions tokenizerOptions) {
			this.tokenizerOptions = tokenizerOptions;
			return this;
		}

		public Builder generatorOptions(GeneratorOptions generatorOptions) {
			this.generatorOptions = generatorOptions;
			return this;
		}

		public UnitCodec build() {
			if (table == null) {
				throw new IllegalStateException("A definitions table is required");
			}
			return new UnitCodec(table, tokenizerOptions, generatorOptions);
		}
	}
}
