package zedtex.trans;

import zedtex.ZedTexException;
import zedtex.ZedTexOptions;
import zedtex.errors.TopLevelIssueContext;
import zedtex.lexer.ZLexer;
import zedtex.lexer.ZToken;
import zedtex.model.z.ZDocument;
import zedtex.parser.ZDocumentParser;
import zedtex.trans.passes.codegen.latex.Dialect;
import zedtex.trans.passes.codegen.latex.LatexCodeGenPass;

import java.util.List;
import java.util.logging.Logger;

/**
 * Runs whiteboard notation through the lexer, the parser and the LaTeX generator.
 *
 * Every call works on fresh pipeline objects, so one translator may be shared between threads. Errors of any
 * stage are thrown to the caller unchanged.
 */
public class ZedTexTranslator {
	private static final Logger logger = Logger.getLogger("ZedTex");

	private final ZedTexOptions options;

	public ZedTexTranslator() {
		this(ZedTexOptions.defaults());
	}

	public ZedTexTranslator(ZedTexOptions options) {
		this.options = options;
	}

	public ZedTexOptions getOptions() {
		return options;
	}

	/**
	 * @throws zedtex.lexer.ZLexerException if the source cannot be tokenized
	 */
	public List<ZToken> tokenize(String source) {
		logger.fine("Lexing input");
		try {
			return new ZLexer(source, options.proseDetector()).tokenize();
		} catch (ZedTexException e) {
			logger.fine("Lexing failed: " + e.getMessage());
			throw e;
		}
	}

	/**
	 * @throws zedtex.parser.ZParseException if the tokens do not form a document
	 */
	public ZDocument parse(List<ZToken> tokens) {
		logger.fine("Parsing " + tokens.size() + " tokens");
		try {
			return ZDocumentParser.parse(tokens, options.proseDetector());
		} catch (ZedTexException e) {
			logger.fine("Parsing failed: " + e.getMessage());
			throw e;
		}
	}

	/**
	 * @throws zedtex.trans.passes.codegen.latex.GenerationException if an item of the document has no rendering
	 */
	public GenerationResult generate(ZDocument document, Dialect dialect) {
		logger.fine("Generating " + dialect.getConfigName() + " dialect");
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String output;
		try {
			output = LatexCodeGenPass.perform(ctx, document, dialect, options);
		} catch (ZedTexException e) {
			logger.fine("Generation failed: " + e.getMessage());
			throw e;
		}
		List<String> warnings = ctx.getWarnings();
		if(ctx.hasIssues()) {
			logger.warning(ctx.summary());
			for(String warning : warnings) {
				logger.fine(warning);
			}
		}
		return new GenerationResult(output, warnings);
	}

	public GenerationResult generate(ZDocument document) {
		return generate(document, options.dialect);
	}

	public GenerationResult translate(String source, Dialect dialect) {
		GenerationResult result = generate(parse(tokenize(source)), dialect);
		logger.info("Translated " + source.length() + " characters to " + dialect.getConfigName()
				+ " with " + result.getWarnings().size() + " warning(s)");
		return result;
	}

	public GenerationResult translate(String source) {
		return translate(source, options.dialect);
	}
}
