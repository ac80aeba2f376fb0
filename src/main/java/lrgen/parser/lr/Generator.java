package lrgen.parser.lr;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lrgen.Config;
import lrgen.grammar.Grammar;
import lrgen.grammar.GrammarParser;
import lrgen.lexer.LexerError;
import lrgen.lexer.Tokenizer;
import lrgen.report.GenerationReport;
import lrgen.report.ParseReport;
import lrgen.util.Cache;

/**
 * Generates parser tables from grammar texts and parses inputs with them.
 *
 * Generated tables are cached by grammar text and parser type.
 */
public class Generator {

	private static final Logger logger = LoggerFactory.getLogger(Generator.class);

	private final Cache<String, LRParserTable> cache;

	public Generator(){
		this(Config.cacheSize());
	}

	public Generator(int cacheSize){
		this.cache = new Cache<>(cacheSize);
	}

	/**
	 * @throws lrgen.grammar.InvalidGrammarException if the grammar text isn't valid
	 */
	public LRParserTable generateTable(String grammarText, ParserType type){
		String id = type.id + "\n" + grammarText;
		LRParserTable table = cache.getIfPresent(id);
		if (table != null){
			logger.debug("Using cached {} table", type);
			return table;
		}
		Grammar grammar = GrammarParser.parse(grammarText);
		table = Graph.createFromGrammar(grammar).toParserTable(type);
		cache.put(id, table);
		return table;
	}

	public GenerationReport generate(String grammarText, ParserType type){
		return new GenerationReport(generateTable(grammarText, type));
	}

	/**
	 * Tokenizes the input and parses it. Rejected inputs and unknown tokens result in a report that isn't
	 * accepted.
	 *
	 * @throws lrgen.grammar.InvalidGrammarException if the grammar text isn't valid
	 * @throws ConflictingGrammarException if the table has conflicts and {@link Config#rejectConflicts()}
	 */
	public ParseReport parse(String grammarText, String input, ParserType type){
		LRParserTable table = generateTable(grammarText, type);
		if (!table.isConflictFree()){
			if (Config.rejectConflicts()){
				throw new ConflictingGrammarException(table);
			}
			logger.warn("Parsing with a {} table that has {} conflicts", type, table.getConflicts().size());
		}
		List<String> tokens;
		try {
			tokens = new Tokenizer(table.grammar.getTerminals()).tokenize(input);
		} catch (LexerError error){
			logger.debug("Input rejected by the tokenizer: {}", error.getMessage());
			return ParseReport.rejected(error.getMessage());
		}
		try {
			return ParseReport.accepted(new LRParser(table).parse(tokens));
		} catch (ParseRejectedException ex){
			logger.debug("Input rejected: {}", ex.getMessage());
			return ParseReport.rejected(ex);
		}
	}
}
