package lrgen;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import guru.nidi.graphviz.engine.Format;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lrgen.grammar.GrammarParser;
import lrgen.grammar.InvalidGrammarException;
import lrgen.parser.lr.Generator;
import lrgen.parser.lr.Graph;
import lrgen.parser.lr.ParserType;
import lrgen.report.Reports;

/**
 * Command line interface
 *
 * <pre>
 * generate &lt;grammar file&gt; [lr0|slr1]
 * parse &lt;grammar file&gt; &lt;input&gt; [lr0|slr1]
 * dot &lt;grammar file&gt; [output file (.dot, .svg or .png)]
 * </pre>
 */
public class Main {

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	static final String USAGE = "Usage:\n" +
			"  generate <grammar file> [lr0|slr1]\n" +
			"  parse <grammar file> <input> [lr0|slr1]\n" +
			"  dot <grammar file> [output file]";

	private static final List<String> commands = Arrays.asList("generate", "parse", "dot");

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Results and messages are written UTF-8 encoded, independent of the platform charset.
	 *
	 * @return exit code, 0 if the command succeeded (rejected inputs included)
	 */
	static int run(String[] args, OutputStream outStream, OutputStream errStream){
		PrintStream out = new PrintStream(outStream, true, StandardCharsets.UTF_8);
		PrintStream err = new PrintStream(errStream, true, StandardCharsets.UTF_8);
		if (args.length < 2){
			err.println(USAGE);
			return 1;
		}
		try {
			if (!commands.contains(args[0])){
				throw new UsageException("Unknown command " + args[0]);
			}
			String grammarText = read(args[1]);
			switch (args[0]){
				case "generate":
					checkArgumentCount(args, 2, 3);
					out.println(Reports.toJson(new Generator().generate(grammarText, parserType(args, 2))));
					return 0;
				case "parse":
					checkArgumentCount(args, 3, 4);
					out.println(Reports.toJson(new Generator().parse(grammarText, args[2], parserType(args, 3))));
					return 0;
				case "dot":
					checkArgumentCount(args, 2, 3);
					Graph graph = Graph.createFromGrammar(GrammarParser.parse(grammarText));
					if (args.length == 2){
						out.println(graph.toGraphvizString());
					} else {
						writeGraph(graph, args[2]);
					}
					return 0;
				default:
					throw new UsageException("Unknown command " + args[0]);
			}
		} catch (UsageException ex){
			err.println(ex.getMessage());
			err.println(USAGE);
			return 1;
		} catch (InvalidGrammarException ex){
			err.println("Invalid grammar: " + ex.getMessage());
			return 1;
		} catch (LRGenException | IOException ex){
			logger.debug("Command failed", ex);
			err.println(ex.getMessage());
			return 1;
		}
	}

	private static String read(String file) throws IOException {
		return new String(Files.readAllBytes(Paths.get(file)), StandardCharsets.UTF_8);
	}

	private static ParserType parserType(String[] args, int index){
		return args.length > index ? ParserType.fromName(args[index]) : Config.parserType();
	}

	private static void checkArgumentCount(String[] args, int min, int max){
		if (args.length < min || args.length > max){
			throw new UsageException(String.format("%s expects %d to %d arguments", args[0], min - 1, max - 1));
		}
	}

	private static void writeGraph(Graph graph, String file) throws IOException {
		String lowerCase = file.toLowerCase(Locale.ROOT);
		if (lowerCase.endsWith(".svg")){
			graph.toImage(new File(file), Format.SVG);
		} else if (lowerCase.endsWith(".png")){
			graph.toImage(new File(file), Format.PNG);
		} else {
			Files.write(Paths.get(file), graph.toGraphvizString().getBytes(StandardCharsets.UTF_8));
		}
	}

	static class UsageException extends LRGenException {

		UsageException(String message) {
			super(message);
		}
	}
}
