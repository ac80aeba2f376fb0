package lrgen;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lrgen.parser.lr.ParserType;

/**
 * Global settings.
 *
 * Defaults are overridden by the lines of the form <pre>key = value</pre> in the file
 * {@value #configFile} (if it exists in the working directory) and then by system properties
 * named <pre>lrgen.key</pre>.
 */
public class Config {

	private static final Logger logger = LoggerFactory.getLogger(Config.class);

	public static final String configFile = "lrgen.ini";

	public static final String propertyPrefix = "lrgen.";

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("parserType", "lr0");
		put("cacheSize", "16");
		put("maxParseSteps", "10000");
		put("rejectConflicts", "no");
	}};

	/** Parser type used when a request doesn't name one */
	public static ParserType parserType(){
		return ParserType.fromName(get("parserType"));
	}

	/** Number of generated tables kept by the generator */
	public static int cacheSize(){
		return getInt("cacheSize");
	}

	/** Maximum number of steps a single parse may take */
	public static int maxParseSteps(){
		return getInt("maxParseSteps");
	}

	/** Refuse to parse with tables that contain conflicts? */
	public static boolean rejectConflicts(){
		return get("rejectConflicts").equals("yes");
	}

	private static String get(String key){
		String property = System.getProperty(propertyPrefix + key);
		if (property != null){
			return property.trim();
		}
		return config.get(key);
	}

	private static int getInt(String key){
		String value = get(key);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException ex){
			throw new LRGenException(String.format("Config value of \"%s\" isn't an integer: %s", key, value), ex);
		}
	}

	static void load(Path file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					String key = parts[0].trim();
					if (config.containsKey(key)){
						config.put(key, parts[1].trim());
					} else {
						logger.warn("Unknown config key \"{}\" in {}", key, file);
					}
				}
			}
		}
	}

	static {
		Path file = Paths.get(configFile);
		if (Files.exists(file)){
			try {
				load(file);
			} catch (IOException e) {
				logger.warn("Can't read {}, using defaults", file, e);
			}
		}
	}
}
