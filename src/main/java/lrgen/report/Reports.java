package lrgen.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lrgen.LRGenException;

/**
 * Serializes the result documents.
 */
public class Reports {

	private static final ObjectMapper mapper = new ObjectMapper();

	public static String toJson(Object report){
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
		} catch (JsonProcessingException e) {
			throw new LRGenException("Can't serialize " + report.getClass().getSimpleName(), e);
		}
	}
}
