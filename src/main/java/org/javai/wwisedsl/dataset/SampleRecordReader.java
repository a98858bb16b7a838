package org.javai.wwisedsl.dataset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads JSON Lines written by {@link SampleRecordWriter}. Blank lines are skipped; unknown fields are
 * ignored so records enriched by downstream tools still load.
 */
public class SampleRecordReader {

	private final ObjectMapper mapper = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

	/**
	 * @throws DatasetFormatException if a line is not a sample record
	 */
	public List<SampleRecord> readAll(Reader reader) throws IOException {
		BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
		List<SampleRecord> records = new ArrayList<>();
		String line;
		int lineNumber = 0;
		while ((line = buffered.readLine()) != null) {
			lineNumber++;
			if (line.isBlank()) {
				continue;
			}
			records.add(parse(lineNumber, line));
		}
		return records;
	}

	public SampleRecord parse(int lineNumber, String line) {
		try {
			return mapper.readValue(line, SampleRecord.class);
		}
		catch (JsonProcessingException e) {
			throw new DatasetFormatException(lineNumber, e.getOriginalMessage(), e);
		}
	}
}
