package org.javai.wwisedsl.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import org.javai.wwisedsl.reverse.Sample;

/**
 * Writes sample records as JSON Lines, one compact object per line.
 */
public class SampleRecordWriter implements Closeable {

	private final ObjectMapper mapper;
	private final Writer out;
	private int written = 0;

	public SampleRecordWriter(Writer out) {
		this(out, new ObjectMapper());
	}

	public SampleRecordWriter(Writer out, ObjectMapper mapper) {
		this.out = Objects.requireNonNull(out, "out must not be null");
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	public void write(SampleRecord record) throws IOException {
		out.write(mapper.writeValueAsString(record));
		out.write('\n');
		written++;
	}

	public void write(Sample sample) throws IOException {
		write(SampleRecord.from(sample));
	}

	public void writeAll(List<Sample> samples) throws IOException {
		for (Sample sample : samples) {
			write(sample);
		}
		out.flush();
	}

	public int written() {
		return written;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}
}
