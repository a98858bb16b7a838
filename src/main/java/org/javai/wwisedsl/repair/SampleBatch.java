package org.javai.wwisedsl.repair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.javai.wwisedsl.reverse.Sample;

/**
 * Collects the samples of one batch and repairs them once the batch is complete.
 * <p>
 * Samples may be added from any number of trees. {@link #seal()} runs {@link ConsistencyRepair} over
 * everything collected and freezes the batch; adding afterwards is an error. Not thread-safe.
 */
public final class SampleBatch {

	private final List<Sample> collected = new ArrayList<>();
	private List<Sample> sealed;

	public SampleBatch add(Sample sample) {
		requireOpen();
		collected.add(sample);
		return this;
	}

	public SampleBatch addAll(Collection<Sample> samples) {
		requireOpen();
		collected.addAll(samples);
		return this;
	}

	/**
	 * Repair the batch and return the final samples. Later calls return the same list.
	 */
	public List<Sample> seal() {
		if (sealed == null) {
			sealed = ConsistencyRepair.repair(collected);
		}
		return sealed;
	}

	public boolean isSealed() {
		return sealed != null;
	}

	public int size() {
		return collected.size();
	}

	private void requireOpen() {
		if (sealed != null) {
			throw new IllegalStateException("Batch is sealed; samples can no longer be added");
		}
	}
}
