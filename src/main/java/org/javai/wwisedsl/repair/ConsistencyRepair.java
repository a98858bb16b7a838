package org.javai.wwisedsl.repair;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.javai.wwisedsl.dsl.Statement;
import org.javai.wwisedsl.registry.ObjectRegistry;
import org.javai.wwisedsl.reverse.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites cross-sample parent references in a batch of samples.
 * <p>
 * A sample whose head is placed under the head of another sample in the batch would not replay on
 * its own. Repair places such heads under the sentinel root instead. Every other sample is returned
 * as the same instance. Repair needs the whole batch: the set of root names is only known once every
 * sample has been produced. Applying it twice gives the same result as applying it once.
 */
public final class ConsistencyRepair {

	private static final Logger logger = LoggerFactory.getLogger(ConsistencyRepair.class);

	private ConsistencyRepair() {
	}

	public static List<Sample> repair(List<Sample> batch) {
		Set<String> rootNames = rootNames(batch);
		List<Sample> repaired = new ArrayList<>(batch.size());
		int rewritten = 0;
		for (Sample sample : batch) {
			Optional<Statement.Create> head = sample.headCreate();
			if (head.isPresent() && rootNames.contains(head.get().parentName())) {
				logger.debug("Placing \"{}\" under {} instead of \"{}\"", sample.rootName(),
						ObjectRegistry.SENTINEL_ROOT_NAME, head.get().parentName());
				repaired.add(sample.withHeadParent(ObjectRegistry.SENTINEL_ROOT_NAME));
				rewritten++;
			}
			else {
				repaired.add(sample);
			}
		}
		logger.info("Repaired {} of {} sample(s)", rewritten, batch.size());
		return List.copyOf(repaired);
	}

	/**
	 * Names of all sample heads in the batch, excluding the sentinel root.
	 */
	static Set<String> rootNames(List<Sample> batch) {
		Set<String> names = new LinkedHashSet<>();
		for (Sample sample : batch) {
			if (!ObjectRegistry.isSentinel(sample.rootName())) {
				names.add(sample.rootName());
			}
		}
		return names;
	}
}
