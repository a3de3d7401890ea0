package lgen.trans.patterns;

import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;

/**
 * Emits the rungs of one idiom. Generators allocate devices through the allocator and
 * append rungs and pattern tags to the builder; both belong to a single synthesis run.
 */
@FunctionalInterface
public interface PatternGenerator {
	void generate(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder);
}
