package lgen.trans.patterns;

import lgen.model.ladder.builder.LadderBuilder;
import lgen.model.timing.TimingDescription;
import lgen.trans.allocation.DeviceAllocator;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named control idiom: a predicate deciding whether a timing description exhibits it,
 * and a generator producing its rungs.
 */
public final class LadderPattern {
	private final String name;
	private final String description;
	private final int priority;
	private final Predicate<TimingDescription> matcher;
	private final PatternGenerator generator;

	public LadderPattern(String name, String description, int priority,
						 Predicate<TimingDescription> matcher, PatternGenerator generator) {
		this.name = Objects.requireNonNull(name);
		this.description = Objects.requireNonNull(description);
		this.priority = priority;
		this.matcher = Objects.requireNonNull(matcher);
		this.generator = Objects.requireNonNull(generator);
	}

	public String getName() {
		return name;
	}

	public String getDescription() {
		return description;
	}

	public int getPriority() {
		return priority;
	}

	public boolean matches(TimingDescription timing) {
		return matcher.test(timing);
	}

	public void generate(TimingDescription timing, DeviceAllocator allocator, LadderBuilder builder) {
		generator.generate(timing, allocator, builder);
	}

	@Override
	public String toString() {
		return name + " (priority " + priority + ")";
	}
}
