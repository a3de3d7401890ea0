package lgen.trans.patterns;

import lgen.model.timing.TimingDescription;

import java.util.*;

/**
 * Patterns ordered by priority, highest first. Patterns of equal priority keep their
 * registration order, so selection is deterministic.
 */
public class PatternRegistry {
	private static final Comparator<LadderPattern> BY_PRIORITY =
			Comparator.comparingInt(LadderPattern::getPriority).reversed();

	private final List<LadderPattern> patterns;

	public PatternRegistry() {
		this.patterns = new ArrayList<>();
	}

	public static PatternRegistry createDefault() {
		PatternRegistry registry = new PatternRegistry();
		registry.register(SequentialPattern.pattern());
		registry.register(SelfHoldPattern.pattern());
		registry.register(TimerDelayPattern.pattern());
		registry.register(FullResetPattern.pattern());
		registry.register(FlickerPattern.pattern());
		return registry;
	}

	public void register(LadderPattern pattern) {
		if (getPattern(pattern.getName()).isPresent()) {
			throw new IllegalArgumentException("pattern " + pattern.getName() + " is already registered");
		}
		patterns.add(pattern);
		// List.sort is stable
		patterns.sort(BY_PRIORITY);
	}

	public List<LadderPattern> getPatterns() {
		return Collections.unmodifiableList(patterns);
	}

	public List<LadderPattern> findMatching(TimingDescription timing) {
		List<LadderPattern> matching = new ArrayList<>();
		for (LadderPattern pattern : patterns) {
			if (pattern.matches(timing)) {
				matching.add(pattern);
			}
		}
		return matching;
	}

	public Optional<LadderPattern> findBest(TimingDescription timing) {
		for (LadderPattern pattern : patterns) {
			if (pattern.matches(timing)) {
				return Optional.of(pattern);
			}
		}
		return Optional.empty();
	}

	public Optional<LadderPattern> getPattern(String name) {
		for (LadderPattern pattern : patterns) {
			if (pattern.getName().equals(name)) {
				return Optional.of(pattern);
			}
		}
		return Optional.empty();
	}
}
