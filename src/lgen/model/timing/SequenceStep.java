package lgen.model.timing;

import java.util.Objects;
import java.util.Optional;

/**
 * One step of a timing sequence: when the trigger happens, perform the action, optionally
 * after a delay in seconds.
 */
public final class SequenceStep {
	private final ActionLabel trigger;
	private final ActionLabel action;
	private final Double delay;

	public SequenceStep(ActionLabel trigger, ActionLabel action, Double delay) {
		this.trigger = Objects.requireNonNull(trigger);
		this.action = Objects.requireNonNull(action);
		this.delay = delay;
	}

	public SequenceStep(String trigger, String action, Double delay) {
		this(ActionLabel.parse(trigger), ActionLabel.parse(action), delay);
	}

	public SequenceStep(String trigger, String action) {
		this(trigger, action, null);
	}

	public ActionLabel getTrigger() {
		return trigger;
	}

	public ActionLabel getAction() {
		return action;
	}

	public Optional<Double> getDelay() {
		return Optional.ofNullable(delay);
	}

	/**
	 * @return true if the step carries no delay at all
	 */
	public boolean isImmediate() {
		return delay == null;
	}

	public boolean isDelayed() {
		return delay != null && delay > 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SequenceStep that = (SequenceStep) o;
		return trigger.equals(that.trigger) && action.equals(that.action) && Objects.equals(delay, that.delay);
	}

	@Override
	public int hashCode() {
		return Objects.hash(trigger, action, delay);
	}

	@Override
	public String toString() {
		return trigger + " -> " + action + (delay == null ? "" : " after " + delay + "s");
	}
}
