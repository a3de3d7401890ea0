package lgen.model.timing;

import java.util.*;

/**
 * What a control program should do, as declared devices plus a sequence of steps.
 */
public final class TimingDescription {
	private final String description;
	private final List<InputDeclaration> inputs;
	private final List<OutputDeclaration> outputs;
	private final List<SequenceStep> steps;

	public TimingDescription(String description, List<InputDeclaration> inputs,
							 List<OutputDeclaration> outputs, List<SequenceStep> steps) {
		this.description = description == null ? "" : description;
		this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
		this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
	}

	public String getDescription() {
		return description;
	}

	public List<InputDeclaration> getInputs() {
		return inputs;
	}

	public List<OutputDeclaration> getOutputs() {
		return outputs;
	}

	public List<SequenceStep> getSteps() {
		return steps;
	}

	public List<SequenceStep> getDelayedSteps() {
		List<SequenceStep> delayed = new ArrayList<>();
		for (SequenceStep step : steps) {
			if (step.isDelayed()) {
				delayed.add(step);
			}
		}
		return delayed;
	}

	public Optional<InputDeclaration> findInput(String name) {
		for (InputDeclaration input : inputs) {
			if (input.getName().equals(name)) {
				return Optional.of(input);
			}
		}
		return Optional.empty();
	}

	public Optional<OutputDeclaration> findOutput(String name) {
		for (OutputDeclaration output : outputs) {
			if (output.getName().equals(name)) {
				return Optional.of(output);
			}
		}
		return Optional.empty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TimingDescription that = (TimingDescription) o;
		return description.equals(that.description) &&
				inputs.equals(that.inputs) &&
				outputs.equals(that.outputs) &&
				steps.equals(that.steps);
	}

	@Override
	public int hashCode() {
		return Objects.hash(description, inputs, outputs, steps);
	}
}
