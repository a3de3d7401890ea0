package lgen.model.il;

import java.util.*;

public final class InstructionSequence implements Iterable<Instruction> {
	private final List<Instruction> instructions;

	public InstructionSequence(List<Instruction> instructions) {
		this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
	}

	public InstructionSequence(Instruction... instructions) {
		this(Arrays.asList(instructions));
	}

	public List<Instruction> getInstructions() {
		return instructions;
	}

	public int size() {
		return instructions.size();
	}

	public boolean isEmpty() {
		return instructions.isEmpty();
	}

	public Instruction get(int index) {
		return instructions.get(index);
	}

	@Override
	public Iterator<Instruction> iterator() {
		return instructions.iterator();
	}

	/**
	 * @return one rendered instruction per line
	 */
	public List<String> toLines() {
		List<String> lines = new ArrayList<>(instructions.size());
		for (Instruction instruction : instructions) {
			lines.add(instruction.toString());
		}
		return lines;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return instructions.equals(((InstructionSequence) o).instructions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(instructions);
	}

	@Override
	public String toString() {
		return String.join(System.lineSeparator(), toLines());
	}
}
