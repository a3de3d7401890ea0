package lgen.model.ladder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An application instruction (MOV, +, INC, ...). Operands are kept verbatim; their count
 * is checked on the instruction list, not here.
 */
public class LadderApplication extends LadderOutput {
	private final String mnemonic;
	private final List<String> operands;

	public LadderApplication(String mnemonic, List<String> operands) {
		this.mnemonic = Objects.requireNonNull(mnemonic);
		this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
	}

	public String getMnemonic() {
		return mnemonic;
	}

	public List<String> getOperands() {
		return operands;
	}

	@Override
	public <T, E extends Throwable> T accept(LadderOutputVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LadderApplication that = (LadderApplication) o;
		return mnemonic.equals(that.mnemonic) && operands.equals(that.operands);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mnemonic, operands);
	}
}
