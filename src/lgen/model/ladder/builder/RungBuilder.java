package lgen.model.ladder.builder;

import lgen.model.device.DeviceAddress;
import lgen.model.ladder.*;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fluent builder for one rung. Contacts are added in series; {@link #orContact} puts a
 * contact in parallel with the most recently added series member.
 *
 * Closing the builder hands the finished rung to its owner. A rung whose construction
 * failed part way is dropped on close; a rung without contacts or outputs is rejected.
 */
public class RungBuilder implements Closeable {

	public interface OnSuccess {
		void action(LadderRung rung);
	}

	private final int index;
	private final String comment;
	private final OnSuccess onSuccess;
	private final List<LadderSeriesMember> members;
	private final List<LadderOutput> outputs;
	// legs of the branch at the end of members, while it is still open for more OR contacts
	private List<LadderSeriesConnection> openLegs;
	private boolean broken;

	public RungBuilder(int index, String comment, OnSuccess onSuccess) {
		this.index = index;
		this.comment = comment;
		this.onSuccess = onSuccess;
		this.members = new ArrayList<>();
		this.outputs = new ArrayList<>();
		this.openLegs = null;
		this.broken = false;
	}

	private DeviceAddress parse(String device) {
		try {
			return DeviceAddress.parse(device);
		} catch (IllegalArgumentException e) {
			broken = true;
			throw e;
		}
	}

	public int getIndex() {
		return index;
	}

	public RungBuilder noContact(DeviceAddress device) {
		return member(LadderContact.normallyOpen(device));
	}

	public RungBuilder noContact(String device) {
		return noContact(parse(device));
	}

	public RungBuilder ncContact(DeviceAddress device) {
		return member(LadderContact.normallyClosed(device));
	}

	public RungBuilder ncContact(String device) {
		return ncContact(parse(device));
	}

	public RungBuilder parallel(LadderParallelBranch branch) {
		return member(branch);
	}

	private RungBuilder member(LadderSeriesMember member) {
		members.add(member);
		openLegs = null;
		return this;
	}

	public RungBuilder orContact(DeviceAddress device, ContactMode mode) {
		if (members.isEmpty()) {
			broken = true;
			throw new IllegalStateException("rung " + index + ": OR contact needs a preceding contact");
		}
		int last = members.size() - 1;
		if (openLegs == null) {
			openLegs = new ArrayList<>();
			openLegs.add(LadderSeriesConnection.of(members.get(last)));
		}
		openLegs.add(LadderSeriesConnection.of(new LadderContact(device, mode)));
		members.set(last, new LadderParallelBranch(openLegs));
		return this;
	}

	public RungBuilder orContact(DeviceAddress device) {
		return orContact(device, ContactMode.NO);
	}

	public RungBuilder orContact(String device, ContactMode mode) {
		return orContact(parse(device), mode);
	}

	public RungBuilder orContact(String device) {
		return orContact(parse(device), ContactMode.NO);
	}

	public RungBuilder coil(DeviceAddress device) {
		outputs.add(new LadderCoil(device));
		return this;
	}

	public RungBuilder coil(String device) {
		return coil(parse(device));
	}

	public RungBuilder timer(DeviceAddress device, int kValue) {
		outputs.add(new LadderTimer(device, kValue));
		return this;
	}

	public RungBuilder timer(String device, int kValue) {
		return timer(parse(device), kValue);
	}

	public RungBuilder counter(DeviceAddress device, int kValue) {
		outputs.add(new LadderCounter(device, kValue));
		return this;
	}

	public RungBuilder counter(String device, int kValue) {
		return counter(parse(device), kValue);
	}

	public RungBuilder set(DeviceAddress device) {
		outputs.add(new LadderSetReset(device, LadderSetReset.Operation.SET));
		return this;
	}

	public RungBuilder set(String device) {
		return set(parse(device));
	}

	public RungBuilder reset(DeviceAddress device) {
		outputs.add(new LadderSetReset(device, LadderSetReset.Operation.RESET));
		return this;
	}

	public RungBuilder reset(String device) {
		return reset(parse(device));
	}

	public RungBuilder application(String mnemonic, String... operands) {
		outputs.add(new LadderApplication(mnemonic, Arrays.asList(operands)));
		return this;
	}

	public LadderRung build() {
		LadderInputSection inputSection;
		if (members.size() == 1 && members.get(0) instanceof LadderParallelBranch) {
			inputSection = (LadderParallelBranch) members.get(0);
		} else {
			inputSection = new LadderSeriesConnection(members);
		}
		return new LadderRung(index, comment, inputSection, outputs);
	}

	@Override
	public void close() {
		if (broken) {
			return;
		}
		if (members.isEmpty() || outputs.isEmpty()) {
			throw new IllegalStateException("rung " + index + " needs at least one contact and one output");
		}
		onSuccess.action(build());
	}
}
