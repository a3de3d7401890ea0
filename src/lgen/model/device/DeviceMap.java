package lgen.model.device;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered, read-only snapshot of a synthesis run's allocations.
 */
public final class DeviceMap {
	private final List<DeviceAllocation> allocations;

	public DeviceMap() {
		this(Collections.emptyList());
	}

	public DeviceMap(List<DeviceAllocation> allocations) {
		this.allocations = Collections.unmodifiableList(new ArrayList<>(allocations));
	}

	public List<DeviceAllocation> getAllocations() {
		return allocations;
	}

	public Optional<DeviceAllocation> getByName(String name) {
		for (DeviceAllocation allocation : allocations) {
			if (allocation.getLogicalName().equals(name)) {
				return Optional.of(allocation);
			}
		}
		return Optional.empty();
	}

	public Optional<DeviceAllocation> getByAddress(DeviceAddress address) {
		for (DeviceAllocation allocation : allocations) {
			if (allocation.getAddress().equals(address)) {
				return Optional.of(allocation);
			}
		}
		return Optional.empty();
	}

	public Optional<String> getAddressString(String name) {
		return getByName(name).map(a -> a.getAddress().render());
	}

	public int size() {
		return allocations.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return allocations.equals(((DeviceMap) o).allocations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(allocations);
	}
}
