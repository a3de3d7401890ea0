package lgen.trans.allocation;

import lgen.model.device.*;

import java.util.*;

/**
 * First-fit device allocator. Each logical name maps to exactly one address for the
 * lifetime of the allocator; addresses of one type never collide.
 *
 * An allocator belongs to a single synthesis run and must not be shared.
 */
public class DeviceAllocator {

	private final Map<DeviceType, Integer> nextAddress;
	private final Map<DeviceType, Set<Integer>> allocated;
	private final Map<String, DeviceAllocation> allocationsByName;
	private final List<DeviceAllocation> allocations;

	public DeviceAllocator() {
		this(Collections.emptyMap());
	}

	/**
	 * @param startAddresses per-type cursor start; types not present start at 0
	 */
	public DeviceAllocator(Map<DeviceType, Integer> startAddresses) {
		this.nextAddress = new EnumMap<>(DeviceType.class);
		this.allocated = new EnumMap<>(DeviceType.class);
		for (DeviceType type : DeviceType.values()) {
			int start = startAddresses.getOrDefault(type, 0);
			if (start < 0) {
				throw new DeviceRangeException("start address for " + type + " must be non-negative, got " + start);
			}
			nextAddress.put(type, start);
			allocated.put(type, new HashSet<>());
		}
		this.allocationsByName = new HashMap<>();
		this.allocations = new ArrayList<>();
	}

	public DeviceAllocation allocate(String logicalName, DeviceType type, String comment) {
		return allocate(logicalName, type, comment, null, null, null);
	}

	public DeviceAllocation allocate(String logicalName, DeviceType type, String comment, Integer preferredAddress) {
		return allocate(logicalName, type, comment, null, null, preferredAddress);
	}

	/**
	 * Returns the existing allocation when the name was seen before (whatever the
	 * requested type); otherwise assigns the preferred address or the type's cursor,
	 * skipping addresses that are already taken.
	 */
	public DeviceAllocation allocate(String logicalName, DeviceType type, String comment,
	                                 TimerConfig timerConfig, CounterConfig counterConfig,
	                                 Integer preferredAddress) {
		DeviceAllocation existing = allocationsByName.get(logicalName);
		if (existing != null) {
			return existing;
		}

		int limit = type.getCapacity();
		Set<Integer> taken = allocated.get(type);
		int address = preferredAddress != null ? preferredAddress : nextAddress.get(type);
		while (taken.contains(address)) {
			address++;
			if (address >= limit) {
				throw new DeviceRangeException(
						"No more addresses available for " + type + " (limit: " + limit + ")");
			}
		}
		if (address >= limit) {
			throw new DeviceRangeException(
					"Address " + address + " exceeds limit for " + type + " (max: " + (limit - 1) + ")");
		}

		return record(logicalName, new DeviceAddress(type, address), comment, timerConfig, counterConfig);
	}

	/**
	 * Pins a logical name to an exact address. Unlike {@link #allocate}, a taken address
	 * is a conflict instead of being skipped.
	 */
	public DeviceAllocation reserve(String logicalName, DeviceType type, int address, String comment) {
		DeviceAllocation existing = allocationsByName.get(logicalName);
		DeviceAddress requested = new DeviceAddress(type, address);
		if (existing != null) {
			if (existing.getAddress().equals(requested)) {
				return existing;
			}
			throw new DeviceConflictException(
					logicalName + " is already allocated to " + existing.getAddress().render());
		}
		if (address >= type.getCapacity()) {
			throw new DeviceRangeException(
					"Address " + address + " exceeds limit for " + type + " (max: " + (type.getCapacity() - 1) + ")");
		}
		if (allocated.get(type).contains(address)) {
			throw new DeviceConflictException("Address " + requested.render() + " is already allocated");
		}
		return record(logicalName, requested, comment, null, null);
	}

	private DeviceAllocation record(String logicalName, DeviceAddress address, String comment,
	                                TimerConfig timerConfig, CounterConfig counterConfig) {
		DeviceType type = address.getType();
		allocated.get(type).add(address.getAddress());
		nextAddress.put(type, address.getAddress() + 1);
		DeviceAllocation allocation = new DeviceAllocation(logicalName, address, comment, timerConfig, counterConfig);
		allocationsByName.put(logicalName, allocation);
		allocations.add(allocation);
		return allocation;
	}

	public DeviceAllocation allocateInput(String name, String comment) {
		return allocate(name, DeviceType.X, comment);
	}

	public DeviceAllocation allocateOutput(String name, String comment) {
		return allocate(name, DeviceType.Y, comment);
	}

	public DeviceAllocation allocateRelay(String name, String comment) {
		return allocate(name, DeviceType.M, comment);
	}

	public DeviceAllocation allocateTimer(String name, double seconds, String comment) {
		TimerConfig config = TimerConfig.fromSeconds(seconds, comment);
		return allocate(name, DeviceType.T, comment, config, null, null);
	}

	public DeviceAllocation allocateCounter(String name, int count, String comment) {
		CounterConfig config = new CounterConfig(count, comment);
		return allocate(name, DeviceType.C, comment, null, config, null);
	}

	public Optional<DeviceAllocation> getAllocation(String logicalName) {
		return Optional.ofNullable(allocationsByName.get(logicalName));
	}

	public DeviceMap buildDeviceMap() {
		return new DeviceMap(allocations);
	}
}
