package lgen.model.device;

import java.util.Objects;
import java.util.Optional;

/**
 * Binds a logical name (PB1, RL, M_HOLD, ...) to a device address.
 */
public final class DeviceAllocation {
	private final String logicalName;
	private final DeviceAddress address;
	private final String comment;
	private final TimerConfig timerConfig;
	private final CounterConfig counterConfig;

	public DeviceAllocation(String logicalName, DeviceAddress address, String comment,
	                        TimerConfig timerConfig, CounterConfig counterConfig) {
		this.logicalName = Objects.requireNonNull(logicalName);
		this.address = Objects.requireNonNull(address);
		this.comment = comment == null ? "" : comment;
		this.timerConfig = timerConfig;
		this.counterConfig = counterConfig;
	}

	public String getLogicalName() {
		return logicalName;
	}

	public DeviceAddress getAddress() {
		return address;
	}

	public String getComment() {
		return comment;
	}

	public Optional<TimerConfig> getTimerConfig() {
		return Optional.ofNullable(timerConfig);
	}

	public Optional<CounterConfig> getCounterConfig() {
		return Optional.ofNullable(counterConfig);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DeviceAllocation that = (DeviceAllocation) o;
		return logicalName.equals(that.logicalName) &&
				address.equals(that.address) &&
				comment.equals(that.comment) &&
				Objects.equals(timerConfig, that.timerConfig) &&
				Objects.equals(counterConfig, that.counterConfig);
	}

	@Override
	public int hashCode() {
		return Objects.hash(logicalName, address, comment, timerConfig, counterConfig);
	}

	@Override
	public String toString() {
		return logicalName + "=" + address.render();
	}
}
