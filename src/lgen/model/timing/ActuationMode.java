package lgen.model.timing;

import java.util.Optional;

/**
 * Whether an input springs back when released.
 */
public enum ActuationMode {
	MOMENTARY("momentary"),
	MAINTAINED("maintained");

	private final String externalName;

	ActuationMode(String externalName) {
		this.externalName = externalName;
	}

	public String getExternalName() {
		return externalName;
	}

	public static Optional<ActuationMode> fromExternalName(String name) {
		for (ActuationMode mode : values()) {
			if (mode.externalName.equals(name)) {
				return Optional.of(mode);
			}
		}
		return Optional.empty();
	}
}
