package lgen.model.timing;

import java.util.Optional;

public enum OutputKind {
	LAMP("lamp"),
	MOTOR("motor"),
	BUZZER("buzzer"),
	SOLENOID("solenoid"),
	RELAY("relay"),
	PUMP("pump");

	private final String externalName;

	OutputKind(String externalName) {
		this.externalName = externalName;
	}

	public String getExternalName() {
		return externalName;
	}

	public static Optional<OutputKind> fromExternalName(String name) {
		for (OutputKind kind : values()) {
			if (kind.externalName.equals(name)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
