package lgen.model.timing;

import java.util.Optional;

public enum InputKind {
	PUSH_BUTTON("push_button"),
	TOGGLE_SWITCH("toggle_switch"),
	SENSOR("sensor"),
	LIMIT_SWITCH("limit_switch");

	private final String externalName;

	InputKind(String externalName) {
		this.externalName = externalName;
	}

	public String getExternalName() {
		return externalName;
	}

	public static Optional<InputKind> fromExternalName(String name) {
		for (InputKind kind : values()) {
			if (kind.externalName.equals(name)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
