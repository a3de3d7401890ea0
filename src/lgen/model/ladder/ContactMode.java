package lgen.model.ladder;

public enum ContactMode {
	NO, // normally open, true while the device is on
	NC, // normally closed, true while the device is off
}
