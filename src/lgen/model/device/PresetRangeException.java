package lgen.model.device;

import lgen.LGenException;

/**
 * A timer or counter preset that does not fit the 16-bit K constant of the PLC.
 */
public class PresetRangeException extends LGenException {
	private static final long serialVersionUID = 4418263097551030871L;

	public PresetRangeException(String detail) {
		super("Device Error", detail);
	}
}
