package lgen.trans.allocation;

import lgen.LGenException;

/**
 * Device allocation or addressing failure. Always fatal for the synthesis run.
 */
public class DeviceException extends LGenException {
	private static final long serialVersionUID = 6610258853287351770L;
	private static final String prefix = "Device Error";

	public DeviceException(String msg) {
		super(prefix, msg);
	}
}
