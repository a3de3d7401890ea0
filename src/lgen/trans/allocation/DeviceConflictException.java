package lgen.trans.allocation;

public class DeviceConflictException extends DeviceException {
	private static final long serialVersionUID = 1862007314512376924L;

	public DeviceConflictException(String msg) {
		super(msg);
	}
}
