package lgen.trans.allocation;

public class DeviceRangeException extends DeviceException {
	private static final long serialVersionUID = -2950433436020734613L;

	public DeviceRangeException(String msg) {
		super(msg);
	}
}
