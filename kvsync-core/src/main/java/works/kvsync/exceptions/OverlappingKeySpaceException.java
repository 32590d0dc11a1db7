package works.kvsync.exceptions;

public class OverlappingKeySpaceException extends IllegalArgumentException {
	private final String format;
	private final String existingFormat;

	public OverlappingKeySpaceException(String format, String existingFormat) {
		super("Format \"" + format + "\" overlaps the key space of \"" + existingFormat + "\"");
		this.format = format;
		this.existingFormat = existingFormat;
	}

	public String format() {
		return format;
	}

	public String existingFormat() {
		return existingFormat;
	}
}
