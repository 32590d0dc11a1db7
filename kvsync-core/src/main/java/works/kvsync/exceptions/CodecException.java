package works.kvsync.exceptions;

public class CodecException extends Exception {
	public CodecException(String message) {
		super(message);
	}

	public CodecException(String message, Throwable cause) {
		super(message, cause);
	}

	public CodecException(Throwable cause) {
		super(cause);
	}
}
