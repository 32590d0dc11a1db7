package works.kvsync.exceptions;

import java.io.IOException;

public class NoSuchKeyException extends IOException {
	private final String key;

	public NoSuchKeyException(String key) {
		super("No such key: \"" + key + "\"");
		this.key = key;
	}

	public String key() {
		return key;
	}
}
