package works.kvsync.exceptions;

import works.kvsync.sync.ChangeEvent;

public class EventNavigationException extends Exception {
	private final ChangeEvent.Failure failure;

	public EventNavigationException(ChangeEvent.Failure failure) {
		super(failure.description());
		this.failure = failure;
	}

	public ChangeEvent.Failure failure() {
		return failure;
	}
}
