package works.kvsync.sync;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ChangeRouterSettings {
	/**
	 * When an incoming value doesn't decode into the type of the field it targets,
	 * the field is reset to its zero value instead of the update being skipped.
	 * This keeps one malformed write from holding up everything else,
	 * at the cost of losing the malformed value.
	 */
	@Default boolean ignoreUnmarshalFailure = true;

	@Default CallbackFailureMode callbackFailureMode = CallbackFailureMode.PROPAGATE;

	public enum CallbackFailureMode {
		/**
		 * {@link ChangeRouter#next} throws a {@link works.kvsync.exceptions.CallbackFailedException}
		 * once every matching callback has been called.
		 */
		PROPAGATE,

		/**
		 * Failures are logged and otherwise ignored.
		 */
		LOG,
	}
}
