package works.kvsync.sync;

import works.kvsync.Format;
import works.kvsync.RootHandle;

/**
 * A registration with a {@link ChangeRouter}: keys matching {@code format}
 * are applied to the object in {@code root}, and then {@code callback} is called.
 *
 * @param id distinguishes this registration from others with the same format over time
 */
public record SyncObject<T>(
	long id,
	String format,
	Format parsedFormat,
	RootHandle<T> root,
	SyncCallback callback
) { }
