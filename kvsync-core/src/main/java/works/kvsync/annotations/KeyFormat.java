package works.kvsync.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Overrides the format of a field, which otherwise is just the field's name.
 *
 * <p>
 * The format is relative to the enclosing object, so it must not start with {@code /}.
 * End it with {@code /} to store the field's own fields under separate keys,
 * and use a {@code {key}} segment where a map key goes:
 *
 * <pre>
 * record Inventory(
 *     &#64;KeyFormat("items/{key}/") Map&lt;String, Item&gt; items,
 *     &#64;KeyFormat("owner") String ownerName
 * ) {}
 * </pre>
 */
@Retention(RUNTIME)
@Target({ FIELD, RECORD_COMPONENT })
public @interface KeyFormat {
	String value();
}
