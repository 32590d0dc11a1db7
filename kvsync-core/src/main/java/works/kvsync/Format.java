package works.kvsync;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.kvsync.annotations.KeyFormat;
import works.kvsync.exceptions.InvalidFieldFormatException;

import static java.util.Objects.requireNonNull;

/**
 * A parsed key layout like {@code /users/{key}/}.
 *
 * <p>
 * The text is split on {@code /}. Each segment is a literal key component,
 * {@code {key}} where a map key goes, {@code {index}} where a sequence index would go,
 * or, as the last segment only, an empty string meaning the object's fields
 * are stored under keys of their own. A format that does not end this way
 * stores the whole object as one value.
 */
public final class Format {
	private final String text;
	private final PVector<Segment> segments;

	public sealed interface Segment permits Literal, Token { }

	public record Literal(String text) implements Segment {
		@Override
		public String toString() {
			return text;
		}
	}

	public enum Token implements Segment {
		KEY("{key}"),
		INDEX("{index}"),
		END("");

		private final String text;

		Token(String text) {
			this.text = text;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	private Format(String text, PVector<Segment> segments) {
		this.text = text;
		this.segments = segments;
	}

	public static Format parse(String text) {
		String[] parts = requireNonNull(text).split("/", -1);
		List<Segment> segments = new ArrayList<>(parts.length);
		for (int i = 0; i < parts.length; i++) {
			String part = parts[i];
			if (part.isEmpty() && i == parts.length - 1) {
				segments.add(Token.END);
			} else if (part.equals(Token.KEY.text)) {
				segments.add(Token.KEY);
			} else if (part.equals(Token.INDEX.text)) {
				segments.add(Token.INDEX);
			} else {
				segments.add(new Literal(part));
			}
		}
		return new Format(text, TreePVector.from(segments));
	}

	/**
	 * @param annotation the field's override, if any
	 * @return the format of a field within its enclosing object
	 * @throws InvalidFieldFormatException if the format is absolute
	 */
	public static Format forField(Class<?> containingClass, String fieldName, @Nullable KeyFormat annotation) {
		if (annotation == null) {
			return parse(fieldName);
		}
		String text = annotation.value();
		if (text.startsWith("/")) {
			throw new InvalidFieldFormatException(containingClass, fieldName, "format \"" + text + "\" must not start with a slash");
		}
		return parse(text);
	}

	public List<Segment> segments() {
		return segments;
	}

	public boolean isEmpty() {
		return segments.isEmpty();
	}

	public Segment first() {
		return segments.get(0);
	}

	public Format rest() {
		return new Format(null, segments.minus(0));
	}

	public boolean startsWith(Segment segment) {
		return !segments.isEmpty() && segments.get(0).equals(segment);
	}

	/**
	 * @return true if only the {@link Token#END END} marker remains,
	 * meaning the current object's fields are stored under keys of their own
	 */
	public boolean isFieldBoundary() {
		return segments.size() == 1 && segments.get(0) == Token.END;
	}

	/**
	 * @return the literal segments up to the first token, ignoring the empty
	 * first segment of a format that starts with a slash
	 */
	public List<String> literalPrefix() {
		List<String> result = new ArrayList<>();
		for (int i = 0; i < segments.size(); i++) {
			if (!(segments.get(i) instanceof Literal literal)) {
				break;
			}
			if (i == 0 && literal.text().isEmpty()) {
				continue;
			}
			result.add(literal.text());
		}
		return result;
	}

	/**
	 * @return true if the literal key space of one format contains the other's
	 */
	public boolean overlaps(Format other) {
		List<String> mine = this.literalPrefix();
		List<String> theirs = other.literalPrefix();
		int common = Math.min(mine.size(), theirs.size());
		return mine.subList(0, common).equals(theirs.subList(0, common));
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return segments.equals(((Format) o).segments);
	}

	@Override
	public int hashCode() {
		return segments.hashCode();
	}

	@Override
	public String toString() {
		if (text != null) {
			return text;
		}
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < segments.size(); i++) {
			if (i > 0) {
				sb.append('/');
			}
			sb.append(segments.get(i));
		}
		return sb.toString();
	}
}
