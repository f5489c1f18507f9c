package works.jsonapi.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Defensive copies for the member collections held by JSON:API value types.
 * <p>
 * {@link List#copyOf} and {@link Map#copyOf} reject nulls, but JSON arrays and
 * objects can legitimately contain {@code null}, so we can't use those here.
 * Member order is preserved.
 */
public final class Members {
	private Members() {}

	@Nullable
	public static <K, V> Map<K, V> immutableCopy(@Nullable Map<K, V> map) {
		if (map == null) {
			return null;
		} else {
			return Collections.unmodifiableMap(new LinkedHashMap<>(map));
		}
	}

	@Nullable
	public static <E> List<E> immutableCopy(@Nullable List<E> list) {
		if (list == null) {
			return null;
		} else {
			return Collections.unmodifiableList(new ArrayList<>(list));
		}
	}

	@Nullable
	public static String emptyToNull(@Nullable String s) {
		return (s == null || s.isEmpty()) ? null : s;
	}
}
