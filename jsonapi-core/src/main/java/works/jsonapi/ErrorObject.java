package works.jsonapi;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static works.jsonapi.util.Members.immutableCopy;

/**
 * An error object. See https://jsonapi.org/format/#error-objects.
 * Every member is optional.
 *
 * @param status the HTTP status code applicable to this problem, as a string.
 * @param code an application-specific error code.
 */
public record ErrorObject(
	@Nullable String id,
	@Nullable ErrorLinks links,
	@Nullable String status,
	@Nullable String code,
	@Nullable String title,
	@Nullable String detail,
	@Nullable ErrorSource source,
	@Nullable Map<String, Object> meta
) {
	public ErrorObject {
		meta = immutableCopy(meta);
	}

	public static ErrorObject of(String status, String title) {
		return new ErrorObject(null, null, status, null, title, null, null, null);
	}
}
