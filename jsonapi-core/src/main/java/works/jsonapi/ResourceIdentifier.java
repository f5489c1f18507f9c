package works.jsonapi;

import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;
import static works.jsonapi.util.Members.immutableCopy;

/**
 * A reference to a resource by type and identifier,
 * as in https://jsonapi.org/format/#document-resource-identifier-objects.
 * <p>
 * Ordinarily at least one of {@code id} and {@code lid} is present,
 * but that's left to the caller.
 *
 * @param lid a local identifier, unique only within the enclosing document.
 */
public record ResourceIdentifier(
	String type,
	@Nullable String id,
	@Nullable String lid,
	@Nullable Map<String, Object> meta
) {
	public ResourceIdentifier {
		requireNonNull(type, "type is required for resource identifiers");
		meta = immutableCopy(meta);
	}

	public static ResourceIdentifier of(String type, String id) {
		return new ResourceIdentifier(type, id, null, null);
	}

	public static ResourceIdentifier local(String type, String lid) {
		return new ResourceIdentifier(type, null, lid, null);
	}
}
