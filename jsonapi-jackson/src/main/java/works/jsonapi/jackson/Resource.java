package works.jsonapi.jackson;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.jsonapi.Link;
import works.jsonapi.ResourceIdentifier;

import static java.util.Objects.requireNonNull;
import static works.jsonapi.util.Members.immutableCopy;

/**
 * A resource object. See https://jsonapi.org/format/#document-resource-objects.
 * <p>
 * The attributes and relationships are type parameters so that callers who
 * know the schema can bind them to their own classes. Callers who don't can use
 * {@link JsonApiTypes#UNTYPED_RESOURCE}, where the attributes are an open map
 * and each relationship is a {@code Relationship<PrimaryData>}.
 *
 * @param <A> the attributes type.
 * @param <R> the relationships type.
 * @param lid a local identifier, unique only within the enclosing document.
 */
public record Resource<A, R>(
	String type,
	@Nullable String id,
	@Nullable String lid,
	@Nullable A attributes,
	@Nullable R relationships,
	@Nullable Map<String, Link> links,
	@Nullable Map<String, Object> meta
) {
	public Resource {
		requireNonNull(type, "type is required for resource objects");
		links = immutableCopy(links);
		meta = immutableCopy(meta);
	}

	public static <A, R> Resource<A, R> of(String type, String id, A attributes) {
		return new Resource<>(type, id, null, attributes, null, null, null);
	}

	public ResourceIdentifier identifier() {
		return new ResourceIdentifier(type, id, lid, null);
	}
}
