package works.jsonapi.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.jsonapi.ErrorObject;
import works.jsonapi.JsonApiInfo;
import works.jsonapi.Link;

/**
 * A document whose {@code data} member is a single resource object
 * with attributes of type {@code A} and relationships of type {@code R}.
 * <p>
 * Reading a document whose {@code data} is an array into this type fails
 * with the underlying mapper's usual type mismatch error.
 */
public final class ResourceDocument<A, R> extends AbstractDocument<Resource<A, R>> {
	private ResourceDocument() {
	}

	@JsonCreator(mode = JsonCreator.Mode.DISABLED)
	public ResourceDocument(
		@Nullable JsonApiInfo jsonApi,
		@Nullable Resource<A, R> data,
		@Nullable List<ErrorObject> errors,
		@Nullable Map<String, Link> links,
		@Nullable List<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>> included,
		@Nullable Map<String, Object> meta
	) {
		super(jsonApi, data, errors, links, included, meta);
	}

	public static <A, R> ResourceDocument<A, R> of(Resource<A, R> data) {
		return new ResourceDocument<>(null, data, null, null, null, null);
	}

	@Override
	public boolean hasSingleResource() {
		return data() != null;
	}

	@Override
	public boolean hasCollectionResource() {
		return false;
	}

	public ResourceDocument<A, R> withExtension(String name, JsonNode value) {
		ResourceDocument<A, R> result = new ResourceDocument<>(jsonApi(), data(), errors(), links(), included(), meta());
		result.putAllExtensions(this);
		result.putExtension(name, value);
		return result;
	}
}
