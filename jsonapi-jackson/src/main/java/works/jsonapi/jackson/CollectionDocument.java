package works.jsonapi.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.jsonapi.ErrorObject;
import works.jsonapi.JsonApiInfo;
import works.jsonapi.Link;

import static works.jsonapi.util.Members.immutableCopy;

/**
 * A document whose {@code data} member is an array of resource objects
 * with attributes of type {@code A} and relationships of type {@code R}.
 */
public final class CollectionDocument<A, R> extends AbstractDocument<List<Resource<A, R>>> {
	private CollectionDocument() {
	}

	@JsonCreator(mode = JsonCreator.Mode.DISABLED)
	public CollectionDocument(
		@Nullable JsonApiInfo jsonApi,
		@Nullable List<Resource<A, R>> data,
		@Nullable List<ErrorObject> errors,
		@Nullable Map<String, Link> links,
		@Nullable List<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>> included,
		@Nullable Map<String, Object> meta
	) {
		super(jsonApi, immutableCopy(data), errors, links, included, meta);
	}

	public static <A, R> CollectionDocument<A, R> of(List<Resource<A, R>> data) {
		return new CollectionDocument<>(null, data, null, null, null, null);
	}

	@Override
	public boolean hasSingleResource() {
		return false;
	}

	@Override
	public boolean hasCollectionResource() {
		return data() != null;
	}

	public CollectionDocument<A, R> withExtension(String name, JsonNode value) {
		CollectionDocument<A, R> result = new CollectionDocument<>(jsonApi(), data(), errors(), links(), included(), meta());
		result.putAllExtensions(this);
		result.putExtension(name, value);
		return result;
	}
}
