package works.jsonapi.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.jsonapi.ErrorObject;
import works.jsonapi.JsonApiInfo;
import works.jsonapi.Link;

/**
 * A document whose {@code data} member has not been bound to any resource type.
 * <p>
 * Use {@link #hasSingleResource()} and {@link #hasCollectionResource()} to find
 * out what the data looks like, then project it with
 * {@link JsonApiSerializer#resource(JsonApiDocument, Class) resource}
 * or {@link JsonApiSerializer#resourceCollection(JsonApiDocument, Class) resourceCollection}.
 */
public final class JsonApiDocument extends AbstractDocument<PrimaryData> {
	private JsonApiDocument() {
	}

	@JsonCreator(mode = JsonCreator.Mode.DISABLED)
	public JsonApiDocument(
		@Nullable JsonApiInfo jsonApi,
		@Nullable PrimaryData data,
		@Nullable List<ErrorObject> errors,
		@Nullable Map<String, Link> links,
		@Nullable List<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>> included,
		@Nullable Map<String, Object> meta
	) {
		super(jsonApi, PrimaryData.orAbsent(data), errors, links, included, meta);
	}

	public static JsonApiDocument ofData(PrimaryData data) {
		return new JsonApiDocument(null, data, null, null, null, null);
	}

	public static JsonApiDocument ofErrors(List<ErrorObject> errors) {
		return new JsonApiDocument(null, null, errors, null, null, null);
	}

	/**
	 * Never null. A missing or {@code null} member is {@link PrimaryData.Absent}.
	 */
	@Override
	public @NotNull PrimaryData data() {
		return PrimaryData.orAbsent(super.data());
	}

	@Override
	public boolean hasSingleResource() {
		return data() instanceof PrimaryData.Single;
	}

	@Override
	public boolean hasCollectionResource() {
		return data() instanceof PrimaryData.Collection;
	}

	public JsonApiDocument withExtension(String name, JsonNode value) {
		JsonApiDocument result = new JsonApiDocument(jsonApi(), data(), errors(), links(), included(), meta());
		result.putAllExtensions(this);
		result.putExtension(name, value);
		return result;
	}
}
