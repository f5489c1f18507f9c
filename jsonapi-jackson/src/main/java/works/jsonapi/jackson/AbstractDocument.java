package works.jsonapi.jackson;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.jsonapi.ErrorObject;
import works.jsonapi.JsonApiInfo;
import works.jsonapi.Link;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.CUSTOM;
import static works.jsonapi.util.Members.immutableCopy;

/**
 * The members common to every top-level JSON:API document
 * (https://jsonapi.org/format/#document-top-level).
 * <p>
 * Subclasses decide how the {@code data} member is typed:
 * {@link JsonApiDocument} keeps it as {@link PrimaryData},
 * while {@link ResourceDocument} and {@link CollectionDocument} bind it to
 * a single resource or a list of resources respectively.
 * <p>
 * {@code data} and {@code errors} are reported independently.
 * A document carrying both is not valid JSON:API, but it is not rejected either.
 * <p>
 * Top-level members with no field here (such as those defined by extensions)
 * are kept in {@link #extensions()}, in the order they were read,
 * and written back out unchanged after the standard members.
 * <p>
 * Extension members must reach {@link #putExtension} in document order, so Jackson
 * binds documents through the no-argument constructor and the setters, never a creator.
 *
 * @param <D> the type of the {@code data} member.
 */
@JsonPropertyOrder({"jsonapi", "data", "errors", "links", "included", "meta"})
public abstract class AbstractDocument<D> {
	private JsonApiInfo jsonApi;
	private D data;
	private List<ErrorObject> errors;
	private Map<String, Link> links;
	private List<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>> included;
	private Map<String, Object> meta;
	private final Map<String, JsonNode> extensions = new LinkedHashMap<>();

	protected AbstractDocument() {
	}

	protected AbstractDocument(
		@Nullable JsonApiInfo jsonApi,
		@Nullable D data,
		@Nullable List<ErrorObject> errors,
		@Nullable Map<String, Link> links,
		@Nullable List<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>> included,
		@Nullable Map<String, Object> meta
	) {
		this.jsonApi = jsonApi;
		this.data = data;
		this.errors = immutableCopy(errors);
		this.links = immutableCopy(links);
		this.included = immutableCopy(included);
		this.meta = immutableCopy(meta);
	}

	@JsonProperty("jsonapi")
	public @Nullable JsonApiInfo jsonApi() {
		return jsonApi;
	}

	@JsonProperty("jsonapi")
	private void setJsonApi(@Nullable JsonApiInfo jsonApi) {
		this.jsonApi = jsonApi;
	}

	@JsonProperty("data")
	@JsonInclude(value = CUSTOM, valueFilter = AbsentDataFilter.class)
	public @Nullable D data() {
		return data;
	}

	@JsonProperty("data")
	private void setData(@Nullable D data) {
		this.data = data;
	}

	@JsonProperty("errors")
	public @Nullable List<ErrorObject> errors() {
		return errors;
	}

	@JsonProperty("errors")
	private void setErrors(@Nullable List<ErrorObject> errors) {
		this.errors = immutableCopy(errors);
	}

	@JsonProperty("links")
	public @Nullable Map<String, Link> links() {
		return links;
	}

	@JsonProperty("links")
	private void setLinks(@Nullable Map<String, Link> links) {
		this.links = immutableCopy(links);
	}

	@JsonProperty("included")
	public @Nullable List<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>> included() {
		return included;
	}

	@JsonProperty("included")
	private void setIncluded(@Nullable List<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>> included) {
		this.included = immutableCopy(included);
	}

	@JsonProperty("meta")
	public @Nullable Map<String, Object> meta() {
		return meta;
	}

	@JsonProperty("meta")
	private void setMeta(@Nullable Map<String, Object> meta) {
		this.meta = immutableCopy(meta);
	}

	@JsonAnyGetter
	public Map<String, JsonNode> extensions() {
		return Collections.unmodifiableMap(extensions);
	}

	@JsonAnySetter
	protected void putExtension(String name, JsonNode value) {
		extensions.put(name, value);
	}

	protected void putAllExtensions(AbstractDocument<?> other) {
		extensions.putAll(other.extensions);
	}

	/**
	 * @return true if the {@code data} member is a single resource object.
	 */
	public abstract boolean hasSingleResource();

	/**
	 * @return true if the {@code data} member is an array of resource objects, even an empty one.
	 */
	public abstract boolean hasCollectionResource();

	/**
	 * @return true if the {@code errors} member is present and non-empty.
	 */
	public boolean hasErrors() {
		return errors != null && !errors.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		AbstractDocument<?> that = (AbstractDocument<?>) o;
		return Objects.equals(jsonApi, that.jsonApi)
			&& Objects.equals(data(), that.data())
			&& Objects.equals(errors, that.errors)
			&& Objects.equals(links, that.links)
			&& Objects.equals(included, that.included)
			&& Objects.equals(meta, that.meta)
			&& Objects.equals(extensions, that.extensions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(jsonApi, data(), errors, links, included, meta, extensions);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()
			+ "(jsonApi=" + jsonApi
			+ ", data=" + data()
			+ ", errors=" + errors
			+ ", links=" + links
			+ ", included=" + included
			+ ", meta=" + meta
			+ ", extensions=" + extensions
			+ ")";
	}
}
