package works.jsonapi.jackson;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.jsonapi.Link;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.CUSTOM;
import static works.jsonapi.util.Members.immutableCopy;

/**
 * A relationship object. See https://jsonapi.org/format/#document-resource-object-relationships.
 * <p>
 * The {@code data} member is a resource linkage. It is usually either
 * {@link PrimaryData} (leaving the shape undecided), {@link works.jsonapi.ResourceIdentifier ResourceIdentifier}
 * for a to-one relationship, or a {@code List<ResourceIdentifier>} for a to-many relationship.
 * <p>
 * Members other than {@code links}, {@code data} and {@code meta} are kept in
 * {@link #extensions()}, in the order they were read, and written back out unchanged.
 * As with {@link AbstractDocument}, Jackson binds it through the no-argument
 * constructor and the setters, never a creator.
 *
 * @param <D> the type of the {@code data} member.
 */
@JsonPropertyOrder({"links", "data", "meta"})
public final class Relationship<D> {
	private Map<String, Link> links;
	private D data;
	private Map<String, Object> meta;
	private final Map<String, JsonNode> extensions = new LinkedHashMap<>();

	private Relationship() {
	}

	@JsonCreator(mode = JsonCreator.Mode.DISABLED)
	public Relationship(
		@Nullable Map<String, Link> links,
		@Nullable D data,
		@Nullable Map<String, Object> meta
	) {
		this.links = immutableCopy(links);
		this.data = data;
		this.meta = immutableCopy(meta);
	}

	public static <D> Relationship<D> of(D data) {
		return new Relationship<>(null, data, null);
	}

	@JsonProperty("links")
	public @Nullable Map<String, Link> links() {
		return links;
	}

	@JsonProperty("links")
	private void setLinks(@Nullable Map<String, Link> links) {
		this.links = immutableCopy(links);
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
	private void putExtension(String name, JsonNode value) {
		extensions.put(name, value);
	}

	public Relationship<D> withExtension(String name, JsonNode value) {
		Relationship<D> result = new Relationship<>(links, data, meta);
		result.extensions.putAll(this.extensions);
		result.extensions.put(name, value);
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Relationship<?> that = (Relationship<?>) o;
		return Objects.equals(links, that.links)
			&& Objects.equals(data, that.data)
			&& Objects.equals(meta, that.meta)
			&& Objects.equals(extensions, that.extensions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(links, data, meta, extensions);
	}

	@Override
	public String toString() {
		return "Relationship(links=" + links + ", data=" + data + ", meta=" + meta + ", extensions=" + extensions + ")";
	}
}
