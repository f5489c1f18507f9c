package works.jsonapi.jackson;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.MapperFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;
import works.jsonapi.Link;
import works.jsonapi.ResourceIdentifier;
import works.jsonapi.exceptions.JsonApiException;
import works.jsonapi.exceptions.MalformedLinkException;
import works.jsonapi.exceptions.ShapeMismatchException;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL;
import static java.nio.charset.StandardCharsets.UTF_8;
import static works.jsonapi.exceptions.ShapeMismatchException.NOT_AN_ARRAY;
import static works.jsonapi.exceptions.ShapeMismatchException.NOT_AN_OBJECT;
import static works.jsonapi.jackson.JsonApiTypes.JSON_API_DOCUMENT;
import static works.jsonapi.jackson.JsonApiTypes.RESOURCE_IDENTIFIER;
import static works.jsonapi.jackson.JsonApiTypes.UNTYPED_RELATIONSHIPS;
import static works.jsonapi.jackson.JsonApiTypes.UNTYPED_RESOURCE;
import static works.jsonapi.jackson.JsonApiTypes.collectionDocumentType;
import static works.jsonapi.jackson.JsonApiTypes.listOf;
import static works.jsonapi.jackson.JsonApiTypes.resourceDocumentType;
import static works.jsonapi.jackson.JsonApiTypes.resourceType;
import static works.jsonapi.jackson.JsonApiTypes.type;

/**
 * Converts JSON:API documents, resources and links to and from JSON text.
 * <p>
 * Documents can be read in two ways:
 *
 * <ul>
 *     <li>
 *         as a {@link JsonApiDocument}, whose {@code data} stays an unbound
 *         {@link PrimaryData} until you {@link #projectSingle project} it
 *         into whatever type you like; or
 *     </li>
 *     <li>
 *         directly as a {@link ResourceDocument} or {@link CollectionDocument}
 *         when you already know the shape and the attribute types.
 *     </li>
 * </ul>
 *
 * Reading methods return {@link Optional#empty()} when the input is empty or is
 * the JSON literal {@code null}. Malformed JSON text fails with Jackson's own
 * exceptions, and a malformed link anywhere in the input fails with
 * {@link MalformedLinkException}.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class JsonApiSerializer {
	private final JsonApiSerializerConfiguration configuration;
	private final ObjectMapper mapper;

	public JsonApiSerializer() {
		this(JsonApiSerializerConfiguration.defaultConfiguration());
	}

	public JsonApiSerializer(JsonApiSerializerConfiguration configuration) {
		this.configuration = configuration;
		this.mapper = JsonMapper.builder()
			.addModule(new JsonApiJacksonModule())
			.changeDefaultPropertyInclusion(incl -> incl.withValueInclusion(NON_NULL))
			.disable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, configuration.isFailOnUnknownMembers())
			.configure(SerializationFeature.INDENT_OUTPUT, configuration.isIndentOutput())
			.build();
		LOGGER.debug("Created JsonApiSerializer with {}", configuration);
	}

	public JsonApiSerializerConfiguration configuration() {
		return configuration;
	}

	/**
	 * The mapper used for all conversions, with {@link JsonApiJacksonModule} installed.
	 */
	public ObjectMapper mapper() {
		return mapper;
	}

	//
	// Documents
	//

	public Optional<JsonApiDocument> readDocument(String json) {
		Optional<JsonApiDocument> result = read(json, JSON_API_DOCUMENT);
		if (LOGGER.isTraceEnabled()) {
			result.ifPresentOrElse(
				doc -> LOGGER.trace("Read document: single={} collection={} errors={} extensions={}",
					doc.hasSingleResource(), doc.hasCollectionResource(), doc.hasErrors(), doc.extensions().keySet()),
				() -> LOGGER.trace("Read no document"));
		}
		return result;
	}

	/**
	 * Reads the whole stream as UTF-8 and closes it.
	 */
	public Optional<JsonApiDocument> readDocument(InputStream in) {
		return readDocument(readAll(in));
	}

	/**
	 * Reads a document whose {@code data} is a single resource with the given attributes type,
	 * leaving its relationships untyped.
	 */
	public <A> Optional<ResourceDocument<A, Map<String, Relationship<PrimaryData>>>> readResourceDocument(String json, Class<A> attributes) {
		return readResourceDocument(json, type(attributes), UNTYPED_RELATIONSHIPS);
	}

	public <A, R> Optional<ResourceDocument<A, R>> readResourceDocument(String json, Class<A> attributes, Class<R> relationships) {
		return readResourceDocument(json, type(attributes), type(relationships));
	}

	public <A, R> Optional<ResourceDocument<A, R>> readResourceDocument(String json, JavaType attributes, JavaType relationships) {
		return read(json, resourceDocumentType(attributes, relationships));
	}

	/**
	 * Reads a document whose {@code data} is an array of resources with the given attributes type,
	 * leaving their relationships untyped.
	 */
	public <A> Optional<CollectionDocument<A, Map<String, Relationship<PrimaryData>>>> readCollectionDocument(String json, Class<A> attributes) {
		return readCollectionDocument(json, type(attributes), UNTYPED_RELATIONSHIPS);
	}

	public <A, R> Optional<CollectionDocument<A, R>> readCollectionDocument(String json, Class<A> attributes, Class<R> relationships) {
		return readCollectionDocument(json, type(attributes), type(relationships));
	}

	public <A, R> Optional<CollectionDocument<A, R>> readCollectionDocument(String json, JavaType attributes, JavaType relationships) {
		return read(json, collectionDocumentType(attributes, relationships));
	}

	//
	// Links
	//

	public Optional<Link> readLink(String json) {
		return read(json, type(Link.class));
	}

	public String writeLink(Link link) {
		return writeValueAsString(link);
	}

	/**
	 * Writes any document, resource, relationship, link, or other value
	 * that the {@link #mapper()} can handle.
	 * Links are written in their most compact form, and absent members are omitted.
	 */
	public String writeValueAsString(Object value) {
		return mapper.writeValueAsString(value);
	}

	//
	// Projection
	//

	/**
	 * Binds single-resource data to the given type.
	 *
	 * @return empty if the data is absent.
	 * @throws ShapeMismatchException if the data is present but isn't a JSON object.
	 */
	public <T> Optional<T> projectSingle(@Nullable PrimaryData data, JavaType type) {
		PrimaryData d = PrimaryData.orAbsent(data);
		if (d instanceof PrimaryData.Absent) {
			return Optional.empty();
		} else if (d instanceof PrimaryData.Single single) {
			return Optional.of(convert(single.tree(), type));
		} else {
			LOGGER.trace("Can't project {} as a single resource", d.getClass().getSimpleName());
			throw new ShapeMismatchException(NOT_AN_OBJECT);
		}
	}

	public <T> Optional<T> projectSingle(@Nullable PrimaryData data, Class<T> type) {
		return projectSingle(data, type(type));
	}

	public <T> Optional<T> projectSingle(@Nullable PrimaryData data, TypeReference<T> type) {
		return projectSingle(data, mapper.getTypeFactory().constructType(type));
	}

	/**
	 * Binds collection data to a list of the given element type.
	 *
	 * @return empty if the data is absent. An empty array yields an empty list, not an empty {@link Optional}.
	 * @throws ShapeMismatchException if the data is present but isn't a JSON array.
	 */
	public <T> Optional<List<T>> projectCollection(@Nullable PrimaryData data, JavaType elementType) {
		PrimaryData d = PrimaryData.orAbsent(data);
		if (d instanceof PrimaryData.Absent) {
			return Optional.empty();
		} else if (d instanceof PrimaryData.Collection collection) {
			return Optional.of(convert(collection.tree(), listOf(elementType)));
		} else {
			LOGGER.trace("Can't project {} as a resource collection", d.getClass().getSimpleName());
			throw new ShapeMismatchException(NOT_AN_ARRAY);
		}
	}

	public <T> Optional<List<T>> projectCollection(@Nullable PrimaryData data, Class<T> elementType) {
		return projectCollection(data, type(elementType));
	}

	public <T> Optional<List<T>> projectCollection(@Nullable PrimaryData data, TypeReference<T> elementType) {
		return projectCollection(data, mapper.getTypeFactory().constructType(elementType));
	}

	/**
	 * The document's {@code data} as a single untyped resource.
	 */
	public Optional<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>> resource(JsonApiDocument document) {
		return projectSingle(document.data(), UNTYPED_RESOURCE);
	}

	public <A> Optional<Resource<A, Map<String, Relationship<PrimaryData>>>> resource(JsonApiDocument document, Class<A> attributes) {
		return projectSingle(document.data(), resourceType(attributes));
	}

	public <A, R> Optional<Resource<A, R>> resource(JsonApiDocument document, Class<A> attributes, Class<R> relationships) {
		return projectSingle(document.data(), resourceType(attributes, relationships));
	}

	/**
	 * The document's {@code data} as a list of untyped resources.
	 */
	public Optional<List<Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>>> resourceCollection(JsonApiDocument document) {
		return projectCollection(document.data(), UNTYPED_RESOURCE);
	}

	public <A> Optional<List<Resource<A, Map<String, Relationship<PrimaryData>>>>> resourceCollection(JsonApiDocument document, Class<A> attributes) {
		return projectCollection(document.data(), resourceType(attributes));
	}

	public <A, R> Optional<List<Resource<A, R>>> resourceCollection(JsonApiDocument document, Class<A> attributes, Class<R> relationships) {
		return projectCollection(document.data(), resourceType(attributes, relationships));
	}

	/**
	 * The resource linkage of a to-one relationship.
	 */
	public Optional<ResourceIdentifier> projectIdentifier(Relationship<PrimaryData> relationship) {
		return projectSingle(relationship.data(), RESOURCE_IDENTIFIER);
	}

	/**
	 * The resource linkage of a to-many relationship.
	 */
	public Optional<List<ResourceIdentifier>> projectIdentifiers(Relationship<PrimaryData> relationship) {
		return projectCollection(relationship.data(), RESOURCE_IDENTIFIER);
	}

	/**
	 * Converts application objects (a resource, a list of resources, an identifier)
	 * into unbound {@code data} for a {@link JsonApiDocument} or {@link Relationship}.
	 */
	public PrimaryData toPrimaryData(@Nullable Object value) {
		if (value == null) {
			return PrimaryData.absent();
		}
		JsonNode tree = mapper.valueToTree(value);
		return PrimaryData.of(tree);
	}

	//
	// Helpers
	//

	private <T> Optional<T> read(String json, JavaType type) {
		if (json.isBlank()) {
			return Optional.empty();
		}
		try {
			T result = mapper.readValue(json, type);
			return Optional.ofNullable(result);
		} catch (JacksonException e) {
			throw unwrapped(e);
		}
	}

	private static String readAll(InputStream in) {
		try (in) {
			return new String(in.readAllBytes(), UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private <T> T convert(JsonNode tree, JavaType type) {
		try {
			return mapper.treeToValue(tree, type);
		} catch (JacksonException e) {
			throw unwrapped(e);
		}
	}

	/**
	 * Jackson wraps exceptions thrown by deserializers to add location information.
	 * Ours carry their own meaning, so we dig them back out; Jackson's own exceptions
	 * are returned unchanged.
	 */
	private static RuntimeException unwrapped(JacksonException e) {
		for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
			if (cause instanceof JsonApiException jsonApiException) {
				LOGGER.trace("Unwrapped {} from {}", cause.getClass().getSimpleName(), e.getClass().getSimpleName());
				return jsonApiException;
			}
		}
		return e;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonApiSerializer.class);
}
