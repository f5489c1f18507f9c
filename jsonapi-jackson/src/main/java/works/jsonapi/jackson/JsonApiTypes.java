package works.jsonapi.jackson;

import java.util.LinkedHashMap;
import java.util.List;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.type.TypeFactory;
import works.jsonapi.ResourceIdentifier;

/**
 * {@link JavaType}s for the generic JSON:API types, for use with the
 * projection and typed-document methods of {@link JsonApiSerializer}.
 */
public final class JsonApiTypes {
	private JsonApiTypes() {}

	static final TypeFactory typeFactory = TypeFactory.createDefaultInstance();

	/**
	 * An open JSON object, as used for {@code meta} members and untyped attributes.
	 */
	public static final JavaType OPEN_OBJECT = typeFactory.constructMapType(LinkedHashMap.class, String.class, Object.class);

	public static final JavaType UNTYPED_RELATIONSHIP = typeFactory.constructParametricType(Relationship.class, PrimaryData.class);

	public static final JavaType UNTYPED_RELATIONSHIPS = typeFactory.constructMapType(
		LinkedHashMap.class,
		typeFactory.constructType(String.class),
		UNTYPED_RELATIONSHIP);

	/**
	 * {@code Resource<Map<String, Object>, Map<String, Relationship<PrimaryData>>>}
	 */
	public static final JavaType UNTYPED_RESOURCE = resourceType(OPEN_OBJECT, UNTYPED_RELATIONSHIPS);

	public static final JavaType RESOURCE_IDENTIFIER = typeFactory.constructType(ResourceIdentifier.class);

	public static final JavaType JSON_API_DOCUMENT = typeFactory.constructType(JsonApiDocument.class);

	public static JavaType resourceType(JavaType attributes, JavaType relationships) {
		return typeFactory.constructParametricType(Resource.class, attributes, relationships);
	}

	public static JavaType resourceType(Class<?> attributes) {
		return resourceType(typeFactory.constructType(attributes), UNTYPED_RELATIONSHIPS);
	}

	public static JavaType resourceType(Class<?> attributes, Class<?> relationships) {
		return resourceType(typeFactory.constructType(attributes), typeFactory.constructType(relationships));
	}

	public static JavaType resourceDocumentType(JavaType attributes, JavaType relationships) {
		return typeFactory.constructParametricType(ResourceDocument.class, attributes, relationships);
	}

	public static JavaType collectionDocumentType(JavaType attributes, JavaType relationships) {
		return typeFactory.constructParametricType(CollectionDocument.class, attributes, relationships);
	}

	public static JavaType listOf(JavaType elementType) {
		return typeFactory.constructCollectionType(List.class, elementType);
	}

	public static JavaType type(Class<?> c) {
		return typeFactory.constructType(c);
	}
}
