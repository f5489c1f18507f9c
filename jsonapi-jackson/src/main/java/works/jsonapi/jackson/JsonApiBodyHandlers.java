package works.jsonapi.jackson;

import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscribers;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link BodyHandler}s that read a JSON:API response body with a {@link JsonApiSerializer}.
 * <p>
 * The body is decoded once it has been fully received. Decode failures complete the
 * response exceptionally with the same exceptions the serializer throws;
 * transport failures and cancellation are reported by the {@link java.net.http.HttpClient} as usual.
 * <p>
 * The status code is not examined. An error response typically yields a document
 * whose {@link AbstractDocument#hasErrors() hasErrors()} is true.
 */
public final class JsonApiBodyHandlers {
	private final JsonApiSerializer serializer;

	public JsonApiBodyHandlers(JsonApiSerializer serializer) {
		this.serializer = serializer;
	}

	public BodyHandler<Optional<JsonApiDocument>> ofDocument() {
		return handler(serializer::readDocument);
	}

	public <A> BodyHandler<Optional<ResourceDocument<A, Map<String, Relationship<PrimaryData>>>>> ofResourceDocument(Class<A> attributes) {
		return handler(body -> serializer.readResourceDocument(body, attributes));
	}

	public <A, R> BodyHandler<Optional<ResourceDocument<A, R>>> ofResourceDocument(Class<A> attributes, Class<R> relationships) {
		return handler(body -> serializer.readResourceDocument(body, attributes, relationships));
	}

	public <A> BodyHandler<Optional<CollectionDocument<A, Map<String, Relationship<PrimaryData>>>>> ofCollectionDocument(Class<A> attributes) {
		return handler(body -> serializer.readCollectionDocument(body, attributes));
	}

	public <A, R> BodyHandler<Optional<CollectionDocument<A, R>>> ofCollectionDocument(Class<A> attributes, Class<R> relationships) {
		return handler(body -> serializer.readCollectionDocument(body, attributes, relationships));
	}

	private static <T> BodyHandler<T> handler(Function<String, T> reader) {
		return responseInfo -> BodySubscribers.mapping(
			BodySubscribers.ofString(UTF_8),
			reader);
	}
}
