package works.jsonapi.jackson;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class JsonApiSerializerConfiguration {
	/**
	 * Pretty-print written JSON.
	 */
	@Default boolean indentOutput = false;

	/**
	 * Whether an unrecognized member in a resource object, resource identifier,
	 * error object, or {@code jsonapi} object is a decode error.
	 * <p>
	 * This doesn't affect documents and relationships, which always keep
	 * unrecognized members as {@link AbstractDocument#extensions() extensions},
	 * nor links, which always ignore them.
	 * <p>
	 * Off by default, because JSON:API permits servers to add members
	 * to these objects through extensions and profiles.
	 */
	@Default boolean failOnUnknownMembers = false;

	public static JsonApiSerializerConfiguration defaultConfiguration() {
		return JsonApiSerializerConfiguration.builder().build();
	}
}
