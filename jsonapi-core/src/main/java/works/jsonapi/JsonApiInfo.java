package works.jsonapi;

import java.net.URI;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static works.jsonapi.util.Members.immutableCopy;

/**
 * The top-level {@code jsonapi} member describing the server's implementation.
 *
 * @param ext the extensions applied to the document.
 * @param profile the profiles applied to the document.
 */
public record JsonApiInfo(
	@Nullable String version,
	@Nullable List<URI> ext,
	@Nullable List<URI> profile,
	@Nullable Map<String, Object> meta
) {
	public static final String VERSION_1_1 = "1.1";

	public JsonApiInfo {
		ext = immutableCopy(ext);
		profile = immutableCopy(profile);
		meta = immutableCopy(meta);
	}

	public static JsonApiInfo ofVersion(String version) {
		return new JsonApiInfo(version, null, null, null);
	}
}
