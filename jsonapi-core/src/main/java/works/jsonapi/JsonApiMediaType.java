package works.jsonapi;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.Builder;
import lombok.Singular;
import org.jetbrains.annotations.Nullable;
import works.jsonapi.exceptions.InvalidMediaTypeException;

import static java.util.stream.Collectors.joining;
import static works.jsonapi.exceptions.InvalidMediaTypeException.INVALID_MEDIA_TYPE;
import static works.jsonapi.exceptions.InvalidMediaTypeException.INVALID_PARAMETERS;

/**
 * The JSON:API media type with its optional {@code ext} and {@code profile} parameters,
 * for use in {@code Content-Type} and {@code Accept} headers.
 * <p>
 * {@link #toString()} renders the header value. For example:
 *
 * <pre>
 * JsonApiMediaType.builder()
 *     .extension(URI.create("https://jsonapi.org/ext/atomic"))
 *     .quality(0.5)
 *     .build()
 *     .toString()
 * </pre>
 *
 * yields {@code application/vnd.api+json;ext="https://jsonapi.org/ext/atomic";q=0.5}.
 *
 * @param quality the {@code q} weight, only meaningful in an {@code Accept} header.
 */
@Builder(toBuilder = true)
public record JsonApiMediaType(
	@Singular List<URI> extensions,
	@Singular List<URI> profiles,
	@Nullable Double quality
) {
	public static final String MEDIA_TYPE = "application/vnd.api+json";
	public static final String EXT_PARAMETER = "ext";
	public static final String PROFILE_PARAMETER = "profile";
	public static final String QUALITY_PARAMETER = "q";

	public JsonApiMediaType {
		extensions = List.copyOf(extensions);
		profiles = List.copyOf(profiles);
		if (quality != null && !(0.0 <= quality && quality <= 1.0)) {
			throw new IllegalArgumentException("Quality must be between 0 and 1: " + quality);
		}
	}

	/**
	 * The bare media type, with no parameters.
	 */
	public static JsonApiMediaType plain() {
		return new JsonApiMediaType(List.of(), List.of(), null);
	}

	/**
	 * Parses a single media range from a header value.
	 *
	 * @throws InvalidMediaTypeException if the type is not {@value #MEDIA_TYPE},
	 * or if it has parameters other than {@code ext}, {@code profile}, and {@code q}.
	 */
	public static JsonApiMediaType parse(String header) {
		String[] parts = header.split(";");
		if (!MEDIA_TYPE.equals(parts[0].trim().toLowerCase(Locale.ROOT))) {
			throw new InvalidMediaTypeException(INVALID_MEDIA_TYPE);
		}
		List<URI> extensions = new ArrayList<>();
		List<URI> profiles = new ArrayList<>();
		Double quality = null;
		for (int i = 1; i < parts.length; i++) {
			String parameter = parts[i].trim();
			int equals = parameter.indexOf('=');
			if (equals < 0) {
				throw new InvalidMediaTypeException(INVALID_PARAMETERS);
			}
			String name = parameter.substring(0, equals).trim().toLowerCase(Locale.ROOT);
			String value = unquoted(parameter.substring(equals + 1).trim());
			switch (name) {
				case EXT_PARAMETER:
					extensions.addAll(uriList(value));
					break;
				case PROFILE_PARAMETER:
					profiles.addAll(uriList(value));
					break;
				case QUALITY_PARAMETER:
					try {
						quality = Double.valueOf(value);
					} catch (NumberFormatException e) {
						throw new InvalidMediaTypeException("Invalid quality value \"" + value + "\"", e);
					}
					break;
				default:
					throw new InvalidMediaTypeException(INVALID_PARAMETERS);
			}
		}
		try {
			return new JsonApiMediaType(extensions, profiles, quality);
		} catch (IllegalArgumentException e) {
			throw new InvalidMediaTypeException(e.getMessage(), e);
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(MEDIA_TYPE);
		if (!extensions.isEmpty()) {
			sb.append(';').append(EXT_PARAMETER).append("=\"").append(spaceSeparated(extensions)).append('"');
		}
		if (!profiles.isEmpty()) {
			sb.append(';').append(PROFILE_PARAMETER).append("=\"").append(spaceSeparated(profiles)).append('"');
		}
		if (quality != null) {
			sb.append(';').append(QUALITY_PARAMETER).append('=')
				.append(BigDecimal.valueOf(quality).stripTrailingZeros().toPlainString());
		}
		return sb.toString();
	}

	private static String spaceSeparated(List<URI> uris) {
		return uris.stream().map(URI::toString).collect(joining(" "));
	}

	private static List<URI> uriList(String value) {
		List<URI> result = new ArrayList<>();
		for (String token : value.trim().split("\\s+")) {
			if (!token.isEmpty()) {
				try {
					result.add(new URI(token));
				} catch (URISyntaxException e) {
					throw new InvalidMediaTypeException("Invalid URI in media type parameter: \"" + token + "\"", e);
				}
			}
		}
		return result;
	}

	private static String unquoted(String value) {
		if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
			return value.substring(1, value.length() - 1);
		} else {
			return value;
		}
	}
}
