package works.jsonapi.exceptions;

public final class InvalidMediaTypeException extends JsonApiException {
	public static final String INVALID_MEDIA_TYPE =
		"Invalid media type; see https://jsonapi.org/format/#jsonapi-media-type";
	public static final String INVALID_PARAMETERS =
		"Only ext and profile parameters are allowed; see https://jsonapi.org/format/#media-type-parameter-rules";

	public InvalidMediaTypeException(String message) {
		super(message);
	}

	public InvalidMediaTypeException(Throwable cause) {
		super(cause);
	}

	public InvalidMediaTypeException(String message, Throwable cause) {
		super(message, cause);
	}
}
