package works.jsonapi.exceptions;

/**
 * A JSON:API structural rule was violated.
 * <p>
 * Problems with the JSON text itself, and with binding JSON values to Java types,
 * are reported by the underlying JSON library and are not subclasses of this.
 */
public sealed abstract class JsonApiException extends RuntimeException permits
	MalformedLinkException,
	ShapeMismatchException,
	InvalidMediaTypeException
{
	protected JsonApiException(String message) {
		super(message);
	}

	protected JsonApiException(Throwable cause) {
		super(cause);
	}

	protected JsonApiException(String message, Throwable cause) {
		super(message, cause);
	}
}
