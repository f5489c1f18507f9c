package works.jsonapi.exceptions;

/**
 * A link value in the input is neither a string nor an object,
 * or it is an object with no {@code href} member.
 */
public final class MalformedLinkException extends JsonApiException {
	public static final String NOT_STRING_OR_OBJECT = "link must be a string or object";
	public static final String MISSING_HREF = "href is required for link objects";

	public MalformedLinkException(String message) {
		super(message);
	}

	public MalformedLinkException(Throwable cause) {
		super(cause);
	}

	public MalformedLinkException(String message, Throwable cause) {
		super(message, cause);
	}
}
