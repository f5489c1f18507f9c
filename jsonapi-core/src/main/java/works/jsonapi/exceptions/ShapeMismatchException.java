package works.jsonapi.exceptions;

/**
 * Primary data was projected with the wrong cardinality:
 * a single resource was requested from something that isn't a JSON object,
 * or a collection from something that isn't a JSON array.
 * <p>
 * Thrown only by the projection call. The document that holds the data is unaffected.
 */
public final class ShapeMismatchException extends JsonApiException {
	public static final String NOT_AN_OBJECT = "data is not an object; use the collection projection";
	public static final String NOT_AN_ARRAY = "data is not an array; use the single projection";

	public ShapeMismatchException(String message) {
		super(message);
	}

	public ShapeMismatchException(Throwable cause) {
		super(cause);
	}

	public ShapeMismatchException(String message, Throwable cause) {
		super(message, cause);
	}
}
