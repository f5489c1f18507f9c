package works.jsonapi;

import org.jetbrains.annotations.Nullable;

/**
 * References to the primary source of an error.
 *
 * @param pointer a JSON Pointer (RFC 6901) to the value in the request document that caused the error.
 * @param parameter the URI query parameter that caused the error.
 * @param header the name of the request header that caused the error.
 */
public record ErrorSource(
	@Nullable String pointer,
	@Nullable String parameter,
	@Nullable String header
) { }
