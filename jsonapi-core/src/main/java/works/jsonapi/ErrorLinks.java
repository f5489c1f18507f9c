package works.jsonapi;

import org.jetbrains.annotations.Nullable;

/**
 * @param about a link leading to further details about this particular occurrence of the problem.
 * @param type a link identifying the type of error this particular error is an instance of.
 */
public record ErrorLinks(
	@Nullable Link about,
	@Nullable Link type
) { }
