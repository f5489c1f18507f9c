package works.jsonapi;

import java.util.Map;
import lombok.Builder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;
import static works.jsonapi.util.Members.emptyToNull;
import static works.jsonapi.util.Members.immutableCopy;

/**
 * A hypermedia link. See https://jsonapi.org/format/#document-links-link-object.
 * <p>
 * On the wire, a link is either a bare URI string or an object with an
 * {@code href} member and some optional metadata.
 * Both forms describe the same thing: a link whose optional components are
 * all absent is written as a bare string, and a bare string reads as such a link.
 * <p>
 * Empty strings in the optional components are normalized to {@code null},
 * since the wire format can't tell them apart from absent members.
 *
 * @param href the link's URI reference. Never null, but may be a relative reference.
 * @param describedBy a link to a description document (such as a schema) for the link target.
 * @param hrefLang the language(s) of the link target, as in the HTML {@code hreflang} attribute.
 * @param meta non-standard meta-information about the link.
 */
@Builder(toBuilder = true)
public record Link(
	@NotNull String href,
	@Nullable String rel,
	@Nullable Link describedBy,
	@Nullable String title,
	@Nullable String type,
	@Nullable String hrefLang,
	@Nullable Map<String, Object> meta
) {
	public Link {
		requireNonNull(href, "href");
		rel = emptyToNull(rel);
		title = emptyToNull(title);
		type = emptyToNull(type);
		hrefLang = emptyToNull(hrefLang);
		meta = immutableCopy(meta);
	}

	public static Link of(String href) {
		return new Link(href, null, null, null, null, null, null);
	}

	/**
	 * @return true if this link has nothing but a non-empty {@code href},
	 * and so can be represented as a bare string.
	 */
	public boolean hasOnlyHref() {
		return !href.isEmpty()
			&& rel == null
			&& describedBy == null
			&& title == null
			&& type == null
			&& hrefLang == null
			&& meta == null;
	}

	@Override
	public String toString() {
		if (hasOnlyHref()) {
			return "Link(" + href + ")";
		}
		StringBuilder sb = new StringBuilder("Link(").append(href);
		appendIfPresent(sb, "rel", rel);
		appendIfPresent(sb, "describedBy", describedBy);
		appendIfPresent(sb, "title", title);
		appendIfPresent(sb, "type", type);
		appendIfPresent(sb, "hrefLang", hrefLang);
		appendIfPresent(sb, "meta", meta);
		return sb.append(")").toString();
	}

	private static void appendIfPresent(StringBuilder sb, String name, @Nullable Object value) {
		if (value != null) {
			sb.append(", ").append(name).append("=").append(value);
		}
	}
}
