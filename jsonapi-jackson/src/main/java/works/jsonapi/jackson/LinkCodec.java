package works.jsonapi.jackson;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import works.jsonapi.Link;
import works.jsonapi.exceptions.MalformedLinkException;

import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_NULL;
import static tools.jackson.core.JsonToken.VALUE_STRING;
import static works.jsonapi.exceptions.MalformedLinkException.MISSING_HREF;
import static works.jsonapi.exceptions.MalformedLinkException.NOT_STRING_OR_OBJECT;
import static works.jsonapi.jackson.JsonApiTypes.OPEN_OBJECT;

/**
 * Reads and writes {@link Link}s in either of their two JSON forms.
 * <p>
 * A link with nothing but an {@code href} is written as a bare string;
 * anything else is written as an object whose members appear in the order
 * {@code href}, {@code rel}, {@code describedby}, {@code title}, {@code type},
 * {@code hreflang}, {@code meta}, omitting absent ones.
 * When reading, both forms are accepted, unknown object members are skipped,
 * and {@code null} means "no link".
 */
final class LinkCodec {
	static final String HREF = "href";
	static final String REL = "rel";
	static final String DESCRIBEDBY = "describedby";
	static final String TITLE = "title";
	static final String TYPE = "type";
	static final String HREFLANG = "hreflang";
	static final String META = "meta";

	private LinkCodec() {}

	static final class Serializer extends ValueSerializer<Link> {
		@Override
		public void serialize(Link link, JsonGenerator gen, SerializationContext serializers) {
			if (link.hasOnlyHref()) {
				gen.writeString(link.href());
				return;
			}

			gen.writeStartObject();
			if (!link.href().isEmpty()) {
				writeString(HREF, link.href(), gen);
			}
			writeString(REL, link.rel(), gen);
			if (link.describedBy() != null) {
				gen.writeName(DESCRIBEDBY);
				serialize(link.describedBy(), gen, serializers);
			}
			writeString(TITLE, link.title(), gen);
			writeString(TYPE, link.type(), gen);
			writeString(HREFLANG, link.hrefLang(), gen);
			if (link.meta() != null) {
				gen.writeName(META);
				serializers.writeValue(gen, link.meta());
			}
			gen.writeEndObject();
		}

		private static void writeString(String name, @Nullable String value, JsonGenerator gen) {
			if (value != null) {
				gen.writeName(name);
				gen.writeString(value);
			}
		}
	}

	static final class Deserializer extends ValueDeserializer<Link> {
		@Override
		public Link deserialize(JsonParser p, DeserializationContext ctxt) {
			return readLink(p, ctxt);
		}

		@Override
		public boolean isCachable() {
			return true;
		}

		/**
		 * Leaves the parser on the last token of the link value.
		 *
		 * @return null if the current token is {@link JsonToken#VALUE_NULL VALUE_NULL}.
		 */
		private @Nullable Link readLink(JsonParser p, DeserializationContext ctxt) {
			JsonToken token = p.currentToken();
			if (token == VALUE_NULL) {
				return null;
			} else if (token == VALUE_STRING) {
				return Link.of(p.getString());
			} else if (token != START_OBJECT) {
				throw new MalformedLinkException(NOT_STRING_OR_OBJECT);
			}

			String href = null;
			Link.LinkBuilder builder = Link.builder();
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				String name = p.currentName();
				switch (name) {
					case HREF:
						href = readString(name, p);
						break;
					case REL:
						builder.rel(readString(name, p));
						break;
					case DESCRIBEDBY:
						builder.describedBy(readLink(p, ctxt));
						break;
					case TITLE:
						builder.title(readString(name, p));
						break;
					case TYPE:
						builder.type(readString(name, p));
						break;
					case HREFLANG:
						builder.hrefLang(readString(name, p));
						break;
					case META:
						builder.meta(readMeta(p, ctxt));
						break;
					default:
						p.skipChildren();
						break;
				}
			}

			if (href == null) {
				throw new MalformedLinkException(MISSING_HREF);
			}
			return builder.href(href).build();
		}

		private static @Nullable String readString(String name, JsonParser p) {
			JsonToken token = p.currentToken();
			if (token == VALUE_STRING) {
				return p.getString();
			} else if (token == VALUE_NULL) {
				return null;
			} else {
				throw new StreamReadException(p, "Link member \"" + name + "\" must be a string; found " + token);
			}
		}

		@SuppressWarnings("unchecked")
		private static @Nullable Map<String, Object> readMeta(JsonParser p, DeserializationContext ctxt) {
			JsonToken token = p.currentToken();
			if (token == VALUE_NULL) {
				return null;
			} else if (token == START_OBJECT) {
				return (Map<String, Object>) ctxt
					.findContextualValueDeserializer(OPEN_OBJECT, null)
					.deserialize(p, ctxt);
			} else {
				throw new StreamReadException(p, "Link member \"" + META + "\" must be an object; found " + token);
			}
		}
	}
}
