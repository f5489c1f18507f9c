package works.jsonapi.jackson;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.core.exc.StreamReadException;
import works.jsonapi.Link;
import works.jsonapi.exceptions.MalformedLinkException;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.jsonapi.exceptions.MalformedLinkException.MISSING_HREF;
import static works.jsonapi.exceptions.MalformedLinkException.NOT_STRING_OR_OBJECT;

class LinkCodecTest extends AbstractJsonApiTest {

	@Test
	void bareString_readsAsHrefOnly() {
		assertEquals(Optional.of(Link.of("https://example.com/articles/1")),
			serializer.readLink("\"https://example.com/articles/1\""));
	}

	@Test
	void minimalObject_compactsToString() {
		Link link = serializer.readLink("{\"href\": \"https://example.com/articles/1\"}").orElseThrow();
		assertEquals(Link.of("https://example.com/articles/1"), link);
		assertEquals("\"https://example.com/articles/1\"", serializer.writeLink(link));
	}

	@Test
	void allMembers_writtenInOrder() {
		Map<String, Object> meta = new LinkedHashMap<>();
		meta.put("count", 10);
		meta.put("note", null);
		Link link = Link.builder()
			.href("https://example.com/people/9")
			.rel("author")
			.describedBy(Link.of("https://example.com/schemas/people"))
			.title("Dan Gebhardt")
			.type("application/vnd.api+json")
			.hrefLang("en")
			.meta(meta)
			.build();
		String expected = "{"
			+ "\"href\":\"https://example.com/people/9\","
			+ "\"rel\":\"author\","
			+ "\"describedby\":\"https://example.com/schemas/people\","
			+ "\"title\":\"Dan Gebhardt\","
			+ "\"type\":\"application/vnd.api+json\","
			+ "\"hreflang\":\"en\","
			+ "\"meta\":{\"count\":10,\"note\":null}"
			+ "}";
		assertEquals(expected, serializer.writeLink(link));
		assertEquals(Optional.of(link), serializer.readLink(expected));
	}

	@Test
	void nestedDescribedBy_roundTrips() {
		String json = "{\"href\":\"/a\",\"describedby\":{\"href\":\"/b\",\"describedby\":\"/c\",\"title\":\"B\"}}";
		Link link = serializer.readLink(json).orElseThrow();
		assertEquals("B", link.describedBy().title());
		assertEquals(Link.of("/c"), link.describedBy().describedBy());
		assertEquals(json, serializer.writeLink(link));
	}

	@Test
	void describedBy_writtenBeforeTitle() {
		Link link = serializer.readLink("{\"title\":\"A\",\"describedby\":{\"title\":\"B\",\"describedby\":\"/c\",\"href\":\"/b\"},\"href\":\"/a\"}").orElseThrow();
		assertEquals(
			"{\"href\":\"/a\",\"describedby\":{\"href\":\"/b\",\"describedby\":\"/c\",\"title\":\"B\"},\"title\":\"A\"}",
			serializer.writeLink(link));
	}

	@Test
	void nestedMeta_written() {
		Link link = Link.builder()
			.href("/a")
			.describedBy(Link.builder()
				.href("/schema")
				.meta(Map.of("version", 2))
				.build())
			.build();
		assertEquals("{\"href\":\"/a\",\"describedby\":{\"href\":\"/schema\",\"meta\":{\"version\":2}}}", serializer.writeLink(link));
	}

	@Test
	void nullDescribedBy_isAbsent() {
		Link link = serializer.readLink("{\"href\":\"/a\",\"describedby\":null,\"title\":null}").orElseThrow();
		assertNull(link.describedBy());
		assertEquals(Link.of("/a"), link);
		assertEquals("\"/a\"", serializer.writeLink(link));
	}

	@Test
	void unknownMembers_skipped() {
		Link link = serializer.readLink("{\"foo\":{\"bar\":[1,{\"baz\":null}]},\"href\":\"/a\",\"extra\":[],\"rel\":\"self\"}").orElseThrow();
		assertEquals(Link.builder().href("/a").rel("self").build(), link);
		assertEquals("{\"href\":\"/a\",\"rel\":\"self\"}", serializer.writeLink(link));
	}

	@Test
	void emptyHref_writtenAsObject() {
		assertEquals("{}", serializer.writeLink(Link.of("")));
		assertEquals("{\"title\":\"T\"}", serializer.writeLink(Link.builder().href("").title("T").build()));
	}

	@Test
	void emptyStrings_countAsAbsent() {
		Link link = Link.builder().href("/a").title("").hrefLang("").build();
		assertEquals("\"/a\"", serializer.writeLink(link));
	}

	@Test
	void emptyMeta_isPresent() {
		Link link = Link.builder().href("/a").meta(Map.of()).build();
		assertEquals("{\"href\":\"/a\",\"meta\":{}}", serializer.writeLink(link));
	}

	@Test
	void nullLiteral_isNoLink() {
		assertEquals(Optional.empty(), serializer.readLink("null"));
		assertEquals(Optional.empty(), serializer.readLink(""));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"42",
		"true",
		"[\"/a\"]",
		"{\"href\":\"/a\",\"describedby\":7}",
		"{\"href\":\"/a\",\"describedby\":[]}",
	})
	void notStringOrObject_throws(String json) {
		MalformedLinkException e = assertThrows(MalformedLinkException.class, () -> serializer.readLink(json));
		assertEquals(NOT_STRING_OR_OBJECT, e.getMessage());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{}",
		"{\"rel\":\"self\"}",
		"{\"href\":null}",
		"{\"href\":\"/a\",\"describedby\":{\"title\":\"no href\"}}",
	})
	void missingHref_throws(String json) {
		MalformedLinkException e = assertThrows(MalformedLinkException.class, () -> serializer.readLink(json));
		assertEquals(MISSING_HREF, e.getMessage());
	}

	@Test
	void nonStringMember_throws() {
		StreamReadException e = assertThrows(StreamReadException.class, () -> serializer.readLink("{\"href\":5}"));
		assertThat(e.getMessage(), containsString("\"href\""));
		assertThrows(StreamReadException.class, () -> serializer.readLink("{\"href\":\"/a\",\"title\":{}}"));
	}

	@Test
	void nonObjectMeta_throws() {
		assertThrows(StreamReadException.class, () -> serializer.readLink("{\"href\":\"/a\",\"meta\":\"nope\"}"));
	}

	@Test
	void malformedLinkInDocument_throws() {
		MalformedLinkException e = assertThrows(MalformedLinkException.class, () ->
			serializer.readDocument("{\"data\":null,\"links\":{\"self\":42}}"));
		assertEquals(NOT_STRING_OR_OBJECT, e.getMessage());
	}

	@ParameterizedTest
	@MethodSource("linkArguments")
	void writeThenRead_isIdempotent(String json) {
		Link first = serializer.readLink(json).orElseThrow();
		String written = serializer.writeLink(first);
		Link second = serializer.readLink(written).orElseThrow();
		assertEquals(first, second);
		assertEquals(written, serializer.writeLink(second));
	}

	static Stream<String> linkArguments() {
		return Stream.of(
			"\"/a\"",
			"{\"href\":\"/a\"}",
			"{\"href\":\"/a\",\"rel\":\"self\"}",
			"{\"title\":\"T\",\"href\":\"/a\"}",
			"{\"href\":\"/a\",\"describedby\":\"/b\"}",
			"{\"href\":\"/a\",\"describedby\":{\"href\":\"/b\",\"describedby\":{\"href\":\"/c\",\"meta\":{\"depth\":3}}}}",
			"{\"href\":\"/a\",\"meta\":{\"nested\":{\"list\":[1,2.5,\"three\",null,false]}}}"
		);
	}
}
