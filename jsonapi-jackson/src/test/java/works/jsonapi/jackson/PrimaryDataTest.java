package works.jsonapi.jackson;

import org.junit.jupiter.api.Test;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.MissingNode;
import tools.jackson.databind.node.NullNode;
import tools.jackson.databind.node.ObjectNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrimaryDataTest extends AbstractJsonApiTest {
	private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

	@Test
	void nothing_isAbsent() {
		assertSame(PrimaryData.absent(), PrimaryData.of(null));
		assertSame(PrimaryData.absent(), PrimaryData.of(NullNode.getInstance()));
		assertSame(PrimaryData.absent(), PrimaryData.of(MissingNode.getInstance()));
		assertSame(PrimaryData.absent(), PrimaryData.orAbsent(null));
		assertFalse(PrimaryData.absent().isPresent());
		assertNull(PrimaryData.absent().tree());
	}

	@Test
	void object_isSingle() {
		ObjectNode tree = nodes.objectNode().put("type", "articles");
		PrimaryData data = PrimaryData.of(tree);
		assertInstanceOf(PrimaryData.Single.class, data);
		assertSame(tree, data.tree());
		assertTrue(data.isPresent());
	}

	@Test
	void emptyObject_isSingle() {
		assertInstanceOf(PrimaryData.Single.class, PrimaryData.of(nodes.objectNode()));
	}

	@Test
	void array_isCollection() {
		ArrayNode tree = nodes.arrayNode();
		tree.addObject().put("type", "articles");
		tree.addObject().put("type", "people");
		PrimaryData.Collection data = assertInstanceOf(PrimaryData.Collection.class, PrimaryData.of(tree));
		assertEquals(2, data.size());
	}

	@Test
	void emptyArray_isPresentCollection() {
		PrimaryData.Collection data = assertInstanceOf(PrimaryData.Collection.class, PrimaryData.of(nodes.arrayNode()));
		assertEquals(0, data.size());
		assertTrue(data.isPresent());
	}

	@Test
	void scalars_areScalar() {
		for (String json : new String[]{ "42", "\"articles\"", "true" }) {
			assertInstanceOf(PrimaryData.Scalar.class, PrimaryData.of(serializer.mapper().readTree(json)), json);
		}
	}

	@Test
	void orAbsent_keepsPresentData() {
		PrimaryData data = PrimaryData.of(nodes.arrayNode());
		assertSame(data, PrimaryData.orAbsent(data));
	}
}
