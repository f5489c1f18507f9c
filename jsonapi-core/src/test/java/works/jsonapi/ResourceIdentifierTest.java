package works.jsonapi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResourceIdentifierTest {

	@Test
	void of_setsTypeAndId() {
		ResourceIdentifier id = ResourceIdentifier.of("people", "9");
		assertEquals("people", id.type());
		assertEquals("9", id.id());
		assertNull(id.lid());
		assertNull(id.meta());
	}

	@Test
	void local_setsLid() {
		ResourceIdentifier id = ResourceIdentifier.local("people", "temp-1");
		assertNull(id.id());
		assertEquals("temp-1", id.lid());
	}

	@Test
	void missingType_throws() {
		assertThrows(NullPointerException.class, () -> new ResourceIdentifier(null, "1", null, null));
	}

	@Test
	void errorObject_of() {
		ErrorObject error = ErrorObject.of("404", "Not Found");
		assertEquals("404", error.status());
		assertEquals("Not Found", error.title());
		assertNull(error.detail());
	}
}
