package works.jsonapi.jackson;

import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

/**
 * The {@code data} member of a document or relationship, parsed but not yet
 * bound to any particular resource type.
 * <p>
 * The case is decided once, by the shape of the JSON value, when the
 * {@code PrimaryData} is {@link #of created}. Nothing here checks that the
 * contents look like resources; that happens when the data is projected
 * (see {@link JsonApiSerializer#projectSingle projectSingle} and
 * {@link JsonApiSerializer#projectCollection projectCollection}).
 * <p>
 * The trees held here belong to the {@code PrimaryData} and must not be modified.
 */
public sealed interface PrimaryData permits
	PrimaryData.Absent,
	PrimaryData.Single,
	PrimaryData.Collection,
	PrimaryData.Scalar
{
	/**
	 * @return the JSON value, or null if {@link Absent absent}.
	 */
	@Nullable JsonNode tree();

	static PrimaryData absent() {
		return Absent.INSTANCE;
	}

	/**
	 * @param tree the value of the {@code data} member; null or a JSON {@code null} if there is none.
	 */
	static PrimaryData of(@Nullable JsonNode tree) {
		if (tree == null || tree.isNull() || tree.isMissingNode()) {
			return Absent.INSTANCE;
		} else if (tree.isObject()) {
			return new Single((ObjectNode) tree);
		} else if (tree.isArray()) {
			return new Collection((ArrayNode) tree);
		} else {
			return new Scalar(tree);
		}
	}

	/**
	 * Treats a Java null the same as {@link Absent}, since a
	 * relationship whose {@code data} member was never present
	 * may hold either one.
	 */
	static PrimaryData orAbsent(@Nullable PrimaryData data) {
		return (data == null) ? Absent.INSTANCE : data;
	}

	default boolean isPresent() {
		return !(this instanceof Absent);
	}

	/**
	 * The {@code data} member is missing or {@code null}.
	 */
	record Absent() implements PrimaryData {
		static final Absent INSTANCE = new Absent();

		@Override
		public @Nullable JsonNode tree() {
			return null;
		}
	}

	/**
	 * The {@code data} member is a JSON object, presumably one resource object or identifier.
	 */
	record Single(ObjectNode tree) implements PrimaryData { }

	/**
	 * The {@code data} member is a JSON array, presumably of resource objects or identifiers.
	 * It may be empty.
	 */
	record Collection(ArrayNode tree) implements PrimaryData {
		public int size() {
			return tree.size();
		}
	}

	/**
	 * The {@code data} member is a string, number, or boolean.
	 * This is not valid JSON:API, but it's tolerated until someone tries to project it.
	 */
	record Scalar(JsonNode tree) implements PrimaryData { }
}
