package works.jsonapi.jackson;

import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;

/**
 * Holds the {@code data} member as a tree, deferring the choice of resource type.
 */
final class PrimaryDataCodec {
	private PrimaryDataCodec() {}

	static final class Serializer extends ValueSerializer<PrimaryData> {
		@Override
		public void serialize(PrimaryData value, JsonGenerator gen, SerializationContext serializers) {
			if (value.tree() == null) {
				// Only reachable when the enclosing property doesn't use AbsentDataFilter
				gen.writeNull();
			} else {
				gen.writeTree(value.tree());
			}
		}

		@Override
		public boolean isEmpty(SerializationContext serializers, PrimaryData value) {
			return value == null || !value.isPresent();
		}
	}

	static final class Deserializer extends ValueDeserializer<PrimaryData> {
		@Override
		public PrimaryData deserialize(JsonParser p, DeserializationContext ctxt) {
			return PrimaryData.of(ctxt.readTree(p));
		}

		@Override
		public PrimaryData getNullValue(DeserializationContext ctxt) {
			return PrimaryData.absent();
		}

		@Override
		public boolean isCachable() {
			return true;
		}
	}
}
