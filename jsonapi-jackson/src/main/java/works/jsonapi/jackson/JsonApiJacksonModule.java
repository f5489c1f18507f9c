package works.jsonapi.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.Version;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.DeserializationConfig;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.deser.Deserializers;
import tools.jackson.databind.ser.Serializers;
import works.jsonapi.Link;

/**
 * Teaches Jackson the JSON:API wire forms of {@link Link} and {@link PrimaryData}.
 * <p>
 * {@link JsonApiSerializer} installs this automatically.
 * Add it yourself only when building your own mapper.
 */
public class JsonApiJacksonModule extends JacksonModule {
	private final LinkCodec.Serializer linkSerializer = new LinkCodec.Serializer();
	private final LinkCodec.Deserializer linkDeserializer = new LinkCodec.Deserializer();
	private final PrimaryDataCodec.Serializer dataSerializer = new PrimaryDataCodec.Serializer();
	private final PrimaryDataCodec.Deserializer dataDeserializer = new PrimaryDataCodec.Deserializer();

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		LOGGER.debug("Registering JSON:API serializers and deserializers");
		context.addSerializers(new JsonApiSerializers());
		context.addDeserializers(new JsonApiDeserializers());
	}

	private final class JsonApiSerializers extends Serializers.Base {
		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			Class<?> theClass = type.getRawClass();
			if (Link.class.isAssignableFrom(theClass)) {
				return linkSerializer;
			} else if (PrimaryData.class.isAssignableFrom(theClass)) {
				return dataSerializer;
			} else {
				return null;
			}
		}
	}

	private final class JsonApiDeserializers extends Deserializers.Base {
		@Override
		public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			Class<?> theClass = type.getRawClass();
			if (Link.class.equals(theClass)) {
				return linkDeserializer;
			} else if (PrimaryData.class.equals(theClass)) {
				return dataDeserializer;
			} else {
				return null;
			}
		}

		@Override
		public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
			return Link.class.equals(valueType) || PrimaryData.class.equals(valueType);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonApiJacksonModule.class);
}
