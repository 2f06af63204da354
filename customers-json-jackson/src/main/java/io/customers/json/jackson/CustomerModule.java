package io.customers.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.customers.server.spi.Customer;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * Jackson mapping for {@link Customer}.
 *
 * <p>The wire shape is a JSON object with exactly five string fields:
 * {@code guid}, {@code first_name}, {@code last_name}, {@code email}, {@code address}.
 * Missing, extra, null or non-string fields are rejected.
 */
public final class CustomerModule extends SimpleModule {

    static final String GUID = "guid";
    static final String FIRST_NAME = "first_name";
    static final String LAST_NAME = "last_name";
    static final String EMAIL = "email";
    static final String ADDRESS = "address";

    private static final List<String> FIELDS = List.of(GUID, FIRST_NAME, LAST_NAME, EMAIL, ADDRESS);

    public CustomerModule() {
        super("CustomerModule");
        addSerializer(Customer.class, new CustomerSerializer());
        addDeserializer(Customer.class, new CustomerDeserializer());
    }

    static final class CustomerSerializer extends StdSerializer<Customer> {
        CustomerSerializer() {
            super(Customer.class);
        }

        @Override
        public void serialize(Customer value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(GUID, value.guid());
            gen.writeStringField(FIRST_NAME, value.firstName());
            gen.writeStringField(LAST_NAME, value.lastName());
            gen.writeStringField(EMAIL, value.email());
            gen.writeStringField(ADDRESS, value.address());
            gen.writeEndObject();
        }
    }

    static final class CustomerDeserializer extends StdDeserializer<Customer> {
        CustomerDeserializer() {
            super(Customer.class);
        }

        @Override
        public Customer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node == null || !node.isObject()) {
                return ctxt.reportInputMismatch(this, "customer must be a JSON object");
            }
            for (Iterator<String> names = node.fieldNames(); names.hasNext(); ) {
                String name = names.next();
                if (!FIELDS.contains(name)) {
                    return ctxt.reportInputMismatch(this, "unknown field '%s'", name);
                }
            }
            return new Customer(
                    text(node, GUID, ctxt),
                    text(node, FIRST_NAME, ctxt),
                    text(node, LAST_NAME, ctxt),
                    text(node, EMAIL, ctxt),
                    text(node, ADDRESS, ctxt));
        }

        @Override
        public Customer getNullValue(DeserializationContext ctxt) throws JsonMappingException {
            return ctxt.reportInputMismatch(this, "customer must be a JSON object, not null");
        }

        private String text(JsonNode node, String field, DeserializationContext ctxt) throws IOException {
            JsonNode value = node.get(field);
            if (value == null) {
                return ctxt.reportInputMismatch(this, "missing field '%s'", field);
            }
            if (!value.isTextual()) {
                return ctxt.reportInputMismatch(this, "field '%s' must be a string", field);
            }
            return value.textValue();
        }
    }
}
