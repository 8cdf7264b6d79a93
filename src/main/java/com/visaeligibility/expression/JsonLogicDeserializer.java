package com.visaeligibility.expression;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.visaeligibility.exception.InvalidExpressionException;

import java.io.IOException;

public class JsonLogicDeserializer extends StdDeserializer<Expression> {

    public JsonLogicDeserializer() {
        super(Expression.class);
    }

    @Override
    public Expression deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        try {
            return JsonLogicReader.read(node);
        } catch (InvalidExpressionException e) {
            throw JsonMappingException.from(parser, e.getMessage(), e);
        }
    }
}
