package com.visaeligibility.expression;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.visaeligibility.exception.InvalidExpressionException;
import com.visaeligibility.model.FactValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonLogicDeserializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private Expression parse(String json) throws Exception {
        return objectMapper.readValue(json, Expression.class);
    }

    @Test
    @DisplayName("reads a comparison into the operator union")
    void comparison() throws Exception {
        Expression expression = parse("{\">=\": [{\"var\": \"salary\"}, 38700]}");

        assertThat(expression).isEqualTo(new Compare(
                ComparisonOperator.GE,
                new Var("salary"),
                new Literal(FactValue.of(new BigDecimal("38700")))));
    }

    @Test
    @DisplayName("=== and !== are read as == and !=")
    void strictAliases() throws Exception {
        assertThat(parse("{\"===\": [{\"var\": \"a\"}, 1]}"))
                .isInstanceOf(Compare.class)
                .extracting(e -> ((Compare) e).operator())
                .isEqualTo(ComparisonOperator.EQ);
        assertThat(((Compare) parse("{\"!==\": [{\"var\": \"a\"}, 1]}")).operator())
                .isEqualTo(ComparisonOperator.NE);
    }

    @Test
    @DisplayName("nested and/or/not with in")
    void nested() throws Exception {
        Expression expression = parse("""
                {"and": [
                  {"in": [{"var": "english_level"}, ["B1", "B2"]]},
                  {"!": {"var": "criminal_record"}},
                  {"or": [{"==": [{"var": "sponsor"}, true]}, {"var": ["self_employed"]}]}
                ]}
                """);

        assertThat(expression).isInstanceOf(And.class);
        List<Expression> operands = ((And) expression).operands();
        assertThat(operands).hasSize(3);
        assertThat(operands.get(0)).isInstanceOf(In.class);
        assertThat(((In) operands.get(0)).substring()).isFalse();
        assertThat(operands.get(1)).isEqualTo(new Not(new Var("criminal_record")));
        assertThat(((Or) operands.get(2)).operands().get(1)).isEqualTo(new Var("self_employed"));

        var facts = Map.of(
                "english_level", FactValue.of("B2"),
                "criminal_record", FactValue.of(false),
                "sponsor", FactValue.of(true));
        EvaluationResult result = new ExpressionEvaluator().evaluate(expression, facts);
        assertThat(result.isTrue()).isTrue();
        assertThat(result.missingVariables()).containsExactly("self_employed");
    }

    @Test
    @DisplayName("in with a string container is substring containment")
    void substringIn() throws Exception {
        Expression expression = parse("{\"in\": [\"engineer\", {\"var\": \"occupation\"}]}");

        assertThat(((In) expression).substring()).isTrue();
    }

    @Test
    @DisplayName("unknown operators are rejected at load time")
    void unknownOperator() {
        assertThatThrownBy(() -> parse("{\"substr\": [{\"var\": \"name\"}, 0, 2]}"))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("substr");
    }

    @Test
    @DisplayName("comparison arity is checked")
    void arity() {
        assertThatThrownBy(() -> parse("{\"<\": [1, {\"var\": \"x\"}, 3]}"))
                .hasRootCauseInstanceOf(InvalidExpressionException.class);
    }

    @Test
    @DisplayName("objects with more than one operator are rejected")
    void multipleKeys() {
        assertThatThrownBy(() -> parse("{\"==\": [1, 1], \"!=\": [1, 2]}"))
                .hasRootCauseInstanceOf(InvalidExpressionException.class);
    }

    @Test
    @DisplayName("var defaults are not supported")
    void varDefault() {
        assertThatThrownBy(() -> parse("{\"var\": [\"salary\", 0]}"))
                .hasRootCauseInstanceOf(InvalidExpressionException.class);
    }

    @Test
    @DisplayName("nesting deeper than the limit is rejected")
    void depthLimit() {
        String json = "true";
        for (int i = 0; i <= JsonLogicReader.MAX_DEPTH + 1; i++) {
            json = "{\"!\": " + json + "}";
        }
        String deep = json;

        assertThatThrownBy(() -> parse(deep))
                .hasRootCauseInstanceOf(InvalidExpressionException.class)
                .hasStackTraceContaining("depth");
    }

    @Test
    @DisplayName("expressions with too many nodes are rejected")
    void nodeLimit() {
        StringBuilder json = new StringBuilder("{\"or\": [");
        for (int i = 0; i < JsonLogicReader.MAX_NODES; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("true");
        }
        json.append("]}");

        assertThatThrownBy(() -> parse(json.toString()))
                .hasRootCauseInstanceOf(InvalidExpressionException.class)
                .hasStackTraceContaining("complex");
    }
}
