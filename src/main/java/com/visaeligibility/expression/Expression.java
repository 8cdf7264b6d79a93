package com.visaeligibility.expression;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Node of a requirement's boolean expression tree. The node set is closed:
 * {@link Compare}, {@link And}, {@link Or}, {@link Not}, {@link In},
 * {@link Var} and {@link Literal}. Trees are read from JSON-Logic documents
 * by {@link JsonLogicDeserializer}; nothing is ever compiled or executed.
 */
@JsonDeserialize(using = JsonLogicDeserializer.class)
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
