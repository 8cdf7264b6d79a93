package com.visaeligibility.expression;

import com.visaeligibility.model.FactValue;

public record Literal(FactValue value) implements Expression {

    public static Literal of(Object raw) {
        return new Literal(FactValue.of(raw));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
