package com.visaeligibility.expression;

public record Var(String name) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVar(this);
    }
}
