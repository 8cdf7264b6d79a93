package com.visaeligibility.expression;

public record Compare(ComparisonOperator operator, Expression left, Expression right) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }
}
