package com.visaeligibility.expression;

import java.util.List;

public record Or(List<Expression> operands) implements Expression {

    public Or {
        operands = List.copyOf(operands);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
