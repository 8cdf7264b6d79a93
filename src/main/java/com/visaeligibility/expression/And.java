package com.visaeligibility.expression;

import java.util.List;

public record And(List<Expression> operands) implements Expression {

    public And {
        operands = List.copyOf(operands);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
