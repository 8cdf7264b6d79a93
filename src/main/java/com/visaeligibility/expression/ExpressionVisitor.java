package com.visaeligibility.expression;

public interface ExpressionVisitor<R> {

    R visitCompare(Compare compare);

    R visitAnd(And and);

    R visitOr(Or or);

    R visitNot(Not not);

    R visitIn(In in);

    R visitVar(Var var);

    R visitLiteral(Literal literal);
}
