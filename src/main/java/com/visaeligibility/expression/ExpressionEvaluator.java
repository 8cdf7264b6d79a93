package com.visaeligibility.expression;

import com.visaeligibility.exception.EvaluationError;
import com.visaeligibility.model.FactType;
import com.visaeligibility.model.FactValue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive interpreter for requirement expressions.
 *
 * <p>A {@link Var} whose key is absent from the facts is indeterminate, and the
 * key is reported in {@link EvaluationResult#missingVariables()}. Indeterminate
 * values propagate with three-valued logic: {@code false AND ?} is false,
 * {@code true OR ?} is true, everything else touching {@code ?} stays {@code ?}.
 * Every operand is visited so that all missing keys are reported.
 *
 * <p>Comparisons use the operands' declared types when they agree, otherwise
 * try numeric then date coercion, and for {@code ==}/{@code !=} fall back to
 * comparing text forms. Anything else raises {@link EvaluationError}.
 */
@Component
public class ExpressionEvaluator {

    public EvaluationResult evaluate(Expression expression, Map<String, FactValue> facts) {
        Set<String> missing = new LinkedHashSet<>();
        FactValue value = expression.accept(new Interpreter(facts, missing));

        if (value == null) {
            return new EvaluationResult(null, missing);
        }
        return new EvaluationResult(requireBoolean(value, "expression result"), missing);
    }

    private static boolean requireBoolean(FactValue value, String role) {
        return value.asBoolean().orElseThrow(() -> new EvaluationError(
                "Expected a boolean for " + role + " but got " + value.type() + " '" + value.asText() + "'"));
    }

    private static FactValue bool(boolean value) {
        return new FactValue(FactType.BOOLEAN, value);
    }

    static boolean compare(ComparisonOperator operator, FactValue left, FactValue right) {
        if (left.type() == right.type()) {
            switch (left.type()) {
                case NUMBER:
                    return operator.test(((BigDecimal) left.value()).compareTo((BigDecimal) right.value()));
                case DATE:
                    return operator.test(((LocalDate) left.value()).compareTo((LocalDate) right.value()));
                case BOOLEAN:
                    if (operator.isEquality()) {
                        return operator.test(left.value().equals(right.value()) ? 0 : 1);
                    }
                    throw incompatible(operator, left, right);
                case STRING:
                    if (operator.isEquality()) {
                        return operator.test(left.value().equals(right.value()) ? 0 : 1);
                    }
                    break;
                default:
                    throw incompatible(operator, left, right);
            }
        }

        Optional<BigDecimal> leftNumber = left.asNumber();
        Optional<BigDecimal> rightNumber = right.asNumber();
        if (leftNumber.isPresent() && rightNumber.isPresent()) {
            return operator.test(leftNumber.get().compareTo(rightNumber.get()));
        }

        Optional<LocalDate> leftDate = left.asDate();
        Optional<LocalDate> rightDate = right.asDate();
        if (leftDate.isPresent() && rightDate.isPresent()) {
            return operator.test(leftDate.get().compareTo(rightDate.get()));
        }

        if (operator.isEquality()) {
            return operator.test(left.asText().equals(right.asText()) ? 0 : 1);
        }
        throw incompatible(operator, left, right);
    }

    private static EvaluationError incompatible(ComparisonOperator operator, FactValue left, FactValue right) {
        return new EvaluationError(String.format("Cannot apply '%s' to %s '%s' and %s '%s'",
                operator.symbol(), left.type(), left.asText(), right.type(), right.asText()));
    }

    private static final class Interpreter implements ExpressionVisitor<FactValue> {

        private final Map<String, FactValue> facts;
        private final Set<String> missing;

        private Interpreter(Map<String, FactValue> facts, Set<String> missing) {
            this.facts = facts;
            this.missing = missing;
        }

        @Override
        public FactValue visitCompare(Compare compare) {
            FactValue left = compare.left().accept(this);
            FactValue right = compare.right().accept(this);
            if (left == null || right == null) {
                return null;
            }
            return bool(ExpressionEvaluator.compare(compare.operator(), left, right));
        }

        @Override
        public FactValue visitAnd(And and) {
            boolean unknown = false;
            boolean anyFalse = false;
            for (Boolean operand : operands(and.operands(), "and")) {
                if (operand == null) {
                    unknown = true;
                } else if (!operand) {
                    anyFalse = true;
                }
            }
            if (anyFalse) {
                return bool(false);
            }
            return unknown ? null : bool(true);
        }

        @Override
        public FactValue visitOr(Or or) {
            boolean unknown = false;
            boolean anyTrue = false;
            for (Boolean operand : operands(or.operands(), "or")) {
                if (operand == null) {
                    unknown = true;
                } else if (operand) {
                    anyTrue = true;
                }
            }
            if (anyTrue) {
                return bool(true);
            }
            return unknown ? null : bool(false);
        }

        @Override
        public FactValue visitNot(Not not) {
            FactValue operand = not.operand().accept(this);
            if (operand == null) {
                return null;
            }
            return bool(!requireBoolean(operand, "'!' operand"));
        }

        @Override
        public FactValue visitIn(In in) {
            FactValue needle = in.needle().accept(this);
            boolean unknown = needle == null;
            boolean found = false;

            for (Expression candidateExpression : in.candidates()) {
                FactValue candidate = candidateExpression.accept(this);
                if (candidate == null) {
                    unknown = true;
                    continue;
                }
                if (needle == null || found) {
                    continue;
                }
                found = in.substring()
                        ? candidate.asText().contains(needle.asText())
                        : compare(ComparisonOperator.EQ, needle, candidate);
            }

            if (found) {
                return bool(true);
            }
            return unknown ? null : bool(false);
        }

        @Override
        public FactValue visitVar(Var var) {
            FactValue value = facts.get(var.name());
            if (value == null) {
                missing.add(var.name());
            }
            return value;
        }

        @Override
        public FactValue visitLiteral(Literal literal) {
            return literal.value();
        }

        private Boolean[] operands(List<Expression> expressions, String operator) {
            Boolean[] values = new Boolean[expressions.size()];
            for (int i = 0; i < expressions.size(); i++) {
                FactValue value = expressions.get(i).accept(this);
                values[i] = value == null ? null : requireBoolean(value, "'" + operator + "' operand");
            }
            return values;
        }
    }
}
