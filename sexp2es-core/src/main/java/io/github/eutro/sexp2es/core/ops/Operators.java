package io.github.eutro.sexp2es.core.ops;

import io.github.eutro.sexp2es.core.ArityMismatchException;
import io.github.eutro.sexp2es.core.estree.*;
import io.github.eutro.sexp2es.core.ir.InvokeNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static io.github.eutro.sexp2es.core.estree.Es.literal;
import static io.github.eutro.sexp2es.core.estree.Es.voidZero;

/**
 * Factories for the {@link SpecialForm}s that lower operator names to target operators,
 * and {@link #installAll(SpecialForms.Builder)} to register the standard set.
 */
public final class Operators {
    private Operators() {
    }

    /**
     * Install every standard operator form into a builder.
     *
     * @param builder The builder.
     * @return The builder.
     */
    public static SpecialForms.Builder installAll(SpecialForms.Builder builder) {
        builder.install("or", logical("||", Es::voidZero));
        builder.install("and", logical("&&", () -> literal(true)));

        builder.install("not", unary("not", "!"));
        builder.install("bit-not", unary("bit-not", "~"));

        builder.install("bit-and", bitwise("bit-and", "&"));
        builder.install("bit-or", bitwise("bit-or", "|"));
        builder.install("bit-xor", bitwise("bit-xor", "^"));
        builder.install("bit-shift-left", bitwise("bit-shift-left", "<<"));
        builder.install("bit-shift-right", bitwise("bit-shift-right", ">>"));
        builder.install("bit-shift-right-unsigned", bitwise("bit-shift-right-unsigned", ">>>"));

        builder.install("+", arithmetic("+", "+", 0, null));
        builder.install("-", arithmetic("-", "-", 0, Arity.atLeast(1)));
        builder.install("*", arithmetic("*", "*", 1, null));
        builder.install("/", arithmetic("/", "/", 1, Arity.atLeast(1)));
        builder.install("mod", arithmetic("mod", "%", 1, Arity.exactly(2)));

        builder.install("==", comparison("==", "===", true));
        builder.install(">", comparison(">", ">", true));
        builder.install(">=", comparison(">=", ">=", true));
        builder.install("<", comparison("<", "<", true));
        builder.install("<=", comparison("<=", "<=", true));

        builder.install("identical?", identical("identical?"));
        builder.install("instance?", instanceOf("instance?"));
        return builder;
    }

    /**
     * A short-circuiting operator, folded left to right.
     *
     * @param operator The target logical operator.
     * @param fallback The value of an application with no operands.
     * @return The form.
     */
    public static SpecialForm logical(String operator, Supplier<Expression> fallback) {
        return (form, writer) -> {
            if (form.params.isEmpty()) return fallback.get();
            List<Expression> operands = writer.writeAll(form.params);
            Expression acc = operands.get(0);
            for (int i = 1; i < operands.size(); i++) {
                acc = new LogicalExpression(operator, acc, operands.get(i));
            }
            return acc;
        };
    }

    /**
     * A prefix operator of exactly one operand.
     *
     * @param name     The name of the form, for errors.
     * @param operator The target unary operator.
     * @return The form.
     */
    public static SpecialForm unary(String name, String operator) {
        return (form, writer) -> {
            Arity.exactly(1).check(name, form);
            return new UnaryExpression(operator, writer.write(form.params.get(0)));
        };
    }

    /**
     * A binary operator of two or more operands, folded left to right.
     *
     * @param name     The name of the form, for errors.
     * @param operator The target binary operator.
     * @return The form.
     */
    public static SpecialForm bitwise(String name, String operator) {
        return (form, writer) -> {
            Arity.atLeast(2).check(name, form);
            return fold(operator, writer.writeAll(form.params));
        };
    }

    /**
     * An arithmetic operator with an identity element.
     * <p>
     * No operands give the identity, one operand is combined with the identity
     * on its left ({@code (- x)} is {@code 0 - x}), and more are folded left to right.
     *
     * @param name     The name of the form, for errors.
     * @param operator The target binary operator.
     * @param identity The identity element.
     * @param arity    The operand counts accepted, or null to accept any.
     * @return The form.
     */
    public static SpecialForm arithmetic(String name, String operator, int identity, @Nullable Arity arity) {
        return (form, writer) -> {
            if (arity != null) arity.check(name, form);
            List<Expression> operands = writer.writeAll(form.params);
            switch (operands.size()) {
                case 0:
                    return literal(identity);
                case 1:
                    return new BinaryExpression(operator, literal(identity), operands.get(0));
                default:
                    return fold(operator, operands);
            }
        };
    }

    /**
     * A comparison, chained over more than two operands.
     * <p>
     * {@code (< a b c)} is {@code a < b && b < c}. The middle operands appear in
     * two comparisons, as the same output node, so an operand with side effects
     * is evaluated twice.
     *
     * @param name     The name of the form, for errors.
     * @param operator The target binary operator.
     * @param fallback The value of an application with one operand.
     * @return The form.
     */
    public static SpecialForm comparison(String name, String operator, boolean fallback) {
        return (form, writer) -> {
            Arity.atLeast(1).check(name, form);
            List<Expression> operands = writer.writeAll(form.params);
            if (operands.size() == 1) {
                List<Expression> seq = new ArrayList<>(2);
                seq.add(operands.get(0));
                seq.add(literal(fallback));
                return new SequenceExpression(seq);
            }
            BinaryExpression last = new BinaryExpression(operator, operands.get(0), operands.get(1));
            Expression acc = last;
            for (int i = 2; i < operands.size(); i++) {
                last = new BinaryExpression(operator, last.right, operands.get(i));
                acc = new LogicalExpression("&&", acc, last);
            }
            return acc;
        };
    }

    /**
     * Strict equality of exactly two operands.
     *
     * @param name The name of the form, for errors.
     * @return The form.
     */
    public static SpecialForm identical(String name) {
        return (form, writer) -> {
            Arity.exactly(2).check(name, form);
            return new BinaryExpression("===", writer.write(form.params.get(0)), writer.write(form.params.get(1)));
        };
    }

    /**
     * An {@code instanceof} test, the constructor first and then the instance.
     * A missing instance is the absent value.
     *
     * @param name The name of the form, for errors.
     * @return The form.
     */
    public static SpecialForm instanceOf(String name) {
        return (form, writer) -> {
            Arity.atLeast(1).check(name, form);
            Expression constructor = writer.write(form.params.get(0));
            Expression instance = form.params.size() > 1 ? writer.write(form.params.get(1)) : voidZero();
            return new BinaryExpression("instanceof", instance, constructor);
        };
    }

    private static Expression fold(String operator, List<Expression> operands) {
        Expression acc = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            acc = new BinaryExpression(operator, acc, operands.get(i));
        }
        return acc;
    }

    /**
     * A rule for the number of operands an operator accepts.
     */
    @FunctionalInterface
    public interface Arity {
        boolean accepts(int count);

        /**
         * Throw if {@code form} has an operand count this rule doesn't accept.
         *
         * @param name The name of the operator, for the error.
         * @param form The application.
         * @throws ArityMismatchException If the count is not accepted.
         */
        default void check(String name, InvokeNode form) {
            int count = form.params.size();
            if (!accepts(count)) {
                throw new ArityMismatchException(name, count, form);
            }
        }

        static Arity exactly(int n) {
            return count -> count == n;
        }

        static Arity atLeast(int n) {
            return count -> count >= n;
        }
    }
}
