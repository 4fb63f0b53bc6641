package com.formulas.app.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tree-walking evaluator shared by every formula language and mode. Operators, grouping,
 * function dispatch and format merging live here; what a reference means is delegated to a
 * {@link ReferenceResolver}.
 *
 * <p>Evaluation is a single pure descent: no state is kept between nodes and the first error
 * met aborts the enclosing expression.
 */
public final class FormulaEvaluator implements FormulaVisitor<FormulaResult> {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final ReferenceResolver resolver;

    public FormulaEvaluator(ReferenceResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Evaluates {@code ast}, converting any unexpected fault into an {@link FormulaErrorKind#EVALUATION}
     * result so that callers never see an exception.
     */
    public static FormulaResult evaluate(FormulaNode ast, ReferenceResolver resolver) {
        try {
            return ast.accept(new FormulaEvaluator(resolver));
        } catch (RuntimeException | StackOverflowError ex) {
            log.warn("Unexpected fault while evaluating formula {}", ast, ex);
            return FormulaResult.failure(FormulaErrorKind.EVALUATION, "Evaluation error");
        }
    }

    @Override
    public FormulaResult visitNumber(NumberLiteral node) {
        return FormulaResult.of(node.value());
    }

    @Override
    public FormulaResult visitCellReference(CellReference node) {
        return resolver.resolveCell(node);
    }

    @Override
    public FormulaResult visitCellRange(CellRange node) {
        // a bare range outside a function evaluates to its sum
        return resolver.expandRange(node).sum();
    }

    @Override
    public FormulaResult visitColumnReference(ColumnReference node) {
        return resolver.resolveColumn(node);
    }

    @Override
    public FormulaResult visitAggregateSelf(AggregateSelf node) {
        return resolver.resolveAggregateSelf(node);
    }

    @Override
    public FormulaResult visitBinaryOp(BinaryOp node) {
        FormulaResult left = node.left().accept(this);
        if (!left.isOk()) {
            return left;
        }
        FormulaResult right = node.right().accept(this);
        if (!right.isOk()) {
            return right;
        }

        double l = left.getValue();
        double r = right.getValue();
        double value;
        switch (node.operator()) {
            case ADD:
                value = l + r;
                break;
            case SUB:
                value = l - r;
                break;
            case MUL:
                value = l * r;
                break;
            case DIV:
                if (r == 0) {
                    return FormulaResult.failure(FormulaErrorKind.ARITHMETIC, "Division by zero");
                }
                value = l / r;
                break;
            default:
                throw new IllegalStateException("Unknown operator " + node.operator());
        }
        return finite(value, left.getFormat().merge(right.getFormat()));
    }

    @Override
    public FormulaResult visitUnaryOp(UnaryOp node) {
        FormulaResult operand = node.operand().accept(this);
        if (!operand.isOk()) {
            return operand;
        }
        return FormulaResult.of(-operand.getValue(), operand.getFormat());
    }

    @Override
    public FormulaResult visitFunctionCall(FunctionCall node) {
        Optional<FormulaFunction> lookup = FormulaFunction.lookup(node.name(), resolver.supportedFunctions());
        if (lookup.isEmpty()) {
            return FormulaResult.failure(FormulaErrorKind.RESOLUTION, "Unknown function: " + node.name());
        }
        FormulaFunction function = lookup.get();
        FormulaResult arityError = function.checkArity(node.args().size());
        if (arityError != null) {
            return arityError;
        }

        List<FormulaResult> values = new ArrayList<>();
        for (FormulaNode arg : node.args()) {
            if (function.isAggregate()) {
                ValueList expanded = expand(arg);
                if (!expanded.isOk()) {
                    return expanded.getFailure();
                }
                values.addAll(expanded.getValues());
            } else {
                FormulaResult result = arg.accept(this);
                if (!result.isOk()) {
                    return result;
                }
                values.add(result);
            }
        }
        FormulaResult result = function.apply(values);
        return finite(result.getValue(), result.getFormat());
    }

    @Override
    public FormulaResult visitGroup(Group node) {
        return node.expression().accept(this);
    }

    private ValueList expand(FormulaNode arg) {
        if (arg instanceof CellRange range) {
            return resolver.expandRange(range);
        }
        if (arg instanceof ColumnReference column) {
            return resolver.expandColumn(column);
        }
        if (arg instanceof AggregateSelf self) {
            return resolver.expandAggregateSelf(self);
        }
        return ValueList.single(arg.accept(this));
    }

    private static FormulaResult finite(double value, ValueFormat format) {
        if (!Double.isFinite(value)) {
            return FormulaResult.failure(FormulaErrorKind.ARITHMETIC, "Numeric overflow");
        }
        return FormulaResult.of(value, format);
    }
}
