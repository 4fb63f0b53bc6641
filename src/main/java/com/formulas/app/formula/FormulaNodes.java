package com.formulas.app.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree traversal helpers.
 */
public final class FormulaNodes {

    private FormulaNodes() {
    }

    /**
     * Every node of the tree in pre-order (parents before children, arguments left to right).
     */
    public static List<FormulaNode> preOrder(FormulaNode root) {
        List<FormulaNode> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(FormulaNode node, List<FormulaNode> out) {
        out.add(node);
        if (node instanceof BinaryOp binary) {
            collect(binary.left(), out);
            collect(binary.right(), out);
        } else if (node instanceof UnaryOp unary) {
            collect(unary.operand(), out);
        } else if (node instanceof Group group) {
            collect(group.expression(), out);
        } else if (node instanceof FunctionCall call) {
            for (FormulaNode arg : call.args()) {
                collect(arg, out);
            }
        }
    }
}
