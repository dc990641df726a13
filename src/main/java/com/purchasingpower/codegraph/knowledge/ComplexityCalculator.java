package com.purchasingpower.codegraph.knowledge;

import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;

/**
 * Cyclomatic complexity of a declaration.
 *
 * <p>Starts at 1 and adds one per descendant {@code if}, ternary, {@code for},
 * enhanced {@code for}, {@code while}, {@code do}, labelled {@code case} entry
 * and {@code catch} clause, plus one per binary expression whose source text
 * contains {@code &&} or {@code ||}. Nested binary expressions are each
 * counted, so {@code a && b && c} scores two.
 */
public final class ComplexityCalculator {

    public static final int BASE_COMPLEXITY = 1;

    private ComplexityCalculator() {
    }

    public static int calculate(Node declaration) {
        return BASE_COMPLEXITY + countDecisionPoints(declaration);
    }

    private static int countDecisionPoints(Node node) {
        int count = 0;
        for (Node child : node.getChildNodes()) {
            if (isDecisionPoint(child)) {
                count++;
            }
            count += countDecisionPoints(child);
        }
        return count;
    }

    static boolean isDecisionPoint(Node node) {
        if (node instanceof IfStmt
            || node instanceof ConditionalExpr
            || node instanceof ForStmt
            || node instanceof ForEachStmt
            || node instanceof WhileStmt
            || node instanceof DoStmt
            || node instanceof CatchClause) {
            return true;
        }
        if (node instanceof SwitchEntry entry) {
            return !entry.getLabels().isEmpty();
        }
        if (node instanceof BinaryExpr binary) {
            String text = binary.getTokenRange()
                .map(TokenRange::toString)
                .orElseGet(binary::toString);
            return text.contains("&&") || text.contains("||");
        }
        return false;
    }
}
