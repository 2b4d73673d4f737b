package com.raditha.checkcode.metrics;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.checkcode.model.Metrics;
import com.raditha.checkcode.model.Range;

/**
 * Extracts structural metrics from a method or constructor declaration.
 * <p>
 * The whole subtree is walked, so lambdas, anonymous and local classes
 * declared inside the body count toward the enclosing declaration.
 * Cyclomatic complexity follows McCabe: one for the entry plus one for each
 * branch, loop, try, catch, switch and short-circuit operator. A
 * {@code synchronized} block is scored like {@code try}, the other scoped
 * block, and {@code i++} or {@code --i} is scored like a compound assignment.
 */
public class MetricExtractor {

    /**
     * Compute metrics for a callable declaration.
     *
     * @param callable Method or constructor with a known source range
     * @return Metrics with no duplication attached
     * @throws IllegalStateException if the declaration has no source range
     */
    public Metrics extract(CallableDeclaration<?> callable) {
        Range range = callable.getRange()
                .map(Range::from)
                .orElseThrow(() -> new IllegalStateException(
                        "No source range for " + callable.getNameAsString()));

        Counter counter = new Counter();
        callable.walk(counter::visit);

        return new Metrics(
                range.getLineCount(),
                counter.statements,
                counter.expressions,
                counter.expressionStatements,
                counter.decisions + 1,
                countParameters(callable));
    }

    /**
     * Declared parameters, not counting a trailing varargs collector.
     */
    int countParameters(CallableDeclaration<?> callable) {
        int count = 0;
        for (Parameter parameter : callable.getParameters()) {
            if (!parameter.isVarArgs()) {
                count++;
            }
        }
        return count;
    }

    static boolean isStatement(Node node) {
        return node instanceof IfStmt
                || node instanceof ForStmt
                || node instanceof ForEachStmt
                || node instanceof WhileStmt
                || node instanceof DoStmt
                || node instanceof TryStmt
                || node instanceof CatchClause
                || node instanceof SwitchStmt
                || node instanceof SynchronizedStmt
                || node instanceof AssignExpr
                || isIncrementOrDecrement(node)
                || node instanceof VariableDeclarationExpr
                || node instanceof ThrowStmt
                || node instanceof ReturnStmt
                || node instanceof CallableDeclaration<?>
                || node instanceof TypeDeclaration<?>;
    }

    static boolean isDecision(Node node) {
        if (node instanceof BinaryExpr binary) {
            return binary.getOperator() == BinaryExpr.Operator.AND
                    || binary.getOperator() == BinaryExpr.Operator.OR;
        }
        return node instanceof IfStmt
                || node instanceof ForStmt
                || node instanceof ForEachStmt
                || node instanceof WhileStmt
                || node instanceof DoStmt
                || node instanceof TryStmt
                || node instanceof CatchClause
                || node instanceof SwitchStmt
                || node instanceof SynchronizedStmt
                || node instanceof SwitchExpr;
    }

    static boolean isIncrementOrDecrement(Node node) {
        if (node instanceof UnaryExpr unary) {
            UnaryExpr.Operator operator = unary.getOperator();
            return operator == UnaryExpr.Operator.PREFIX_INCREMENT
                    || operator == UnaryExpr.Operator.PREFIX_DECREMENT
                    || operator == UnaryExpr.Operator.POSTFIX_INCREMENT
                    || operator == UnaryExpr.Operator.POSTFIX_DECREMENT;
        }
        return false;
    }

    /**
     * An expression statement whose value is discarded, such as a call or an
     * object creation. Assignments, increments and declarations are counted
     * as statements instead.
     */
    static boolean isExpressionStatement(Node node) {
        if (node instanceof ExpressionStmt stmt) {
            Expression expression = stmt.getExpression();
            return !(expression instanceof AssignExpr)
                    && !(expression instanceof VariableDeclarationExpr)
                    && !isIncrementOrDecrement(expression);
        }
        return false;
    }

    private static final class Counter {
        int statements;
        int expressions;
        int expressionStatements;
        int decisions;

        void visit(Node node) {
            if (isStatement(node)) {
                statements++;
            }
            if (isDecision(node)) {
                decisions++;
            }
            if (isExpressionStatement(node)) {
                expressionStatements++;
            }
            if (node instanceof Expression) {
                expressions++;
            }
        }
    }
}
