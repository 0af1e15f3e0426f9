package org.introspect.javaparser;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.AssertStmt;
import org.introspect.tree.Arithmetic;
import org.introspect.tree.BinaryNode;
import org.introspect.tree.Comparison;
import org.introspect.tree.ExpressionNode;
import org.introspect.tree.Leaf;
import org.introspect.tree.LogicalAnd;
import org.introspect.tree.LogicalOr;
import org.introspect.tree.OperatorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JavaExpressionReaderTest {

    private final JavaExpressionReader reader = new JavaExpressionReader();

    private ExpressionNode<Expression> read(String expression) {
        return read("", expression);
    }

    // the condition is read in place so that names resolve against the surrounding declarations
    private ExpressionNode<Expression> read(String members, String expression) {
        CompilationUnit unit = StaticJavaParser.parse(
                "class Sample {\n" + members + "\n"
                + "    void check(int a, int b, int c, int n, int x, int flags, int mask, boolean done, boolean flag,\n"
                + "               java.util.List<?> list, Object o, String s) {\n"
                + "        assert " + expression + ";\n"
                + "    }\n"
                + "}\n");
        return reader.read(unit.findFirst(AssertStmt.class).orElseThrow().getCheck());
    }

    @Test
    void comparisonOfArithmetic() {
        ExpressionNode<Expression> node = read("(a + b) == c");

        assertThat(node).isInstanceOf(Comparison.class);
        BinaryNode<Expression> comparison = (BinaryNode<Expression>) node;
        assertThat(comparison.operator()).isEqualTo(OperatorKind.EQUALS);
        assertThat(comparison.left()).isInstanceOf(Arithmetic.class);
        assertThat(((BinaryNode<Expression>) comparison.left()).operator()).isEqualTo(OperatorKind.PLUS);
        assertThat(comparison.right().source().toString()).isEqualTo("c");
    }

    @Test
    void parenthesesAreTransparent() {
        ExpressionNode<Expression> node = read("((x))");

        assertThat(node).isInstanceOf(Leaf.class);
        assertThat(node.source().isNameExpr()).isTrue();
    }

    @Test
    void literalOnlySubtreeIsOneLeaf() {
        BinaryNode<Expression> node = (BinaryNode<Expression>) read("(1 + 2) * -3 == n");

        assertThat(node.left()).isInstanceOf(Leaf.class);
        assertThat(node.left().source().toString()).isEqualTo("(1 + 2) * -3");
    }

    @Test
    void constantVariablesFoldWithTheirUse() {
        BinaryNode<Expression> node = (BinaryNode<Expression>) read("static final String PREFIX = \"a\";", "s == PREFIX + \"b\"");

        assertThat(node.left().source().toString()).isEqualTo("s");
        assertThat(node.right()).isInstanceOf(Leaf.class);
        assertThat(node.right().source().toString()).isEqualTo("PREFIX + \"b\"");
    }

    @Test
    void qualifiedConstantOfThisUnitFolds() {
        BinaryNode<Expression> node = (BinaryNode<Expression>) read("static final int LIMIT = 2 * 50;", "n < Sample.LIMIT - 1");

        assertThat(node.right()).isInstanceOf(Leaf.class);
    }

    @Test
    void nonFinalFieldIsDecomposed() {
        BinaryNode<Expression> node = (BinaryNode<Expression>) read("static String prefix = \"a\";", "s == prefix + \"b\"");

        assertThat(node.right()).isInstanceOf(Arithmetic.class);
    }

    @Test
    void finalLocalWithConstantInitializerFolds() {
        CompilationUnit unit = StaticJavaParser.parse(
                "class Sample { void check(String s) { final String tail = \"b\"; assert s == \"a\" + tail; } }");

        BinaryNode<Expression> node = (BinaryNode<Expression>) reader.read(unit.findFirst(AssertStmt.class).orElseThrow().getCheck());

        assertThat(node.right()).isInstanceOf(Leaf.class);
    }

    @Test
    void concatenationOfUnresolvedNamesStaysWhole() {
        BinaryNode<Expression> node = (BinaryNode<Expression>) read("s == Other.PREFIX + \"b\"");

        assertThat(node.right()).isInstanceOf(Leaf.class);
        assertThat(((BinaryNode<Expression>) read("Other.COUNT * 2 == n")).left()).isInstanceOf(Arithmetic.class);
    }

    @Test
    void nullComparisonIsDecomposed() {
        assertThat(read("null == null")).isInstanceOf(Comparison.class);
    }

    @Test
    void logicalOperatorsKeepPrecedence() {
        ExpressionNode<Expression> node = read("a && b || c");

        assertThat(node).isInstanceOf(LogicalOr.class);
        assertThat(((BinaryNode<Expression>) node).left()).isInstanceOf(LogicalAnd.class);
    }

    @Test
    void bitwiseOperatorsAreArithmetic() {
        ExpressionNode<Expression> node = read("flags & mask");

        assertThat(node).isInstanceOf(Arithmetic.class);
        assertThat(((BinaryNode<Expression>) node).operator()).isEqualTo(OperatorKind.BINARY_AND);
    }

    @Test
    void everythingElseIsALeaf() {
        assertThat(read("list.isEmpty()")).isInstanceOf(Leaf.class);
        assertThat(read("!done")).isInstanceOf(Leaf.class);
        assertThat(read("flag ? a : b")).isInstanceOf(Leaf.class);
        assertThat(read("o instanceof String")).isInstanceOf(Leaf.class);
    }

    @Test
    void everyOperatorMapsBothWays() {
        for (OperatorKind kind : OperatorKind.values()) {
            assertThat(OperatorMapping.toKind(OperatorMapping.toOperator(kind))).isEqualTo(kind);
        }
    }
}
