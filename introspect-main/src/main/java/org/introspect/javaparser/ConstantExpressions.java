package org.introspect.javaparser;

import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.Type;

/**
 * Decides which expressions javac folds at compile time (JLS 15.29). A folded {@code String} is interned,
 * so splitting such an expression into captured operands would change its identity.
 * <p>
 * Names are resolved syntactically against the enclosing unit: locals and parameters in scope, then the
 * fields of the enclosing types. A name declared elsewhere (inherited, statically imported, another unit)
 * is {@link Constancy#UNKNOWN}.
 */
final class ConstantExpressions {

    enum Constancy {
        CONSTANT,
        VARIABLE,
        UNKNOWN;

        Constancy and(Constancy other) {
            if (this == VARIABLE || other == VARIABLE) {
                return VARIABLE;
            }
            return this == UNKNOWN || other == UNKNOWN ? UNKNOWN : CONSTANT;
        }
    }

    // initializers referring to each other are illegal, the limit only stops malformed input
    private static final int MAX_DEPTH = 32;

    private ConstantExpressions() {
    }

    static Constancy classify(Expression expression) {
        return classify(expression, 0);
    }

    private static Constancy classify(Expression expression, int depth) {
        if (depth > MAX_DEPTH) {
            return Constancy.UNKNOWN;
        }
        if (expression.isLiteralExpr()) {
            return expression.isNullLiteralExpr() ? Constancy.VARIABLE : Constancy.CONSTANT;
        }
        if (expression instanceof EnclosedExpr enclosed) {
            return classify(enclosed.getInner(), depth);
        }
        if (expression instanceof UnaryExpr unary) {
            return switch (unary.getOperator()) {
                case PLUS, MINUS, LOGICAL_COMPLEMENT, BITWISE_COMPLEMENT -> classify(unary.getExpression(), depth);
                default -> Constancy.VARIABLE;
            };
        }
        if (expression instanceof CastExpr cast) {
            return isConstantType(cast.getType()) ? classify(cast.getExpression(), depth) : Constancy.VARIABLE;
        }
        if (expression instanceof BinaryExpr binary) {
            return classify(binary.getLeft(), depth).and(classify(binary.getRight(), depth));
        }
        if (expression instanceof ConditionalExpr conditional) {
            return classify(conditional.getCondition(), depth)
                    .and(classify(conditional.getThenExpr(), depth))
                    .and(classify(conditional.getElseExpr(), depth));
        }
        if (expression instanceof NameExpr name) {
            Constancy declared = lookup(name.getNameAsString(), name, depth);
            return declared == null ? Constancy.UNKNOWN : declared;
        }
        if (expression instanceof FieldAccessExpr access) {
            return classifyQualified(access, depth);
        }
        return Constancy.VARIABLE;
    }

    // only TypeName.Identifier is a constant expression, a field read through a variable never is
    private static Constancy classifyQualified(FieldAccessExpr access, int depth) {
        Expression scope = access.getScope();
        if (!scope.isNameExpr()) {
            return scope.isFieldAccessExpr() ? Constancy.UNKNOWN : Constancy.VARIABLE;
        }
        String scopeName = scope.asNameExpr().getNameAsString();
        Constancy variable = lookup(scopeName, access, depth);
        if (variable == Constancy.UNKNOWN) {
            return Constancy.UNKNOWN;
        }
        if (variable != null) {
            return Constancy.VARIABLE;
        }
        Optional<CompilationUnit> unit = access.findCompilationUnit();
        if (unit.isEmpty()) {
            return Constancy.UNKNOWN;
        }
        List<TypeDeclaration> types = unit.get().findAll(TypeDeclaration.class,
                                                          type -> type.getNameAsString().equals(scopeName));
        if (types.size() != 1) {
            return Constancy.UNKNOWN;
        }
        Constancy field = fieldOf(types.get(0), access.getNameAsString(), depth);
        return field == null ? Constancy.UNKNOWN : field;
    }

    /**
     * @return how the innermost declaration of {@code name} visible from {@code from} folds, or {@code null}
     *         when the unit declares no such name in scope
     */
    private static Constancy lookup(String name, Node from, int depth) {
        Node child = from;
        Optional<Node> parent = from.getParentNode();
        while (parent.isPresent()) {
            Node node = parent.get();
            Constancy declared = declaredIn(node, child, name, depth);
            if (declared != null) {
                return declared;
            }
            child = node;
            parent = node.getParentNode();
        }
        return null;
    }

    private static Constancy declaredIn(Node node, Node child, String name, int depth) {
        if (node instanceof BlockStmt block) {
            return declaredBefore(block.getStatements(), child, name, depth);
        }
        if (node instanceof SwitchEntry entry) {
            return declaredBefore(entry.getStatements(), child, name, depth);
        }
        if (node instanceof LambdaExpr lambda) {
            return hasParameter(lambda.getParameters(), name) ? Constancy.VARIABLE : null;
        }
        if (node instanceof CallableDeclaration<?> callable) {
            return hasParameter(callable.getParameters(), name) ? Constancy.VARIABLE : null;
        }
        if (node instanceof CatchClause clause) {
            return clause.getParameter().getNameAsString().equals(name) ? Constancy.VARIABLE : null;
        }
        if (node instanceof ForEachStmt forEach) {
            return declares(forEach.getVariable(), name) ? Constancy.VARIABLE : null;
        }
        if (node instanceof ForStmt forStmt) {
            return declaredAmong(forStmt.getInitialization(), name, depth);
        }
        if (node instanceof TryStmt tryStmt) {
            return declaredAmong(tryStmt.getResources(), name, depth);
        }
        if (node instanceof TypeDeclaration<?> type) {
            return declaredInType(type, name, depth);
        }
        if (node instanceof ObjectCreationExpr creation && child instanceof BodyDeclaration) {
            // an anonymous class may inherit the name from its supertype
            Constancy field = fieldAmong(creation.getAnonymousClassBody().orElseGet(NodeList::new), name, false, depth);
            return field == null ? Constancy.UNKNOWN : field;
        }
        return null;
    }

    private static Constancy declaredInType(TypeDeclaration<?> type, String name, int depth) {
        Constancy field = fieldOf(type, name, depth);
        if (field != null) {
            return field;
        }
        if (type instanceof RecordDeclaration recordType) {
            if (hasParameter(recordType.getParameters(), name)) {
                return Constancy.VARIABLE;
            }
            return recordType.getImplementedTypes().isEmpty() ? null : Constancy.UNKNOWN;
        }
        if (type instanceof EnumDeclaration enumeration) {
            if (enumeration.getEntries().stream().anyMatch(entry -> entry.getNameAsString().equals(name))) {
                return Constancy.VARIABLE;
            }
            return enumeration.getImplementedTypes().isEmpty() ? null : Constancy.UNKNOWN;
        }
        if (type instanceof ClassOrInterfaceDeclaration declaration) {
            boolean inherits = !declaration.getExtendedTypes().isEmpty() || !declaration.getImplementedTypes().isEmpty();
            return inherits ? Constancy.UNKNOWN : null;
        }
        return null;
    }

    private static Constancy fieldOf(TypeDeclaration<?> type, String name, int depth) {
        boolean implicitlyFinal = type instanceof AnnotationDeclaration
                                  || (type instanceof ClassOrInterfaceDeclaration declaration && declaration.isInterface());
        return fieldAmong(type.getMembers(), name, implicitlyFinal, depth);
    }

    private static Constancy fieldAmong(NodeList<BodyDeclaration<?>> members, String name, boolean implicitlyFinal, int depth) {
        for (BodyDeclaration<?> member : members) {
            if (!member.isFieldDeclaration()) {
                continue;
            }
            FieldDeclaration field = member.asFieldDeclaration();
            for (VariableDeclarator variable : field.getVariables()) {
                if (variable.getNameAsString().equals(name)) {
                    return constancyOf(variable, implicitlyFinal || field.isFinal(), depth);
                }
            }
        }
        return null;
    }

    private static Constancy declaredBefore(NodeList<Statement> statements, Node child, String name, int depth) {
        for (Statement statement : statements) {
            if (statement == child) {
                break;
            }
            if (statement instanceof ExpressionStmt expressionStmt
                && expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration) {
                Constancy local = declaredBy(declaration, name, depth);
                if (local != null) {
                    return local;
                }
            }
        }
        return null;
    }

    private static Constancy declaredAmong(NodeList<Expression> expressions, String name, int depth) {
        for (Expression expression : expressions) {
            if (expression instanceof VariableDeclarationExpr declaration) {
                Constancy local = declaredBy(declaration, name, depth);
                if (local != null) {
                    return local;
                }
            }
        }
        return null;
    }

    private static Constancy declaredBy(VariableDeclarationExpr declaration, String name, int depth) {
        for (VariableDeclarator variable : declaration.getVariables()) {
            if (variable.getNameAsString().equals(name)) {
                return constancyOf(variable, declaration.isFinal(), depth);
            }
        }
        return null;
    }

    // JLS 4.12.4: a final variable of primitive or String type initialized with a constant expression
    private static Constancy constancyOf(VariableDeclarator variable, boolean isFinal, int depth) {
        if (!isFinal || !isConstantType(variable.getType()) || variable.getInitializer().isEmpty()) {
            return Constancy.VARIABLE;
        }
        return classify(variable.getInitializer().get(), depth + 1);
    }

    private static boolean declares(VariableDeclarationExpr declaration, String name) {
        return declaration.getVariables().stream().anyMatch(variable -> variable.getNameAsString().equals(name));
    }

    private static boolean hasParameter(NodeList<Parameter> parameters, String name) {
        return parameters.stream().anyMatch(parameter -> parameter.getNameAsString().equals(name));
    }

    // a var with a constant initializer always infers a primitive or String
    private static boolean isConstantType(Type type) {
        if (type.isPrimitiveType() || type.isVarType()) {
            return true;
        }
        String name = type.asString();
        return name.equals("String") || name.equals("java.lang.String");
    }
}
