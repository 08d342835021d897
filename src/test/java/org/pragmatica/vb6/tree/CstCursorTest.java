package org.pragmatica.vb6.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.vb6.Vb6Parser;
import org.pragmatica.vb6.lexer.TokenKind;

import static org.assertj.core.api.Assertions.assertThat;

class CstCursorTest {

    private static CstCursor cursor(String source) {
        return Vb6Parser.parseText("cursor.bas", source)
                        .tree()
                        .orElseThrow()
                        .cursor();
    }

    @Test
    void root_hasNoParent() {
        var root = cursor("x = 1");

        assertThat(root.parent()).isEmpty();
        assertThat(root.depth()).isZero();
        assertThat(root.index()).isZero();
        assertThat(root.path()).isEqualTo("Root");
        assertThat(root.nextSibling()).isEmpty();
    }

    @Test
    void path_namesKindsFromRoot() {
        var literal = cursor("x = 1").find(TokenKind.INTEGER_LITERAL)
                                     .orElseThrow();

        assertThat(literal.path()).isEqualTo("Root/AssignmentStatement/NumericLiteralExpression/IntegerLiteral");
        assertThat(literal.depth()).isEqualTo(3);
        assertThat(literal.ancestors()).hasSize(3);
    }

    @Test
    void parent_andAncestor() {
        var literal = cursor("x = 1").find(TokenKind.INTEGER_LITERAL)
                                     .orElseThrow();

        assertThat(literal.parent()).map(parent -> parent.node()
                                                         .kind())
                                    .contains(NodeKind.NUMERIC_LITERAL_EXPRESSION);
        assertThat(literal.ancestor(NodeKind.ASSIGNMENT_STATEMENT)).isPresent();
        assertThat(literal.ancestor(NodeKind.IF_STATEMENT)).isEmpty();
    }

    @Test
    void siblings_followChildOrder() {
        var identifier = cursor("x = 1").find(NodeKind.IDENTIFIER_EXPRESSION)
                                        .orElseThrow();

        assertThat(identifier.index()).isZero();
        assertThat(identifier.previousSibling()).isEmpty();
        var whitespace = identifier.nextSibling()
                                   .orElseThrow();
        assertThat(whitespace.node()
                             .kind()).isEqualTo(TokenKind.WHITESPACE);
        assertThat(whitespace.index()).isEqualTo(1);
        assertThat(whitespace.nextSibling()
                             .orElseThrow()
                             .node()
                             .kind()).isEqualTo(TokenKind.EQUALITY_OPERATOR);
        assertThat(whitespace.previousSibling()).map(CstCursor::node)
                                                .contains(identifier.node());
    }

    @Test
    void children_carryParent() {
        var statement = cursor("x = 1").firstChild()
                                       .orElseThrow();

        assertThat(statement.children()).hasSize(5)
                                        .allSatisfy(child -> assertThat(child.parent()).map(CstCursor::node)
                                                                                       .contains(statement.node()));
    }

    @Test
    void nestedBlock_pathThroughStatementLists() {
        var source = """
            Sub Main()
                If a Then
                    b = 1
                End If
            End Sub
            """;
        var assignment = cursor(source).find(NodeKind.ASSIGNMENT_STATEMENT)
                                       .orElseThrow();

        assertThat(assignment.path()).isEqualTo("Root/SubStatement/StatementList/IfStatement/StatementList/AssignmentStatement");
        assertThat(assignment.ancestor(NodeKind.SUB_STATEMENT)).isPresent();
    }

    @Test
    void toString_showsPathAndSpan() {
        var statement = cursor("x = 1").firstChild()
                                       .orElseThrow();

        assertThat(statement.toString()).isEqualTo("Root/AssignmentStatement@0..5");
    }
}
