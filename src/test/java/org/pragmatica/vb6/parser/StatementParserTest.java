package org.pragmatica.vb6.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.vb6.Vb6Parser;
import org.pragmatica.vb6.tree.ConcreteSyntaxTree;
import org.pragmatica.vb6.tree.CstNode;
import org.pragmatica.vb6.tree.NodeKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.vb6.query.TreeMatcher.assertTree;

class StatementParserTest {

    private static ConcreteSyntaxTree parseClean(String source) {
        var result = Vb6Parser.parseText("test.bas", source);
        assertThat(result.failures()).isEmpty();
        return result.tree()
                     .orElseThrow();
    }

    private static List<CstNode> statements(String source) {
        return parseClean(source).root()
                                 .significantChildren();
    }

    private static CstNode statement(String source) {
        var statements = statements(source);
        assertThat(statements).hasSize(1);
        return statements.get(0);
    }

    // === Call forms ===

    @Test
    void bareCall_withoutArguments_hasEmptyArgumentList() {
        assertTree(statement("Foo"), "CallStatement { Identifier(\"Foo\") ArgumentList { } }");
    }

    @Test
    void parenthesizedCall_keepsParentheses() {
        assertTree(statement("Foo()"), "CallStatement { Identifier(\"Foo\") LeftParenthesis ArgumentList { } RightParenthesis }");
    }

    @Test
    void callKeyword_isFirstChild() {
        assertTree(statement("Call Foo"), "CallStatement { CallKeyword Identifier(\"Foo\") ArgumentList { } }");
    }

    @Test
    void callKeyword_withArguments() {
        assertTree(statement("Call Foo(1, x)"), """
            CallStatement {
              CallKeyword Identifier("Foo") LeftParenthesis
              ArgumentList { Argument { NumericLiteralExpression } Comma Argument { IdentifierExpression } }
              RightParenthesis
            }
            """);
    }

    @Test
    void bareCall_withArguments() {
        assertTree(statement("Foo 1, x"), """
            CallStatement {
              Identifier("Foo")
              ArgumentList { Argument { NumericLiteralExpression } Comma Argument { IdentifierExpression } }
            }
            """);
    }

    @Test
    void bareCall_withParenthesizedFirstArgument_isNotParenthesizedCall() {
        assertTree(statement("MsgBox (x), vbInformation"), """
            CallStatement {
              Identifier("MsgBox")
              ArgumentList {
                Argument { ParenthesizedExpression }
                Comma
                Argument { IdentifierExpression }
              }
            }
            """);
    }

    @Test
    void bareCall_withSpaceBeforeParentheses_treatsThemAsArgument() {
        assertTree(statement("Foo (1)"), """
            CallStatement { Identifier ArgumentList { Argument { ParenthesizedExpression } } }
            """);
    }

    @Test
    void memberCall_keepsMemberAccessAsCallee() {
        assertTree(statement("rs.MoveNext"), """
            CallStatement {
              MemberAccessExpression { Identifier("rs") PeriodOperator Identifier("MoveNext") }
              ArgumentList { }
            }
            """);
    }

    @Test
    void memberCall_afterIndexedObject() {
        assertTree(statement("Forms(0).Show 1"), """
            CallStatement {
              MemberAccessExpression {
                CallExpression { Identifier("Forms") LeftParenthesis ArgumentList RightParenthesis }
                PeriodOperator Identifier("Show")
              }
              ArgumentList { Argument }
            }
            """);
    }

    @Test
    void doEvents_withAndWithoutParentheses_bothHaveEmptyArguments() {
        assertTree(statement("DoEvents"), "CallStatement { Identifier(\"DoEvents\") ArgumentList { } }");
        assertTree(statement("DoEvents()"), "CallStatement { Identifier LeftParenthesis ArgumentList { } RightParenthesis }");
    }

    @Test
    void printMethodOnObject_isCall() {
        assertTree(statement("Debug.Print \"a\"; x"), """
            CallStatement {
              MemberAccessExpression { Identifier("Debug") PeriodOperator PrintKeyword }
              ArgumentList { Argument Semicolon Argument }
            }
            """);
    }

    // === Assignments ===

    @Test
    void assignment_withIndexedTarget() {
        assertTree(statement("arr(i) = 5"), """
            AssignmentStatement {
              CallExpression { Identifier("arr") LeftParenthesis ArgumentList { Argument } RightParenthesis }
              EqualityOperator NumericLiteralExpression
            }
            """);
    }

    @Test
    void assignment_toMidStatement() {
        assertTree(statement("Mid(s, 2, 1) = \"x\""), """
            AssignmentStatement {
              CallExpression { MidKeyword LeftParenthesis ArgumentList RightParenthesis }
              EqualityOperator StringLiteralExpression
            }
            """);
    }

    @Test
    void assignment_toKeywordNamedVariable() {
        assertTree(statement("Name = \"x\""), """
            AssignmentStatement { IdentifierExpression { NameKeyword } EqualityOperator StringLiteralExpression }
            """);
    }

    @Test
    void assignment_toPropertyOfMe() {
        assertTree(statement("Me.Caption = \"Main\""), """
            AssignmentStatement {
              MemberAccessExpression { MeKeyword PeriodOperator Identifier("Caption") }
              EqualityOperator StringLiteralExpression
            }
            """);
    }

    @Test
    void assignment_rightSideComparisonStaysInExpression() {
        assertTree(statement("ok = a = b"), """
            AssignmentStatement {
              IdentifierExpression EqualityOperator
              BinaryExpression { IdentifierExpression EqualityOperator IdentifierExpression }
            }
            """);
    }

    @Test
    void assignment_toLongSuffixedVariable() {
        assertTree(statement("x& = 1"), """
            AssignmentStatement {
              IdentifierExpression { Identifier("x") Ampersand } EqualityOperator NumericLiteralExpression
            }
            """);
    }

    @Test
    void assignment_adjacentAmpersandBeforeOperand_staysConcatenation() {
        assertTree(statement("s = a&b & c& d"), """
            AssignmentStatement {
              IdentifierExpression EqualityOperator
              BinaryExpression {
                BinaryExpression {
                  BinaryExpression { IdentifierExpression Ampersand IdentifierExpression }
                  Ampersand IdentifierExpression
                }
                Ampersand IdentifierExpression
              }
            }
            """);
    }

    @Test
    void setStatement_withNewObject() {
        assertTree(statement("Set col = New Collection"), """
            SetStatement { SetKeyword IdentifierExpression EqualityOperator NewExpression }
            """);
    }

    @Test
    void letStatement_keepsKeyword() {
        assertTree(statement("Let x = 1"), "LetStatement { LetKeyword IdentifierExpression EqualityOperator NumericLiteralExpression }");
    }

    @Test
    void lSet_isAssignment() {
        assertTree(statement("LSet buf = s"), "AssignmentStatement { LSetKeyword IdentifierExpression EqualityOperator IdentifierExpression }");
    }

    @Test
    void raiseEvent_withArguments() {
        assertTree(statement("RaiseEvent Changed(1)"), """
            RaiseEventStatement {
              RaiseEventKeyword Identifier("Changed") LeftParenthesis ArgumentList { Argument } RightParenthesis
            }
            """);
    }

    // === Labels and separators ===

    @Test
    void identifierLabel_ownsColonAndNewline() {
        var statements = statements("Retry:\n    x = 1\n");

        assertTree(statements.get(0), "LabelStatement { Identifier(\"Retry\") ColonOperator }");
        assertThat(statements.get(0).text()).isEqualTo("Retry:\n");
        assertThat(statements.get(1).kind()).isEqualTo(NodeKind.ASSIGNMENT_STATEMENT);
    }

    @Test
    void lineNumber_precedesStatementOnSameLine() {
        var statements = statements("10 x = 1\n20 GoTo 10\n");

        assertThat(statements).extracting(CstNode::kind)
                              .containsExactly(NodeKind.LABEL_STATEMENT, NodeKind.ASSIGNMENT_STATEMENT,
                                               NodeKind.LABEL_STATEMENT, NodeKind.GOTO_STATEMENT);
    }

    @Test
    void lineNumberLabel_keepsFollowingStatementAsSibling() {
        var statements = statements("100 x = 1\n");

        assertThat(statements).hasSize(2);
        assertTree(statements.get(0), "LabelStatement { IntegerLiteral(\"100\") }");
        assertTree(statements.get(1), """
            AssignmentStatement { IdentifierExpression { Identifier("x") } EqualityOperator NumericLiteralExpression }
            """);
    }

    @Test
    void colonSeparatedStatements_areSiblingsWithColonLeaf() {
        var root = parseClean("a = 1: b = 2\n").root();

        assertTree(root, """
            Root { AssignmentStatement ColonOperator AssignmentStatement }
            """);
    }

    @Test
    void statement_ownsTrailingCommentAndNewline() {
        var statement = statements("x = 1 ' set x\ny = 2\n").get(0);

        assertThat(statement.text()).isEqualTo("x = 1 ' set x\n");
        assertThat(statement.lastChild()
                            .orElseThrow()
                            .isNewline()).isTrue();
    }

    @Test
    void blankAndCommentLines_stayInParent() {
        var root = parseClean("' header\n\nx = 1\n").root();

        assertThat(root.children()
                       .get(0)
                       .isComment()).isTrue();
        assertThat(root.significantChildren()).hasSize(1);
    }
}
