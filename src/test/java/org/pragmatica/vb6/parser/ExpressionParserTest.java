package org.pragmatica.vb6.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.vb6.Vb6Parser;
import org.pragmatica.vb6.tree.CstNode;
import org.pragmatica.vb6.tree.NodeKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.vb6.query.TreeMatcher.assertTree;

class ExpressionParserTest {

    /**
     * Right-hand side of the single assignment in {@code source}.
     */
    private static CstNode rhs(String source) {
        var result = Vb6Parser.parseText("test.bas", source);
        assertThat(result.failures()).isEmpty();
        var statement = result.tree()
                              .orElseThrow()
                              .root()
                              .significantChildren()
                              .get(0);
        assertThat(statement.kind()).isEqualTo(NodeKind.ASSIGNMENT_STATEMENT);
        return statement.significantChildren()
                        .get(2);
    }

    // === Precedence ===

    @Test
    void multiplication_bindsTighterThanAddition() {
        assertTree(rhs("x = 1 + 2 * 3"), """
            BinaryExpression {
              NumericLiteralExpression AdditionOperator
              BinaryExpression { NumericLiteralExpression MultiplicationOperator NumericLiteralExpression }
            }
            """);
    }

    @Test
    void subtraction_isLeftAssociative() {
        assertTree(rhs("x = a - b - c"), """
            BinaryExpression {
              BinaryExpression { IdentifierExpression SubtractionOperator IdentifierExpression }
              SubtractionOperator IdentifierExpression
            }
            """);
    }

    @Test
    void exponent_isLeftAssociative() {
        assertTree(rhs("x = 2 ^ 3 ^ 2"), """
            BinaryExpression {
              BinaryExpression { NumericLiteralExpression ExponentiationOperator NumericLiteralExpression }
              ExponentiationOperator NumericLiteralExpression
            }
            """);
    }

    @Test
    void unaryMinus_bindsLooserThanExponent() {
        assertTree(rhs("x = -2 ^ 2"), """
            UnaryExpression {
              SubtractionOperator
              BinaryExpression { NumericLiteralExpression ExponentiationOperator NumericLiteralExpression }
            }
            """);
    }

    @Test
    void integerDivision_bindsLooserThanMultiplication() {
        assertTree(rhs("x = a \\ b * c"), """
            BinaryExpression {
              IdentifierExpression BackwardSlashOperator
              BinaryExpression { IdentifierExpression MultiplicationOperator IdentifierExpression }
            }
            """);
    }

    @Test
    void mod_bindsTighterThanAddition() {
        assertTree(rhs("x = a + b Mod c"), """
            BinaryExpression {
              IdentifierExpression AdditionOperator
              BinaryExpression { IdentifierExpression ModKeyword IdentifierExpression }
            }
            """);
    }

    @Test
    void concatenation_bindsLooserThanAddition() {
        assertTree(rhs("x = a & b + c"), """
            BinaryExpression {
              IdentifierExpression Ampersand
              BinaryExpression { IdentifierExpression AdditionOperator IdentifierExpression }
            }
            """);
    }

    @Test
    void comparison_bindsLooserThanConcatenation() {
        assertTree(rhs("x = a & b = c"), """
            BinaryExpression {
              BinaryExpression { IdentifierExpression Ampersand IdentifierExpression }
              EqualityOperator IdentifierExpression
            }
            """);
    }

    @Test
    void not_appliesToWholeComparison() {
        assertTree(rhs("x = Not a = b"), """
            UnaryExpression {
              NotKeyword
              BinaryExpression { IdentifierExpression EqualityOperator IdentifierExpression }
            }
            """);
    }

    @Test
    void not_bindsTighterThanAnd() {
        assertTree(rhs("x = Not a And b"), """
            BinaryExpression {
              UnaryExpression { NotKeyword IdentifierExpression }
              AndKeyword IdentifierExpression
            }
            """);
    }

    @Test
    void and_bindsTighterThanOr() {
        assertTree(rhs("x = a Or b And c"), """
            BinaryExpression {
              IdentifierExpression OrKeyword
              BinaryExpression { IdentifierExpression AndKeyword IdentifierExpression }
            }
            """);
    }

    @Test
    void imp_isLoosest() {
        assertTree(rhs("x = a Imp b Eqv c"), """
            BinaryExpression {
              IdentifierExpression ImpKeyword
              BinaryExpression { IdentifierExpression EqvKeyword IdentifierExpression }
            }
            """);
    }

    @Test
    void likeAndIs_areComparisons() {
        assertTree(rhs("x = s Like \"a*\" And o Is Nothing"), """
            BinaryExpression {
              BinaryExpression { IdentifierExpression LikeKeyword StringLiteralExpression }
              AndKeyword
              BinaryExpression { IdentifierExpression IsKeyword LiteralExpression { NothingKeyword } }
            }
            """);
    }

    @Test
    void parentheses_overridePrecedence() {
        assertTree(rhs("x = (1 + 2) * 3"), """
            BinaryExpression {
              ParenthesizedExpression {
                LeftParenthesis
                BinaryExpression { NumericLiteralExpression AdditionOperator NumericLiteralExpression }
                RightParenthesis
              }
              MultiplicationOperator NumericLiteralExpression
            }
            """);
    }

    // === Primaries ===

    @Test
    void literals_areWrappedByKind() {
        assertTree(rhs("x = True"), "BooleanLiteralExpression { TrueKeyword }");
        assertTree(rhs("x = #1/1/2000#"), "LiteralExpression { DateLiteral }");
        assertTree(rhs("x = \"text\""), "StringLiteralExpression { StringLiteral(\"\\\"text\\\"\") }");
        assertTree(rhs("x = &HFF&"), "NumericLiteralExpression { LongLiteral(\"&HFF&\") }");
    }

    @Test
    void memberAccessChain_nestsLeftToRight() {
        assertTree(rhs("x = App.Path.Length"), """
            MemberAccessExpression {
              MemberAccessExpression { Identifier("App") PeriodOperator Identifier("Path") }
              PeriodOperator Identifier("Length")
            }
            """);
    }

    @Test
    void bangAccess_isMemberAccess() {
        assertTree(rhs("x = rs!Name"), """
            MemberAccessExpression { Identifier("rs") ExclamationMark NameKeyword }
            """);
    }

    @Test
    void keywordAfterPeriod_keepsKeywordKind() {
        assertTree(rhs("x = Me.Width"), """
            MemberAccessExpression { MeKeyword PeriodOperator WidthKeyword }
            """);
    }

    @Test
    void callOnMember_wrapsMemberAccess() {
        assertTree(rhs("x = col.Item(1).Value"), """
            MemberAccessExpression {
              CallExpression {
                MemberAccessExpression { Identifier("col") PeriodOperator Identifier("Item") }
                LeftParenthesis ArgumentList { Argument { NumericLiteralExpression } } RightParenthesis
              }
              PeriodOperator Identifier("Value")
            }
            """);
    }

    @Test
    void typeSuffix_staysInsideIdentifierExpression() {
        assertTree(rhs("x = count%"), """
            IdentifierExpression { Identifier("count") Percent }
            """);
    }

    @Test
    void newExpression_takesClassName() {
        assertTree(rhs("x = New Collection"), "NewExpression { NewKeyword Identifier(\"Collection\") }");
    }

    @Test
    void addressOf_takesProcedureName() {
        assertTree(rhs("x = AddressOf WindowProc"), "AddressOfExpression { AddressOfKeyword Identifier }");
    }

    @Test
    void typeOf_takesTypeAfterIs() {
        assertTree(rhs("x = TypeOf ctl Is TextBox"), """
            TypeOfExpression { TypeOfKeyword IdentifierExpression IsKeyword Identifier("TextBox") }
            """);
    }

    // === Arguments ===

    @Test
    void emptyArgumentSlots_keepOnlySeparators() {
        assertTree(rhs("x = f(1, , 3)"), """
            CallExpression {
              Identifier LeftParenthesis
              ArgumentList { Argument Comma Comma Argument }
              RightParenthesis
            }
            """);
    }

    @Test
    void namedArgument_keepsNameAndColonEquals() {
        assertTree(rhs("x = MsgBox(Prompt:=\"Hi\", Buttons:=vbOKOnly)"), """
            CallExpression {
              Identifier LeftParenthesis
              ArgumentList {
                Argument { Identifier("Prompt") ColonEqualsOperator StringLiteralExpression }
                Comma
                Argument { Identifier("Buttons") ColonEqualsOperator IdentifierExpression }
              }
              RightParenthesis
            }
            """);
    }

    @Test
    void byValArgument_keepsKeyword() {
        assertTree(rhs("x = f(ByVal p)"), """
            CallExpression {
              Identifier LeftParenthesis ArgumentList { Argument { ByValKeyword IdentifierExpression } } RightParenthesis
            }
            """);
    }

    @Test
    void binaryOperator_keepsSurroundingTrivia() {
        var expression = rhs("x = a  +  b");

        assertThat(expression.text()).isEqualTo("a  +  b");
        assertThat(expression.children()).hasSize(5);
    }

    @Test
    void lineContinuation_insideExpression_isTrivia() {
        var expression = rhs("x = a + _\n    b");

        assertTree(expression, "BinaryExpression { IdentifierExpression AdditionOperator IdentifierExpression }");
        assertThat(expression.text()).isEqualTo("a + _\n    b");
    }
}
