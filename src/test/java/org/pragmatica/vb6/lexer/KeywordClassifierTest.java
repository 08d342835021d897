package org.pragmatica.vb6.lexer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.vb6.lexer.TokenKind.*;

class KeywordClassifierTest {

    // === Keyword table ===

    @Test
    void keyword_lookupIgnoresCase() {
        assertThat(KeywordClassifier.keyword("ReDim")).contains(RE_DIM_KEYWORD);
        assertThat(KeywordClassifier.keyword("REDIM")).contains(RE_DIM_KEYWORD);
        assertThat(KeywordClassifier.keyword("goto")).contains(GOTO_KEYWORD);
    }

    @Test
    void keyword_unknownWordIsEmpty() {
        assertThat(KeywordClassifier.keyword("DatePart")).isEmpty();
    }

    @Test
    void keywordTable_coversEveryKeywordKind() {
        long keywordKinds = java.util.Arrays.stream(TokenKind.values())
                                            .filter(TokenKind::isKeyword)
                                            .count();

        assertThat(KeywordClassifier.keywordCount()).isEqualTo((int) keywordKinds);
    }

    // === Positions ===

    @Test
    void declarationName_retagsKeywordToIdentifier() {
        assertThat(KeywordClassifier.classify(TEXT_KEYWORD, NamePosition.DECLARATION_NAME)).isEqualTo(IDENTIFIER);
    }

    @Test
    void memberName_keepsKeywordKind() {
        assertThat(KeywordClassifier.classify(PRINT_KEYWORD, NamePosition.MEMBER_NAME)).isEqualTo(PRINT_KEYWORD);
    }

    @Test
    void expression_keepsKeywordKind() {
        assertThat(KeywordClassifier.classify(DATE_KEYWORD, NamePosition.EXPRESSION)).isEqualTo(DATE_KEYWORD);
    }

    @Test
    void identifier_isAcceptedEverywhere() {
        for (var position : NamePosition.values()) {
            assertThat(KeywordClassifier.accepts(IDENTIFIER, position)).isTrue();
        }
    }

    @Test
    void operandKeyword_isAcceptedInExpressions() {
        assertThat(KeywordClassifier.accepts(DATE_KEYWORD, NamePosition.EXPRESSION)).isTrue();
        assertThat(KeywordClassifier.accepts(ME_KEYWORD, NamePosition.STATEMENT_START)).isTrue();
        assertThat(KeywordClassifier.isOperand(LEN_KEYWORD)).isTrue();
    }

    @Test
    void structuralKeyword_isRejectedInExpressions() {
        assertThat(KeywordClassifier.accepts(THEN_KEYWORD, NamePosition.EXPRESSION)).isFalse();
        assertThat(KeywordClassifier.accepts(SUB_KEYWORD, NamePosition.STATEMENT_START)).isFalse();
        assertThat(KeywordClassifier.isOperand(IF_KEYWORD)).isFalse();
    }

    @Test
    void anyKeyword_isAcceptedAsMemberOrDeclarationName() {
        assertThat(KeywordClassifier.accepts(END_KEYWORD, NamePosition.MEMBER_NAME)).isTrue();
        assertThat(KeywordClassifier.accepts(TEXT_KEYWORD, NamePosition.DECLARATION_NAME)).isTrue();
    }

    @Test
    void nonWord_isNeverAName() {
        assertThat(KeywordClassifier.accepts(INTEGER_LITERAL, NamePosition.EXPRESSION)).isFalse();
        assertThat(KeywordClassifier.accepts(COMMA, NamePosition.MEMBER_NAME)).isFalse();
    }

    // === Statement start ===

    @Test
    void plainKeyword_alwaysStartsStatement() {
        assertThat(KeywordClassifier.startsStatement(IF_KEYWORD, IDENTIFIER, false)).isTrue();
        assertThat(KeywordClassifier.startsStatement(MK_DIR_KEYWORD, STRING_LITERAL, false)).isTrue();
    }

    @Test
    void nonKeyword_neverStartsKeywordStatement() {
        assertThat(KeywordClassifier.startsStatement(IDENTIFIER, IDENTIFIER, false)).isFalse();
    }

    @Test
    void dualKeyword_beforeAssignment_isNotStatement() {
        assertThat(KeywordClassifier.startsStatement(NAME_KEYWORD, EQUALITY_OPERATOR, false)).isFalse();
        assertThat(KeywordClassifier.startsStatement(WIDTH_KEYWORD, PERIOD_OPERATOR, true)).isFalse();
    }

    @Test
    void dualKeyword_beforeAdjacentParenthesis_isNotStatement() {
        assertThat(KeywordClassifier.startsStatement(INPUT_KEYWORD, LEFT_PARENTHESIS, true)).isFalse();
        assertThat(KeywordClassifier.startsStatement(ERROR_KEYWORD, LEFT_PARENTHESIS, false)).isTrue();
    }

    @Test
    void dualKeyword_withOperands_startsStatement() {
        assertThat(KeywordClassifier.startsStatement(NAME_KEYWORD, STRING_LITERAL, false)).isTrue();
        assertThat(KeywordClassifier.startsStatement(INPUT_KEYWORD, OCTOTHORPE, false)).isTrue();
    }

    @Test
    void line_startsStatementOnlyBeforeInput() {
        assertThat(KeywordClassifier.startsStatement(LINE_KEYWORD, INPUT_KEYWORD, false)).isTrue();
        assertThat(KeywordClassifier.startsStatement(LINE_KEYWORD, IDENTIFIER, false)).isFalse();
    }

    @Test
    void property_startsStatementOnlyBeforeAccessor() {
        assertThat(KeywordClassifier.startsStatement(PROPERTY_KEYWORD, GET_KEYWORD, false)).isTrue();
        assertThat(KeywordClassifier.startsStatement(PROPERTY_KEYWORD, IDENTIFIER, false)).isFalse();
    }

    // === Dollar fusion ===

    @Test
    void fusesDollar_followsTable() {
        assertThat(KeywordClassifier.fusesDollar("Environ")).isTrue();
        assertThat(KeywordClassifier.fusesDollar("LEFT")).isTrue();
        assertThat(KeywordClassifier.fusesDollar("Mid")).isTrue();
        assertThat(KeywordClassifier.fusesDollar("Time")).isFalse();
        assertThat(KeywordClassifier.fusesDollar("buffer")).isFalse();
    }

    @Test
    void fusesDollar_reservedWordsFollowKeywordList() {
        assertThat(KeywordClassifier.fusesDollar("Error")).isTrue();
        assertThat(KeywordClassifier.fusesDollar("midb")).isTrue();
        assertThat(KeywordClassifier.fusesDollar("String")).isTrue();
        assertThat(KeywordClassifier.fusesDollar("TIME")).isFalse();
        assertThat(KeywordClassifier.fusesDollar("Input")).isFalse();
    }
}
