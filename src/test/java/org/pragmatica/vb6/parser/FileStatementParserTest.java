package org.pragmatica.vb6.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.vb6.Vb6Parser;
import org.pragmatica.vb6.tree.CstNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.vb6.query.TreeMatcher.assertTree;

class FileStatementParserTest {

    private static CstNode statement(String source) {
        var result = Vb6Parser.parseText("test.bas", source);
        assertThat(result.failures()).isEmpty();
        var statements = result.tree()
                               .orElseThrow()
                               .root()
                               .significantChildren();
        assertThat(statements).hasSize(1);
        return statements.get(0);
    }

    // === Open and Close ===

    @Test
    void open_forInputAsFileNumber() {
        assertTree(statement("Open \"data.txt\" For Input As #1"), """
            OpenStatement {
              OpenKeyword StringLiteralExpression ForKeyword InputKeyword
              AsKeyword Octothorpe NumericLiteralExpression
            }
            """);
    }

    @Test
    void open_withAccessLockAndLength() {
        assertTree(statement("Open path For Random Access Read Write Lock Write As fileNo Len = 128"), """
            OpenStatement {
              OpenKeyword IdentifierExpression ForKeyword RandomKeyword
              AccessKeyword ReadKeyword WriteKeyword
              LockKeyword WriteKeyword
              AsKeyword IdentifierExpression
              LenKeyword EqualityOperator NumericLiteralExpression
            }
            """);
    }

    @Test
    void open_shared() {
        assertTree(statement("Open f For Binary Shared As #2"), """
            OpenStatement {
              OpenKeyword IdentifierExpression ForKeyword BinaryKeyword Identifier("Shared")
              AsKeyword Octothorpe NumericLiteralExpression
            }
            """);
    }

    @Test
    void close_withFileNumbers() {
        assertTree(statement("Close #1, #2"), """
            CloseStatement { CloseKeyword Octothorpe NumericLiteralExpression Comma Octothorpe NumericLiteralExpression }
            """);
    }

    @Test
    void close_withoutArguments() {
        assertTree(statement("Close"), "CloseStatement { CloseKeyword }");
    }

    // === Print, Write and Input ===

    @Test
    void print_toFileWithSeparators() {
        assertTree(statement("Print #1, \"x\"; y"), """
            PrintStatement {
              PrintKeyword Octothorpe NumericLiteralExpression Comma
              StringLiteralExpression Semicolon IdentifierExpression
            }
            """);
    }

    @Test
    void write_trailingSeparatorIsKept() {
        assertTree(statement("Write #1, a, b;"), """
            WriteStatement {
              WriteKeyword Octothorpe NumericLiteralExpression Comma
              IdentifierExpression Comma IdentifierExpression Semicolon
            }
            """);
    }

    @Test
    void lineInput_fromFile() {
        assertTree(statement("Line Input #1, s"), """
            LineInputStatement { LineKeyword InputKeyword Octothorpe NumericLiteralExpression Comma IdentifierExpression }
            """);
    }

    @Test
    void input_withSeveralTargets() {
        assertTree(statement("Input #1, a, b"), """
            InputStatement {
              InputKeyword Octothorpe NumericLiteralExpression Comma IdentifierExpression Comma IdentifierExpression
            }
            """);
    }

    // === Record I/O ===

    @Test
    void get_withEmptyRecordNumber() {
        assertTree(statement("Get #1, , buffer"), """
            GetStatement { GetKeyword Octothorpe NumericLiteralExpression Comma Comma IdentifierExpression }
            """);
    }

    @Test
    void lock_withRecordRange() {
        assertTree(statement("Lock #1, 1 To 5"), """
            LockStatement {
              LockKeyword Octothorpe NumericLiteralExpression Comma NumericLiteralExpression ToKeyword NumericLiteralExpression
            }
            """);
    }

    @Test
    void seek_withPosition() {
        assertTree(statement("Seek #1, 10"), """
            SeekStatement { SeekKeyword Octothorpe NumericLiteralExpression Comma NumericLiteralExpression }
            """);
    }

    // === File system and environment ===

    @Test
    void name_renamesFile() {
        assertTree(statement("Name \"a.txt\" As \"b.txt\""), """
            NameStatement { NameKeyword StringLiteralExpression AsKeyword StringLiteralExpression }
            """);
    }

    @Test
    void kill_andMkDir() {
        assertTree(statement("Kill \"x.tmp\""), "KillStatement { KillKeyword StringLiteralExpression }");
        assertTree(statement("MkDir dir & \"\\\\sub\""), "MkDirStatement { MkDirKeyword BinaryExpression }");
    }

    @Test
    void fileCopy_withTwoPaths() {
        assertTree(statement("FileCopy src, dst"), """
            FileCopyStatement { FileCopyKeyword IdentifierExpression Comma IdentifierExpression }
            """);
    }

    @Test
    void unload_me() {
        assertTree(statement("Unload Me"), "UnloadStatement { UnloadKeyword IdentifierExpression { MeKeyword } }");
    }

    @Test
    void simpleStatements_withoutArguments() {
        assertTree(statement("Beep"), "BeepStatement { BeepKeyword }");
        assertTree(statement("Randomize"), "RandomizeStatement { RandomizeKeyword }");
        assertTree(statement("Stop"), "StopStatement { StopKeyword }");
    }

    @Test
    void error_raisesNumber() {
        assertTree(statement("Error 5"), "ErrorStatement { ErrorKeyword NumericLiteralExpression }");
    }

    @Test
    void erase_withSeveralArrays() {
        assertTree(statement("Erase a, b"), "EraseStatement { EraseKeyword IdentifierExpression Comma IdentifierExpression }");
    }

    @Test
    void saveSetting_withFourArguments() {
        assertTree(statement("SaveSetting App.Title, \"Opts\", \"Size\", 10"), """
            SaveSettingStatement {
              SaveSettingKeyword MemberAccessExpression Comma StringLiteralExpression Comma
              StringLiteralExpression Comma NumericLiteralExpression
            }
            """);
    }

    // === Keywords used as names ===

    @Test
    void widthAssignment_isNotWidthStatement() {
        assertTree(statement("Width = 100"), """
            AssignmentStatement { IdentifierExpression { WidthKeyword } EqualityOperator NumericLiteralExpression }
            """);
    }

    @Test
    void inputFunctionCall_isNotInputStatement() {
        assertTree(statement("Input(5, #1)"), """
            CallStatement {
              InputKeyword LeftParenthesis
              ArgumentList {
                Argument { NumericLiteralExpression }
                Comma
                Argument { Octothorpe NumericLiteralExpression }
              }
              RightParenthesis
            }
            """);
    }
}
