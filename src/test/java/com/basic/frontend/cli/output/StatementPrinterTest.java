package com.basic.frontend.cli.output;

import com.basic.frontend.parser.LineParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StatementPrinterTest {

    private final LineParser parser = new LineParser();
    private final StatementPrinter printer = new StatementPrinter();

    @Test
    void testPrintsEveryStatementKind() {
        assertThat(render("10 print \"hi\";")).isEqualTo("10 PRINT \"hi\";");
        assertThat(render("20 LET A[1] = B + C * 2")).isEqualTo("20 LET A[1] = (B + (C * 2))");
        assertThat(render("30 REM  keep  spacing ")).isEqualTo("30 REM keep  spacing ");
        assertThat(render("40 REM")).isEqualTo("40 REM");
        assertThat(render("50 PAUSE 10")).isEqualTo("50 PAUSE 10");
        assertThat(render("60 INPUT \"?\";X")).isEqualTo("60 INPUT \"?\"; X");
        assertThat(render("70 FOR I=1 TO N STEP 2")).isEqualTo("70 FOR I = 1 TO N STEP 2");
        assertThat(render("80 NEXT I")).isEqualTo("80 NEXT I");
        assertThat(render("90 GOTO 10")).isEqualTo("90 GOTO 10");
        assertThat(render("100 END")).isEqualTo("100 END");
    }

    @Test
    void testPrintsNestedIf() {
        assertThat(render("10 IF A THEN IF B THEN END ELSE GOTO 5"))
                .isEqualTo("10 IF A THEN IF B THEN END ELSE GOTO 5");
        assertThat(render("10 IF A<>1 THEN PRINT -A"))
                .isEqualTo("10 IF (A <> 1) THEN PRINT (-A)");
    }

    private String render(String line) {
        return printer.print(parser.parseLine(line));
    }
}
