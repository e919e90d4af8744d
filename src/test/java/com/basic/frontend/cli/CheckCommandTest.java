package com.basic.frontend.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the check command, run the way the CLI entry point runs it.
 */
class CheckCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCleanProgramExitsZero() throws IOException {
        Path source = tempDir.resolve("clean.bas");
        Files.writeString(source, """
                10 REM clean
                20 FOR I = 1 TO 3
                30 PRINT I * 2;
                40 NEXT I
                50 END
                """);

        int exitCode = execute(source.toString(), "--tokens", "--tree");

        assertThat(exitCode).isZero();
    }

    @Test
    void testProgramWithErrorsExitsOne() throws IOException {
        Path source = tempDir.resolve("broken.bas");
        Files.writeString(source, """
                10 PRINT "ok"
                20 LET A =
                30 GOSUB 100
                """);

        assertThat(execute(source.toString())).isEqualTo(1);
    }

    @Test
    void testExtraFunctionsAreRecognized() throws IOException {
        Path source = tempDir.resolve("beep.bas");
        Files.writeString(source, "10 PRINT BEEP(1)\n");

        assertThat(execute(source.toString())).isEqualTo(1);
        assertThat(execute(source.toString(), "--functions", "beep, buzz")).isZero();
    }

    @Test
    void testIfDepthOption() throws IOException {
        Path source = tempDir.resolve("nested.bas");
        Files.writeString(source, "10 IF A THEN IF B THEN END\n");

        assertThat(execute(source.toString())).isZero();
        assertThat(execute(source.toString(), "--max-if-depth", "1")).isEqualTo(1);
    }

    @Test
    void testLongExpressionIsReportedNotPrinted() throws IOException {
        Path source = tempDir.resolve("long.bas");
        Files.writeString(source, "10 PRINT 1" + " + 1".repeat(20000) + "\n20 END\n");

        assertThat(execute(source.toString(), "--tree")).isEqualTo(1);
    }

    @Test
    void testInvalidExpressionLengthExitsOne() throws IOException {
        Path source = tempDir.resolve("end.bas");
        Files.writeString(source, "10 END\n");

        assertThat(execute(source.toString(), "--max-expression-length", "0")).isEqualTo(1);
    }

    @Test
    void testMissingFileExitsOne() {
        assertThat(execute(tempDir.resolve("missing.bas").toString())).isEqualTo(1);
    }

    @Test
    void testInvalidDepthExitsOne() throws IOException {
        Path source = tempDir.resolve("end.bas");
        Files.writeString(source, "10 END\n");

        assertThat(execute(source.toString(), "--max-expression-depth", "0")).isEqualTo(1);
    }

    private static int execute(String... args) {
        return new CommandLine(new CheckCommand()).execute(args);
    }
}
