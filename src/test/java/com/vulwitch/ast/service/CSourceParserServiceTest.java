package com.vulwitch.ast.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.vulwitch.ast.error.CodeError;
import com.vulwitch.ast.error.NotYetSupportedError;
import com.vulwitch.ast.lowering.LoweringConfig;
import com.vulwitch.ast.model.TranslationUnit;
import com.vulwitch.ast.model.declaration.Declaration;
import com.vulwitch.ast.model.declaration.TypeDefinition;
import com.vulwitch.ast.model.preprocess.IfSectionDirective;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for lowering whole files through the service.
 */
class CSourceParserServiceTest {

    @TempDir
    Path tempDir;

    private final CSourceParserService service = new CSourceParserService();

    private static byte[] utf8(String source) {
        return source.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testParseHeaderFromDisk() throws IOException {
        String header = """
                #ifndef LIST_H
                #define LIST_H

                typedef struct list {
                    struct list *next;
                    void *payload;
                } list_t;

                extern list_t *list_push(list_t *head, void *payload);

                #endif
                """;
        Path file = tempDir.resolve("list.h");
        Files.writeString(file, header);

        TranslationUnit unit = service.parse(file);

        assertThat(unit.getNodes()).singleElement().isInstanceOf(IfSectionDirective.class);
        assertThat(unit.getRange().getFile()).isEqualTo(file.toAbsolutePath().normalize().toString());
    }

    @Test
    void testRelativePathsCanBeKept() throws IOException {
        Path file = tempDir.resolve("one.c");
        Files.writeString(file, "int one = 1;\n");
        Path relative = Path.of("").toAbsolutePath().relativize(file);
        CSourceParserService keeping = new CSourceParserService(
                LoweringConfig.builder().resolveAbsolutePaths(false).build());

        TranslationUnit unit = keeping.parse(relative);

        assertThat(unit.getRange().getFile()).isEqualTo(relative.toString());
        assertThat(unit.getNodes()).singleElement().isInstanceOf(Declaration.class);
    }

    @Test
    void testMissingFileThrows() {
        assertThatThrownBy(() -> service.parse(tempDir.resolve("absent.c")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void testLowerReportsSuccess() {
        LoweringOutcome outcome = service.lower("types.h", utf8("typedef unsigned char byte;\n"));

        assertThat(outcome.isLowered()).isTrue();
        assertThat(outcome.getStatus()).isEqualTo(LoweringOutcome.Status.LOWERED);
        assertThat(outcome.getError()).isNull();
        assertThat(outcome.getUnit().getNodes()).singleElement().isInstanceOf(TypeDefinition.class);
    }

    @Test
    void testLowerReportsMalformedInput() {
        LoweringOutcome outcome = service.lower("broken.c", utf8("int x = ;\n"));

        assertThat(outcome.isLowered()).isFalse();
        assertThat(outcome.getStatus()).isEqualTo(LoweringOutcome.Status.MALFORMED_INPUT);
        assertThat(outcome.getUnit()).isNull();
        assertThat(outcome.getError()).isInstanceOf(CodeError.class);
    }

    @Test
    void testLowerReportsUnsupportedConstruct() {
        LoweringOutcome outcome = service.lower("main.c", utf8("""
                int main(void) {
                    return 0;
                }
                """));

        assertThat(outcome.getStatus()).isEqualTo(LoweringOutcome.Status.NOT_YET_SUPPORTED);
        assertThat(outcome.getError()).isInstanceOfSatisfying(NotYetSupportedError.class,
                error -> assertThat(error.getProduction()).isEqualTo("function_definition"));
    }

    @Test
    void testFailedOutcomeNeedsFailureStatus() {
        assertThatThrownBy(() -> LoweringOutcome.failed("a.c", LoweringOutcome.Status.LOWERED, new RuntimeException()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
