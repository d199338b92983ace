package org.caretta.source;

import org.caretta.diagnostics.ColumnRange;
import org.caretta.diagnostics.Diagnostic;
import org.caretta.diagnostics.DiagnosticHandler;
import org.caretta.diagnostics.DiagnosticKind;
import org.caretta.diagnostics.DiagnosticsEngine;
import org.caretta.diagnostics.FixIt;
import org.caretta.diagnostics.render.AnsiOutputSink;
import org.caretta.io.SourceLoader;
import org.caretta.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

/**
 * Tests for {@link BufferRegistry}: registration, location resolution, include handling
 * and diagnostic delivery.
 */
@ExtendWith({LogWatchExtension.class, MockitoExtension.class})
public class BufferRegistryTest {

    private BufferRegistry registry;

    @Mock
    private DiagnosticHandler handler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        registry = new BufferRegistry();
    }

    private int add(String content, String name) {
        return registry.addBuffer(SourceText.fromString(content, name));
    }

    @Test
    @Tag("unit")
    void idsAreDenseAndStartAtOne() {
        assertThat(registry.getMainBufferId()).isZero();

        int first = add("abc", "a");
        int second = add("xyz", "b");

        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(2);
        assertThat(registry.getNumBuffers()).isEqualTo(2);
        assertThat(registry.getMainBufferId()).isEqualTo(1);
        assertThat(registry.isValidBufferId(0)).isFalse();
        assertThat(registry.isValidBufferId(3)).isFalse();
        assertThatThrownBy(() -> registry.getBuffer(3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void locationsAreFoundInTheirOwnBuffer() {
        int first = add("abc", "a");
        int second = add("xyz", "b");
        SourceLocation endOfFirst = registry.getLocation(first, 3);
        SourceLocation startOfSecond = registry.getLocation(second, 0);

        assertThat(registry.findBufferContaining(endOfFirst)).isEqualTo(first);
        assertThat(registry.findBufferContaining(startOfSecond)).isEqualTo(second);
        // The cached buffer must not shadow the right answer.
        assertThat(registry.findBufferContaining(registry.getLocation(first, 1))).isEqualTo(first);
        assertThat(registry.findBufferContaining(registry.getLocation(second, 2))).isEqualTo(second);
    }

    @Test
    @Tag("unit")
    void foreignOrInvalidLocationsBelongToNoBuffer() {
        add("abc", "a");

        assertThat(registry.findBufferContaining(SourceLocation.NONE)).isZero();
        assertThat(registry.findBufferContaining(new SourceLocation(1_000))).isZero();
        assertThatThrownBy(() -> registry.findLine(new SourceLocation(1_000)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @Tag("unit")
    void wrongBufferHintIsRejected() {
        int first = add("abc", "a");
        int second = add("xyz", "b");

        SourceLocation location = registry.getLocation(first, 1);

        assertThatThrownBy(() -> registry.findLine(location, second)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void findLineReturnsTheWholeLineIncludingItsNewline() {
        int id = add("first\nsecond\nthird", "f");

        SourceLine line = registry.findLine(registry.getLocation(id, 8));

        assertThat(line.lineNumber()).isEqualTo(2);
        assertThat(line.text()).isEqualTo("second\n");
        assertThat(registry.findLineNumber(registry.getLocation(id, 17), 0)).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void bufferWithoutNewlineIsOneLine() {
        int id = add("hello", "h");

        for (int offset = 0; offset <= 5; offset++) {
            SourceLine line = registry.findLine(registry.getLocation(id, offset), id);
            assertThat(line.lineNumber()).isEqualTo(1);
            assertThat(line.text()).isEqualTo("hello");
        }
    }

    @Test
    @Tag("unit")
    void getLineRefRequiresABufferId() {
        int id = add("one\ntwo\n", "f");

        assertThat(registry.getLineRef(2, id).text()).isEqualTo("two\n");
        assertThat(registry.getLineRef(3, id).text()).isEmpty();
        assertThat(registry.getLineRef(10, id).isEmpty()).isTrue();
        assertThatThrownBy(() -> registry.getLineRef(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Every way of computing a line and column must agree for every offset, including
     * the end of the buffer, a final line without newline and a buffer without any.
     */
    @Test
    @Tag("unit")
    void lineColumnLineRefAndDiagnosticColumnAgree() {
        for (String content : List.of("ab\n\ncde\tf\n", "ab\n\ncde\tf", "no newline at all", "")) {
            int id = add(content, "f");

            for (int offset = 0; offset <= content.length(); offset++) {
                SourceLocation location = registry.getLocation(id, offset);
                SourceLine line = registry.findLine(location, id);
                LineAndColumn lineAndColumn = registry.getLineAndColumn(location, 0);
                SourceLine lineRef = registry.getLineRef(lineAndColumn.line(), id);
                Diagnostic diagnostic = registry.buildDiagnostic(location, DiagnosticKind.NOTE, "n");

                assertThat(lineAndColumn.line()).isEqualTo(line.lineNumber());
                assertThat(lineAndColumn.column()).isEqualTo(offset - line.startOffset() + 1);
                assertThat(lineRef).isEqualTo(line);
                assertThat(offset - lineRef.startOffset() + 1).isEqualTo(lineAndColumn.column());
                assertThat(diagnostic.lineNumber()).isEqualTo(lineAndColumn.line());
                assertThat(diagnostic.columnNumber()).isEqualTo(lineAndColumn.column() - 1);
            }
        }
    }

    @Test
    @Tag("unit")
    void includeLocationMustBelongToARegisteredBuffer() {
        assertThatThrownBy(() -> registry.addBuffer(SourceText.fromString("x", "x"), new SourceLocation(42)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * An include file is looked up directly first and then in each search directory.
     */
    @Test
    @Tag("integration")
    void includeFileIsFoundInSearchDirectory() throws IOException {
        // Arrange
        Path first = Files.createDirectory(tempDir.resolve("first"));
        Path second = Files.createDirectory(tempDir.resolve("second"));
        Path header = Files.writeString(second.resolve("lib.h"), "int lib;\n");
        int main = add("#include \"lib.h\"\n", "main.c");
        SourceLocation includeLocation = registry.getLocation(main, 0);

        // Act
        IncludeResult result = registry.addIncludeFile("lib.h", includeLocation, List.of(first, second));

        // Assert
        assertThat(result.found()).isTrue();
        assertThat(result.bufferId()).isEqualTo(2);
        assertThat(result.resolvedPath()).isEqualTo(SourceLoader.logicalName(header));
        assertThat(registry.getParentIncludeLocation(result.bufferId())).isEqualTo(includeLocation);
        assertThat(registry.getBuffer(2).text().decode(0, 8)).isEqualTo("int lib;");
    }

    @Test
    @Tag("integration")
    void configuredIncludeDirectoriesAreUsed() throws IOException {
        Files.writeString(tempDir.resolve("defs.h"), "#define X 1\n");
        int main = add("#include \"defs.h\"\n", "main.c");
        registry.setIncludeDirectories(List.of(tempDir));

        IncludeResult result = registry.addIncludeFile("defs.h", registry.getLocation(main, 0));

        assertThat(result.found()).isTrue();
        assertThat(registry.getIncludeDirectories()).containsExactly(tempDir);
    }

    @Test
    @Tag("integration")
    void missingIncludeRegistersNothing() {
        int main = add("#include \"nope.h\"\n", "main.c");

        IncludeResult result = registry.addIncludeFile("nope.h", registry.getLocation(main, 0), List.of(tempDir));

        assertThat(result).isEqualTo(IncludeResult.NOT_FOUND);
        assertThat(result.found()).isFalse();
        assertThat(registry.getNumBuffers()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void includeStackIsPrintedOutermostFirst() {
        // Arrange
        int a = add("int x;\n#include \"b.h\"\n", "a.c");
        int b = registry.addBuffer(SourceText.fromString("#include \"c.h\"\n", "b.h"), registry.getLocation(a, 7));
        int c = registry.addBuffer(SourceText.fromString("oops\n", "c.h"), registry.getLocation(b, 0));
        StringBuilder out = new StringBuilder();

        // Act
        registry.report(AnsiOutputSink.plain(out), registry.getLocation(c, 0), DiagnosticKind.ERROR, "boom");

        // Assert
        assertThat(out.toString()).isEqualTo(
                "Included from a.c:2:\n"
                        + "Included from b.h:1:\n"
                        + "c.h:1:1: error: boom\n"
                        + "oops\n"
                        + "^\n");
    }

    @Test
    @Tag("unit")
    void diagnosticRangesAreClippedToTheReportedLine() {
        int id = add("foo bar\nbaz\n", "f.c");
        SourceLocation location = registry.getLocation(id, 4);
        List<SourceRange> ranges = List.of(
                new SourceRange(registry.getLocation(id, 0), registry.getLocation(id, 7)),
                new SourceRange(registry.getLocation(id, 5), registry.getLocation(id, 10)),
                new SourceRange(registry.getLocation(id, 9), registry.getLocation(id, 11)),
                SourceRange.NONE);

        Diagnostic diagnostic = registry.buildDiagnostic(location, DiagnosticKind.WARNING, "w", ranges, List.of());

        assertThat(diagnostic.fileName()).isEqualTo("f.c");
        assertThat(diagnostic.lineNumber()).isEqualTo(1);
        assertThat(diagnostic.columnNumber()).isEqualTo(4);
        assertThat(diagnostic.lineContents()).isEqualTo("foo bar");
        assertThat(diagnostic.ranges()).containsExactly(new ColumnRange(0, 7), new ColumnRange(5, 7));
    }

    @Test
    @Tag("unit")
    void carriageReturnEndsTheReportedLine() {
        int id = add("abc\r\ndef", "f.c");

        Diagnostic diagnostic = registry.buildDiagnostic(registry.getLocation(id, 1), DiagnosticKind.ERROR, "e");

        assertThat(diagnostic.lineContents()).isEqualTo("abc");
    }

    @Test
    @Tag("unit")
    void caretAndFixItFollowLoneCarriageReturn() {
        // Arrange
        int id = add("ab\r\ncd\rxy", "a");
        SourceLocation x = registry.getLocation(id, 7);
        StringBuilder out = new StringBuilder();

        // Act
        Diagnostic diagnostic = registry.buildDiagnostic(x, DiagnosticKind.ERROR, "m", List.of(),
                List.of(FixIt.insertion(x, "Z")));
        registry.printMessage(AnsiOutputSink.plain(out), diagnostic, false);

        // Assert
        assertThat(diagnostic.lineNumber()).isEqualTo(2);
        assertThat(diagnostic.columnNumber()).isZero();
        assertThat(diagnostic.lineContents()).isEqualTo("xy");
        assertThat(out.toString()).isEqualTo("a:2:1: error: m\n" + "xy\n" + "^\n" + "Z\n");
    }

    @Test
    @Tag("unit")
    void invalidLocationProducesMessageOnlyDiagnostic() {
        StringBuilder out = new StringBuilder();

        Diagnostic diagnostic = registry.buildDiagnostic(SourceLocation.NONE, DiagnosticKind.ERROR, "no location");
        registry.printMessage(AnsiOutputSink.plain(out), diagnostic, false);

        assertThat(diagnostic.fileName()).isEqualTo(BufferRegistry.UNKNOWN_FILE);
        assertThat(diagnostic.lineNumber()).isEqualTo(-1);
        assertThat(diagnostic.columnNumber()).isEqualTo(-1);
        assertThat(out.toString()).isEqualTo("<unknown>: error: no location\n");
    }

    @Test
    @Tag("unit")
    void installedHandlerReplacesRendering() {
        // Arrange
        Object context = new Object();
        registry.setHandler(handler, context);
        int id = add("abc", "f.c");
        StringBuilder out = new StringBuilder();

        // Act
        registry.report(AnsiOutputSink.plain(out), registry.getLocation(id, 1), DiagnosticKind.WARNING, "handled");

        // Assert
        verify(handler).handle(argThat(d -> d.message().equals("handled") && d.columnNumber() == 1), eq(context));
        assertThat(out.toString()).isEmpty();
        assertThat(registry.getHandler()).isSameAs(handler);
        assertThat(registry.getHandlerContext()).isSameAs(context);
    }

    @Test
    @Tag("unit")
    void diagnosticsEngineCollectsReportedDiagnostics() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        registry.setHandler(engine, null);
        int id = add("abc\ndef", "f.c");
        StringBuilder out = new StringBuilder();

        registry.report(AnsiOutputSink.plain(out), registry.getLocation(id, 5), DiagnosticKind.ERROR, "bad");
        registry.report(AnsiOutputSink.plain(out), registry.getLocation(id, 0), DiagnosticKind.NOTE, "here");

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.count(DiagnosticKind.NOTE)).isEqualTo(1);
        assertThat(engine.summary()).isEqualTo("f.c:2:2: error: bad\nf.c:1:1: note: here");
        assertThat(out.toString()).isEmpty();
    }
}
