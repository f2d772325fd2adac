package ai.flowir.scan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class SourceIndexTest {

    @TempDir
    Path tempDir;

    private Path sourceRoot;

    @BeforeEach
    void setUp() throws Exception {
        sourceRoot = tempDir.resolve("src/main/java");
        write("com/acme/flow/Steps.java",
                "package com.acme.flow;\n"
                        + "\n"
                        + "public class Steps {\n"
                        + "\n"
                        + "    @Deprecated\n"
                        + "    public static void fetch(State state) {\n"
                        + "        state.touch();\n"
                        + "    }\n"
                        + "\n"
                        + "    public static void store(State state) {\n"
                        + "    }\n"
                        + "\n"
                        + "    public static void store(State state, int retries) {\n"
                        + "    }\n"
                        + "}\n");
        write("com/acme/flow/State.java",
                "package com.acme.flow;\n"
                        + "\n"
                        + "public record State(String id) {\n"
                        + "    void touch() {\n"
                        + "    }\n"
                        + "}\n");
    }

    @Test
    void testResolvesMethodWithLocationAndText() throws Exception {
        // Given
        SourceIndex index = SourceIndex.build(tempDir, List.of(sourceRoot));

        // When
        CodeDefinition def = index.resolveFunction("com.acme.flow.Steps#fetch");

        // Then
        assertThat(def).isNotNull();
        assertThat(def.file()).isEqualTo("src/main/java/com/acme/flow/Steps.java");
        assertThat(def.line()).isEqualTo(5);
        assertThat(def.location()).isEqualTo("src/main/java/com/acme/flow/Steps.java:5");
        assertThat(def.source()).isEqualTo("    @Deprecated\n"
                + "    public static void fetch(State state) {\n"
                + "        state.touch();\n"
                + "    }");
        assertThat(def.describeFunction()).isEqualTo("defined at src/main/java/com/acme/flow/Steps.java:5:\n"
                + "```java\n" + def.source() + "\n```");
    }

    @Test
    void testResolvesUniqueSimpleTypeName() throws Exception {
        // Given
        SourceIndex index = SourceIndex.build(tempDir, List.of(sourceRoot));

        // When
        CodeDefinition byMethod = index.resolveFunction("Steps#fetch");
        CodeDefinition byType = index.resolveType("State");

        // Then
        assertThat(byMethod).isEqualTo(index.resolveFunction("com.acme.flow.Steps#fetch"));
        assertThat(byType).isNotNull();
        assertThat(byType.line()).isEqualTo(3);
        assertThat(byType.describeType()).startsWith("Defined at src/main/java/com/acme/flow/State.java:3:\n```java\n"
                + "public record State(String id) {");
    }

    @Test
    void testFirstOverloadWins() throws Exception {
        // When
        SourceIndex index = SourceIndex.build(tempDir, List.of(sourceRoot));

        // Then
        assertThat(index.resolveFunction("Steps#store").line()).isEqualTo(10);
    }

    @Test
    void testAmbiguousSimpleNameIsUnresolved() throws Exception {
        // Given
        write("com/acme/other/State.java",
                "package com.acme.other;\n\npublic class State {\n}\n");

        // When
        SourceIndex index = SourceIndex.build(tempDir, List.of(sourceRoot));

        // Then
        assertThat(index.resolveType("State")).isNull();
        assertThat(index.resolveType("com.acme.other.State")).isNotNull();
        assertThat(index.resolveFunction("State#touch")).isNull();
        assertThat(index.resolveFunction("com.acme.flow.State#touch")).isNotNull();
    }

    @Test
    void testUnknownReferencesAreNull() throws Exception {
        // Given
        SourceIndex index = SourceIndex.build(tempDir, List.of(sourceRoot));

        // Then
        assertThat(index.resolveFunction("Steps#missing")).isNull();
        assertThat(index.resolveFunction("Missing#fetch")).isNull();
        assertThat(index.resolveFunction("Steps")).isNull();
        assertThat(index.resolveFunction("Steps#")).isNull();
        assertThat(index.resolveFunction(null)).isNull();
        assertThat(index.resolveType(null)).isNull();
        assertThat(index.resolveType("com.acme.Missing")).isNull();
    }

    @Test
    void testNestedTypesIndexed() throws Exception {
        // Given
        write("com/acme/flow/Outer.java",
                "package com.acme.flow;\n"
                        + "\n"
                        + "public class Outer {\n"
                        + "    public record Inner(int n) {\n"
                        + "        static Inner zero() {\n"
                        + "            return new Inner(0);\n"
                        + "        }\n"
                        + "    }\n"
                        + "}\n");

        // When
        SourceIndex index = SourceIndex.build(tempDir, List.of(sourceRoot));

        // Then
        assertThat(index.resolveType("com.acme.flow.Outer.Inner").line()).isEqualTo(4);
        assertThat(index.resolveFunction("Inner#zero").line()).isEqualTo(5);
    }

    @Test
    void testBrokenFileCountsAsWarning() throws Exception {
        // Given
        write("com/acme/flow/Broken.java", "package com.acme.flow;\n\npublic class Broken {\n");

        // When
        SourceIndex index = SourceIndex.build(tempDir, List.of(sourceRoot));

        // Then
        assertThat(index.parseWarningCount()).isEqualTo(1);
        assertThat(index.resolveFunction("Steps#fetch")).isNotNull();
    }

    @Test
    void testCarriageReturnOnlyLineEndings() throws Exception {
        // Given
        write("com/acme/flow/Legacy.java",
                "package com.acme.flow;\r\rpublic class Legacy {\r    void go() {}\r}\r");

        // When
        SourceIndex index = SourceIndex.build(tempDir, List.of(sourceRoot));

        // Then
        assertThat(index.parseWarningCount()).isZero();
        CodeDefinition go = index.resolveFunction("Legacy#go");
        assertThat(go).isNotNull();
        assertThat(go.line()).isEqualTo(4);
        assertThat(go.source()).isEqualTo("    void go() {}");
        assertThat(index.resolveType("Legacy").source())
                .isEqualTo("public class Legacy {\n    void go() {}\n}");
    }

    @Test
    void testEmptyIndexResolvesNothing() {
        // Given
        SourceIndex index = SourceIndex.empty(tempDir);

        // Then
        assertThat(index.typeCount()).isZero();
        assertThat(index.methodCount()).isZero();
        assertThat(index.resolveType("State")).isNull();
    }

    private void write(String relative, String content) throws Exception {
        Path file = sourceRoot.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
