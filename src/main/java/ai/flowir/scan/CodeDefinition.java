package ai.flowir.scan;

import java.util.Objects;

import ai.flowir.model.NodeNames;

/**
 * Source location and original text of one declaration.
 */
public record CodeDefinition(
        String file,   // relative to the index base dir, '/' separated
        int line,      // first line of the declaration, annotations included
        String source
) {
    public CodeDefinition {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(source, "source");
    }

    public String location() {
        return NodeNames.location(file, line);
    }

    public String describeFunction() {
        return "defined at " + location() + ":\n```java\n" + source + "\n```";
    }

    public String describeType() {
        return "Defined at " + location() + ":\n```java\n" + source + "\n```";
    }
}
