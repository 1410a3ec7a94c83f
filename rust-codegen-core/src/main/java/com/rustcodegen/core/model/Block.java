package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Nested brace block inside a function body.
 */
public class Block implements Body {

    private final List<Body> body = new ArrayList<>();

    public List<Body> getBody() {
        return Collections.unmodifiableList(body);
    }

    public Block pushLine(String line) {
        body.add(new Body.Line(line));
        return this;
    }

    public Block pushBlock(Block block) {
        body.add(Objects.requireNonNull(block, "block must not be null"));
        return this;
    }

    @Override
    public void format(Formatter fmt) throws IOException {
        fmt.block(inner -> {
            for (Body entry : body) {
                entry.format(inner);
            }
        });
        fmt.writeln();
    }
}
