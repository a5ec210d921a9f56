package com.autolang.tree.stmt;

import com.autolang.tree.SourceLocation;
import com.autolang.tree.pattern.Pattern;

/**
 * 模式匹配分支
 */
public class MatchArm {
    private final SourceLocation location;
    private final Pattern pattern;
    private final Block body;

    public MatchArm(SourceLocation location, Pattern pattern, Block body) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.pattern = pattern;
        this.body = body;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Block getBody() {
        return body;
    }
}
