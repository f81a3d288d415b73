package com.xpdustry.prefixtrie.core.codec;

public record DecodeError(String message) {}
