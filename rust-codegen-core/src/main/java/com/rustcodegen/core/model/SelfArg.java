package com.rustcodegen.core.model;

/**
 * Receiver of a method.
 */
public enum SelfArg {
    NONE(""),
    SELF("self"),
    REF("&self"),
    MUT("mut self"),
    MUT_REF("&mut self");

    private final String text;

    SelfArg(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
