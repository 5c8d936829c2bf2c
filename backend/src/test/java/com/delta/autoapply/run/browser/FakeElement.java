package com.delta.autoapply.run.browser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One in-memory DOM node for heuristic tests. Records the interactions performed on it.
 */
public class FakeElement {
    final String text;
    String labelText = "";
    FakeElement container;
    FakeElement enclosingLabel;
    final Map<String, List<FakeElement>> children = new LinkedHashMap<>();
    List<String> options = List.of();
    RuntimeException failure;
    Runnable onClick;

    String filledValue;
    Path uploadedFile;
    String selectedOption;
    int clicks;

    public FakeElement(String text) {
        this.text = text == null ? "" : text;
    }

    public static FakeElement of(String text) {
        return new FakeElement(text);
    }

    public FakeElement child(String selector, FakeElement child) {
        children.computeIfAbsent(selector, ignored -> new ArrayList<>()).add(child);
        return this;
    }

    public FakeElement inContainer(FakeElement container) {
        this.container = container;
        return this;
    }

    public FakeElement insideLabel(FakeElement label) {
        this.enclosingLabel = label;
        return this;
    }

    public FakeElement labelled(String labelText) {
        this.labelText = labelText;
        return this;
    }

    public FakeElement withOptions(String... options) {
        this.options = List.of(options);
        return this;
    }

    public FakeElement failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public FakeElement onClick(Runnable onClick) {
        this.onClick = onClick;
        return this;
    }

    public String filledValue() {
        return filledValue;
    }

    public Path uploadedFile() {
        return uploadedFile;
    }

    public String selectedOption() {
        return selectedOption;
    }

    public int clicks() {
        return clicks;
    }

    void interact() {
        if (failure != null) {
            throw failure;
        }
    }
}
