package com.delta.autoapply.run.browser;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scriptable page for exercising the form heuristics without a browser.
 */
public class FakeBrowserPage implements BrowserPage {
    private String url;
    private final Map<String, List<FakeElement>> selectors = new LinkedHashMap<>();
    private final List<FakeElement> textNodes = new ArrayList<>();
    private int textLookups;
    private final List<FakeElement> labelledControls = new ArrayList<>();
    private final Map<ElementRole, List<FakeElement>> roles = new EnumMap<>(ElementRole.class);
    private final Map<String, Runnable> locateListeners = new LinkedHashMap<>();
    private RuntimeException navigationFailure;

    private final List<String> navigations = new ArrayList<>();
    private final List<Path> screenshots = new ArrayList<>();
    private final List<Duration> pauses = new ArrayList<>();

    public FakeBrowserPage(String url) {
        this.url = url;
    }

    public FakeBrowserPage add(String selector, FakeElement element) {
        selectors.computeIfAbsent(selector, ignored -> new ArrayList<>()).add(element);
        return this;
    }

    public FakeBrowserPage removeAll(String selector) {
        selectors.remove(selector);
        return this;
    }

    public FakeBrowserPage addText(FakeElement element) {
        textNodes.add(element);
        return this;
    }

    public FakeBrowserPage clearText() {
        textNodes.clear();
        return this;
    }

    public FakeBrowserPage addLabelled(FakeElement control) {
        labelledControls.add(control);
        return this;
    }

    public FakeBrowserPage addRole(ElementRole role, FakeElement element) {
        roles.computeIfAbsent(role, ignored -> new ArrayList<>()).add(element);
        return this;
    }

    public FakeBrowserPage onLocate(String selector, Runnable listener) {
        locateListeners.put(selector, listener);
        return this;
    }

    public FakeBrowserPage failNavigationWith(RuntimeException failure) {
        this.navigationFailure = failure;
        return this;
    }

    public FakeBrowserPage moveTo(String url) {
        this.url = url;
        return this;
    }

    public List<String> navigations() {
        return navigations;
    }

    public int textLookups() {
        return textLookups;
    }

    public List<Path> screenshots() {
        return screenshots;
    }

    public List<Duration> pauses() {
        return pauses;
    }

    @Override
    public void navigate(String target) {
        navigations.add(target);
        if (navigationFailure != null) {
            throw navigationFailure;
        }
        this.url = target;
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public PageElements locate(String selector) {
        Runnable listener = locateListeners.get(selector);
        if (listener != null) {
            listener.run();
        }
        return new FakeElements(new ArrayList<>(selectors.getOrDefault(selector, List.of())));
    }

    @Override
    public PageElements byLabel(Pattern pattern) {
        return new FakeElements(labelledControls.stream()
            .filter(control -> pattern.matcher(control.labelText).find())
            .toList());
    }

    @Override
    public PageElements byText(Pattern pattern) {
        textLookups++;
        return new FakeElements(textNodes.stream()
            .filter(node -> pattern.matcher(node.text).find())
            .toList());
    }

    @Override
    public PageElements byRole(ElementRole role, Pattern name) {
        return new FakeElements(roles.getOrDefault(role, List.of()).stream()
            .filter(element -> name == null || name.matcher(element.text).find())
            .toList());
    }

    @Override
    public void screenshot(Path file) {
        screenshots.add(file);
    }

    @Override
    public void pause(Duration duration) {
        pauses.add(duration);
    }

    @Override
    public void waitForLoad() {
    }
}
