package com.delta.autoapply.run.browser.playwright;

import com.delta.autoapply.run.browser.PageElements;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.options.SelectOption;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

class PlaywrightElements implements PageElements {
    private static final String CONTAINER_XPATH =
        "xpath=ancestor::*[self::div or self::section or self::fieldset][1]";
    private static final String LABEL_XPATH = "xpath=ancestor::label";
    private static final String LABEL_TEXT_SCRIPT = "(el) => {"
        + " const label = el.closest('label') || (el.labels && el.labels[0]);"
        + " return label ? label.innerText : '';"
        + " }";

    private final Locator locator;

    PlaywrightElements(Locator locator) {
        this.locator = locator;
    }

    @Override
    public int count() {
        return locator.count();
    }

    @Override
    public PageElements nth(int index) {
        return new PlaywrightElements(locator.nth(index));
    }

    @Override
    public PageElements first() {
        return new PlaywrightElements(locator.first());
    }

    @Override
    public PageElements locate(String selector) {
        return new PlaywrightElements(locator.locator(selector));
    }

    @Override
    public PageElements withText(Pattern pattern) {
        return new PlaywrightElements(locator.filter(new Locator.FilterOptions().setHasText(pattern)));
    }

    @Override
    public PageElements container() {
        return new PlaywrightElements(locator.locator(CONTAINER_XPATH));
    }

    @Override
    public PageElements enclosingLabel() {
        return new PlaywrightElements(locator.locator(LABEL_XPATH));
    }

    @Override
    public String labelText() {
        Object text = locator.first().evaluate(LABEL_TEXT_SCRIPT);
        return text == null ? "" : text.toString();
    }

    @Override
    public String innerText() {
        return locator.first().innerText();
    }

    @Override
    public List<String> optionLabels() {
        return locator.first().locator("option").allInnerTexts();
    }

    @Override
    public void fill(String value) {
        locator.first().fill(value);
    }

    @Override
    public void click() {
        locator.first().click();
    }

    @Override
    public void setInputFiles(Path file) {
        locator.first().setInputFiles(file);
    }

    @Override
    public void selectOptionByLabel(String label) {
        locator.first().selectOption(new SelectOption().setLabel(label));
    }
}
