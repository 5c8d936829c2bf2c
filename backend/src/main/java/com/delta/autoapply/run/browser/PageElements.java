package com.delta.autoapply.run.browser;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A lazily evaluated set of matching elements on a live page. Narrowing methods never
 * fail; interaction methods act on the first element and throw the driver's runtime
 * exception when the element cannot be used.
 */
public interface PageElements {

    int count();

    PageElements nth(int index);

    default PageElements first() {
        return nth(0);
    }

    /**
     * Descendants matching a CSS selector.
     */
    PageElements locate(String selector);

    /**
     * Elements of this set whose text matches.
     */
    PageElements withText(Pattern pattern);

    /**
     * Nearest enclosing {@code div}, {@code section} or {@code fieldset}.
     */
    PageElements container();

    /**
     * Enclosing {@code label} elements.
     */
    PageElements enclosingLabel();

    /**
     * Text of the label associated with the first element, empty when it has none.
     */
    String labelText();

    String innerText();

    /**
     * Option labels of the first element when it is a {@code select}.
     */
    List<String> optionLabels();

    void fill(String value);

    void click();

    void setInputFiles(Path file);

    void selectOptionByLabel(String label);
}
