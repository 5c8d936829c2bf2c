package com.delta.autoapply.run.model;

import com.delta.autoapply.run.browser.PageElements;

/**
 * A control believed to hold a profile field, with the lookup that found it.
 */
public record FieldMatch(FieldPurpose purpose, PageElements control, String locatedBy) {}
