package com.delta.autoapply.run.browser;

public enum ElementRole {
    BUTTON,
    LINK
}
