package com.delta.autoapply.run.model;

public enum AnswerIntent {
    YES,
    NO;

    public static AnswerIntent of(boolean yes) {
        return yes ? YES : NO;
    }
}
