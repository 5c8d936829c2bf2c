package com.delta.autoapply.run.model;

public record JobContext(String title, String company, String url, String description) {}
