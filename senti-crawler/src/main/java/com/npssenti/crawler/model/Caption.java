package com.npssenti.crawler.model;

public record Caption(String lang, String text) {}
