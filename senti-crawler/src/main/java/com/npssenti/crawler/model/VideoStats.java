package com.npssenti.crawler.model;

public record VideoStats(Long views, Long likes, Long comments) {}
