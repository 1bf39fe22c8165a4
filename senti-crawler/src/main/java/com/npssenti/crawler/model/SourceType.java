package com.npssenti.crawler.model;

/**
 * The three kinds of source the crawler talks to.
 * The group key is what the autocrawl state counts against; all forum sites roll up into "forums".
 */
public enum SourceType {

    NEWS_INDEX("gdelt"),
    FORUM("forums"),
    VIDEO("youtube");

    private final String group;

    SourceType(String group) {
        this.group = group;
    }

    public String group() {
        return group;
    }

    public static SourceType fromGroup(String group) {
        for (SourceType type : values()) {
            if (type.group.equalsIgnoreCase(group)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source group: " + group);
    }
}
