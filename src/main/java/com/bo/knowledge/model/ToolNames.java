package com.bo.knowledge.model;

/**
 * Tool identifiers shared by the lexicon, the router and the tool registry
 */
public final class ToolNames {

    public static final String INSTITUTIONS = "institutions";
    public static final String HOSPITALS = "hospitals";
    public static final String RESTAURANTS = "restaurants";
    public static final String WEB_SEARCH = "web_search";

    private ToolNames() {
    }
}
