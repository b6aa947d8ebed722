package com.bo.knowledge.model;

import lombok.Data;

/**
 * Ask request
 */
@Data
public class AskRequest {

    /**
     * Question text
     */
    private String query;

    /**
     * Optional tool timeout, the configured default applies when absent
     */
    private Integer timeoutSeconds;
}
