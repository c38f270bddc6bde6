package com.guardianplatform.common.exception;

/**
 * No language model is configured, so contextual repair cannot run.
 */
public class LanguageModelUnavailableException extends GuardianException {

    public LanguageModelUnavailableException(String message) {
        super("LanguageModel", message);
    }
}
