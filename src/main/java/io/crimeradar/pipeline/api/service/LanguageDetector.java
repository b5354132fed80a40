package io.crimeradar.pipeline.api.service;

public interface LanguageDetector {

    /**
     * @return a supported language code; the default language when the text
     *         is too short or ambiguous to tell
     */
    String detect(String text);
}
