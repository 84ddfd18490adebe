package com.phillippitts.batchanalyzer.domain;

/**
 * What the capability is asked to produce for each image.
 *
 * @param generatePrompt     ask for a reproduction prompt
 * @param extractTags        ask for categorized tags
 * @param detailed           ask for a long-form description
 * @param customInstructions extra free-text instructions, may be null
 */
public record AnalysisOptions(
        boolean generatePrompt,
        boolean extractTags,
        boolean detailed,
        String customInstructions
) {

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(true, true, false, null);
    }

    /**
     * Renders the options into the instruction text passed to the capability.
     */
    public String toInstructions() {
        StringBuilder sb = new StringBuilder("Describe this image");
        sb.append(detailed ? " in detail." : " concisely.");
        if (extractTags) {
            sb.append(" Return tags grouped by category (subject, style, mood, color, technical).");
        }
        if (generatePrompt) {
            sb.append(" Provide a prompt that could reproduce the image.");
        }
        if (customInstructions != null && !customInstructions.isBlank()) {
            sb.append(' ').append(customInstructions.trim());
        }
        return sb.toString();
    }
}
