package com.example.clipscore_backend.scoring.text;

/**
 * Lowercased search corpora for a single video. Fields are never {@code null}.
 */
public record TextCorpus(String title,
                         String description,
                         String tags,
                         String comments,
                         String transcript,
                         String channelDescription) {

    public String metadata() {
        return join(title, description, tags);
    }

    public String all() {
        return join(title, description, tags, comments, transcript, channelDescription);
    }

    public static String join(String... parts) {
        return String.join(TextCorpusBuilder.SEPARATOR, parts);
    }
}
