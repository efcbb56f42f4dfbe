package com.example.clipscore_backend.scoring.text;

import com.example.clipscore_backend.model.VideoRecord;

import java.util.List;

import static com.example.clipscore_backend.scoring.text.KeywordMatcher.lower;

/**
 * Normalizes the textual fields of a video into lowercase corpora.
 */
public class TextCorpusBuilder {
    /** Joins fields and comments; keywords never contain it, so no match can span two entries. */
    static final String SEPARATOR = "\n|\n";
    private static final String TAG_SEPARATOR = " | ";

    public TextCorpus build(VideoRecord video) {
        String transcript = video.hasTranscript() ? video.transcript().fullText() : "";
        String channelDescription = video.hasChannelInfo() ? video.channelInfo().description() : "";
        return new TextCorpus(
                lower(video.title()),
                lower(video.description()),
                lower(String.join(TAG_SEPARATOR, video.tags())),
                joinComments(video.comments()),
                lower(transcript),
                lower(channelDescription)
        );
    }

    private static String joinComments(List<String> comments) {
        return lower(String.join(SEPARATOR, comments));
    }
}
