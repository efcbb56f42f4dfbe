package com.example.clipscore_backend.scoring.text;

import com.example.clipscore_backend.model.ChannelInfo;
import com.example.clipscore_backend.model.Transcript;
import com.example.clipscore_backend.model.TranscriptSegment;
import com.example.clipscore_backend.model.VideoRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextCorpusBuilderTest {

    private final TextCorpusBuilder builder = new TextCorpusBuilder();

    @Test
    void lowercasesAndJoinsFields() {
        VideoRecord video = new VideoRecord("id", "Big REUNION", "Soldier Comes Home", List.of("Family", "Dog"),
                10, 1, 2, 60, null, "Chan", List.of("So SWEET", "Crying"), null, null,
                new ChannelInfo(5, 1, "Official NEWS"));

        TextCorpus corpus = builder.build(video);

        assertThat(corpus.title()).isEqualTo("big reunion");
        assertThat(corpus.tags()).isEqualTo("family | dog");
        assertThat(corpus.comments()).isEqualTo("so sweet" + TextCorpusBuilder.SEPARATOR + "crying");
        assertThat(corpus.transcript()).isEmpty();
        assertThat(corpus.channelDescription()).isEqualTo("official news");
        assertThat(corpus.metadata()).contains("big reunion", "soldier comes home", "family | dog");
    }

    @Test
    void keywordsCannotSpanTwoComments() {
        VideoRecord video = new VideoRecord("id", "", "", List.of(), 0, 0, 0, 0, null, "",
                List.of("welcome", "home"), null, null, null);

        TextCorpus corpus = builder.build(video);

        assertThat(KeywordMatcher.containsAny(corpus.comments(), List.of("welcome home"))).isFalse();
    }

    @Test
    void usesSegmentsWhenTranscriptTextIsBlank() {
        Transcript transcript = new Transcript(true, " ", List.of(
                new TranscriptSegment(0, 2, "Thank You"),
                new TranscriptSegment(2, 3, "so much")));
        VideoRecord video = new VideoRecord("id", "", "", List.of(), 0, 0, 0, 0, null, "",
                List.of(), transcript, null, null);

        assertThat(builder.build(video).transcript()).isEqualTo("thank you so much");
    }

    @Test
    void ignoresUnavailableTranscript() {
        VideoRecord video = new VideoRecord("id", "", "", List.of(), 0, 0, 0, 0, null, "",
                List.of(), new Transcript(false, "should not be used", List.of()), null, null);

        assertThat(builder.build(video).transcript()).isEmpty();
    }
}
