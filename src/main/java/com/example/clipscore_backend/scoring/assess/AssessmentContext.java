package com.example.clipscore_backend.scoring.assess;

import com.example.clipscore_backend.model.VideoRecord;
import com.example.clipscore_backend.scoring.moment.Moment;
import com.example.clipscore_backend.scoring.profile.CategoryProfile;
import com.example.clipscore_backend.scoring.sentiment.Sentiment;
import com.example.clipscore_backend.scoring.text.TextCorpus;

import java.util.List;

/**
 * Inputs shared by all component assessors for one scoring call.
 *
 * @param video      the video being scored.
 * @param corpus     lowercased text of the video.
 * @param profile    category the video is scored against.
 * @param moments    extracted moments, highest relevance first.
 * @param sentiments sentiment per comment, in comment order.
 */
public record AssessmentContext(VideoRecord video,
                                TextCorpus corpus,
                                CategoryProfile profile,
                                List<Moment> moments,
                                List<Sentiment> sentiments) {
}
